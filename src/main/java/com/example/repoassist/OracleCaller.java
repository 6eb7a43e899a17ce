package com.example.repoassist;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Runs reasoning-engine calls with a hard timeout. Timeouts and unparseable answers are retried
 * a bounded number of times with a fixed backoff; an unreachable engine is not retried.
 */
@Slf4j
@Component
public class OracleCaller {

    @FunctionalInterface
    public interface OracleCall<T> {
        T call() throws OracleException;
    }

    private final long timeoutMillis;
    private final int retries;
    private final long backoffMillis;
    private final ExecutorService executor;

    @Autowired
    public OracleCaller(Environment env) {
        this(env.getProperty("oracle.timeout.seconds", Long.class, 60L) * 1000L,
                env.getProperty("oracle.retries", Integer.class, 1),
                env.getProperty("oracle.backoff.millis", Long.class, 500L));
    }

    public OracleCaller(long timeoutMillis, int retries, long backoffMillis) {
        this.timeoutMillis = timeoutMillis;
        this.retries = Math.max(0, retries);
        this.backoffMillis = backoffMillis;
        AtomicInteger n = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "oracle-call-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T call(String what, OracleCall<T> call) throws OracleException {
        OracleException last = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            if (attempt > 0) {
                log.info("Retrying {} (attempt {} of {}) after {}", what, attempt + 1, retries + 1, last.kind());
                sleep(backoffMillis * attempt);
            }
            try {
                return once(what, call);
            } catch (OracleTimeoutException | OracleUnparseableException e) {
                log.warn("{} failed: {}", what, e.getMessage());
                last = e;
            }
        }
        throw last;
    }

    private <T> T once(String what, OracleCall<T> call) throws OracleException {
        Callable<T> task = call::call;
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OracleTimeoutException(what + " did not finish within " + timeoutMillis + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OracleException(what + " was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OracleException) throw (OracleException) cause;
            throw new OracleException(what + " failed: " + cause, cause);
        }
    }

    private static void sleep(long millis) throws OracleException {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted during retry backoff", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
