package com.example.repoassist;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OracleCallerTest {

    private final OracleCaller caller = new OracleCaller(200, 1, 0);

    @AfterEach
    public void tearDown() {
        caller.shutdown();
    }

    @Test
    public void returnsTheEngineAnswer() throws Exception {
        assertThat(caller.call("classification", () -> Intent.LOCATE)).isEqualTo(Intent.LOCATE);
    }

    @Test
    public void slowCallsTimeOutAfterRetrying() {
        AtomicInteger attempts = new AtomicInteger();
        assertThatThrownBy(() -> caller.call("synthesis", () -> {
            attempts.incrementAndGet();
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                throw new OracleException("interrupted", e);
            }
            return "late";
        })).isInstanceOfSatisfying(OracleTimeoutException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.ORACLE_TIMEOUT));
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    public void unparseableAnswersAreRetried() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        Intent intent = caller.call("classification", () -> {
            if (attempts.incrementAndGet() == 1) throw new OracleUnparseableException("unknown intent 'banana'", "banana");
            return Intent.OVERVIEW;
        });

        assertThat(intent).isEqualTo(Intent.OVERVIEW);
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    public void unreachableEngineIsNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        assertThatThrownBy(() -> caller.call("classification", () -> {
            attempts.incrementAndGet();
            throw new OracleException("Could not start ollama");
        })).isInstanceOfSatisfying(OracleException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.ORACLE_UNREACHABLE));
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    public void unexpectedFailuresBecomeOracleExceptions() {
        assertThatThrownBy(() -> caller.call("tagging", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(OracleException.class).hasCauseInstanceOf(IllegalStateException.class);
    }
}
