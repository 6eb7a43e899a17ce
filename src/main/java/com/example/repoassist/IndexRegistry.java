package com.example.repoassist;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the published repository snapshot. Requests read through a {@link Lease} for their whole
 * lifetime; publishing a new snapshot takes the write lock and therefore waits until every
 * request on the old epoch has closed its lease. The lock is fair so a waiting publisher is not
 * starved by a stream of new requests.
 */
@Component
public class IndexRegistry {

    private static final Logger log = LoggerFactory.getLogger(IndexRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final AtomicLong epochs = new AtomicLong(0);
    private volatile RepositorySnapshot current = RepositorySnapshot.empty();

    public long nextEpoch() {
        return epochs.incrementAndGet();
    }

    /** Must be closed on the thread that acquired it. */
    public Lease acquire() {
        lock.readLock().lock();
        return new Lease(current);
    }

    /** @throws IngestionException if the snapshot's epoch is not newer than the published one */
    public void publish(RepositorySnapshot snapshot) {
        log.info("Waiting for in-flight requests before publishing epoch {}", snapshot.getEpoch());
        lock.writeLock().lock();
        try {
            swap(snapshot);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Like {@link #publish} but gives up after the timeout; returns whether the swap happened. */
    public boolean tryPublish(RepositorySnapshot snapshot, long timeout, TimeUnit unit) throws InterruptedException {
        if (!lock.writeLock().tryLock(timeout, unit)) {
            log.warn("Epoch {} not published: requests on epoch {} still running", snapshot.getEpoch(), current.getEpoch());
            return false;
        }
        try {
            swap(snapshot);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void swap(RepositorySnapshot snapshot) {
        RepositorySnapshot old = current;
        if (snapshot.getEpoch() <= old.getEpoch()) {
            throw new IngestionException("Refusing to publish epoch " + snapshot.getEpoch()
                    + " over newer epoch " + old.getEpoch());
        }
        current = snapshot;
        log.info("Published repository {} epoch {} (was {}): files={}, chunks={}",
                snapshot.getId(), snapshot.getEpoch(), old.getEpoch(), snapshot.totalFiles(), snapshot.totalChunks());
    }

    public RepositorySnapshot current() {
        return current;
    }

    public class Lease implements AutoCloseable {
        private final RepositorySnapshot snapshot;
        private boolean closed;

        private Lease(RepositorySnapshot snapshot) {
            this.snapshot = snapshot;
        }

        public RepositorySnapshot snapshot() {
            return snapshot;
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                lock.readLock().unlock();
            }
        }
    }
}
