package io.relay.core.agent;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AbortSignal {
    private static final Logger LOG = LoggerFactory.getLogger(AbortSignal.class);

    private final AtomicBoolean aborted = new AtomicBoolean();
    private final CountDownLatch latch = new CountDownLatch(1);
    private final Set<Runnable> callbacks = ConcurrentHashMap.newKeySet();

    /** Idempotent; only the first call runs the registered callbacks. */
    public void abort() {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        for (Runnable callback : callbacks) {
            runQuietly(callback);
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /** Runs {@code callback} on abort, or right away when already aborted. */
    public Registration onAbort(Runnable callback) {
        callbacks.add(callback);
        if (aborted.get()) {
            runQuietly(callback);
        }
        return () -> callbacks.remove(callback);
    }

    /**
     * Waits for {@code delay} unless aborted first.
     *
     * @return {@code true} when the signal was aborted
     */
    public boolean await(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return aborted.get();
        }
        try {
            return latch.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            return true;
        }
    }

    private void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            LOG.warn("Abort callback failed", e);
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
