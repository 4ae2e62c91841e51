package io.relay.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, non-blocking metrics emitter.
 *
 * <p>Events are queued in a buffer of fixed capacity and written to the sink by a single daemon thread.
 * When the buffer is full the oldest queued event is discarded to make room, so {@link #emit} never waits
 * on a slow or failing sink. Discarded events are counted in {@link #droppedCount()}.
 */
public final class BufferedMetricsEmitter implements MetricsEmitter, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BufferedMetricsEmitter.class);
    private static final int MAX_BATCH = 256;

    private final MetricsSink sink;
    private final Clock clock;
    private final int capacity;
    private final Deque<MetricsEvent> buffer;
    private final AtomicLong dropped = new AtomicLong();
    private final Thread drainer;
    private volatile boolean running;

    public BufferedMetricsEmitter(MetricsSink sink, int capacity, Clock clock) {
        this(sink, capacity, clock, true);
    }

    BufferedMetricsEmitter(MetricsSink sink, int capacity, Clock clock, boolean startDrainer) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.capacity = Math.max(1, capacity);
        this.buffer = new ArrayDeque<>(this.capacity);
        this.running = startDrainer;
        if (startDrainer) {
            drainer = new Thread(this::drainLoop, "relay-metrics");
            drainer.setDaemon(true);
            drainer.start();
        } else {
            drainer = null;
        }
    }

    @Override
    public void emit(String type, Map<String, Object> attributes) {
        MetricsEvent event = new MetricsEvent(UUID.randomUUID().toString(), clock.instant(), type, attributes);
        synchronized (buffer) {
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
                long total = dropped.incrementAndGet();
                if (total == 1 || total % 1_000 == 0) {
                    LOG.debug("Metrics buffer full; {} events dropped so far", total);
                }
            }
            buffer.addLast(event);
            buffer.notifyAll();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int pending() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /** Writes everything queued so far on the calling thread. */
    public void flush() {
        List<MetricsEvent> batch;
        do {
            batch = takeBatch(false);
            write(batch);
        } while (!batch.isEmpty());
    }

    @Override
    public void close() {
        running = false;
        if (drainer != null) {
            drainer.interrupt();
            try {
                drainer.join(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        flush();
    }

    private void drainLoop() {
        while (running) {
            List<MetricsEvent> batch = takeBatch(true);
            write(batch);
        }
    }

    private List<MetricsEvent> takeBatch(boolean wait) {
        synchronized (buffer) {
            if (wait) {
                while (buffer.isEmpty() && running) {
                    try {
                        buffer.wait();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return List.of();
                    }
                }
            }
            List<MetricsEvent> batch = new ArrayList<>(Math.min(buffer.size(), MAX_BATCH));
            while (!buffer.isEmpty() && batch.size() < MAX_BATCH) {
                batch.add(buffer.pollFirst());
            }
            return batch;
        }
    }

    private void write(List<MetricsEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            sink.write(batch);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to write {} metrics events", batch.size(), e);
        }
    }
}
