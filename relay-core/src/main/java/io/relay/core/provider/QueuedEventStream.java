package io.relay.core.provider;

import io.relay.core.error.ErrorKind;
import io.relay.core.error.ProviderError;
import io.relay.core.event.CanonicalEvent;
import io.relay.core.event.EventStream;
import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges a push-style producer (an SDK callback thread) to the pull-style {@link EventStream} contract.
 * Each read waits at most {@code readTimeout}; a stall longer than that ends the stream with a network error.
 */
final class QueuedEventStream implements EventStream {
    private final BlockingQueue<CanonicalEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean producerDone = new AtomicBoolean();
    private final Duration readTimeout;
    private volatile Runnable onCancel = () -> { };
    private CanonicalEvent buffered;
    private boolean consumerDone;

    QueuedEventStream(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    void onCancel(Runnable action) {
        this.onCancel = action;
    }

    /** Producer side; events after the first terminal one are dropped. */
    void offer(CanonicalEvent event) {
        if (producerDone.get()) {
            return;
        }
        if (event.isTerminal() && !producerDone.compareAndSet(false, true)) {
            return;
        }
        queue.add(event);
    }

    @Override
    public boolean hasNext() {
        if (buffered != null) {
            return true;
        }
        if (consumerDone) {
            return false;
        }
        try {
            CanonicalEvent event = queue.poll(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (event == null) {
                cancel();
                event = new CanonicalEvent.StreamError(ProviderError.of(
                    ErrorKind.NETWORK_ERROR, "no stream event within " + readTimeout.toMillis() + " ms"
                ));
            }
            buffered = event;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            buffered = new CanonicalEvent.StreamError(ProviderError.of(ErrorKind.NETWORK_ERROR, "stream read interrupted"));
        }
        if (buffered.isTerminal()) {
            consumerDone = true;
        }
        return true;
    }

    @Override
    public CanonicalEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("stream is exhausted");
        }
        CanonicalEvent event = buffered;
        buffered = null;
        return event;
    }

    @Override
    public void cancel() {
        offer(new CanonicalEvent.StreamError(ProviderError.of(ErrorKind.NETWORK_ERROR, "stream cancelled")));
        onCancel.run();
    }

    @Override
    public void close() {
        consumerDone = true;
        if (!producerDone.get()) {
            cancel();
        }
    }
}
