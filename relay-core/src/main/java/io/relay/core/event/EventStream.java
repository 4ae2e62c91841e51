package io.relay.core.event;

import io.relay.core.error.ProviderError;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily produced events of one attempt. Reading blocks only while waiting on the network.
 * {@link #cancel()} may be called from any thread and makes a blocked read return promptly.
 */
public interface EventStream extends Iterator<CanonicalEvent>, AutoCloseable {

    void cancel();

    @Override
    void close();

    static EventStream failed(ProviderError error) {
        return new EventStream() {
            private boolean consumed;

            @Override
            public boolean hasNext() {
                return !consumed;
            }

            @Override
            public CanonicalEvent next() {
                if (consumed) {
                    throw new NoSuchElementException();
                }
                consumed = true;
                return new CanonicalEvent.StreamError(error);
            }

            @Override
            public void cancel() {
                consumed = true;
            }

            @Override
            public void close() {
                consumed = true;
            }
        };
    }
}
