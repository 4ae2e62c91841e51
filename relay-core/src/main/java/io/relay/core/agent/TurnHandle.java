package io.relay.core.agent;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

public final class TurnHandle {
    private final String id;
    private final AbortSignal signal;
    private final CompletableFuture<TurnResult> result = new CompletableFuture<>();
    private final AtomicReference<TurnState> state = new AtomicReference<>(TurnState.IDLE);

    TurnHandle(String id, AbortSignal signal) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.signal = Objects.requireNonNull(signal, "signal must not be null");
    }

    public String id() {
        return id;
    }

    public TurnState state() {
        return state.get();
    }

    public boolean isDone() {
        return state.get().isTerminal();
    }

    /** Requests cancellation. Safe to call any number of times and after the turn has ended. */
    public void abort() {
        if (!isDone()) {
            signal.abort();
        }
    }

    public CompletableFuture<TurnResult> result() {
        return result.copy();
    }

    AbortSignal signal() {
        return signal;
    }

    boolean transition(TurnState next) {
        TurnState previous = state.get();
        if (previous.isTerminal() || previous == next) {
            return false;
        }
        return state.compareAndSet(previous, next);
    }

    void complete(TurnResult turnResult) {
        state.set(turnResult.outcome().state());
        result.complete(turnResult);
    }

    void fail(Throwable error) {
        state.set(TurnState.FAILED);
        result.completeExceptionally(error);
    }
}
