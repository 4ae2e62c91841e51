package io.relay.core.error;

import java.util.Objects;

public class RelayException extends RuntimeException {
    private final ProviderError error;

    public RelayException(ProviderError error) {
        super(Objects.requireNonNull(error, "error must not be null").message());
        this.error = error;
    }

    public RelayException(ProviderError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error must not be null").message(), cause);
        this.error = error;
    }

    public static RelayException config(String message) {
        return new RelayException(ProviderError.of(ErrorKind.CONFIG_ERROR, message));
    }

    public static RelayException malformed(String message) {
        return new RelayException(ProviderError.of(ErrorKind.MALFORMED_STREAM, message));
    }

    public ProviderError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }
}
