package com.chatrelay.providers;

/**
 * A classified provider failure. The kind is decided by the capability layer
 * where it knows the cause, or by {@link ProviderFailures} from the raw text.
 */
public class ProviderException extends RuntimeException {

    public enum Kind {
        BLOCKED,
        CREDENTIALS,
        TIMEOUT,
        EMPTY,
        UPSTREAM
    }

    private final String provider;
    private final Kind kind;

    public ProviderException(String provider, Kind kind, String message) {
        super(message);
        this.provider = provider;
        this.kind = kind;
    }

    public ProviderException(String provider, Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.kind = kind;
    }

    public String provider() {
        return provider;
    }

    public Kind kind() {
        return kind;
    }
}
