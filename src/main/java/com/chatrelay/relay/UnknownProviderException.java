package com.chatrelay.relay;

public class UnknownProviderException extends RuntimeException {

    private final String provider;

    public UnknownProviderException(String provider) {
        super("Provider " + provider + " not found");
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
