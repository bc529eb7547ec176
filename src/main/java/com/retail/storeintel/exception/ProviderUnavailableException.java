package com.retail.storeintel.exception;

/**
 * An external source (weather provider, transaction feed) failed or timed out.
 * Internal only: callers in the core catch it and degrade.
 */
public class ProviderUnavailableException extends RuntimeException {

    private final String provider;

    public ProviderUnavailableException(String provider, String message) {
        super(provider + ": " + message);
        this.provider = provider;
    }

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
