package com.locplat.translation.service;

/**
 * Raised when a single translation unit cannot be produced by a provider.
 */
public class TranslationException extends RuntimeException {

    private final String provider;

    public TranslationException(String provider, String message) {
        super(provider == null ? message : provider + ": " + message);
        this.provider = provider;
    }

    public TranslationException(String provider, String message, Throwable cause) {
        super(provider == null ? message : provider + ": " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
