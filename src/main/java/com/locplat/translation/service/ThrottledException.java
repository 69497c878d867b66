package com.locplat.translation.service;

public class ThrottledException extends TranslationException {
    /**
     * Creates an exception describing a throttled upstream call.
     */
    public ThrottledException(String provider, String m) { super(provider, m); }
    /**
     * Creates an exception that preserves the originating cause.
     */
    public ThrottledException(String provider, String m, Throwable c) { super(provider, m, c); }
}
