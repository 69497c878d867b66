package com.locplat.translation.service;

/**
 * A batched call failed for at least one item; callers fall back to per-field translation.
 */
public class BatchTranslationException extends RuntimeException {

    private final int failedIndex;

    public BatchTranslationException(int failedIndex, Throwable cause) {
        super("Batch translation failed at index " + failedIndex + ": " + cause.getMessage(), cause);
        this.failedIndex = failedIndex;
    }

    public int getFailedIndex() {
        return failedIndex;
    }
}
