package com.locplat.translation.service;

/**
 * Input the pipeline cannot work with at all: non-document content, unknown provider,
 * unsupported language pair.
 */
public class InvalidTranslationRequestException extends RuntimeException {
    public InvalidTranslationRequestException(String message) {
        super(message);
    }
}
