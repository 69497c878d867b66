package com.locplat.translation.service;

/**
 * Cleans field text before it is sent to a provider.
 */
public interface ContentSanitizer {

    /**
     * @param maxLength upper bound on the returned length; non-positive disables truncation
     */
    String sanitize(String text, int maxLength);
}
