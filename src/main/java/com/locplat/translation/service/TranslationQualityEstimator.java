package com.locplat.translation.service;

import org.springframework.stereotype.Component;

/**
 * Length-ratio heuristic for translation quality. It only flags obviously broken
 * output (empty, echoed, wildly different length); it says nothing about fluency.
 */
@Component
public class TranslationQualityEstimator {

    public double estimate(String original, String translation) {
        if (original == null || original.isEmpty() || translation == null || translation.isEmpty()) {
            return 0.0;
        }
        double ratio = (double) translation.length() / original.length();
        if (ratio < 0.3 || ratio > 3.0) {
            return 0.3;
        }
        if (translation.equalsIgnoreCase(original)) {
            return 0.2;
        }
        if (ratio >= 0.7 && ratio <= 1.5) {
            return 0.9;
        }
        if (ratio >= 0.5 && ratio <= 2.0) {
            return 0.8;
        }
        return 0.7;
    }
}
