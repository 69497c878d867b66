package com.locplat.translation.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TranslationQualityEstimatorTest {

    private final TranslationQualityEstimator estimator = new TranslationQualityEstimator();

    @Test
    void scoresByLengthRatio() {
        assertThat(estimator.estimate("Hello", "")).isEqualTo(0.0);
        assertThat(estimator.estimate("Hello world", "x")).isEqualTo(0.3);
        assertThat(estimator.estimate("Hello", "HELLO")).isEqualTo(0.2);
        assertThat(estimator.estimate("Hello", "Bonjour")).isEqualTo(0.9);
        assertThat(estimator.estimate("Hello", "Bonjour!!")).isEqualTo(0.8);
        assertThat(estimator.estimate("Hi there", "Salut")).isEqualTo(0.8);
        assertThat(estimator.estimate("Hello", "Bonjour, mon")).isEqualTo(0.7);
    }
}
