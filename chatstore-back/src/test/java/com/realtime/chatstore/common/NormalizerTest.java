package com.realtime.chatstore.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();

    @Test
    void emailIsTrimmedAndLowercased() {
        assertThat(normalizer.normalizeEmail("  Alice@Example.COM ")).isEqualTo("alice@example.com");
        assertThat(normalizer.normalizeEmail(null)).isNull();
    }

    @Test
    void phoneKeepsDigitsAndPlus() {
        assertThat(normalizer.normalizePhone("+82 10-1234-5678")).isEqualTo("+821012345678");
        assertThat(normalizer.normalizePhone(" - ")).isNull();
    }

    @Test
    void identifierDetection() {
        assertThat(normalizer.looksLikeEmail("bob@example.com")).isTrue();
        assertThat(normalizer.looksLikeEmail("bob")).isFalse();
        assertThat(normalizer.looksLikePhone("010-1234-5678")).isTrue();
        assertThat(normalizer.looksLikePhone("bob")).isFalse();
    }
}
