package com.realtime.chatstore.common;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class UuidOrderTest {

    private final UUID low = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private final UUID high = UUID.fromString("ffffffff-0000-0000-0000-000000000000");

    @Test
    void comparesAsUnsignedBytes() {
        // 부호 있는 비교에서는 high 가 음수라 더 작게 나온다
        assertThat(high.compareTo(low)).isNegative();
        assertThat(UuidOrder.compare(high, low)).isPositive();
        assertThat(UuidOrder.compare(low, high)).isNegative();
    }

    @Test
    void fallsBackToLeastSignificantBits() {
        UUID a = new UUID(5L, 1L);
        UUID b = new UUID(5L, -1L);
        assertThat(UuidOrder.compare(a, b)).isNegative();
        assertThat(UuidOrder.compare(a, new UUID(5L, 1L))).isZero();
    }

    @Test
    void minAndMaxIgnoreArgumentOrder() {
        assertThat(UuidOrder.min(high, low)).isEqualTo(low);
        assertThat(UuidOrder.min(low, high)).isEqualTo(low);
        assertThat(UuidOrder.max(high, low)).isEqualTo(high);
        assertThat(UuidOrder.max(low, high)).isEqualTo(high);
    }

    @Test
    void sortsLikeHexStrings() {
        List<UUID> ids = new ArrayList<>(List.of(
                UUID.fromString("9a000000-0000-0000-0000-000000000000"),
                UUID.fromString("10000000-0000-0000-0000-000000000000"),
                UUID.fromString("10000000-0000-0000-8000-000000000000"),
                UUID.fromString("f0000000-0000-0000-0000-000000000000")));
        ids.sort(UuidOrder.COMPARATOR);
        List<String> asText = ids.stream().map(UUID::toString).toList();
        assertThat(asText).isSorted();
    }
}
