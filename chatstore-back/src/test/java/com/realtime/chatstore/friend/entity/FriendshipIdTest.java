package com.realtime.chatstore.friend.entity;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FriendshipIdTest {

    private final UUID a = UUID.fromString("0fffffff-0000-0000-0000-000000000000");
    private final UUID b = UUID.fromString("f0000000-0000-0000-0000-000000000000");

    @Test
    void sameKeyForEitherDirection() {
        FriendshipId ab = FriendshipId.of(a, b);
        FriendshipId ba = FriendshipId.of(b, a);

        assertThat(ab).isEqualTo(ba);
        assertThat(ab.getUserA()).isEqualTo(a);
        assertThat(ab.getUserB()).isEqualTo(b);
    }

    @Test
    void otherReturnsTheOppositeEnd() {
        FriendshipId key = FriendshipId.of(b, a);
        assertThat(key.other(a)).isEqualTo(b);
        assertThat(key.other(b)).isEqualTo(a);
    }

    @Test
    void rejectsSelfEdgeAndNulls() {
        assertThatThrownBy(() -> FriendshipId.of(a, a)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FriendshipId.of(null, a)).isInstanceOf(IllegalArgumentException.class);
    }
}
