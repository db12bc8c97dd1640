package com.realtime.chatstore.friend.dto;

import com.realtime.chatstore.friend.entity.Friendship;

import java.time.Instant;
import java.util.UUID;

/** 저장된 정규화 간선 그대로 (userA &lt; userB) */
public record FriendshipDto(
        UUID userA,
        UUID userB,
        Instant createdAt
) {
    public static FriendshipDto from(Friendship f) {
        return new FriendshipDto(f.getId().getUserA(), f.getId().getUserB(), f.getCreatedAt());
    }
}
