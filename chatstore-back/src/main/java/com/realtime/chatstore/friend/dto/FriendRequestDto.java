package com.realtime.chatstore.friend.dto;

import com.realtime.chatstore.friend.entity.FriendRequest;
import com.realtime.chatstore.user.dto.UserBriefDto;

import java.time.Instant;
import java.util.UUID;

public record FriendRequestDto(
        UUID id,
        UserBriefDto from,
        UserBriefDto to,
        String message,
        Instant createdAt
) {
    public static FriendRequestDto from(FriendRequest fr) {
        return new FriendRequestDto(
                fr.getId(),
                UserBriefDto.from(fr.getFromUser()),
                UserBriefDto.from(fr.getToUser()),
                fr.getMessage(),
                fr.getCreatedAt()
        );
    }
}
