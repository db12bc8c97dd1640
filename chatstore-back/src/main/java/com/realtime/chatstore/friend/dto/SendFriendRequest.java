package com.realtime.chatstore.friend.dto;

import jakarta.validation.constraints.Size;

import java.util.UUID;

/** toUserId 또는 identifier(이메일/휴대폰/username) 중 하나 */
public record SendFriendRequest(
        UUID toUserId,
        String identifier,
        @Size(max = 300) String message
) {}
