package com.realtime.chatstore.chat.dto;

import com.realtime.chatstore.chat.entity.Participant;

import java.time.Instant;
import java.util.UUID;

public record ParticipantDto(
        UUID userId,
        String displayName,
        String avatarUrl,
        int unreadCount,
        UUID lastSeenMessageId,
        Instant joinedAt
) {
    public static ParticipantDto from(Participant p) {
        return new ParticipantDto(
                p.getId().getUserId(),
                p.getUser().getDisplayName(),
                p.getUser().getAvatarUrl(),
                p.getUnreadCount(),
                p.getLastSeenMessageId(),
                p.getJoinedAt()
        );
    }
}
