package com.realtime.chatstore.chat.dto;

import com.realtime.chatstore.chat.entity.LastMessage;

import java.time.Instant;
import java.util.UUID;

public record LastMessageDto(
        UUID messageId,
        UUID senderId,
        String type,
        String content,
        Instant createdAt
) {
    public static LastMessageDto from(LastMessage l) {
        return new LastMessageDto(l.getMessageId(), l.getSender().getId(), l.getType().name(), l.getContent(), l.getCreatedAt());
    }
}
