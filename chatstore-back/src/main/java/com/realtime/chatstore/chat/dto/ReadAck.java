package com.realtime.chatstore.chat.dto;

import java.util.UUID;

public record ReadAck(
        UUID conversationId,
        UUID userId,
        UUID lastSeenMessageId,  // 빈 방이면 null
        int unread               // 덮어쓴 미읽음 값
) {}
