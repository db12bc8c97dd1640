package com.realtime.chatstore.chat.dto;

import com.realtime.chatstore.chat.entity.Message;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record SendMessageRequest(
        Message.Type type,           // 없으면 TEXT
        @Size(max = 4000) String content,
        @Size(max = 1024) String fileUrl,
        UUID replyToId
) {}
