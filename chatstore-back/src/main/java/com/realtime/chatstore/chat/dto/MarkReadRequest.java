package com.realtime.chatstore.chat.dto;

import java.util.UUID;

/** messageId 가 없으면 가장 최신 메시지까지 읽음 */
public record MarkReadRequest(UUID messageId) {}
