package com.realtime.chatstore.chat.dto;

import java.time.Instant;
import java.util.UUID;

/** 페이지 재시작 지점. 이 (createdAt, id) 보다 오래된 메시지부터 이어서 읽는다 */
public record MessageCursor(Instant createdAt, UUID id) {}
