package com.realtime.chatstore.chat.dto;

import java.util.List;

/**
 * 최신 → 과거 (created_at DESC, id DESC) 순서. nextCursor 가 null 이면 끝.
 */
public record MessagePage(
        List<MessageDto> messages,
        MessageCursor nextCursor
) {}
