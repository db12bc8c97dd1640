package com.realtime.chatstore.friend.dto;

import com.realtime.chatstore.user.dto.UserBriefDto;

import java.time.Instant;

/** 친구 목록 한 줄: 상대 요약 + 친구가 된 시각 */
public record FriendBriefDto(
        UserBriefDto friend,
        Instant since
) {}
