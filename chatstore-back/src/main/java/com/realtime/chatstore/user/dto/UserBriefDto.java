package com.realtime.chatstore.user.dto;

import com.realtime.chatstore.user.entity.User;

import java.util.UUID;

/** 친구 목록/참여자 목록 등에 들어가는 요약 정보 */
public record UserBriefDto(
        UUID id,
        String username,
        String displayName,
        String avatarUrl
) {
    public static UserBriefDto from(User u) {
        return new UserBriefDto(u.getId(), u.getUsername(), u.getDisplayName(), u.getAvatarUrl());
    }
}
