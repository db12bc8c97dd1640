package com.realtime.chatstore.chat.dto;

import com.realtime.chatstore.chat.entity.GroupConversation;

import java.util.UUID;

public record GroupInfoDto(
        String name,
        UUID createdBy,
        String avatarUrl
) {
    public static GroupInfoDto from(GroupConversation g) {
        return new GroupInfoDto(g.getName(), g.getCreatedBy().getId(), g.getAvatarUrl());
    }
}
