package com.realtime.chatstore.user.dto;

import com.realtime.chatstore.user.entity.User;

import java.time.Instant;
import java.util.UUID;

public record UserDto(
        UUID id,
        String username,
        String email,
        String phone,
        String role,
        String displayName,
        String avatarUrl,
        String bio,
        Instant createdAt
) {
    public static UserDto from(User u) {
        return new UserDto(
                u.getId(),
                u.getUsername(),
                u.getEmail(),
                u.getPhone(),
                u.getRole().name(),
                u.getDisplayName(),
                u.getAvatarUrl(),
                u.getBio(),
                u.getCreatedAt()
        );
    }
}
