package com.realtime.chatstore.chat.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record CreateGroupRequest(
        @NotBlank @Size(max = 255) String name,
        List<UUID> memberIds   // 생성자는 자동 포함
) {}
