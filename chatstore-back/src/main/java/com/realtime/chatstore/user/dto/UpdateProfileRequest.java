package com.realtime.chatstore.user.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** null 필드는 변경하지 않음 */
public record UpdateProfileRequest(
        @Size(min = 1, max = 255) String displayName,
        @Size(max = 300) String bio,
        @Size(max = 512) String avatarUrl,
        @Size(max = 255) String avatarId,
        @Pattern(regexp = "^[0-9\\-+ ]{7,20}$", message = "invalid phone number") String phone
) {}
