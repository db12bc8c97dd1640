package com.realtime.chatstore.user.dto;

import jakarta.validation.constraints.*;

public record RegisterRequest(
        @NotBlank @Size(min = 2, max = 255)
        String username,

        @Email @NotBlank @Size(max = 255)
        String email,

        /** 선택 항목 */
        @Pattern(regexp = "^[0-9\\-+ ]{7,20}$", message = "invalid phone number")
        String phone,

        /** 표시용 이름 */
        @NotBlank @Size(max = 255)
        String displayName,

        /** 인증 계층에서 이미 해시된 값 */
        @NotBlank
        String passwordHash
) {}
