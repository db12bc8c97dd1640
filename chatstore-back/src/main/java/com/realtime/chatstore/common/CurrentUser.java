package com.realtime.chatstore.common;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.security.Principal;
import java.util.UUID;

/**
 * 앞단 인증 계층이 채워준 Principal(name = 사용자 UUID)을 그대로 신뢰한다.
 */
public final class CurrentUser {

    private CurrentUser() {}

    public static UUID id(Principal principal) {
        if (principal == null || principal.getName() == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "unauthenticated");
        }
        try {
            return UUID.fromString(principal.getName());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "invalid principal", e);
        }
    }
}
