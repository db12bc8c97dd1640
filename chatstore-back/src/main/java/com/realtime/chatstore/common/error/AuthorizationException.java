package com.realtime.chatstore.common.error;

import org.springframework.http.HttpStatus;

/** 요청자가 대상 행에 대한 권한이 없음 */
public class AuthorizationException extends ChatStoreException {

    public AuthorizationException(String reason) {
        super(HttpStatus.FORBIDDEN, reason);
    }
}
