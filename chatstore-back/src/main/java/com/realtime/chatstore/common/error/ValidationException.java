package com.realtime.chatstore.common.error;

import org.springframework.http.HttpStatus;

/** 잘못된 입력 또는 자기 자신을 가리키는 입력 */
public class ValidationException extends ChatStoreException {

    public ValidationException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }
}
