package com.realtime.chatstore.common.error;

import org.springframework.http.HttpStatus;

/** 유니크/정규화 간선/중복 대화방 위반 */
public class ConflictException extends ChatStoreException {

    public ConflictException(String reason) {
        super(HttpStatus.CONFLICT, reason);
    }

    public ConflictException(String reason, Throwable cause) {
        super(HttpStatus.CONFLICT, reason, cause);
    }
}
