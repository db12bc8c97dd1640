package com.realtime.chatstore.common.error;

import org.springframework.http.HttpStatus;

/** 참조 대상이 없거나 이미 제거됨 */
public class NotFoundException extends ChatStoreException {

    public NotFoundException(String reason) {
        super(HttpStatus.NOT_FOUND, reason);
    }
}
