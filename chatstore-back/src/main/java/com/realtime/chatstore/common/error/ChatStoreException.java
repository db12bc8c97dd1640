package com.realtime.chatstore.common.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 저장소 계층에서 던지는 모든 도메인 오류의 공통 부모.
 * HTTP 어댑터는 상태코드/사유만 그대로 내려보낸다.
 */
public abstract class ChatStoreException extends ResponseStatusException {

    protected ChatStoreException(HttpStatus status, String reason) {
        super(status, reason);
    }

    protected ChatStoreException(HttpStatus status, String reason, Throwable cause) {
        super(status, reason, cause);
    }
}
