package com.realtime.chatstore.storage.dto;

import lombok.Builder;
import lombok.Getter;

/**
 * 외부 저장소가 이미 받아둔 객체에 대한 설명. 바이트는 여기로 오지 않는다.
 */
@Getter
@Builder
public class StoredObject {
    private final String storagePath;   // 저장소 안의 위치 (ex. s3 key, 로컬 경로)
    private final long size;
    private final String contentType;
    private final String originalName;
}
