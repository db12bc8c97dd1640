package com.realtime.chatstore.storage.dto;

import com.realtime.chatstore.storage.entity.StoredFile;

import java.time.Instant;
import java.util.UUID;

public record StoredFileDto(
        UUID id,
        String filename,
        String originalFilename,
        String mimeType,
        long fileSize,
        String url,
        UUID uploadedBy,
        Instant createdAt
) {
    public static StoredFileDto from(StoredFile f, String urlPrefix) {
        return new StoredFileDto(
                f.getId(),
                f.getFilename(),
                f.getOriginalFilename(),
                f.getMimeType(),
                f.getFileSize(),
                urlPrefix + "/" + f.getFilename(),
                f.getUploadedBy().getId(),
                f.getCreatedAt()
        );
    }
}
