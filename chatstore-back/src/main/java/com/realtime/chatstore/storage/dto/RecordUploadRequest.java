package com.realtime.chatstore.storage.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record RecordUploadRequest(
        @NotBlank @Size(max = 1024) String storagePath,
        @PositiveOrZero long size,
        @NotBlank @Size(max = 100) String contentType,
        @NotBlank @Size(max = 255) String originalName
) {
    public StoredObject toStoredObject() {
        return StoredObject.builder()
                .storagePath(storagePath)
                .size(size)
                .contentType(contentType)
                .originalName(originalName)
                .build();
    }
}
