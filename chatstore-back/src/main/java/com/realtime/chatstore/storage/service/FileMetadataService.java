package com.realtime.chatstore.storage.service;

import com.realtime.chatstore.common.Timestamps;
import com.realtime.chatstore.common.TransactionRunner;
import com.realtime.chatstore.common.error.AuthorizationException;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.config.UploadProps;
import com.realtime.chatstore.storage.dto.StoredFileDto;
import com.realtime.chatstore.storage.dto.StoredObject;
import com.realtime.chatstore.storage.entity.StoredFile;
import com.realtime.chatstore.storage.repository.StoredFileRepository;
import com.realtime.chatstore.user.entity.User;
import com.realtime.chatstore.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 첨부 파일 메타데이터. 업로드 자체는 외부 저장소가 처리하고 여기서는 검증 후 기록만 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileMetadataService {

    private final StoredFileRepository fileRepo;
    private final UserService userService;
    private final UploadProps props;
    private final TransactionRunner tx;
    private final Clock clock;

    public StoredFileDto recordUpload(UUID uploaderId, StoredObject so) {
        validate(so);
        String originalName = safeOriginalName(so.getOriginalName());
        String filename = generateFilename(originalName);

        return tx.write("recordUpload", () -> {
            User uploader = userService.requireLive(uploaderId);
            StoredFile saved = fileRepo.save(StoredFile.builder()
                    .filename(filename)
                    .originalFilename(originalName)
                    .mimeType(so.getContentType())
                    .fileSize(so.getSize())
                    .storagePath(so.getStoragePath())
                    .uploadedBy(uploader)
                    .createdAt(Timestamps.now(clock))
                    .build());
            log.info("file {} recorded for {} ({} bytes, {})", saved.getId(), uploaderId, so.getSize(), so.getContentType());
            return StoredFileDto.from(saved, urlPrefix());
        });
    }

    @Transactional(readOnly = true)
    public StoredFileDto getFile(UUID fileId) {
        return fileRepo.findById(fileId)
                .map(f -> StoredFileDto.from(f, urlPrefix()))
                .orElseThrow(() -> new NotFoundException("file not found"));
    }

    @Transactional(readOnly = true)
    public List<StoredFileDto> listUploads(UUID uploaderId) {
        return fileRepo.findByUploadedBy_IdOrderByCreatedAtDesc(uploaderId).stream()
                .map(f -> StoredFileDto.from(f, urlPrefix()))
                .toList();
    }

    /** 메타데이터만 지운다. 올린 사람만 가능 */
    public void deleteFile(UUID fileId, UUID actingUserId) {
        tx.run("deleteFile", () -> {
            StoredFile f = fileRepo.findById(fileId)
                    .orElseThrow(() -> new NotFoundException("file not found"));
            if (!f.getUploadedBy().getId().equals(actingUserId)) {
                throw new AuthorizationException("only the uploader can delete this file");
            }
            fileRepo.delete(f);
        });
    }

    /* =============== 검증 / 이름 =============== */

    private void validate(StoredObject so) {
        if (so == null) throw new ValidationException("file is required");
        if (!StringUtils.hasText(so.getStoragePath())) throw new ValidationException("storagePath is required");
        if (so.getSize() < 0) throw new ValidationException("size must not be negative");
        if (so.getSize() > props.maxFileBytes()) {
            throw new ValidationException("file size exceeds maximum allowed size of " + props.maxFileBytes() + " bytes");
        }
        String mime = so.getContentType();
        if (!StringUtils.hasText(mime) || !props.getAllowedMimeTypes().contains(mime)) {
            throw new ValidationException("file type '" + mime + "' is not allowed");
        }
    }

    /** <uuid>.<ext> (확장자가 없으면 uuid 만) */
    String generateFilename(String originalName) {
        String ext = safeExt(originalName);
        String id = UUID.randomUUID().toString();
        return ext.isEmpty() ? id : id + "." + ext;
    }

    private String safeExt(String originalName) {
        String ext = FilenameUtils.getExtension(originalName);
        if (ext == null) return "";
        ext = ext.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "");
        return ext.length() > 10 ? "" : ext;
    }

    private String safeOriginalName(String originalName) {
        if (!StringUtils.hasText(originalName)) return "upload.bin";
        // 브라우저/OS가 보낼 수 있는 전체 경로 제거
        String name = FilenameUtils.getName(originalName.trim());
        if (name.isEmpty()) return "upload.bin";
        return name.length() > 255 ? name.substring(0, 255) : name;
    }

    private String urlPrefix() {
        String p = props.getUrlPrefix();
        if (!StringUtils.hasText(p)) return "";
        return p.trim().replaceAll("/+$", "");
    }
}
