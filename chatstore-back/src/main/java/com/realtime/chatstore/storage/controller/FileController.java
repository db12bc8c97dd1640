package com.realtime.chatstore.storage.controller;

import com.realtime.chatstore.common.CurrentUser;
import com.realtime.chatstore.storage.dto.RecordUploadRequest;
import com.realtime.chatstore.storage.dto.StoredFileDto;
import com.realtime.chatstore.storage.service.FileMetadataService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class FileController {

    private final FileMetadataService fileService;

    /** 저장소 업로드가 끝난 객체의 메타데이터 기록 */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public StoredFileDto record(@Valid @RequestBody RecordUploadRequest req, Principal principal) {
        return fileService.recordUpload(CurrentUser.id(principal), req.toStoredObject());
    }

    /** 내가 올린 파일들 */
    @GetMapping
    public List<StoredFileDto> mine(Principal principal) {
        return fileService.listUploads(CurrentUser.id(principal));
    }

    @GetMapping("/{fileId}")
    public StoredFileDto get(@PathVariable("fileId") UUID fileId) {
        return fileService.getFile(fileId);
    }

    @DeleteMapping("/{fileId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("fileId") UUID fileId, Principal principal) {
        fileService.deleteFile(fileId, CurrentUser.id(principal));
    }
}
