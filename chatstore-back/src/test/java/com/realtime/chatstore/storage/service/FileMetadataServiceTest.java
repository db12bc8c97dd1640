package com.realtime.chatstore.storage.service;

import com.realtime.chatstore.common.error.AuthorizationException;
import com.realtime.chatstore.common.error.NotFoundException;
import com.realtime.chatstore.common.error.ValidationException;
import com.realtime.chatstore.storage.dto.StoredFileDto;
import com.realtime.chatstore.storage.dto.StoredObject;
import com.realtime.chatstore.storage.repository.StoredFileRepository;
import com.realtime.chatstore.support.StoreIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileMetadataServiceTest extends StoreIntegrationTest {

    @Autowired
    FileMetadataService fileService;

    @Autowired
    StoredFileRepository fileRepo;

    private static StoredObject object(String name, String mime, long size) {
        return StoredObject.builder()
                .storagePath("bucket/" + name)
                .size(size)
                .contentType(mime)
                .originalName(name)
                .build();
    }

    @Test
    void recordsMetadataWithGeneratedName() {
        user(1);

        StoredFileDto f = fileService.recordUpload(id(1), object("C:\\photos\\Cat.PNG", "image/png", 2048));

        assertThat(f.originalFilename()).isEqualTo("Cat.PNG");
        assertThat(f.filename()).matches("[0-9a-f\\-]{36}\\.png");
        assertThat(f.url()).isEqualTo("/uploads/" + f.filename());
        assertThat(f.fileSize()).isEqualTo(2048);
        assertThat(f.uploadedBy()).isEqualTo(id(1));
        assertThat(fileService.getFile(f.id()).filename()).isEqualTo(f.filename());
    }

    @Test
    void nameWithoutExtensionIsJustTheUuid() {
        user(1);

        StoredFileDto f = fileService.recordUpload(id(1), object("README", "application/pdf", 10));

        assertThat(f.filename()).matches("[0-9a-f\\-]{36}");
    }

    @Test
    void rejectsOversizedAndDisallowedTypes() {
        user(1);
        long oneMb = 1024L * 1024L;

        assertThatThrownBy(() -> fileService.recordUpload(id(1), object("big.png", "image/png", oneMb + 1)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> fileService.recordUpload(id(1), object("run.exe", "application/x-msdownload", 10)))
                .isInstanceOf(ValidationException.class);
        assertThat(fileRepo.count()).isZero();

        assertThat(fileService.recordUpload(id(1), object("edge.png", "image/png", oneMb))).isNotNull();
    }

    @Test
    void uploaderMustExist() {
        assertThatThrownBy(() -> fileService.recordUpload(id(5), object("a.png", "image/png", 1)))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void listAndDeleteAreScopedToUploader() {
        user(1);
        user(2);
        StoredFileDto older = fileService.recordUpload(id(1), object("a.png", "image/png", 1));
        StoredFileDto newer = fileService.recordUpload(id(1), object("b.pdf", "application/pdf", 1));
        fileService.recordUpload(id(2), object("c.png", "image/png", 1));

        assertThat(fileService.listUploads(id(1)))
                .extracting(StoredFileDto::id)
                .containsExactly(newer.id(), older.id());

        assertThatThrownBy(() -> fileService.deleteFile(older.id(), id(2)))
                .isInstanceOf(AuthorizationException.class);

        fileService.deleteFile(older.id(), id(1));

        assertThatThrownBy(() -> fileService.getFile(older.id())).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fileService.deleteFile(UUID.randomUUID(), id(1)))
                .isInstanceOf(NotFoundException.class);
    }
}
