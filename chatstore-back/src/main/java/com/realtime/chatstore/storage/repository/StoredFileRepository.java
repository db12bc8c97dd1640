package com.realtime.chatstore.storage.repository;

import com.realtime.chatstore.storage.entity.StoredFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StoredFileRepository extends JpaRepository<StoredFile, UUID> {

    List<StoredFile> findByUploadedBy_IdOrderByCreatedAtDesc(UUID uploaderId);
}
