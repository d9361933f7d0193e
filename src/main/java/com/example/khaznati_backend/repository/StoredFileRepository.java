package com.example.khaznati_backend.repository;

import com.example.khaznati_backend.model.StoredFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface StoredFileRepository extends JpaRepository<StoredFile, UUID> {
    Optional<StoredFile> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<StoredFile> findByOwnerIdAndFolderIdIsNullAndTrashedFalseOrderByNameAsc(UUID ownerId);
    List<StoredFile> findByOwnerIdAndFolderIdAndTrashedFalseOrderByNameAsc(UUID ownerId, UUID folderId);

    List<StoredFile> findByOwnerIdAndTrashedTrueOrderByTrashedAtDesc(UUID ownerId);

    long countByFolderIdAndTrashedFalse(UUID folderId);
}
