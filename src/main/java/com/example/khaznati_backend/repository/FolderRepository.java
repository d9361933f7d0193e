package com.example.khaznati_backend.repository;

import com.example.khaznati_backend.model.Folder;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FolderRepository extends JpaRepository<Folder, UUID> {
    Optional<Folder> findByIdAndOwnerId(UUID id, UUID ownerId);
    boolean existsByIdAndOwnerId(UUID id, UUID ownerId);

    List<Folder> findByOwnerIdAndParentIsNullOrderByNameAsc(UUID ownerId);
    List<Folder> findByOwnerIdAndParentIdOrderByNameAsc(UUID ownerId, UUID parentId);

    boolean existsByOwnerIdAndParentIsNullAndName(UUID ownerId, String name);
    boolean existsByOwnerIdAndParentIdAndName(UUID ownerId, UUID parentId, String name);

    long countByParentId(UUID parentId);
}
