package com.example.khaznati_backend.repository;

import com.example.khaznati_backend.model.FileChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

public interface FileChunkRepository extends JpaRepository<FileChunk, UUID> {
    List<FileChunk> findByFileIdOrderBySequenceIndexAsc(UUID fileId);

    boolean existsByFileIdAndSequenceIndex(UUID fileId, int sequenceIndex);

    long countByFileId(UUID fileId);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("delete from FileChunk c where c.file.id = :fileId")
    int deleteByFileId(@Param("fileId") UUID fileId);
}
