package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.ConflictException;
import com.example.khaznati_backend.exception.IncompleteException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.model.FileChunk;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.repository.FileChunkRepository;
import com.example.khaznati_backend.repository.StoredFileRepository;
import com.example.khaznati_backend.service.Interfaces.ChunkIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
public class JpaChunkIndex implements ChunkIndex {
    private static final Logger LOGGER = LoggerFactory.getLogger(JpaChunkIndex.class);

    private final FileChunkRepository chunkRepo;
    private final StoredFileRepository fileRepo;

    public JpaChunkIndex(FileChunkRepository chunkRepo, StoredFileRepository fileRepo) {
        this.chunkRepo = chunkRepo;
        this.fileRepo = fileRepo;
    }

    @Override
    @Transactional
    public void append(UUID fileId, int sequenceIndex, String locator, long size) {
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("sequenceIndex must be >= 0");
        }
        if (locator == null || locator.isBlank()) {
            throw new IllegalArgumentException("locator is required");
        }
        if (chunkRepo.existsByFileIdAndSequenceIndex(fileId, sequenceIndex)) {
            throw new ConflictException("Chunk %d of file %s already recorded".formatted(sequenceIndex, fileId));
        }
        StoredFile file = fileRepo.findById(fileId)
                .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
        chunkRepo.save(new FileChunk(file, sequenceIndex, locator, size));
        LOGGER.debug("ChunkIndex append file={} seq={} size={}", fileId, sequenceIndex, size);
    }

    /**
     * @throws IncompleteException when the recorded indexes are not exactly {@code 0..n-1}
     */
    @Override
    @Transactional(readOnly = true)
    public List<ChunkRecord> listOrdered(UUID fileId) {
        List<ChunkRecord> records = listAll(fileId);
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).sequenceIndex() != i) {
                throw new IncompleteException("File %s has a gap in its chunks at index %d (found %d)"
                        .formatted(fileId, i, records.get(i).sequenceIndex()));
            }
        }
        return records;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ChunkRecord> listAll(UUID fileId) {
        return chunkRepo.findByFileIdOrderBySequenceIndexAsc(fileId).stream()
                .map(c -> new ChunkRecord(fileId, c.getSequenceIndex(), c.getLocator(), c.getSizeBytes()))
                .toList();
    }

    @Override
    @Transactional
    public void deleteAll(UUID fileId) {
        int removed = chunkRepo.deleteByFileId(fileId);
        LOGGER.debug("ChunkIndex deleteAll file={} removed={}", fileId, removed);
    }
}
