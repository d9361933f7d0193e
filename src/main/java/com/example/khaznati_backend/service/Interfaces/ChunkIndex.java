package com.example.khaznati_backend.service.Interfaces;

import java.util.List;
import java.util.UUID;

/**
 * Durable mapping of (file, sequence index) to backend locator and chunk size.
 */
public interface ChunkIndex {

    /**
     * Records one chunk.
     *
     * @throws com.example.khaznati_backend.exception.ConflictException if the sequence index is already taken
     */
    void append(UUID fileId, int sequenceIndex, String locator, long size);

    /**
     * Every chunk record of the file, ascending by sequence index. Empty when the file has none.
     *
     * @throws com.example.khaznati_backend.exception.IncompleteException if the indexes are not contiguous from 0
     */
    List<ChunkRecord> listOrdered(UUID fileId);

    /** Every recorded chunk ascending by index, gaps included. For cleanup paths that must see everything. */
    List<ChunkRecord> listAll(UUID fileId);

    /** Removes every chunk record of the file. Only call once backend deletes were attempted. */
    void deleteAll(UUID fileId);

    record ChunkRecord(UUID fileId, int sequenceIndex, String locator, long size) {
    }
}
