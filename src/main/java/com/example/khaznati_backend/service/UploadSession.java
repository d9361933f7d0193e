package com.example.khaznati_backend.service;

import com.example.khaznati_backend.exception.ConflictException;
import com.example.khaznati_backend.model.StoredFile;
import com.example.khaznati_backend.util.UploadState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Transient state of one upload. Lives in memory only; nothing about an upload is persisted before it is
 * finalized.
 */
public class UploadSession {
    private final UUID id;
    private final UUID ownerId;
    private final String name;
    private final UUID folderId;
    private final String mimeType;
    private final String expectedChecksum;
    private final Long sizeHint;
    private final Instant createdAt;

    private final TreeMap<Integer, StoredChunk> chunks = new TreeMap<>();
    private final CompletableFuture<StoredFile> completion = new CompletableFuture<>();
    private final TransferControl control = new TransferControl();

    private UploadState state = UploadState.INITIATED;
    private boolean received;
    private long sizeBytes = -1;
    private int expectedChunks = -1;
    private String checksum;
    private Throwable failure;
    private Instant lastTransitionAt;

    public UploadSession(UUID id, UUID ownerId, String name, UUID folderId, String mimeType,
                         String expectedChecksum, Long sizeHint, Instant createdAt) {
        this.id = id;
        this.ownerId = ownerId;
        this.name = name;
        this.folderId = folderId;
        this.mimeType = mimeType;
        this.expectedChecksum = expectedChecksum;
        this.sizeHint = sizeHint;
        this.createdAt = createdAt;
        this.lastTransitionAt = createdAt;
    }

    public synchronized void transition(UploadState next, Instant now) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Upload %s cannot go from %s to %s".formatted(id, state, next));
        }
        state = next;
        lastTransitionAt = now;
    }

    /** Moves to FAILED unless already terminal. Returns whether this call did the transition. */
    public synchronized boolean fail(Throwable cause, Instant now) {
        if (state.isTerminal()) {
            return false;
        }
        state = UploadState.FAILED;
        failure = cause;
        lastTransitionAt = now;
        return true;
    }

    /** Claims the one allowed content delivery. */
    public synchronized void markReceived() {
        if (received) {
            throw new ConflictException("Upload " + id + " already received its content");
        }
        if (state != UploadState.INITIATED) {
            throw new ConflictException("Upload " + id + " is " + state);
        }
        received = true;
    }

    public synchronized void setStaged(long sizeBytes, int expectedChunks, String checksum) {
        this.sizeBytes = sizeBytes;
        this.expectedChunks = expectedChunks;
        this.checksum = checksum;
    }

    /**
     * Records a chunk the backend accepted.
     *
     * @return false when the upload already failed; the caller then owns the object and must remove it
     */
    public synchronized boolean recordChunk(int sequenceIndex, String locator, long size) {
        if (state == UploadState.FAILED) {
            return false;
        }
        if (chunks.containsKey(sequenceIndex)) {
            throw new ConflictException("Chunk " + sequenceIndex + " of upload " + id + " already stored");
        }
        chunks.put(sequenceIndex, new StoredChunk(sequenceIndex, locator, size));
        return true;
    }

    /** Stored chunks in sequence order. */
    public synchronized List<StoredChunk> storedChunks() {
        return new ArrayList<>(chunks.values());
    }

    public synchronized int storedChunkCount() {
        return chunks.size();
    }

    public UUID getId() { return id; }
    public UUID getOwnerId() { return ownerId; }
    public String getName() { return name; }
    public UUID getFolderId() { return folderId; }
    public String getMimeType() { return mimeType; }
    public String getExpectedChecksum() { return expectedChecksum; }
    public Long getSizeHint() { return sizeHint; }
    public Instant getCreatedAt() { return createdAt; }
    public CompletableFuture<StoredFile> completion() { return completion; }
    public TransferControl control() { return control; }

    public synchronized UploadState getState() { return state; }
    public synchronized boolean isReceived() { return received; }
    public synchronized long getSizeBytes() { return sizeBytes; }
    public synchronized int getExpectedChunks() { return expectedChunks; }
    public synchronized String getChecksum() { return checksum; }
    public synchronized Throwable getFailure() { return failure; }
    public synchronized Instant getLastTransitionAt() { return lastTransitionAt; }

    public record StoredChunk(int sequenceIndex, String locator, long size) {
    }
}
