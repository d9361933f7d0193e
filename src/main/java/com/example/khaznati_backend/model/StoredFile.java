package com.example.khaznati_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Metadata of a completed upload. Rows are only written once every chunk is durably stored, so a row
 * always describes a downloadable file.
 * <p>
 * Trash is a metadata-only state: {@code trashed} plus {@code trashedAt}, with the folder moved into
 * {@code originalFolderId} so that a restore can put it back.
 */
@Entity
@Table(
        name = "stored_file",
        indexes = {
                @Index(name = "idx_file_owner_folder", columnList = "owner_id, folder_id"),
                @Index(name = "idx_file_owner_trashed", columnList = "owner_id, trashed")
        }
)
public class StoredFile {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_file_owner"))
    private Account owner;

    @Column(name = "folder_id")
    private UUID folderId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "mime_type", length = 100)
    private String mimeType;

    // SHA-256 hex
    @Column(name = "checksum", length = 64)
    private String checksum;

    @Column(name = "chunk_count", nullable = false)
    private int chunkCount;

    @Column(name = "backend", nullable = false, length = 32)
    private String backend;

    @Column(name = "trashed", nullable = false)
    private boolean trashed;

    @Column(name = "trashed_at")
    private Instant trashedAt;

    @Column(name = "original_folder_id")
    private UUID originalFolderId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected StoredFile() {}

    public StoredFile(Account owner, String name, long sizeBytes) {
        this.owner = owner;
        this.name = name;
        this.sizeBytes = sizeBytes;
    }

    /** Moves the file to trash, remembering where it was. Returns false when it already was trashed. */
    public boolean moveToTrash(Instant now) {
        if (trashed) {
            return false;
        }
        this.trashed = true;
        this.trashedAt = now;
        this.originalFolderId = folderId;
        this.folderId = null;
        return true;
    }

    public void restoreTo(UUID folderId) {
        this.trashed = false;
        this.trashedAt = null;
        this.originalFolderId = null;
        this.folderId = folderId;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public Account getOwner() {
        return owner;
    }

    public UUID getOwnerId() {
        return owner == null ? null : owner.getId();
    }

    public UUID getFolderId() {
        return folderId;
    }

    public void setFolderId(UUID folderId) {
        this.folderId = folderId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public String getMimeType() {
        return mimeType;
    }

    public void setMimeType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String getChecksum() {
        return checksum;
    }

    public void setChecksum(String checksum) {
        this.checksum = checksum;
    }

    public int getChunkCount() {
        return chunkCount;
    }

    public void setChunkCount(int chunkCount) {
        this.chunkCount = chunkCount;
    }

    public String getBackend() {
        return backend;
    }

    public void setBackend(String backend) {
        this.backend = backend;
    }

    public boolean isTrashed() {
        return trashed;
    }

    public Instant getTrashedAt() {
        return trashedAt;
    }

    public UUID getOriginalFolderId() {
        return originalFolderId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }
}
