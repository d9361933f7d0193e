package com.example.khaznati_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * One durable chunk record: where the {@code sequenceIndex}-th segment of a file lives in the backend.
 */
@Entity
@Table(
        name = "file_chunk",
        uniqueConstraints = @UniqueConstraint(name = "ux_file_chunk_seq", columnNames = {"file_id", "sequence_index"})
)
public class FileChunk {
    @Id
    @GeneratedValue
    @UuidGenerator
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false, foreignKey = @ForeignKey(name = "fk_chunk_file"))
    private StoredFile file;

    @Column(name = "sequence_index", nullable = false)
    private int sequenceIndex;

    @Column(name = "locator", nullable = false, length = 512)
    private String locator;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected FileChunk() {}

    public FileChunk(StoredFile file, int sequenceIndex, String locator, long sizeBytes) {
        this.file = file;
        this.sequenceIndex = sequenceIndex;
        this.locator = locator;
        this.sizeBytes = sizeBytes;
    }

    public UUID getId() {
        return id;
    }

    public StoredFile getFile() {
        return file;
    }

    public int getSequenceIndex() {
        return sequenceIndex;
    }

    public String getLocator() {
        return locator;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
