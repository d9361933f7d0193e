package com.example.khaznati_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "share_link")
public class ShareLink {
    @Id
    @GeneratedValue
    @UuidGenerator
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "file_id", nullable = false, foreignKey = @ForeignKey(name = "fk_share_file"))
    private StoredFile file;

    @Column(name = "token", nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "max_downloads")
    private Integer maxDownloads;

    @Column(name = "download_count", nullable = false)
    private int downloadCount;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ShareLink() {}

    public ShareLink(StoredFile file, String token) {
        this.file = file;
        this.token = token;
    }

    public boolean isUsableAt(Instant now) {
        if (!active) return false;
        if (expiresAt != null && !now.isBefore(expiresAt)) return false;
        return maxDownloads == null || downloadCount < maxDownloads;
    }

    public UUID getId() { return id; }
    public StoredFile getFile() { return file; }
    public String getToken() { return token; }
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
    public Integer getMaxDownloads() { return maxDownloads; }
    public void setMaxDownloads(Integer maxDownloads) { this.maxDownloads = maxDownloads; }
    public int getDownloadCount() { return downloadCount; }
    public void setDownloadCount(int downloadCount) { this.downloadCount = downloadCount; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getLastAccessedAt() { return lastAccessedAt; }
    public Instant getCreatedAt() { return createdAt; }
}
