package com.example.khaznati_backend.model;

import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * A named container owned by one account. {@code parent == null} means the folder sits at the root.
 */
@Entity
@Table(
        name = "folder",
        indexes = {
                @Index(name = "idx_folder_owner_parent", columnList = "owner_id, parent_id")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_folder_owner_parent_name", columnNames = {"owner_id", "parent_id", "name"})
        }
)
public class Folder {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_folder_owner"))
    private Account owner;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id", foreignKey = @ForeignKey(name = "fk_folder_parent"))
    private Folder parent;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected Folder() {}

    public Folder(Account owner, Folder parent, String name) {
        this.owner = owner;
        this.parent = parent;
        this.name = name;
    }

    public UUID getId()
    { return id; }
    public void setId(UUID id)
    { this.id = id; }
    public Account getOwner()
    { return owner; }
    public Folder getParent()
    { return parent; }
    public void setParent(Folder parent)
    { this.parent = parent; }
    public UUID getParentId()
    { return parent == null ? null : parent.getId(); }
    public String getName()
    { return name; }
    public void setName(String name)
    { this.name = name; }
    public Instant getCreatedAt()
    { return createdAt; }
    public Instant getUpdatedAt()
    { return updatedAt; }
    public long getVersion()
    { return version; }
}
