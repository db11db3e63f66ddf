package com.example.podcast_backend.model;

import com.example.podcast_backend.util.MediaCategory;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UuidGenerator;

import java.time.Instant;
import java.util.UUID;

/**
 * Pointer to an audio or image blob. {@code cloudLocator} and {@code externalHostId} are the
 * authoritative addresses; {@code localCachePath} only exists on the machine that wrote it.
 */
@Entity
@Table(
        name = "media_item",
        indexes = {
                @Index(name = "idx_media_owner_filename", columnList = "owner_id, filename"),
                @Index(name = "idx_media_local_cache", columnList = "local_cache_path")
        }
)
public class MediaItem {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_media_owner"))
    private Account owner;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 32)
    private MediaCategory category;

    @Column(name = "filename", nullable = false, length = 512)
    private String filename;

    @Column(name = "cloud_locator", length = 1024)
    private String cloudLocator;

    @Column(name = "external_host_id", length = 255)
    private String externalHostId;

    @Column(name = "local_cache_path", length = 1024)
    private String localCachePath;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public MediaItem() {
    }

    public MediaItem(Account owner, MediaCategory category, String filename) {
        this.owner = owner;
        this.category = category;
        this.filename = filename;
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

    public void setOwner(Account owner) {
        this.owner = owner;
    }

    public MediaCategory getCategory() {
        return category;
    }

    public void setCategory(MediaCategory category) {
        this.category = category;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getCloudLocator() {
        return cloudLocator;
    }

    public void setCloudLocator(String cloudLocator) {
        this.cloudLocator = cloudLocator;
    }

    public String getExternalHostId() {
        return externalHostId;
    }

    public void setExternalHostId(String externalHostId) {
        this.externalHostId = externalHostId;
    }

    public String getLocalCachePath() {
        return localCachePath;
    }

    public void setLocalCachePath(String localCachePath) {
        this.localCachePath = localCachePath;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public boolean hasAuthoritativeLocator() {
        return (cloudLocator != null && !cloudLocator.isBlank())
                || (externalHostId != null && !externalHostId.isBlank());
    }
}
