package com.example.podcast_backend.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "podcast_template")
public class PodcastTemplate {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_template_owner"))
    private Account owner;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    // [{"segmentType":"intro","mediaId":"..."}, {"segmentType":"content"}, ...]
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "segments")
    private JsonNode segments;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "music_rules")
    private JsonNode musicRules;

    /** Gap (positive) or overlap (negative) between intro end and content start. */
    @Column(name = "content_start_offset_ms", nullable = false)
    private long contentStartOffsetMs;

    @Column(name = "outro_start_offset_ms", nullable = false)
    private long outroStartOffsetMs;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @PrePersist
    void prePersist() {
        createdAt = updatedAt = Instant.now();
    }

    @PreUpdate
    void preUpdate() {
        updatedAt = Instant.now();
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public JsonNode getSegments() {
        return segments;
    }

    public void setSegments(JsonNode segments) {
        this.segments = segments;
    }

    public JsonNode getMusicRules() {
        return musicRules;
    }

    public void setMusicRules(JsonNode musicRules) {
        this.musicRules = musicRules;
    }

    public long getContentStartOffsetMs() {
        return contentStartOffsetMs;
    }

    public void setContentStartOffsetMs(long contentStartOffsetMs) {
        this.contentStartOffsetMs = contentStartOffsetMs;
    }

    public long getOutroStartOffsetMs() {
        return outroStartOffsetMs;
    }

    public void setOutroStartOffsetMs(long outroStartOffsetMs) {
        this.outroStartOffsetMs = outroStartOffsetMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
