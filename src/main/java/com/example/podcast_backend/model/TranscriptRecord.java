package com.example.podcast_backend.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
        name = "transcript_record",
        uniqueConstraints = @UniqueConstraint(name = "uq_transcript_media", columnNames = "media_id")
)
public class TranscriptRecord {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "media_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_transcript_media"))
    private MediaItem media;

    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    // word list inline; null when only archived
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "words")
    private JsonNode words;

    @Column(name = "archive_locator", length = 1024)
    private String archiveLocator;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected TranscriptRecord() {
    }

    public TranscriptRecord(MediaItem media, String provider) {
        this.media = media;
        this.provider = provider;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public MediaItem getMedia() {
        return media;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public JsonNode getWords() {
        return words;
    }

    public void setWords(JsonNode words) {
        this.words = words;
    }

    public String getArchiveLocator() {
        return archiveLocator;
    }

    public void setArchiveLocator(String archiveLocator) {
        this.archiveLocator = archiveLocator;
    }

    public boolean hasInlineWords() {
        return words != null && !words.isNull() && !words.isMissingNode() && !words.isEmpty();
    }

    public long getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
