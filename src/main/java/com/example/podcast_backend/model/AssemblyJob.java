package com.example.podcast_backend.model;

import com.example.podcast_backend.util.FailureKind;
import com.example.podcast_backend.util.JobStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(
        name = "assembly_job",
        indexes = {
                @Index(name = "idx_assembly_job_status_updated", columnList = "status, updated_at"),
                @Index(name = "idx_assembly_job_episode", columnList = "episode_id")
        }
)
public class AssemblyJob {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_assembly_job_owner"))
    private Account owner;

    @Column(name = "episode_id", nullable = false, length = 128)
    private String episodeId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "template_id", foreignKey = @ForeignKey(name = "fk_assembly_job_template"))
    private PodcastTemplate template;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "main_content_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_assembly_job_main_content"))
    private MediaItem mainContent;

    // every media the job reads; the cache janitor keys off this table
    @ManyToMany(fetch = FetchType.LAZY)
    @JoinTable(
            name = "assembly_job_input",
            joinColumns = @JoinColumn(name = "job_id"),
            inverseJoinColumns = @JoinColumn(name = "media_id")
    )
    @OrderColumn(name = "input_order")
    private List<MediaItem> inputs = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.PENDING;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload")
    private Map<String, Object> payload;

    @Embedded
    private AssemblyResult result;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", length = 32)
    private FailureKind failureKind;

    @Column(name = "failure_reason", length = 2000)
    private String failureReason;

    @Column(name = "attempts", nullable = false)
    private int attempts = 0;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected AssemblyJob() {
    }

    public AssemblyJob(Account owner, String episodeId, MediaItem mainContent) {
        this.owner = owner;
        this.episodeId = episodeId;
        this.mainContent = mainContent;
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

    public String getEpisodeId() {
        return episodeId;
    }

    public PodcastTemplate getTemplate() {
        return template;
    }

    public void setTemplate(PodcastTemplate template) {
        this.template = template;
    }

    public MediaItem getMainContent() {
        return mainContent;
    }

    public List<MediaItem> getInputs() {
        return inputs;
    }

    public void setInputs(List<MediaItem> inputs) {
        this.inputs = inputs;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public AssemblyResult getResult() {
        return result;
    }

    public void setResult(AssemblyResult result) {
        this.result = result;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public void recordFailure(FailureKind kind, String reason) {
        this.failureKind = kind;
        this.failureReason = reason != null && reason.length() > 2000 ? reason.substring(0, 2000) : reason;
    }

    public void clearFailure() {
        this.failureKind = null;
        this.failureReason = null;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (status == null) status = JobStatus.PENDING;
    }
}
