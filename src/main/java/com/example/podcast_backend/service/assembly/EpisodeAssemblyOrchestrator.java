package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.config.AssemblyProperties;
import com.example.podcast_backend.dto.CutWindow;
import com.example.podcast_backend.dto.MixPlan;
import com.example.podcast_backend.dto.MixResult;
import com.example.podcast_backend.dto.MusicOverlay;
import com.example.podcast_backend.dto.Placement;
import com.example.podcast_backend.dto.SegmentSpec;
import com.example.podcast_backend.dto.TimeRange;
import com.example.podcast_backend.dto.WordTiming;
import com.example.podcast_backend.engine.Interfaces.AudioMixEngine;
import com.example.podcast_backend.exception.AssemblyException;
import com.example.podcast_backend.exception.CommitExhaustedException;
import com.example.podcast_backend.exception.MissingInputException;
import com.example.podcast_backend.exception.RetriesExhaustedException;
import com.example.podcast_backend.exception.TransientStorageException;
import com.example.podcast_backend.model.AssemblyJob;
import com.example.podcast_backend.model.AssemblyResult;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.repository.AssemblyJobRepository;
import com.example.podcast_backend.service.DurableCommitService;
import com.example.podcast_backend.service.billing.BillingHook;
import com.example.podcast_backend.service.storage.StorageResolver;
import com.example.podcast_backend.service.transcript.TranscriptAssociationResolver;
import com.example.podcast_backend.service.transcript.TranscriptLookup;
import com.example.podcast_backend.util.FailureKind;
import com.example.podcast_backend.util.JobStatus;
import com.example.podcast_backend.util.TransientDataErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Drives one assembly job from PENDING to PROCESSED or ERROR.
 *
 * <p>Safe under at-least-once delivery: a PROCESSED job is returned as is, a redelivered
 * PROCESSING job is simply run again, and billing is keyed per job so a second run books nothing.
 * Only this class writes {@link JobStatus}; every status write goes through
 * {@link DurableCommitService}.
 */
@Service
public class EpisodeAssemblyOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(EpisodeAssemblyOrchestrator.class);

    static final String TERMINAL_COMMIT_REASON = "Failed to persist completion status after retries";
    static final String OUTPUT_FILENAME = "episode.mp3";

    private final AssemblyJobRepository jobs;
    private final DurableCommitService commits;
    private final StorageResolver storage;
    private final TranscriptAssociationResolver transcripts;
    private final AudioMixEngine mixEngine;
    private final BillingHook billing;
    private final AssemblyProperties properties;
    private final Clock clock;

    public EpisodeAssemblyOrchestrator(AssemblyJobRepository jobs, DurableCommitService commits, StorageResolver storage,
                                       TranscriptAssociationResolver transcripts, AudioMixEngine mixEngine,
                                       BillingHook billing, AssemblyProperties properties, Clock clock) {
        this.jobs = jobs;
        this.commits = commits;
        this.storage = storage;
        this.transcripts = transcripts;
        this.mixEngine = mixEngine;
        this.billing = billing;
        this.properties = properties;
        this.clock = clock;
    }

    private record Begin(AssemblyContext context, AssemblyOutcome done, String brokenReason) {
    }

    private record Produced(String finalLocator, long durationMs, String coverLocator) {
    }

    public AssemblyOutcome assemble(UUID jobId) {
        long t0 = System.nanoTime();
        Begin begin = commits.commitIntermediate("begin " + jobId, () -> begin(jobId));
        if (begin.done() != null) {
            LOGGER.info("ASSEMBLE SKIP jobId={} status={}", jobId, begin.done().status());
            return begin.done();
        }
        if (begin.brokenReason() != null) {
            return fail(jobId, FailureKind.PROCESSING_FAILED, begin.brokenReason());
        }
        AssemblyContext ctx = begin.context();
        LOGGER.info("ASSEMBLE START jobId={} episode={} inputs={} segments={} rules={}",
                jobId, ctx.episodeId(), ctx.inputs().size(), ctx.segments().size(), ctx.musicRules().size());

        Path workDir = Path.of(properties.getWorkDir()).resolve(jobId.toString());
        Produced produced;
        try {
            produced = produce(ctx, workDir);
        } catch (MissingInputException e) {
            LOGGER.warn("ASSEMBLE INPUT_MISSING jobId={} media={} reason={}", jobId, e.getMediaId(), e.getMessage());
            return fail(jobId, FailureKind.INPUT_MISSING, e.getMessage());
        } catch (TransientStorageException | RetriesExhaustedException | CommitExhaustedException e) {
            LOGGER.error("ASSEMBLE TRANSIENT_INFRA jobId={} cause={}", jobId, e.toString());
            return fail(jobId, FailureKind.TRANSIENT_INFRA, e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("ASSEMBLE FAILED jobId={} cause={}", jobId, e.toString(), e);
            return fail(jobId, FailureKind.PROCESSING_FAILED, e.getMessage());
        } finally {
            cleanup(workDir);
        }

        billing.onAssemblyFinalized(jobId, ctx.ownerId(), ctx.planTier(), produced.durationMs());

        AssemblyOutcome outcome = complete(jobId, produced);
        LOGGER.info("ASSEMBLE {} jobId={} durationMs={} locator={} in={}ms", outcome.status(), jobId,
                produced.durationMs(), produced.finalLocator(), (System.nanoTime() - t0) / 1_000_000);
        return outcome;
    }

    /**
     * The explicit ERROR to PROCESSING edge. The caller dispatches the job again afterwards.
     */
    public AssemblyOutcome retry(UUID jobId) {
        return commits.commitIntermediate("retry " + jobId, () -> {
            AssemblyJob job = load(jobId);
            if (job.getStatus() != JobStatus.ERROR) {
                throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_RETRYABLE");
            }
            LOGGER.info("ASSEMBLE RETRY jobId={} previousFailure={} attempts={}", jobId, job.getFailureKind(), job.getAttempts());
            job.setStatus(JobStatus.PROCESSING);
            job.clearFailure();
            job.setAttempts(job.getAttempts() + 1);
            return AssemblyOutcome.of(jobs.save(job), "retry accepted");
        });
    }

    private Begin begin(UUID jobId) {
        AssemblyJob job = jobs.findForAssembly(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        switch (job.getStatus()) {
            case PROCESSED:
                return new Begin(null, AssemblyOutcome.of(job, "already processed"), null);
            case ERROR:
                return new Begin(null, AssemblyOutcome.of(job, null), null);
            case PENDING:
                job.setStatus(JobStatus.PROCESSING);
                job.setAttempts(job.getAttempts() + 1);
                jobs.save(job);
                break;
            case PROCESSING:
                LOGGER.info("ASSEMBLE redelivered jobId={} attempts={}", jobId, job.getAttempts());
                break;
        }
        // de claim moet committen, ook als de template kapot is
        try {
            return new Begin(AssemblyContext.of(job, properties.getMarker().isEnabled()), null, null);
        } catch (RuntimeException e) {
            if (TransientDataErrors.isTransient(e)) {
                throw e;
            }
            LOGGER.error("ASSEMBLE TEMPLATE_INVALID jobId={} cause={}", jobId, e.toString());
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new Begin(null, null, "Invalid template: " + reason);
        }
    }

    private Produced produce(AssemblyContext ctx, Path workDir) {
        try {
            Files.createDirectories(workDir);
        } catch (IOException e) {
            throw new AssemblyException("Cannot create work dir " + workDir, e);
        }

        // 1) inputs, main content first
        Map<UUID, Path> files = new HashMap<>();
        for (MediaItem media : ctx.inputs().values()) {
            files.put(media.getId(), storage.resolveBytes(media, workDir));
        }
        Path mainFile = files.get(ctx.mainContent().getId());

        // 2) edits on the content timeline
        long contentMs = mixEngine.probeDurationMs(mainFile);
        List<CutWindow> cuts = new ArrayList<>(ctx.userCuts());
        if (ctx.markerCuts()) {
            cuts.addAll(markerCuts(ctx));
        }
        List<TimeRange> contentKeep = EditApplier.apply(contentMs, cuts);
        if (contentKeep.isEmpty()) {
            throw new AssemblyException("Edits removed all content: cuts=" + cuts.size() + " contentMs=" + contentMs);
        }

        // 3) segments and music
        List<SegmentPlanner.SegmentInput> inputs = new ArrayList<>();
        for (SegmentSpec segment : ctx.segments()) {
            if (segment.isContent()) {
                inputs.add(new SegmentPlanner.SegmentInput(SegmentSpec.CONTENT, mainFile, contentKeep));
                continue;
            }
            if (segment.mediaId() == null) {
                LOGGER.warn("TEMPLATE segment without media skipped jobId={} type={}", ctx.jobId(), segment.segmentType());
                continue;
            }
            Path file = files.get(segment.mediaId());
            if (file == null) {
                throw new MissingInputException(segment.mediaId(), "Template media not attached to job: " + segment.mediaId());
            }
            long ms = mixEngine.probeDurationMs(file);
            inputs.add(new SegmentPlanner.SegmentInput(segment.segmentType(), file, List.of(new TimeRange(0, ms))));
        }
        List<Placement> placements = SegmentPlanner.plan(inputs, ctx.contentStartOffsetMs(), ctx.outroStartOffsetMs());
        List<MusicOverlay> overlays = MusicRuleMatcher.match(ctx.musicRules(), placements);
        Map<UUID, Path> musicFiles = new HashMap<>();
        for (MusicOverlay o : overlays) {
            Path file = files.get(o.musicMediaId());
            if (file == null) {
                throw new MissingInputException(o.musicMediaId(), "Music media not attached to job: " + o.musicMediaId());
            }
            musicFiles.put(o.musicMediaId(), file);
        }

        // 4) mix + export
        MixResult mixed = mixEngine.mix(new MixPlan(placements, overlays, musicFiles), workDir.resolve(OUTPUT_FILENAME));

        // 5) upload
        String prefix = properties.getOutputPrefix() + "/" + ctx.jobId() + "/";
        String finalLocator = storage.upload(mixed.file(), prefix + OUTPUT_FILENAME, "audio/mpeg");
        String coverLocator = ctx.cover()
                .map(cover -> storage.upload(files.get(cover.getId()), prefix + "cover" + extension(cover.getFilename()),
                        imageContentType(cover.getFilename())))
                .orElse(null);
        return new Produced(finalLocator, mixed.durationMs(), coverLocator);
    }

    private List<CutWindow> markerCuts(AssemblyContext ctx) {
        UUID mainId = ctx.mainContent().getId();
        List<WordTiming> words = transcripts.forMedia(mainId)
                .or(() -> transcripts.resolve(ctx.ownerId(), ctx.mainContent().getFilename()))
                .map(TranscriptLookup::words)
                .orElse(List.of());
        if (words.isEmpty()) {
            LOGGER.info("ASSEMBLE no transcript for marker cuts jobId={} media={}", ctx.jobId(), mainId);
            return List.of();
        }
        List<CutWindow> cuts = MarkerCutResolver.resolve(words, properties.getMarker().getKeyword(),
                properties.getMarker().getLookbackMs());
        LOGGER.info("ASSEMBLE marker cuts jobId={} keyword={} cuts={}", ctx.jobId(), properties.getMarker().getKeyword(), cuts.size());
        return cuts;
    }

    private AssemblyOutcome complete(UUID jobId, Produced produced) {
        AssemblyResult result = new AssemblyResult(produced.finalLocator(), produced.durationMs(),
                produced.coverLocator(), Instant.now(clock));
        try {
            return commits.commitTerminal("complete " + jobId, () -> markProcessed(jobId, result));
        } catch (CommitExhaustedException e) {
            LOGGER.error("ASSEMBLE TERMINAL_COMMIT_FAILED jobId={} locator={} attempts={}", jobId,
                    produced.finalLocator(), e.getAttempts());
            return lastResort(jobId, TERMINAL_COMMIT_REASON);
        }
    }

    private AssemblyOutcome fail(UUID jobId, FailureKind kind, String reason) {
        try {
            return commits.commitTerminal("fail " + jobId, () -> markError(jobId, kind, reason));
        } catch (CommitExhaustedException e) {
            LOGGER.error("ASSEMBLE TERMINAL_COMMIT_FAILED jobId={} kind={} attempts={}", jobId, kind, e.getAttempts());
            return lastResort(jobId, TERMINAL_COMMIT_REASON + ": " + reason);
        }
    }

    private AssemblyOutcome lastResort(UUID jobId, String reason) {
        try {
            return commits.commitOnce("last-resort " + jobId,
                    () -> markError(jobId, FailureKind.TERMINAL_COMMIT_FAILED, reason));
        } catch (RuntimeException e) {
            LOGGER.error("ASSEMBLE STATUS_UNPERSISTED jobId={} reason={} cause={}", jobId, reason, e.toString());
            return new AssemblyOutcome(jobId, JobStatus.PROCESSING, null, null, "STATUS_UNPERSISTED: " + reason);
        }
    }

    private AssemblyOutcome markProcessed(UUID jobId, AssemblyResult result) {
        AssemblyJob job = load(jobId);
        if (job.getStatus() == JobStatus.PROCESSED) {
            // an earlier attempt committed before its connection dropped
            return AssemblyOutcome.of(job, "already processed");
        }
        job.setStatus(JobStatus.PROCESSED);
        job.setResult(result);
        job.clearFailure();
        return AssemblyOutcome.of(jobs.save(job), null);
    }

    private AssemblyOutcome markError(UUID jobId, FailureKind kind, String reason) {
        AssemblyJob job = load(jobId);
        if (job.getStatus() == JobStatus.PROCESSED) {
            LOGGER.warn("ASSEMBLE keep PROCESSED jobId={} ignoredFailure={}", jobId, kind);
            return AssemblyOutcome.of(job, "already processed");
        }
        job.setStatus(JobStatus.ERROR);
        job.recordFailure(kind, reason == null || reason.isBlank() ? kind.name() : reason);
        return AssemblyOutcome.of(jobs.save(job), null);
    }

    private AssemblyJob load(UUID jobId) {
        return jobs.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    private static void cleanup(Path workDir) {
        try {
            FileSystemUtils.deleteRecursively(workDir);
        } catch (IOException e) {
            LOGGER.warn("ASSEMBLE work dir cleanup failed dir={} cause={}", workDir, e.toString());
        }
    }

    private static String extension(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot > 0 && dot > filename.lastIndexOf('/') ? filename.substring(dot).toLowerCase(Locale.ROOT) : "";
    }

    private static String imageContentType(String filename) {
        return switch (extension(filename)) {
            case ".png" -> "image/png";
            case ".webp" -> "image/webp";
            default -> "image/jpeg";
        };
    }
}
