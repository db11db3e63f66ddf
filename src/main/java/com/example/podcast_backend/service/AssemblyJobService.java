package com.example.podcast_backend.service;

import com.example.podcast_backend.dto.MusicRule;
import com.example.podcast_backend.dto.SegmentSpec;
import com.example.podcast_backend.dto.web.AssemblyJobResponse;
import com.example.podcast_backend.dto.web.CreateAssemblyJobRequest;
import com.example.podcast_backend.model.Account;
import com.example.podcast_backend.model.AssemblyJob;
import com.example.podcast_backend.model.AssemblyResult;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.PodcastTemplate;
import com.example.podcast_backend.repository.AccountRepository;
import com.example.podcast_backend.repository.AssemblyJobRepository;
import com.example.podcast_backend.repository.MediaItemRepository;
import com.example.podcast_backend.repository.PodcastTemplateRepository;
import com.example.podcast_backend.service.storage.StorageResolver;
import com.example.podcast_backend.util.JobStatus;
import com.example.podcast_backend.util.TemplateMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Intake and read side of assembly jobs. Status transitions belong to
 * {@link com.example.podcast_backend.service.assembly.EpisodeAssemblyOrchestrator}.
 */
@Service
public class AssemblyJobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AssemblyJobService.class);

    private final AssemblyJobRepository jobRepo;
    private final AccountRepository accountRepo;
    private final MediaItemRepository mediaRepo;
    private final PodcastTemplateRepository templateRepo;
    private final StorageResolver storage;

    public AssemblyJobService(AssemblyJobRepository jobRepo, AccountRepository accountRepo, MediaItemRepository mediaRepo,
                              PodcastTemplateRepository templateRepo, StorageResolver storage) {
        this.jobRepo = jobRepo;
        this.accountRepo = accountRepo;
        this.mediaRepo = mediaRepo;
        this.templateRepo = templateRepo;
        this.storage = storage;
    }

    /**
     * Creates a PENDING job. Every media the template refers to is recorded as a job input so the
     * cache janitor keeps it while the job can still run.
     */
    @Transactional
    public UUID create(CreateAssemblyJobRequest req) {
        Account owner = accountRepo.findById(req.ownerId())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "OWNER_NOT_FOUND"));
        MediaItem main = ownedMedia(req.mainContentId(), owner);

        AssemblyJob job = new AssemblyJob(owner, req.episodeId().trim(), main);
        Set<UUID> inputIds = new LinkedHashSet<>();
        inputIds.add(main.getId());

        if (req.templateId() != null) {
            PodcastTemplate template = templateRepo.findById(req.templateId())
                    .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "TEMPLATE_NOT_FOUND"));
            if (!Objects.equals(template.getOwner().getId(), owner.getId())) {
                throw new ResponseStatusException(HttpStatus.FORBIDDEN, "TEMPLATE_NOT_OWNED");
            }
            job.setTemplate(template);
            try {
                for (SegmentSpec s : TemplateMapper.segments(template.getSegments())) {
                    if (s.mediaId() != null) inputIds.add(s.mediaId());
                }
                for (MusicRule r : TemplateMapper.musicRules(template.getMusicRules())) {
                    if (r.musicMediaId() != null) inputIds.add(r.musicMediaId());
                }
            } catch (IllegalArgumentException e) {
                throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "TEMPLATE_INVALID", e);
            }
        }
        if (req.coverMediaId() != null) {
            inputIds.add(req.coverMediaId());
        }

        List<MediaItem> inputs = new ArrayList<>();
        for (UUID id : inputIds) {
            inputs.add(id.equals(main.getId()) ? main : ownedMedia(id, owner));
        }
        job.setInputs(inputs);
        job.setPayload(payload(req));

        UUID id = jobRepo.save(job).getId();
        LOGGER.info("JOB created jobId={} owner={} episode={} inputs={}", id, owner.getId(), job.getEpisodeId(), inputs.size());
        return id;
    }

    @Transactional(readOnly = true)
    public AssemblyJobResponse get(UUID jobId) {
        AssemblyJob job = jobRepo.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        AssemblyResult result = job.getStatus() == JobStatus.PROCESSED ? job.getResult() : null;
        String playbackUrl = result == null ? null
                : storage.resolvePlaybackUrl(result.getFinalLocator()).map(URI::toString).orElse(null);
        return new AssemblyJobResponse(
                job.getId(),
                job.getEpisodeId(),
                job.getStatus().name(),
                job.getAttempts(),
                job.getFailureKind() != null ? job.getFailureKind().name() : null,
                job.getFailureReason(),
                result != null ? result.getFinalLocator() : null,
                result != null ? result.getDurationMs() : null,
                result != null ? result.getCoverLocator() : null,
                playbackUrl,
                job.getCreatedAt(),
                job.getUpdatedAt());
    }

    /**
     * Points a finished job at a copy of the same bytes on another backend. Only PROCESSED jobs
     * have a result to move.
     */
    @Transactional
    public void rewriteResultLocator(UUID jobId, String newLocator) {
        AssemblyJob job = jobRepo.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        if (job.getStatus() != JobStatus.PROCESSED || job.getResult() == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_PROCESSED");
        }
        try {
            storage.kindOf(newLocator);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "LOCATOR_INVALID", e);
        }
        String previous = job.getResult().getFinalLocator();
        job.setResult(job.getResult().withFinalLocator(newLocator));
        jobRepo.save(job);
        LOGGER.info("JOB result moved jobId={} from={} to={}", jobId, previous, newLocator);
    }

    private MediaItem ownedMedia(UUID mediaId, Account owner) {
        MediaItem media = mediaRepo.findById(mediaId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "MEDIA_NOT_FOUND"));
        if (media.getOwner() == null || !Objects.equals(media.getOwner().getId(), owner.getId())) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "MEDIA_NOT_OWNED");
        }
        return media;
    }

    private static Map<String, Object> payload(CreateAssemblyJobRequest req) {
        Map<String, Object> payload = new HashMap<>();
        if (req.cuts() != null && !req.cuts().isEmpty()) {
            List<Map<String, Object>> cuts = new ArrayList<>();
            for (CreateAssemblyJobRequest.Cut c : req.cuts()) {
                if (c.endMs() < c.startMs()) {
                    throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "CUT_INVALID");
                }
                cuts.add(Map.of("startMs", c.startMs(), "endMs", c.endMs()));
            }
            payload.put("cuts", cuts);
        }
        if (req.markerCuts() != null) {
            payload.put("markerCuts", req.markerCuts());
        }
        return payload;
    }
}
