package com.example.podcast_backend.service;

import com.example.podcast_backend.dto.web.AssemblyJobResponse;
import com.example.podcast_backend.dto.web.CreateAssemblyJobRequest;
import com.example.podcast_backend.model.Account;
import com.example.podcast_backend.model.AssemblyJob;
import com.example.podcast_backend.model.AssemblyResult;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.model.PodcastTemplate;
import com.example.podcast_backend.repository.AccountRepository;
import com.example.podcast_backend.repository.AssemblyJobRepository;
import com.example.podcast_backend.repository.MediaItemRepository;
import com.example.podcast_backend.repository.PodcastTemplateRepository;
import com.example.podcast_backend.service.storage.StorageResolver;
import com.example.podcast_backend.util.FailureKind;
import com.example.podcast_backend.util.JobStatus;
import com.example.podcast_backend.util.LocatorKind;
import com.example.podcast_backend.util.MediaCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AssemblyJobServiceTest {

    @Mock
    private AssemblyJobRepository jobRepo;

    @Mock
    private AccountRepository accountRepo;

    @Mock
    private MediaItemRepository mediaRepo;

    @Mock
    private PodcastTemplateRepository templateRepo;

    @Mock
    private StorageResolver storage;

    private AssemblyJobService service;
    private Account owner;
    private MediaItem main;

    @BeforeEach
    void setUp() {
        service = new AssemblyJobService(jobRepo, accountRepo, mediaRepo, templateRepo, storage);
        owner = new Account("sub-1", PlanTier.PRO);
        owner.setId(UUID.randomUUID());
        main = media(owner, MediaCategory.MAIN_CONTENT, "raw.wav");
    }

    private static MediaItem media(Account owner, MediaCategory category, String filename) {
        MediaItem m = new MediaItem(owner, category, filename);
        m.setId(UUID.randomUUID());
        return m;
    }

    private static CreateAssemblyJobRequest request(UUID ownerId, UUID mainId, UUID templateId, UUID coverId,
                                                    List<CreateAssemblyJobRequest.Cut> cuts, Boolean markerCuts) {
        return new CreateAssemblyJobRequest(ownerId, " ep-7 ", mainId, templateId, coverId, cuts, markerCuts, null);
    }

    private void stubMedia(MediaItem... items) {
        when(mediaRepo.findById(any(UUID.class))).thenAnswer(inv -> {
            UUID id = inv.getArgument(0);
            for (MediaItem m : items) {
                if (m.getId().equals(id)) return Optional.of(m);
            }
            return Optional.empty();
        });
    }

    @Test
    void createRecordsTemplateMediaAsInputs() throws Exception {
        MediaItem intro = media(owner, MediaCategory.INTRO, "intro.mp3");
        MediaItem music = media(owner, MediaCategory.MUSIC, "bed.mp3");
        MediaItem cover = media(owner, MediaCategory.COVER, "art.jpg");
        PodcastTemplate template = new PodcastTemplate();
        template.setId(UUID.randomUUID());
        template.setOwner(owner);
        ObjectMapper om = new ObjectMapper();
        template.setSegments(om.readTree("[{\"segmentType\":\"intro\",\"mediaId\":\"" + intro.getId() + "\"},{\"segmentType\":\"content\"}]"));
        template.setMusicRules(om.readTree("[{\"musicMediaId\":\"" + music.getId() + "\",\"applyToSegments\":[\"intro\"]}]"));

        when(accountRepo.findById(owner.getId())).thenReturn(Optional.of(owner));
        when(templateRepo.findById(template.getId())).thenReturn(Optional.of(template));
        stubMedia(main, intro, music, cover);
        UUID jobId = UUID.randomUUID();
        when(jobRepo.save(any(AssemblyJob.class))).thenAnswer(inv -> {
            AssemblyJob j = inv.getArgument(0);
            j.setId(jobId);
            return j;
        });

        UUID id = service.create(request(owner.getId(), main.getId(), template.getId(), cover.getId(),
                List.of(new CreateAssemblyJobRequest.Cut(1000L, 2000L)), true));

        assertThat(id).isEqualTo(jobId);
        ArgumentCaptor<AssemblyJob> saved = ArgumentCaptor.forClass(AssemblyJob.class);
        verify(jobRepo).save(saved.capture());
        AssemblyJob job = saved.getValue();
        assertThat(job.getEpisodeId()).isEqualTo("ep-7");
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getInputs()).containsExactly(main, intro, music, cover);
        assertThat(job.getPayload()).containsEntry("markerCuts", true);
        assertThat(job.getPayload().get("cuts")).isEqualTo(List.of(Map.of("startMs", 1000L, "endMs", 2000L)));
    }

    @Test
    void createRefusesMediaOfAnotherOwner() {
        Account stranger = new Account("sub-2", PlanTier.STARTER);
        stranger.setId(UUID.randomUUID());
        MediaItem foreign = media(stranger, MediaCategory.MAIN_CONTENT, "theirs.mp3");
        when(accountRepo.findById(owner.getId())).thenReturn(Optional.of(owner));
        stubMedia(foreign);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.create(request(owner.getId(), foreign.getId(), null, null, null, null)));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
        verify(jobRepo, never()).save(any());
    }

    @Test
    void createRejectsInvertedCut() {
        when(accountRepo.findById(owner.getId())).thenReturn(Optional.of(owner));
        stubMedia(main);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.create(request(owner.getId(), main.getId(), null, null,
                        List.of(new CreateAssemblyJobRequest.Cut(5000L, 4000L)), null)));

        assertThat(ex.getReason()).isEqualTo("CUT_INVALID");
    }

    @Test
    void createRejectsTemplateWithBrokenMediaId() throws Exception {
        PodcastTemplate template = new PodcastTemplate();
        template.setId(UUID.randomUUID());
        template.setOwner(owner);
        template.setSegments(new ObjectMapper().readTree("[{\"segmentType\":\"intro\",\"mediaId\":\"not-a-uuid\"}]"));
        when(accountRepo.findById(owner.getId())).thenReturn(Optional.of(owner));
        when(templateRepo.findById(template.getId())).thenReturn(Optional.of(template));
        stubMedia(main);

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.create(request(owner.getId(), main.getId(), template.getId(), null, null, null)));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @Test
    void processedJobCarriesResultAndPlaybackUrl() {
        AssemblyJob job = new AssemblyJob(owner, "ep-7", main);
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.PROCESSED);
        job.setAttempts(1);
        job.setResult(new AssemblyResult("r2://bucket/episodes/e.mp3", 3_600_000L, null, Instant.now()));
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(storage.resolvePlaybackUrl("r2://bucket/episodes/e.mp3"))
                .thenReturn(Optional.of(URI.create("https://cdn.example.com/e.mp3?sig=abc")));

        AssemblyJobResponse res = service.get(job.getId());

        assertThat(res.status()).isEqualTo("PROCESSED");
        assertThat(res.finalLocator()).isEqualTo("r2://bucket/episodes/e.mp3");
        assertThat(res.durationMs()).isEqualTo(3_600_000L);
        assertThat(res.playbackUrl()).isEqualTo("https://cdn.example.com/e.mp3?sig=abc");
    }

    @Test
    void unsignableResultHasNoPlaybackUrl() {
        AssemblyJob job = new AssemblyJob(owner, "ep-7", main);
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.PROCESSED);
        job.setResult(new AssemblyResult("file:/var/cache/e.mp3", 1_000L, null, Instant.now()));
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(storage.resolvePlaybackUrl("file:/var/cache/e.mp3")).thenReturn(Optional.empty());

        assertThat(service.get(job.getId()).playbackUrl()).isNull();
    }

    @Test
    void failedJobExposesFailureButNoResult() {
        AssemblyJob job = new AssemblyJob(owner, "ep-7", main);
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.ERROR);
        job.recordFailure(FailureKind.INPUT_MISSING, "Input not found on any backend");
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        AssemblyJobResponse res = service.get(job.getId());

        assertThat(res.failureKind()).isEqualTo("INPUT_MISSING");
        assertThat(res.finalLocator()).isNull();
        verifyNoInteractions(storage);
    }

    @Test
    void rewriteMovesResultToNewLocator() {
        AssemblyJob job = new AssemblyJob(owner, "ep-7", main);
        job.setId(UUID.randomUUID());
        job.setStatus(JobStatus.PROCESSED);
        job.setResult(new AssemblyResult("gs://legacy/e.mp3", 1_000L, "gs://legacy/c.png", Instant.now()));
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        when(storage.kindOf("r2://bucket/e.mp3")).thenReturn(LocatorKind.PRIMARY_CLOUD);

        service.rewriteResultLocator(job.getId(), "r2://bucket/e.mp3");

        assertThat(job.getResult().getFinalLocator()).isEqualTo("r2://bucket/e.mp3");
        assertThat(job.getResult().getCoverLocator()).isEqualTo("gs://legacy/c.png");
        verify(jobRepo).save(job);
    }

    @Test
    void rewriteRequiresProcessedJob() {
        AssemblyJob job = new AssemblyJob(owner, "ep-7", main);
        job.setId(UUID.randomUUID());
        when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> service.rewriteResultLocator(job.getId(), "r2://bucket/e.mp3"));

        assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }
}
