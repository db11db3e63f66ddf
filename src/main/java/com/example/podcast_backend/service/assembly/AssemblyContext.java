package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.dto.CutWindow;
import com.example.podcast_backend.dto.MusicRule;
import com.example.podcast_backend.dto.SegmentSpec;
import com.example.podcast_backend.model.AssemblyJob;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.model.PlanTier;
import com.example.podcast_backend.model.PodcastTemplate;
import com.example.podcast_backend.util.MediaCategory;
import com.example.podcast_backend.util.TemplateMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Detached snapshot of a job, taken inside the claiming transaction so the pipeline runs without
 * holding a connection.
 */
record AssemblyContext(
        UUID jobId,
        UUID ownerId,
        PlanTier planTier,
        String episodeId,
        MediaItem mainContent,
        Map<UUID, MediaItem> inputs,
        List<SegmentSpec> segments,
        List<MusicRule> musicRules,
        long contentStartOffsetMs,
        long outroStartOffsetMs,
        List<CutWindow> userCuts,
        boolean markerCuts
) {
    static final String MARKER_CUTS_FLAG = "markerCuts";

    static AssemblyContext of(AssemblyJob job, boolean markerCutsDefault) {
        Map<UUID, MediaItem> inputs = new LinkedHashMap<>();
        inputs.put(job.getMainContent().getId(), job.getMainContent());
        for (MediaItem m : job.getInputs()) {
            inputs.putIfAbsent(m.getId(), m);
        }
        PodcastTemplate template = job.getTemplate();
        return new AssemblyContext(
                job.getId(),
                job.getOwner().getId(),
                job.getOwner().getPlanTier(),
                job.getEpisodeId(),
                job.getMainContent(),
                inputs,
                TemplateMapper.segments(template != null ? template.getSegments() : null),
                TemplateMapper.musicRules(template != null ? template.getMusicRules() : null),
                template != null ? template.getContentStartOffsetMs() : 0L,
                template != null ? template.getOutroStartOffsetMs() : 0L,
                TemplateMapper.cutWindows(job.getPayload()),
                TemplateMapper.flag(job.getPayload(), MARKER_CUTS_FLAG, markerCutsDefault));
    }

    Optional<MediaItem> cover() {
        return inputs.values().stream().filter(m -> m.getCategory() == MediaCategory.COVER).findFirst();
    }
}
