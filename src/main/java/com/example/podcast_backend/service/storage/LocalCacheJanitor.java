package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.config.CacheCleanupProperties;
import com.example.podcast_backend.exception.StorageException;
import com.example.podcast_backend.model.MediaItem;
import com.example.podcast_backend.repository.AssemblyJobRepository;
import com.example.podcast_backend.repository.MediaItemRepository;
import com.example.podcast_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Purges local cache copies of media. A copy is kept while any job that references the media is
 * PENDING, PROCESSING or ERROR, since a retry from ERROR reads the same inputs again.
 *
 * <p>The held set is a snapshot; a job can claim the media after it is taken, so every
 * delete is preceded by a per-media check against the current job rows.
 */
@Service
public class LocalCacheJanitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalCacheJanitor.class);

    private final AssemblyJobRepository jobRepository;
    private final MediaItemRepository mediaRepository;
    private final StorageResolver storage;
    private final CacheCleanupProperties properties;
    private final Clock clock;

    public LocalCacheJanitor(AssemblyJobRepository jobRepository, MediaItemRepository mediaRepository,
                             StorageResolver storage, CacheCleanupProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.mediaRepository = mediaRepository;
        this.storage = storage;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${cache.cleanup.interval:PT15M}", initialDelayString = "${cache.cleanup.initial-delay:PT1M}")
    public void scheduledPurge() {
        if (!properties.isEnabled()) {
            LOGGER.debug("CACHE PURGE disabled");
            return;
        }
        purge();
    }

    public PurgeReport purge() {
        Set<UUID> held = jobRepository.findInputMediaIdsByStatusIn(JobStatus.holdingInputs());
        Set<UUID> released = jobRepository.findInputMediaIdsByStatusIn(EnumSet.of(JobStatus.PROCESSED));
        Instant now = clock.instant();

        int scanned = 0;
        int purged = 0;
        int kept = 0;
        for (MediaItem media : mediaRepository.findByLocalCachePathIsNotNull()) {
            scanned++;
            if (held.contains(media.getId())) {
                kept++;
                continue;
            }
            boolean expired = media.getExpiresAt() != null && media.getExpiresAt().isBefore(now);
            if (!released.contains(media.getId()) && !expired) {
                continue;
            }
            if (!media.hasAuthoritativeLocator()) {
                // only copy we have
                LOGGER.debug("CACHE PURGE skip media={} reason=local_only", media.getId());
                continue;
            }
            if (jobRepository.existsByInputsIdAndStatusIn(media.getId(), JobStatus.holdingInputs())) {
                LOGGER.info("CACHE PURGE skip media={} reason=claimed_since_snapshot", media.getId());
                kept++;
                continue;
            }
            try {
                storage.deleteLocalCache(media.getLocalCachePath());
                media.setLocalCachePath(null);
                mediaRepository.save(media);
                purged++;
            } catch (StorageException e) {
                LOGGER.warn("CACHE PURGE failed media={} path={} cause={}", media.getId(), media.getLocalCachePath(), e.toString());
            }
        }
        LOGGER.info("CACHE PURGE scanned={} purged={} held={}", scanned, purged, kept);
        return new PurgeReport(scanned, purged, kept);
    }

    public record PurgeReport(int scanned, int purged, int held) {
    }
}
