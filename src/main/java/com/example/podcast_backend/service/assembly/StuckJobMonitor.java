package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.config.AssemblyProperties;
import com.example.podcast_backend.model.AssemblyJob;
import com.example.podcast_backend.repository.AssemblyJobRepository;
import com.example.podcast_backend.util.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Reports jobs whose executor went away mid-run. Reporting only; an operator decides whether to
 * retry them.
 */
@Component
public class StuckJobMonitor {
    private static final Logger LOGGER = LoggerFactory.getLogger(StuckJobMonitor.class);

    private final AssemblyJobRepository jobs;
    private final AssemblyProperties properties;
    private final Clock clock;

    public StuckJobMonitor(AssemblyJobRepository jobs, AssemblyProperties properties, Clock clock) {
        this.jobs = jobs;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${assembly.stuck-check-interval:PT10M}", initialDelayString = "${assembly.stuck-check-initial-delay:PT2M}")
    public void scheduledReport() {
        report();
    }

    @Transactional(readOnly = true)
    public List<UUID> report() {
        Instant cutoff = Instant.now(clock).minus(properties.getStuckAfter());
        List<AssemblyJob> stuck = jobs.findByStatusAndUpdatedAtBefore(JobStatus.PROCESSING, cutoff);
        for (AssemblyJob job : stuck) {
            LOGGER.warn("ASSEMBLE STUCK jobId={} episode={} updatedAt={} attempts={}",
                    job.getId(), job.getEpisodeId(), job.getUpdatedAt(), job.getAttempts());
        }
        if (!stuck.isEmpty()) {
            LOGGER.warn("ASSEMBLE stuck jobs count={} olderThan={}", stuck.size(), properties.getStuckAfter());
        }
        return stuck.stream().map(AssemblyJob::getId).toList();
    }
}
