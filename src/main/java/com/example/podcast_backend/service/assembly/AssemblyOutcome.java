package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.model.AssemblyJob;
import com.example.podcast_backend.model.AssemblyResult;
import com.example.podcast_backend.util.JobStatus;

import java.util.UUID;

/**
 * What one orchestrator run left behind. {@code status} is what was persisted, or the last known
 * status when even the best-effort write failed.
 */
public record AssemblyOutcome(UUID jobId, JobStatus status, String finalLocator, Long durationMs, String detail) {

    static AssemblyOutcome of(AssemblyJob job, String detail) {
        AssemblyResult result = job.getResult();
        return new AssemblyOutcome(job.getId(), job.getStatus(),
                result != null ? result.getFinalLocator() : null,
                result != null ? result.getDurationMs() : null,
                detail != null ? detail : job.getFailureReason());
    }
}
