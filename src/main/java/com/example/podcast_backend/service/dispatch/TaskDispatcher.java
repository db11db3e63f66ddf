package com.example.podcast_backend.service.dispatch;

import com.example.podcast_backend.config.DispatchProperties;
import com.example.podcast_backend.dto.web.TaskPayload;
import com.example.podcast_backend.exception.DispatchException;
import com.example.podcast_backend.service.Interfaces.ManagedTaskQueue;
import com.example.podcast_backend.service.assembly.AssemblyOutcome;
import com.example.podcast_backend.service.assembly.EpisodeAssemblyOrchestrator;
import com.example.podcast_backend.util.ExecutionTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

/**
 * Decides where a job runs and delivers it there. Inline runs go through a bounded FIFO pool so a
 * burst of jobs cannot starve request threads.
 */
@Service
public class TaskDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskDispatcher.class);

    private final TaskExecutor executor;
    private final EpisodeAssemblyOrchestrator orchestrator;
    private final RemoteWorkerClient worker;
    private final ObjectProvider<ManagedTaskQueue> queue;
    private final DispatchProperties properties;

    public TaskDispatcher(@Qualifier("assemblyTaskExecutor") TaskExecutor executor,
                          EpisodeAssemblyOrchestrator orchestrator,
                          RemoteWorkerClient worker,
                          ObjectProvider<ManagedTaskQueue> queue,
                          DispatchProperties properties) {
        this.executor = executor;
        this.orchestrator = orchestrator;
        this.worker = worker;
        this.queue = queue;
        this.properties = properties;
    }

    /**
     * @param requested target, or {@code null} for {@code dispatch.default-target}
     * @return the target the job was actually handed to
     * @throws DispatchException when delivery failed and no fallback applied
     */
    public ExecutionTarget dispatch(UUID jobId, @Nullable ExecutionTarget requested) {
        ExecutionTarget target = requested != null ? requested : properties.getDefaultTarget();
        TaskPayload payload = new TaskPayload(jobId);
        try {
            switch (target) {
                case INLINE -> runInline(payload);
                case REMOTE_WORKER -> worker.deliver(payload);
                case MANAGED_QUEUE -> managedQueue().enqueue(payload);
            }
            LOGGER.info("DISPATCH jobId={} target={}", jobId, target);
            return target;
        } catch (DispatchException e) {
            if (target == ExecutionTarget.INLINE || !properties.isFallbackToInline()) {
                throw e;
            }
            LOGGER.warn("DISPATCH fallback jobId={} target={} cause={} -> INLINE", jobId, target, e.toString());
            runInline(payload);
            return ExecutionTarget.INLINE;
        }
    }

    private void runInline(TaskPayload payload) {
        try {
            executor.execute(() -> runSafely(payload.jobId()));
        } catch (RejectedExecutionException e) {
            throw new DispatchException("Inline assembly queue is full, job " + payload.jobId(), e);
        }
    }

    private void runSafely(UUID jobId) {
        try {
            AssemblyOutcome outcome = orchestrator.assemble(jobId);
            LOGGER.info("DISPATCH inline finished jobId={} status={}", jobId, outcome.status());
        } catch (RuntimeException e) {
            LOGGER.error("DISPATCH inline run failed jobId={} cause={}", jobId, e.toString(), e);
        }
    }

    private ManagedTaskQueue managedQueue() {
        ManagedTaskQueue q = queue.getIfAvailable();
        if (q == null) {
            throw new DispatchException("Managed queue not configured (dispatch.queue.enabled=false)", null);
        }
        return q;
    }
}
