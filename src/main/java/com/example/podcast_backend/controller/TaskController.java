package com.example.podcast_backend.controller;

import com.example.podcast_backend.dto.web.TaskPayload;
import com.example.podcast_backend.exception.CommitExhaustedException;
import com.example.podcast_backend.service.assembly.AssemblyOutcome;
import com.example.podcast_backend.service.assembly.EpisodeAssemblyOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Inbound side of remote and queued dispatch. Runs the job synchronously so the caller's retry
 * policy applies to the whole run.
 */
@RestController
@RequestMapping("/v1/tasks")
public class TaskController {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskController.class);

    private final EpisodeAssemblyOrchestrator orchestrator;
    private final String authHeader;
    private final byte[] sharedSecret;

    public TaskController(EpisodeAssemblyOrchestrator orchestrator,
                          @Value("${dispatch.auth-header:X-Tasks-Auth}") String authHeader,
                          @Value("${dispatch.shared-secret:}") String sharedSecret) {
        this.orchestrator = orchestrator;
        this.authHeader = authHeader;
        this.sharedSecret = sharedSecret.getBytes(StandardCharsets.UTF_8);
    }

    @Operation(summary = "Run one assembly job (called by the worker dispatcher or the managed queue)")
    @PostMapping("/assemble")
    public AssemblyOutcome assemble(@RequestHeader HttpHeaders headers, @Valid @RequestBody TaskPayload payload) {
        if (!authorized(headers.getFirst(authHeader))) {
            LOGGER.warn("TASK auth rejected jobId={}", payload.jobId());
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "TASK_AUTH_FAILED");
        }
        try {
            return orchestrator.assemble(payload.jobId());
        } catch (CommitExhaustedException e) {
            // status unchanged; let the queue redeliver
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "COMMIT_UNAVAILABLE", e);
        }
    }

    private boolean authorized(String presented) {
        if (sharedSecret.length == 0 || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(sharedSecret, presented.getBytes(StandardCharsets.UTF_8));
    }
}
