package com.example.podcast_backend.controller;

import com.example.podcast_backend.dto.web.AssemblyJobResponse;
import com.example.podcast_backend.dto.web.CreateAssemblyJobRequest;
import com.example.podcast_backend.exception.DispatchException;
import com.example.podcast_backend.service.AssemblyJobService;
import com.example.podcast_backend.service.assembly.EpisodeAssemblyOrchestrator;
import com.example.podcast_backend.service.dispatch.TaskDispatcher;
import com.example.podcast_backend.util.ExecutionTarget;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@RestController
@RequestMapping("/v1/jobs")
public class AssemblyJobController {
    private final AssemblyJobService jobService;
    private final EpisodeAssemblyOrchestrator orchestrator;
    private final TaskDispatcher dispatcher;

    public AssemblyJobController(AssemblyJobService jobService, EpisodeAssemblyOrchestrator orchestrator,
                                 TaskDispatcher dispatcher) {
        this.jobService = jobService;
        this.orchestrator = orchestrator;
        this.dispatcher = dispatcher;
    }

    public record DispatchRes(UUID jobId, String status, ExecutionTarget target) {}
    public record LocatorReq(@NotBlank String locator) {}

    @PostMapping
    public ResponseEntity<DispatchRes> create(@Valid @RequestBody CreateAssemblyJobRequest req) {
        UUID id = jobService.create(req);
        ExecutionTarget target = dispatch(id, req.target());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new DispatchRes(id, "PENDING", target));
    }

    @GetMapping("/{id}")
    public AssemblyJobResponse get(@PathVariable UUID id) {
        return jobService.get(id);
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<DispatchRes> retry(@PathVariable UUID id,
                                             @RequestParam(required = false) ExecutionTarget target) {
        var outcome = orchestrator.retry(id);
        ExecutionTarget used = dispatch(id, target);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new DispatchRes(id, outcome.status().name(), used));
    }

    @PostMapping("/{id}/result/locator")
    public ResponseEntity<Void> rewriteLocator(@PathVariable UUID id, @Valid @RequestBody LocatorReq req) {
        jobService.rewriteResultLocator(id, req.locator().trim());
        return ResponseEntity.noContent().build();
    }

    private ExecutionTarget dispatch(UUID id, ExecutionTarget target) {
        try {
            return dispatcher.dispatch(id, target);
        } catch (DispatchException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "DISPATCH_FAILED", e);
        }
    }
}
