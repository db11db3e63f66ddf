package com.example.podcast_backend.controller;

import com.example.podcast_backend.exception.CommitExhaustedException;
import com.example.podcast_backend.service.assembly.AssemblyOutcome;
import com.example.podcast_backend.service.assembly.EpisodeAssemblyOrchestrator;
import com.example.podcast_backend.util.JobStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TaskController.class)
@AutoConfigureMockMvc(addFilters = false)
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EpisodeAssemblyOrchestrator orchestrator;

    private static String body(UUID jobId) {
        return "{\"jobId\":\"" + jobId + "\"}";
    }

    @Test
    void missingSecretIsRejected() throws Exception {
        mockMvc.perform(post("/v1/tasks/assemble")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(UUID.randomUUID())))
                .andExpect(status().isUnauthorized());

        verify(orchestrator, never()).assemble(any());
    }

    @Test
    void wrongSecretIsRejected() throws Exception {
        mockMvc.perform(post("/v1/tasks/assemble")
                        .header("X-Tasks-Auth", "test-secreT")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(UUID.randomUUID())))
                .andExpect(status().isUnauthorized());

        verify(orchestrator, never()).assemble(any());
    }

    @Test
    void authorizedTaskRunsTheJob() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(orchestrator.assemble(jobId))
                .thenReturn(new AssemblyOutcome(jobId, JobStatus.PROCESSED, "r2://bucket/episodes/x/episode.mp3", 5400000L, null));

        mockMvc.perform(post("/v1/tasks/assemble")
                        .header("X-Tasks-Auth", "test-secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(jobId)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSED"))
                .andExpect(jsonPath("$.durationMs").value(5400000));
    }

    @Test
    void exhaustedCommitAsksTheQueueToRedeliver() throws Exception {
        UUID jobId = UUID.randomUUID();
        when(orchestrator.assemble(jobId))
                .thenThrow(new CommitExhaustedException("begin " + jobId, 3, new RuntimeException("db down")));

        mockMvc.perform(post("/v1/tasks/assemble")
                        .header("X-Tasks-Auth", "test-secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body(jobId)))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void missingJobIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/tasks/assemble")
                        .header("X-Tasks-Auth", "test-secret")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }
}
