package com.example.podcast_backend.service.dispatch;

import com.example.podcast_backend.config.DispatchProperties;
import com.example.podcast_backend.dto.web.TaskPayload;
import com.example.podcast_backend.exception.DispatchException;
import com.example.podcast_backend.util.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Hands a job to the dedicated worker host. Only the delivery is confirmed here; the worker runs
 * the job and writes its status.
 */
@Component
public class RemoteWorkerClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteWorkerClient.class);
    static final String TASK_PATH = "/v1/tasks/assemble";

    private final WebClient client;
    private final DispatchProperties properties;

    public RemoteWorkerClient(@Qualifier("workerWebClient") WebClient client, DispatchProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    public void deliver(TaskPayload payload) {
        String base = properties.getWorker().getBaseUrl();
        if (base == null || base.isBlank()) {
            throw new DispatchException("dispatch.worker.base-url not configured", null);
        }
        String secret = properties.getSharedSecret();
        RetryPolicy retry = properties.getWorker().getRetry().toPolicy();
        try {
            client.post()
                    .uri(TASK_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (secret != null && !secret.isBlank()) h.set(properties.getAuthHeader(), secret);
                    })
                    .bodyValue(payload)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.createException())
                    .toBodilessEntity()
                    .retryWhen(Retry.backoff(retry.maxAttempts() - 1, retry.initialBackoff())
                            .maxBackoff(retry.maxBackoff())
                            .filter(RemoteWorkerClient::isRetryable)
                            .doBeforeRetry(signal -> LOGGER.warn("DISPATCH worker retry attempt={} jobId={} cause={}",
                                    signal.totalRetries() + 1, payload.jobId(), signal.failure().toString())))
                    .block(blockTimeout(retry));
            LOGGER.info("DISPATCH delivered jobId={} worker={}", payload.jobId(), base);
        } catch (RuntimeException e) {
            throw new DispatchException("Worker delivery failed for job " + payload.jobId(), e);
        }
    }

    // elke poging krijgt de volle timeout, plus de wachttijd ertussen
    private Duration blockTimeout(RetryPolicy retry) {
        return properties.getWorker().getTimeout().multipliedBy(retry.maxAttempts())
                .plus(retry.maxBackoff().multipliedBy(retry.maxAttempts() - 1L));
    }

    private static boolean isRetryable(Throwable t) {
        if (t instanceof WebClientRequestException) return true;
        return t instanceof WebClientResponseException r && r.getStatusCode().is5xxServerError();
    }
}
