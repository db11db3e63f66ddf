package com.example.podcast_backend.service.dispatch;

import com.example.podcast_backend.config.DispatchProperties;
import com.example.podcast_backend.dto.web.TaskPayload;
import com.example.podcast_backend.exception.DispatchException;
import com.example.podcast_backend.service.Interfaces.ManagedTaskQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.tasks.v2.CloudTasksClient;
import com.google.cloud.tasks.v2.HttpMethod;
import com.google.cloud.tasks.v2.HttpRequest;
import com.google.cloud.tasks.v2.QueueName;
import com.google.cloud.tasks.v2.Task;
import com.google.protobuf.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Google Cloud Tasks HTTP tasks aimed at our own {@code /v1/tasks/assemble} endpoint.
 */
@Component
@ConditionalOnProperty(prefix = "dispatch.queue", name = "enabled", havingValue = "true")
public class CloudTasksQueueClient implements ManagedTaskQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(CloudTasksQueueClient.class);

    private final CloudTasksClient client;
    private final DispatchProperties properties;
    private final ObjectMapper objectMapper;

    public CloudTasksQueueClient(CloudTasksClient client, DispatchProperties properties, ObjectMapper objectMapper) {
        this.client = client;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String enqueue(TaskPayload payload) {
        DispatchProperties.Queue q = properties.getQueue();
        String parent = QueueName.of(q.getProjectId(), q.getLocation(), q.getQueueName()).toString();
        Task task = Task.newBuilder().setHttpRequest(buildRequest(payload)).build();
        try {
            Task created = client.createTask(parent, task);
            LOGGER.info("DISPATCH queued jobId={} task={}", payload.jobId(), created.getName());
            return created.getName();
        } catch (ApiException e) {
            throw new DispatchException("Cloud Tasks enqueue failed for job " + payload.jobId(), e);
        }
    }

    HttpRequest buildRequest(TaskPayload payload) {
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Cannot serialize task payload", e);
        }
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .setUrl(stripTrailingSlash(properties.getQueue().getTargetBaseUrl()) + RemoteWorkerClient.TASK_PATH)
                .setHttpMethod(HttpMethod.POST)
                .putHeaders("Content-Type", "application/json")
                .setBody(ByteString.copyFromUtf8(body));
        String secret = properties.getSharedSecret();
        if (secret != null && !secret.isBlank()) {
            request.putHeaders(properties.getAuthHeader(), secret);
        }
        return request.build();
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
