package com.example.podcast_backend.service.Interfaces;

import com.example.podcast_backend.dto.web.TaskPayload;

public interface ManagedTaskQueue {
    /**
     * Enqueues a durable task that POSTs {@code payload} to the task endpoint.
     *
     * @return the queue's task name
     */
    String enqueue(TaskPayload payload);
}
