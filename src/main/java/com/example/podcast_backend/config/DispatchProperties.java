package com.example.podcast_backend.config;

import com.example.podcast_backend.util.ExecutionTarget;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Where assembly jobs run and how remote deliveries authenticate.
 */
@ConfigurationProperties(prefix = "dispatch")
public class DispatchProperties {
    private ExecutionTarget defaultTarget = ExecutionTarget.INLINE;
    /** Run in-process when the remote worker or the queue cannot take the job. */
    private boolean fallbackToInline = true;
    private String authHeader = "X-Tasks-Auth";
    private String sharedSecret;
    private Inline inline = new Inline();
    private Worker worker = new Worker();
    private Queue queue = new Queue();

    public ExecutionTarget getDefaultTarget() { return defaultTarget; }
    public void setDefaultTarget(ExecutionTarget defaultTarget) { this.defaultTarget = defaultTarget; }

    public boolean isFallbackToInline() { return fallbackToInline; }
    public void setFallbackToInline(boolean fallbackToInline) { this.fallbackToInline = fallbackToInline; }

    public String getAuthHeader() { return authHeader; }
    public void setAuthHeader(String authHeader) { this.authHeader = authHeader; }

    public String getSharedSecret() { return sharedSecret; }
    public void setSharedSecret(String sharedSecret) { this.sharedSecret = sharedSecret; }

    public Inline getInline() { return inline; }
    public void setInline(Inline inline) { this.inline = inline; }

    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }

    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }

    public static class Inline {
        private int threads = 2;
        private int queueCapacity = 50;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }

    public static class Worker {
        private String baseUrl;
        private Duration timeout = Duration.ofSeconds(15);
        /** Only connection failures and 5xx answers are retried. */
        private RetrySettings retry = new RetrySettings(3, Duration.ofMillis(500), Duration.ofSeconds(2));

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public RetrySettings getRetry() { return retry; }
        public void setRetry(RetrySettings retry) { this.retry = retry; }
    }

    public static class Queue {
        private boolean enabled = false;
        private String projectId;
        private String location;
        private String queueName;
        /** Base URL the queue calls back into, usually the worker host. */
        private String targetBaseUrl;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getProjectId() { return projectId; }
        public void setProjectId(String projectId) { this.projectId = projectId; }

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }

        public String getQueueName() { return queueName; }
        public void setQueueName(String queueName) { this.queueName = queueName; }

        public String getTargetBaseUrl() { return targetBaseUrl; }
        public void setTargetBaseUrl(String targetBaseUrl) { this.targetBaseUrl = targetBaseUrl; }
    }
}
