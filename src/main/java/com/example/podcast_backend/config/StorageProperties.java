package com.example.podcast_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    /** Lifetime of signed playback URLs. */
    private Duration signedUrlTtl = Duration.ofHours(1);
    private RetrySettings fetchRetry = new RetrySettings(3, Duration.ofMillis(500), Duration.ofSeconds(4));
    private Local local = new Local();
    private R2 r2 = new R2();
    private Gcs gcs = new Gcs();
    private Spreaker spreaker = new Spreaker();

    public Duration getSignedUrlTtl() { return signedUrlTtl; }
    public void setSignedUrlTtl(Duration signedUrlTtl) { this.signedUrlTtl = signedUrlTtl; }

    public RetrySettings getFetchRetry() { return fetchRetry; }
    public void setFetchRetry(RetrySettings fetchRetry) { this.fetchRetry = fetchRetry; }

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public R2 getR2() { return r2; }
    public void setR2(R2 r2) { this.r2 = r2; }

    public Gcs getGcs() { return gcs; }
    public void setGcs(Gcs gcs) { this.gcs = gcs; }

    public Spreaker getSpreaker() { return spreaker; }
    public void setSpreaker(Spreaker spreaker) { this.spreaker = spreaker; }

    public static class Local {
        private String baseDir = "./data";
        private String cachePrefix = "cache";
        private String transcriptsPrefix = "transcripts";
        /** Dev only: accept media whose sole copy is the local cache. */
        private boolean allowLocalOnly = false;

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

        public String getCachePrefix() { return cachePrefix; }
        public void setCachePrefix(String cachePrefix) { this.cachePrefix = cachePrefix; }

        public String getTranscriptsPrefix() { return transcriptsPrefix; }
        public void setTranscriptsPrefix(String transcriptsPrefix) { this.transcriptsPrefix = transcriptsPrefix; }

        public boolean isAllowLocalOnly() { return allowLocalOnly; }
        public void setAllowLocalOnly(boolean allowLocalOnly) { this.allowLocalOnly = allowLocalOnly; }
    }

    public static class R2 {
        private boolean enabled = false;
        private String accountId;
        private String endpoint;
        private String bucket;
        private String accessKeyId;
        private String secretAccessKey;
        /** Explicitly public bucket domain. When blank every playback URL is presigned. */
        private String publicBaseUrl;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getAccountId() { return accountId; }
        public void setAccountId(String accountId) { this.accountId = accountId; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }

        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

        public String getPublicBaseUrl() { return publicBaseUrl; }
        public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }

        public String resolvedEndpoint() {
            if (endpoint != null && !endpoint.isBlank()) return endpoint;
            return "https://" + accountId + ".r2.cloudflarestorage.com";
        }
    }

    public static class Gcs {
        private boolean enabled = false;
        private String projectId;
        private String bucket;
        /** Auditable opt-in for unsigned playback URLs. Never set implicitly. */
        private boolean publicBucket = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getProjectId() { return projectId; }
        public void setProjectId(String projectId) { this.projectId = projectId; }

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }

        public boolean isPublicBucket() { return publicBucket; }
        public void setPublicBucket(boolean publicBucket) { this.publicBucket = publicBucket; }
    }

    public static class Spreaker {
        private boolean enabled = true;
        private String apiBase = "https://api.spreaker.com";
        private Duration timeout = Duration.ofSeconds(60);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getApiBase() { return apiBase; }
        public void setApiBase(String apiBase) { this.apiBase = apiBase; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
