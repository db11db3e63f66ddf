package com.example.podcast_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "billing")
public class BillingProperties {
    private boolean enabled = true;
    private long assemblyCreditsPerSecond = 3;
    private long overlengthCreditsPerSecond = 1;
    private Ledger ledger = new Ledger();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public long getAssemblyCreditsPerSecond() { return assemblyCreditsPerSecond; }
    public void setAssemblyCreditsPerSecond(long assemblyCreditsPerSecond) { this.assemblyCreditsPerSecond = assemblyCreditsPerSecond; }

    public long getOverlengthCreditsPerSecond() { return overlengthCreditsPerSecond; }
    public void setOverlengthCreditsPerSecond(long overlengthCreditsPerSecond) { this.overlengthCreditsPerSecond = overlengthCreditsPerSecond; }

    public Ledger getLedger() { return ledger; }
    public void setLedger(Ledger ledger) { this.ledger = ledger; }

    public static class Ledger {
        private String baseUrl = "http://localhost:8091";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(10);
        private RetrySettings retry = new RetrySettings(3, Duration.ofMillis(500), Duration.ofSeconds(4));

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public RetrySettings getRetry() { return retry; }
        public void setRetry(RetrySettings retry) { this.retry = retry; }
    }
}
