package com.example.podcast_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Local cache janitor switch. The schedule itself is read from {@code cache.cleanup.interval}.
 */
@ConfigurationProperties(prefix = "cache.cleanup")
public class CacheCleanupProperties {
    private boolean enabled = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
