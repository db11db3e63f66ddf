package com.example.podcast_backend.service.storage;

import com.example.podcast_backend.util.LocatorKind;

/**
 * A locator string split into backend kind, bucket (when the backend has one) and key.
 */
public record ParsedLocator(LocatorKind kind, String bucket, String key, String raw) {

    public String basename() {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }
}
