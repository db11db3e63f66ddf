package com.example.podcast_backend.util;

/**
 * Storage backend variants. Declaration order is resolution priority when a record points at
 * more than one backend.
 */
public enum LocatorKind {
    PRIMARY_CLOUD,
    LEGACY_CLOUD,
    LOCAL_CACHE,
    EXTERNAL_STREAM;

    public boolean isCloudObject() {
        return this == PRIMARY_CLOUD || this == LEGACY_CLOUD;
    }
}
