package com.example.podcast_backend.dto;

import java.util.Locale;
import java.util.UUID;

/**
 * One entry of a template's segment list. {@code mediaId} is null for the content segment, which
 * is filled with the job's main content.
 */
public record SegmentSpec(String segmentType, UUID mediaId) {
    public static final String INTRO = "intro";
    public static final String CONTENT = "content";
    public static final String OUTRO = "outro";

    public SegmentSpec {
        segmentType = segmentType == null ? "" : segmentType.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isContent() {
        return CONTENT.equals(segmentType);
    }
}
