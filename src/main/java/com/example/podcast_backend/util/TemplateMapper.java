package com.example.podcast_backend.util;

import com.example.podcast_backend.dto.CutWindow;
import com.example.podcast_backend.dto.MusicRule;
import com.example.podcast_backend.dto.SegmentSpec;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reads template JSON columns and job payloads into typed values. Accepts the camelCase keys the
 * API writes and the snake_case second-based keys older templates were saved with.
 */
public final class TemplateMapper {
    private TemplateMapper() {
    }

    /** Ordered segments; a template without segments plays the content only. */
    public static List<SegmentSpec> segments(JsonNode node) {
        List<SegmentSpec> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode n : node) {
                String type = text(n, "segmentType", "segment_type");
                out.add(new SegmentSpec(type == null || type.isBlank() ? SegmentSpec.CONTENT : type,
                        uuid(text(n, "mediaId", "media_id"))));
            }
        }
        if (out.isEmpty()) {
            out.add(new SegmentSpec(SegmentSpec.CONTENT, null));
        }
        return out;
    }

    public static List<MusicRule> musicRules(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        List<MusicRule> out = new ArrayList<>();
        for (JsonNode n : node) {
            List<String> targets = new ArrayList<>();
            JsonNode apply = n.has("applyToSegments") ? n.get("applyToSegments") : n.path("apply_to_segments");
            if (apply.isArray()) {
                apply.forEach(t -> targets.add(t.asText()));
            }
            out.add(new MusicRule(
                    uuid(text(n, "musicMediaId", "music_asset_id")),
                    targets,
                    millis(n, "startOffsetMs", "start_offset_s", 0),
                    millis(n, "endOffsetMs", "end_offset_s", 0),
                    millis(n, "fadeInMs", "fade_in_s", MusicRule.DEFAULT_FADE_IN_MS),
                    millis(n, "fadeOutMs", "fade_out_s", MusicRule.DEFAULT_FADE_OUT_MS),
                    n.hasNonNull("volumeDb") ? n.get("volumeDb").asDouble()
                            : n.hasNonNull("volume_db") ? n.get("volume_db").asDouble() : MusicRule.DEFAULT_VOLUME_DB));
        }
        return out;
    }

    /** User cut windows from the job payload ({@code cuts: [{startMs, endMs}]}). */
    public static List<CutWindow> cutWindows(Map<String, Object> payload) {
        if (payload == null || !(payload.get("cuts") instanceof Collection<?> cuts)) return List.of();
        List<CutWindow> out = new ArrayList<>();
        for (Object o : cuts) {
            if (o instanceof Map<?, ?> m && m.get("startMs") instanceof Number s && m.get("endMs") instanceof Number e) {
                if (e.longValue() >= s.longValue()) {
                    out.add(new CutWindow(s.longValue(), e.longValue()));
                }
            }
        }
        return out;
    }

    public static boolean flag(Map<String, Object> payload, String key, boolean fallback) {
        if (payload == null) return fallback;
        Object v = payload.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof String s) return Boolean.parseBoolean(s);
        return fallback;
    }

    private static String text(JsonNode n, String camel, String snake) {
        JsonNode v = n.hasNonNull(camel) ? n.get(camel) : n.get(snake);
        return v == null || v.isNull() ? null : v.asText();
    }

    private static long millis(JsonNode n, String msKey, String secondsKey, long fallback) {
        if (n.hasNonNull(msKey)) return n.get(msKey).asLong();
        if (n.hasNonNull(secondsKey)) return Math.round(n.get(secondsKey).asDouble() * 1000.0);
        return fallback;
    }

    private static UUID uuid(String s) {
        if (s == null || s.isBlank()) return null;
        try {
            return UUID.fromString(s.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Not a media id: " + s, e);
        }
    }
}
