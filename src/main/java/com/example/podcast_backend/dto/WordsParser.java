package com.example.podcast_backend.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads word timings from the transcript shapes we have stored over time.
 */
public final class WordsParser {
    private WordsParser() {}

    public static List<WordTiming> extract(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) return List.of();

        // 1) schema v1 {"items":[{startMs,endMs,text}]}
        List<WordTiming> out = parseItemsArray(root.path("items"));
        if (out.isEmpty()) {
            // 2) {"words":[...]}
            out = parseItemsArray(root.path("words"));
        }
        if (out.isEmpty()) {
            // 3) whisper-style segments with nested words, seconds
            out = parseSegments(root.path("segments"));
        }
        if (out.isEmpty() && root.isArray()) {
            out = parseItemsArray(root);
        }
        if (out.isEmpty()) return List.of();

        out = new ArrayList<>(out);
        out.sort(Comparator.comparingLong(WordTiming::startMs));
        return out;
    }

    private static List<WordTiming> parseItemsArray(JsonNode arr) {
        if (!arr.isArray()) return List.of();
        List<WordTiming> out = new ArrayList<>(arr.size());
        for (JsonNode n : arr) {
            long s = pickMs(n.get("startMs"), n.get("start"));
            long e = pickMs(n.get("endMs"), n.get("end"));
            String text = firstText(n, "text", "word");
            if (!text.isBlank() && e >= s) {
                out.add(new WordTiming(text, s, e));
            }
        }
        return out;
    }

    private static List<WordTiming> parseSegments(JsonNode segs) {
        if (!segs.isArray()) return List.of();
        List<WordTiming> out = new ArrayList<>();
        for (JsonNode seg : segs) {
            JsonNode words = seg.path("words");
            if (!words.isArray()) continue;
            for (JsonNode w : words) {
                long s = asMsFromSeconds(w.get("start"));
                long e = asMsFromSeconds(w.get("end"));
                String text = firstText(w, "word", "text");
                if (!text.isBlank() && e >= s) {
                    out.add(new WordTiming(text, s, e));
                }
            }
        }
        return out;
    }

    private static String firstText(JsonNode n, String... keys) {
        for (String k : keys) {
            JsonNode v = n.get(k);
            if (v != null && !v.isNull()) return v.asText("");
        }
        return "";
    }

    private static long pickMs(JsonNode msNode, JsonNode secNode) {
        if (msNode != null && !msNode.isNull()) return msNode.asLong(0L);
        if (secNode != null && !secNode.isNull()) return asMsFromSeconds(secNode);
        return 0L;
    }

    private static long asMsFromSeconds(JsonNode n) {
        if (n == null || n.isNull()) return 0L;
        return Math.round(n.asDouble(0.0) * 1000.0);
    }
}
