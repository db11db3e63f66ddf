package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.dto.CutWindow;
import com.example.podcast_backend.dto.WordTiming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a spoken marker word into a cut: the marker itself plus the lookback window before it.
 */
public final class MarkerCutResolver {
    private MarkerCutResolver() {
    }

    public static List<CutWindow> resolve(List<WordTiming> words, String keyword, long lookbackMs) {
        String wanted = normalize(keyword);
        if (words == null || wanted.isEmpty()) return List.of();
        List<CutWindow> out = new ArrayList<>();
        for (WordTiming w : words) {
            if (wanted.equals(normalize(w.text()))) {
                out.add(new CutWindow(Math.max(0, w.startMs() - Math.max(0, lookbackMs)), w.endMs()));
            }
        }
        return out;
    }

    static String normalize(String word) {
        if (word == null) return "";
        // "Flubber!" -> "flubber"
        return word.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }
}
