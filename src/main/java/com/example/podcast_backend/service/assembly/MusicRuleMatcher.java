package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.dto.MusicOverlay;
import com.example.podcast_backend.dto.MusicRule;
import com.example.podcast_backend.dto.Placement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Places music beds over the segments their rule targets.
 *
 * <p>Matching is case-insensitive exact on the segment type. A rule with no targets matches
 * nothing; it never falls back to the content segment. Placements of one segment type are merged
 * into contiguous spans, then the start offset is added to the span start and the end offset
 * subtracted from the span end. Spans that collapse are dropped.
 */
public final class MusicRuleMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(MusicRuleMatcher.class);

    private MusicRuleMatcher() {
    }

    public static List<MusicOverlay> match(List<MusicRule> rules, List<Placement> placements) {
        List<MusicOverlay> out = new ArrayList<>();
        for (MusicRule rule : rules) {
            Set<String> targets = rule.applyToSegments().stream()
                    .map(t -> t.trim().toLowerCase(Locale.ROOT))
                    .filter(t -> !t.isEmpty())
                    .collect(Collectors.toSet());
            if (targets.isEmpty()) {
                LOGGER.info("MUSIC rule has no target segments, skipped music={}", rule.musicMediaId());
                continue;
            }
            if (rule.musicMediaId() == null) {
                LOGGER.warn("MUSIC rule without music media, skipped targets={}", targets);
                continue;
            }

            Map<String, List<long[]>> byLabel = new LinkedHashMap<>();
            for (Placement p : placements) {
                String type = p.segmentType().toLowerCase(Locale.ROOT);
                if (targets.contains(type)) {
                    byLabel.computeIfAbsent(type, k -> new ArrayList<>()).add(new long[]{p.startMs(), p.endMs()});
                }
            }
            if (byLabel.isEmpty()) {
                LOGGER.info("MUSIC rule matched no placement targets={} music={}", targets, rule.musicMediaId());
                continue;
            }

            for (var entry : byLabel.entrySet()) {
                for (long[] span : mergeSpans(entry.getValue())) {
                    long s = Math.max(0, span[0] + rule.startOffsetMs());
                    long e = span[1] - rule.endOffsetMs();
                    if (e <= s) {
                        LOGGER.debug("MUSIC span collapsed label={} start={} end={}", entry.getKey(), s, e);
                        continue;
                    }
                    out.add(new MusicOverlay(rule.musicMediaId(), s, e, rule.fadeInMs(), rule.fadeOutMs(), rule.volumeDb()));
                }
            }
        }
        return out;
    }

    private static List<long[]> mergeSpans(List<long[]> spans) {
        spans.sort((a, b) -> Long.compare(a[0], b[0]));
        List<long[]> merged = new ArrayList<>();
        long[] cur = spans.get(0).clone();
        for (int i = 1; i < spans.size(); i++) {
            long[] next = spans.get(i);
            if (next[0] <= cur[1]) {
                cur[1] = Math.max(cur[1], next[1]);
            } else {
                merged.add(cur);
                cur = next.clone();
            }
        }
        merged.add(cur);
        return merged;
    }
}
