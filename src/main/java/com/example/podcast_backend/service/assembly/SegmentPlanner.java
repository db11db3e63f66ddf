package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.dto.Placement;
import com.example.podcast_backend.dto.SegmentSpec;
import com.example.podcast_backend.dto.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays segments end to end. Content starts {@code contentStartOffsetMs} after the previous segment
 * ends and the outro {@code outroStartOffsetMs} after; negative offsets overlap. A segment pushed
 * before zero loses its head.
 */
public final class SegmentPlanner {
    private static final Logger LOGGER = LoggerFactory.getLogger(SegmentPlanner.class);

    public record SegmentInput(String segmentType, Path source, List<TimeRange> keep) {
    }

    private SegmentPlanner() {
    }

    public static List<Placement> plan(List<SegmentInput> segments, long contentStartOffsetMs, long outroStartOffsetMs) {
        List<Placement> out = new ArrayList<>();
        long pos = 0;
        boolean contentPlaced = false;
        for (SegmentInput seg : segments) {
            List<TimeRange> keep = seg.keep();
            long start;
            if (SegmentSpec.CONTENT.equals(seg.segmentType())) {
                if (contentPlaced) {
                    LOGGER.warn("TEMPLATE multiple content segments, content placed once");
                    continue;
                }
                contentPlaced = true;
                start = pos + contentStartOffsetMs;
            } else if (SegmentSpec.OUTRO.equals(seg.segmentType())) {
                start = pos + outroStartOffsetMs;
            } else {
                start = pos;
            }
            if (start < 0) {
                keep = trimHead(keep, -start);
                start = 0;
            }
            Placement placement = new Placement(seg.segmentType(), seg.source(), start, keep);
            if (placement.durationMs() == 0) {
                LOGGER.warn("TEMPLATE empty segment skipped type={}", seg.segmentType());
                continue;
            }
            out.add(placement);
            pos = Math.max(pos, placement.endMs());
        }
        return out;
    }

    static List<TimeRange> trimHead(List<TimeRange> keep, long trimMs) {
        List<TimeRange> out = new ArrayList<>();
        long remaining = trimMs;
        for (TimeRange r : keep) {
            if (remaining >= r.durationMs()) {
                remaining -= r.durationMs();
                continue;
            }
            out.add(new TimeRange(r.startMs() + remaining, r.endMs()));
            remaining = 0;
        }
        return out;
    }
}
