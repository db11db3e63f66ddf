package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.dto.CutWindow;
import com.example.podcast_backend.dto.TimeRange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Removes cut windows from a timeline. Cuts are closed intervals, kept ranges are half-open, so a
 * cut ending exactly on a boundary also removes the boundary millisecond.
 */
public final class EditApplier {
    private EditApplier() {
    }

    public static List<TimeRange> apply(long durationMs, List<CutWindow> cuts) {
        if (durationMs <= 0) return List.of();
        return apply(List.of(new TimeRange(0, durationMs)), cuts);
    }

    public static List<TimeRange> apply(List<TimeRange> timeline, List<CutWindow> cuts) {
        List<CutWindow> merged = merge(cuts);
        List<TimeRange> out = new ArrayList<>();
        for (TimeRange range : timeline) {
            long cursor = range.startMs();
            for (CutWindow cut : merged) {
                if (cut.endMs() < cursor) continue;
                if (cut.startMs() >= range.endMs()) break;
                if (cut.startMs() > cursor) {
                    out.add(new TimeRange(cursor, cut.startMs()));
                }
                cursor = Math.max(cursor, cut.endMs() + 1);
                if (cursor >= range.endMs()) break;
            }
            if (cursor < range.endMs()) {
                out.add(new TimeRange(cursor, range.endMs()));
            }
        }
        return out;
    }

    /** Sorted, with overlapping and adjacent windows joined. */
    static List<CutWindow> merge(List<CutWindow> cuts) {
        if (cuts == null || cuts.isEmpty()) return List.of();
        List<CutWindow> sorted = new ArrayList<>(cuts);
        sorted.sort(Comparator.comparingLong(CutWindow::startMs));
        List<CutWindow> out = new ArrayList<>();
        CutWindow cur = sorted.get(0);
        for (int i = 1; i < sorted.size(); i++) {
            CutWindow next = sorted.get(i);
            if (next.startMs() <= cur.endMs() + 1) {
                cur = new CutWindow(cur.startMs(), Math.max(cur.endMs(), next.endMs()));
            } else {
                out.add(cur);
                cur = next;
            }
        }
        out.add(cur);
        return out;
    }
}
