package com.example.podcast_backend.service.assembly;

import com.example.podcast_backend.dto.Placement;
import com.example.podcast_backend.dto.TimeRange;
import com.example.podcast_backend.service.assembly.SegmentPlanner.SegmentInput;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SegmentPlannerTest {

    private static SegmentInput input(String type, long durationMs) {
        return new SegmentInput(type, Path.of(type + ".mp3"), List.of(new TimeRange(0, durationMs)));
    }

    @Test
    void offsetsShiftContentAndOutroRelativeToThePreviousSegment() {
        List<Placement> plan = SegmentPlanner.plan(List.of(
                input("intro", 10_000),
                input("content", 60_000),
                input("outro", 5_000)), -2_000, 1_000);

        assertThat(plan).extracting(Placement::segmentType).containsExactly("intro", "content", "outro");
        assertThat(plan).extracting(Placement::startMs).containsExactly(0L, 8_000L, 69_000L);
        assertThat(plan.get(2).endMs()).isEqualTo(74_000L);
    }

    @Test
    void segmentPushedBeforeZeroLosesItsHead() {
        List<Placement> plan = SegmentPlanner.plan(List.of(input("content", 60_000)), -3_000, 0);

        assertThat(plan).hasSize(1);
        assertThat(plan.get(0).startMs()).isZero();
        assertThat(plan.get(0).keep()).containsExactly(new TimeRange(3_000, 60_000));
        assertThat(plan.get(0).durationMs()).isEqualTo(57_000L);
    }

    @Test
    void trimHeadWalksAcrossKeptRanges() {
        List<TimeRange> keep = List.of(new TimeRange(0, 1_000), new TimeRange(2_000, 5_000));

        assertThat(SegmentPlanner.trimHead(keep, 1_500)).containsExactly(new TimeRange(2_500, 5_000));
        assertThat(SegmentPlanner.trimHead(keep, 10_000)).isEmpty();
    }

    @Test
    void contentIsPlacedOnlyOnce() {
        List<Placement> plan = SegmentPlanner.plan(List.of(
                input("content", 1_000),
                input("content", 2_000),
                input("outro", 500)), 0, 0);

        assertThat(plan).extracting(Placement::segmentType).containsExactly("content", "outro");
        assertThat(plan.get(1).startMs()).isEqualTo(1_000L);
    }

    @Test
    void overlappingOutroDoesNotPullTheTimelineBack() {
        List<Placement> plan = SegmentPlanner.plan(List.of(
                input("content", 10_000),
                input("outro", 2_000),
                input("stinger", 1_000)), 0, -4_000);

        assertThat(plan).extracting(Placement::startMs).containsExactly(0L, 6_000L, 10_000L);
    }

    @Test
    void emptySegmentsAreSkipped() {
        List<Placement> plan = SegmentPlanner.plan(List.of(
                new SegmentInput("intro", Path.of("intro.mp3"), List.of()),
                input("content", 1_000)), 0, 0);

        assertThat(plan).extracting(Placement::segmentType).containsExactly("content");
    }
}
