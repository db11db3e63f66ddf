package com.example.podcast_backend.engine;

import com.example.podcast_backend.config.AssemblyProperties;
import com.example.podcast_backend.dto.MixPlan;
import com.example.podcast_backend.dto.MixResult;
import com.example.podcast_backend.dto.MusicOverlay;
import com.example.podcast_backend.dto.Placement;
import com.example.podcast_backend.dto.TimeRange;
import com.example.podcast_backend.engine.Interfaces.AudioMixEngine;
import com.example.podcast_backend.exception.AssemblyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegAudioMixEngine implements AudioMixEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioMixEngine.class);
    private static final Duration PROBE_TIMEOUT = Duration.ofMinutes(1);

    private final AssemblyProperties properties;

    public FfmpegAudioMixEngine(AssemblyProperties properties) {
        this.properties = properties;
    }

    @Override
    public long probeDurationMs(Path file) {
        List<String> cmd = List.of(
                properties.getFfprobeBin(), "-v", "error",
                "-show_entries", "format=duration",
                "-of", "default=noprint_wrappers=1:nokey=1",
                file.toAbsolutePath().toString());
        String out = run(cmd, PROBE_TIMEOUT).stdout().trim();
        try {
            return Math.round(Double.parseDouble(out.lines().findFirst().orElse("")) * 1000.0);
        } catch (NumberFormatException e) {
            throw new AssemblyException("ffprobe returned no duration for " + file + ": '" + out + "'", e);
        }
    }

    @Override
    public MixResult mix(MixPlan plan, Path output) {
        if (plan.placements().isEmpty()) {
            throw new AssemblyException("Nothing to mix: no segments placed");
        }
        try {
            Files.createDirectories(output.toAbsolutePath().getParent());
        } catch (IOException e) {
            throw new AssemblyException("Cannot create output dir for " + output, e);
        }
        List<String> cmd = buildCommand(plan, output);
        LOGGER.info("FFmpeg mix placements={} overlays={} totalMs={}", plan.placements().size(),
                plan.overlays().size(), plan.totalDurationMs());
        LOGGER.debug("FFmpeg command: {}", String.join(" ", cmd));
        run(cmd, properties.getProcessTimeout());

        long durationMs = probeDurationMs(output);
        return new MixResult(output, durationMs);
    }

    List<String> buildCommand(MixPlan plan, Path output) {
        List<String> cmd = new ArrayList<>();
        cmd.add(properties.getFfmpegBin());
        cmd.add("-hide_banner");
        cmd.add("-nostats");
        cmd.add("-y");
        for (Placement p : plan.placements()) {
            cmd.add("-i");
            cmd.add(p.source().toAbsolutePath().toString());
        }
        // one looping input per overlay, so beds never need asplit
        for (MusicOverlay o : plan.overlays()) {
            Path music = plan.musicFiles().get(o.musicMediaId());
            if (music == null) {
                throw new AssemblyException("Music file not resolved: " + o.musicMediaId());
            }
            cmd.add("-stream_loop");
            cmd.add("-1");
            cmd.add("-i");
            cmd.add(music.toAbsolutePath().toString());
        }
        cmd.add("-filter_complex");
        cmd.add(buildFilterGraph(plan, properties.getLoudness()));
        cmd.add("-map");
        cmd.add("[out]");
        cmd.add("-ac");
        cmd.add("2");
        cmd.add("-ar");
        cmd.add("44100");
        cmd.add("-c:a");
        cmd.add("libmp3lame");
        cmd.add("-b:a");
        cmd.add(properties.getBitrate());
        cmd.add(output.toAbsolutePath().toString());
        return cmd;
    }

    /**
     * Filter graph: every placement trimmed to its kept ranges and delayed to its start, every bed
     * trimmed, faded and delayed, all summed with {@code amix normalize=0} and passed through
     * {@code loudnorm}. Inputs are numbered placements first, then overlays.
     */
    static String buildFilterGraph(MixPlan plan, AssemblyProperties.Loudness loudness) {
        StringBuilder g = new StringBuilder();
        List<String> mixInputs = new ArrayList<>();

        List<Placement> placements = plan.placements();
        for (int i = 0; i < placements.size(); i++) {
            Placement p = placements.get(i);
            List<TimeRange> keep = p.keep();
            List<String> parts = new ArrayList<>();
            for (int k = 0; k < keep.size(); k++) {
                String label = "p" + i + "k" + k;
                g.append('[').append(i).append(":a]")
                        .append("atrim=start=").append(sec(keep.get(k).startMs()))
                        .append(":end=").append(sec(keep.get(k).endMs()))
                        .append(",asetpts=PTS-STARTPTS[").append(label).append("];");
                parts.add(label);
            }
            String seg = "s" + i;
            if (parts.size() == 1) {
                g.append('[').append(parts.get(0)).append("]anull[").append(seg).append("];");
            } else {
                for (String part : parts) g.append('[').append(part).append(']');
                g.append("concat=n=").append(parts.size()).append(":v=0:a=1[").append(seg).append("];");
            }
            String placed = "d" + i;
            g.append('[').append(seg).append("]adelay=delays=").append(p.startMs()).append(":all=1[").append(placed).append("];");
            mixInputs.add(placed);
        }

        List<MusicOverlay> overlays = plan.overlays();
        for (int j = 0; j < overlays.size(); j++) {
            MusicOverlay o = overlays.get(j);
            int input = placements.size() + j;
            long dur = o.durationMs();
            long fadeIn = Math.min(o.fadeInMs(), dur / 2);
            long fadeOut = Math.min(o.fadeOutMs(), dur - fadeIn);
            String label = "m" + j;
            g.append('[').append(input).append(":a]")
                    .append("atrim=duration=").append(sec(dur))
                    .append(",asetpts=PTS-STARTPTS")
                    .append(",volume=").append(String.format(Locale.ROOT, "%.2fdB", o.volumeDb()));
            if (fadeIn > 0) {
                g.append(",afade=t=in:st=0:d=").append(sec(fadeIn));
            }
            if (fadeOut > 0) {
                g.append(",afade=t=out:st=").append(sec(dur - fadeOut)).append(":d=").append(sec(fadeOut));
            }
            g.append(",adelay=delays=").append(o.startMs()).append(":all=1[").append(label).append("];");
            mixInputs.add(label);
        }

        for (String in : mixInputs) g.append('[').append(in).append(']');
        g.append("amix=inputs=").append(mixInputs.size()).append(":normalize=0:dropout_transition=0")
                .append(",atrim=duration=").append(sec(plan.totalDurationMs()))
                .append(",loudnorm=I=").append(num(loudness.getIntegratedLufs()))
                .append(":TP=").append(num(loudness.getTruePeakDb()))
                .append(":LRA=").append(num(loudness.getLoudnessRange()))
                .append("[out]");
        return g.toString();
    }

    private static String sec(long ms) {
        return String.format(Locale.ROOT, "%.3f", ms / 1000.0);
    }

    private static String num(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }

    private record ProcessOutput(String stdout, String stderr) {
    }

    private ProcessOutput run(List<String> cmd, Duration timeout) {
        Process p;
        try {
            p = new ProcessBuilder(cmd).redirectErrorStream(false).start();
        } catch (IOException e) {
            throw new AssemblyException("Cannot start " + cmd.get(0), e);
        }
        StringBuilder outBuf = new StringBuilder();
        StringBuilder errBuf = new StringBuilder();
        Thread tOut = drain(p.getInputStream(), outBuf, "out");
        Thread tErr = drain(p.getErrorStream(), errBuf, "err");
        try {
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new AssemblyException(cmd.get(0) + " timed out after " + timeout + "\n---- stderr ----\n" + tail(errBuf));
            }
            tOut.join(1000);
            tErr.join(1000);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new AssemblyException(cmd.get(0) + " interrupted", e);
        }
        if (p.exitValue() != 0) {
            throw new AssemblyException(cmd.get(0) + " failed with exit " + p.exitValue()
                    + "\n---- stderr ----\n" + tail(errBuf));
        }
        return new ProcessOutput(outBuf.toString(), errBuf.toString());
    }

    private static Thread drain(InputStream in, StringBuilder buf, String stream) {
        Thread t = new Thread(() -> {
            try (var br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                br.lines().forEach(line -> {
                    LOGGER.debug("[ffmpeg-{}] {}", stream, line);
                    synchronized (buf) {
                        buf.append(line).append('\n');
                    }
                });
            } catch (IOException | java.io.UncheckedIOException e) {
                LOGGER.debug("ffmpeg {} stream closed: {}", stream, e.toString());
            }
        });
        t.setDaemon(true);
        t.start();
        return t;
    }

    private static String tail(StringBuilder buf) {
        synchronized (buf) {
            int from = Math.max(0, buf.length() - 4000);
            return buf.substring(from);
        }
    }
}
