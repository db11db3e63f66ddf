package com.example.podcast_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for the assembly pipeline: scratch space, ffmpeg, loudness target, spoken edit markers.
 */
@ConfigurationProperties(prefix = "assembly")
public class AssemblyProperties {
    private String workDir = "./data/work";
    private String outputPrefix = "episodes";
    private String ffmpegBin = "ffmpeg";
    private String ffprobeBin = "ffprobe";
    private Duration processTimeout = Duration.ofMinutes(30);
    private String bitrate = "192k";
    private Loudness loudness = new Loudness();
    private Marker marker = new Marker();
    private Duration stuckAfter = Duration.ofHours(2);

    public String getWorkDir() { return workDir; }
    public void setWorkDir(String workDir) { this.workDir = workDir; }

    public String getOutputPrefix() { return outputPrefix; }
    public void setOutputPrefix(String outputPrefix) { this.outputPrefix = outputPrefix; }

    public String getFfmpegBin() { return ffmpegBin; }
    public void setFfmpegBin(String ffmpegBin) { this.ffmpegBin = ffmpegBin; }

    public String getFfprobeBin() { return ffprobeBin; }
    public void setFfprobeBin(String ffprobeBin) { this.ffprobeBin = ffprobeBin; }

    public Duration getProcessTimeout() { return processTimeout; }
    public void setProcessTimeout(Duration processTimeout) { this.processTimeout = processTimeout; }

    public String getBitrate() { return bitrate; }
    public void setBitrate(String bitrate) { this.bitrate = bitrate; }

    public Loudness getLoudness() { return loudness; }
    public void setLoudness(Loudness loudness) { this.loudness = loudness; }

    public Marker getMarker() { return marker; }
    public void setMarker(Marker marker) { this.marker = marker; }

    public Duration getStuckAfter() { return stuckAfter; }
    public void setStuckAfter(Duration stuckAfter) { this.stuckAfter = stuckAfter; }

    /** EBU R128 targets passed to loudnorm. */
    public static class Loudness {
        private double integratedLufs = -16.0;
        private double truePeakDb = -1.5;
        private double loudnessRange = 11.0;

        public double getIntegratedLufs() { return integratedLufs; }
        public void setIntegratedLufs(double integratedLufs) { this.integratedLufs = integratedLufs; }

        public double getTruePeakDb() { return truePeakDb; }
        public void setTruePeakDb(double truePeakDb) { this.truePeakDb = truePeakDb; }

        public double getLoudnessRange() { return loudnessRange; }
        public void setLoudnessRange(double loudnessRange) { this.loudnessRange = loudnessRange; }
    }

    /** Spoken keyword that removes the preceding lookback window from the content. */
    public static class Marker {
        private boolean enabled = true;
        private String keyword = "flubber";
        private long lookbackMs = 5000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getKeyword() { return keyword; }
        public void setKeyword(String keyword) { this.keyword = keyword; }

        public long getLookbackMs() { return lookbackMs; }
        public void setLookbackMs(long lookbackMs) { this.lookbackMs = lookbackMs; }
    }
}
