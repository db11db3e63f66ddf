package com.example.podcast_backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(HealthConfig.class);

    @Bean
    public HealthIndicator ffmpegHealth(AssemblyProperties properties) {
        return () -> binaryHealth("ffmpeg", properties.getFfmpegBin());
    }

    @Bean
    public HealthIndicator ffprobeHealth(AssemblyProperties properties) {
        return () -> binaryHealth("ffprobe", properties.getFfprobeBin());
    }

    static Health binaryHealth(String name, String bin) {
        try {
            Process p = new ProcessBuilder(bin, "-version").redirectErrorStream(true).start();
            p.getInputStream().transferTo(java.io.OutputStream.nullOutputStream());
            if (p.waitFor(5, TimeUnit.SECONDS) && p.exitValue() == 0) {
                return Health.up().withDetail(name, "ok").build();
            }
            p.destroyForcibly();
            return Health.down().withDetail(name, "exit " + (p.isAlive() ? "timeout" : p.exitValue())).build();
        } catch (IOException e) {
            LOGGER.debug("{} health check failed bin={} cause={}", name, bin, e.toString());
            return Health.down(e).withDetail(name, "missing").build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).withDetail(name, "interrupted").build();
        }
    }
}
