package com.example.subburn_backend.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(ToolProperties tools) {
        return () -> probe("ffmpeg", tools.getFfmpegBinary(), "-version");
    }

    @Bean
    public HealthIndicator whisperHealth(ToolProperties tools) {
        return () -> probe("whisper", tools.getWhisperBinary(), "--help");
    }

    private static Health probe(String name, String binary, String arg) {
        try {
            var p = new ProcessBuilder(binary, arg).redirectErrorStream(true).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
            if (!p.waitFor(10, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                return Health.down().withDetail(name, "timeout").build();
            }
            if (p.exitValue() == 0) return Health.up().withDetail(name, "ok").build();
            return Health.down().withDetail(name, "exit " + p.exitValue()).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).withDetail(name, "interrupted").build();
        } catch (Exception e) {
            return Health.down(e).withDetail(name, "missing").build();
        }
    }
}
