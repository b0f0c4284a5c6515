package com.example.subburn_backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * External executables used by the pipeline and how they are launched.
 */
@Validated
@ConfigurationProperties(prefix = "tools")
public class ToolProperties {

    @NotBlank
    private String ffmpegBinary = "ffmpeg";

    @NotBlank
    private String whisperBinary = "whisper";

    @NotBlank
    private String whisperModel = "base";

    @Min(1)
    private long timeoutSeconds = 3600;

    /**
     * Directory prepended to {@code PATH} for every tool process. The JVM's own environment is left untouched.
     */
    private String extraPath;

    public String getFfmpegBinary() {
        return ffmpegBinary;
    }

    public void setFfmpegBinary(String ffmpegBinary) {
        this.ffmpegBinary = ffmpegBinary;
    }

    public String getWhisperBinary() {
        return whisperBinary;
    }

    public void setWhisperBinary(String whisperBinary) {
        this.whisperBinary = whisperBinary;
    }

    public String getWhisperModel() {
        return whisperModel;
    }

    public void setWhisperModel(String whisperModel) {
        this.whisperModel = whisperModel;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public String getExtraPath() {
        return extraPath;
    }

    public void setExtraPath(String extraPath) {
        this.extraPath = extraPath;
    }
}
