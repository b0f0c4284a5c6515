package com.example.subburn_backend.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @NotBlank
    private String downloadPrefix = "/download";

    private boolean keepIntermediatesOnFailure = false;

    public String getDownloadPrefix() {
        return downloadPrefix;
    }

    public void setDownloadPrefix(String downloadPrefix) {
        this.downloadPrefix = downloadPrefix;
    }

    public boolean isKeepIntermediatesOnFailure() {
        return keepIntermediatesOnFailure;
    }

    public void setKeepIntermediatesOnFailure(boolean keepIntermediatesOnFailure) {
        this.keepIntermediatesOnFailure = keepIntermediatesOnFailure;
    }
}
