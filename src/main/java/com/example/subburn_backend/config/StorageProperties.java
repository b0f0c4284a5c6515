package com.example.subburn_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String uploadsPrefix = "uploads";
    private String outputsPrefix = "outputs";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getUploadsPrefix() { return uploadsPrefix; }
    public void setUploadsPrefix(String uploadsPrefix) { this.uploadsPrefix = uploadsPrefix; }

    public String getOutputsPrefix() { return outputsPrefix; }
    public void setOutputsPrefix(String outputsPrefix) { this.outputsPrefix = outputsPrefix; }
}
