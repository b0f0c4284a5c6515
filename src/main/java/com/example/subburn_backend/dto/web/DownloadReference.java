package com.example.subburn_backend.dto.web;

/**
 * Payload of the {@code complete} event, e.g. {@code /download/subtitled_<jobId>.mp4}.
 */
public record DownloadReference(String downloadUrl) {
}
