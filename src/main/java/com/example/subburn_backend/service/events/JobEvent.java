package com.example.subburn_backend.service.events;

/**
 * @param payload message text for log/error, an {@link Integer} percentage for progress,
 *                a {@link com.example.subburn_backend.dto.web.DownloadReference} for complete
 */
public record JobEvent(JobEventType type, Object payload) {
}
