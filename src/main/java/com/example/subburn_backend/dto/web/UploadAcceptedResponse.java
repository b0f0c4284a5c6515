package com.example.subburn_backend.dto.web;

public record UploadAcceptedResponse(String message, String jobId) {
}
