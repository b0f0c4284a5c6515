package com.example.subburn_backend.dto.web;

import java.time.Instant;

public record ApiError(String error, String code, Instant timestamp) {
}
