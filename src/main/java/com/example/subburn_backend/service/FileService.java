package com.example.subburn_backend.service;

import com.example.subburn_backend.exception.StorageException;
import com.example.subburn_backend.service.Interfaces.StorageService;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Read-only access to the outputs directory.
 */
@Service
public class FileService {
    private final StorageService storage;

    public FileService(StorageService storage) {
        this.storage = storage;
    }

    /** Range requests are handled by Spring MVC for {@link Resource} bodies. */
    public ResponseEntity<Resource> serveOutput(String fileName) throws IOException {
        Path file;
        try {
            file = storage.resolveOutput(fileName);
        } catch (StorageException e) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Forbidden path");
        }
        if (!Files.isRegularFile(file)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "File not found: " + fileName);
        }

        return ResponseEntity.ok()
                .contentType(guessType(file))
                .cacheControl(CacheControl.noCache())
                .header(HttpHeaders.ACCEPT_RANGES, "bytes")
                .header(HttpHeaders.CONTENT_DISPOSITION, "inline; filename=\"" + file.getFileName() + "\"")
                .body(new FileSystemResource(file));
    }

    private static MediaType guessType(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".mp4")) return MediaType.parseMediaType("video/mp4");
        if (name.endsWith(".srt")) return MediaType.TEXT_PLAIN;
        String probe = Files.probeContentType(file);
        return MediaType.parseMediaType(probe != null ? probe : "application/octet-stream");
    }
}
