package com.example.subburn_backend.service;

import com.example.subburn_backend.exception.StorageException;
import com.example.subburn_backend.service.Interfaces.StorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);

    private final Path baseDir;
    private final Path uploadsDir;
    private final Path outputsDir;

    public LocalStorageService(Path baseDir, String uploadsPrefix, String outputsPrefix) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.uploadsDir = this.baseDir.resolve(uploadsPrefix).normalize();
        this.outputsDir = this.baseDir.resolve(outputsPrefix).normalize();

        try {
            Files.createDirectories(uploadsDir);
            Files.createDirectories(outputsDir);
            LOGGER.info("LocalStorageService ready. base={}, uploads={}, outputs={}", this.baseDir, this.uploadsDir, this.outputsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public Path resolveUpload(String fileName) {
        return safeResolve(uploadsDir, fileName);
    }

    @Override
    public Path resolveOutput(String fileName) {
        return safeResolve(outputsDir, fileName);
    }

    @Override
    public Path storeUpload(MultipartFile file, String fileName) {
        Path target = safeResolve(uploadsDir, fileName);
        try {
            Files.createDirectories(target.getParent());
            try (InputStream in = file.getInputStream()) {
                Files.copy(in, target);
            }
            LOGGER.debug("Stored upload target={} size={}", target, Files.size(target));
            return target;
        } catch (FileAlreadyExistsException e) {
            throw new StorageException("Upload already exists, refusing to overwrite: " + target, e);
        } catch (IOException e) {
            throw new StorageException("Storing upload failed: " + target, e);
        }
    }

    @Override
    public void deleteUpload(String fileName) {
        Path p = safeResolve(uploadsDir, fileName);
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + p, e);
        }
    }

    private Path safeResolve(Path root, String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new StorageException("fileName is blank");
        }
        String normalized = fileName.replace('\\', '/').replaceAll("^/+", "");
        Path p = root.resolve(normalized).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new StorageException("Invalid fileName (path traversal?): " + fileName);
        }
        return p;
    }

    @Override public Path rootUploads() { return uploadsDir; }
    @Override public Path rootOutputs() { return outputsDir; }
    @Override public Path rootWork() { return baseDir; }
}
