package com.example.subburn_backend.service.Interfaces;

import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;

public interface StorageService {

    /** Full local path of a file in the uploads directory (raw uploads, extracted audio). */
    Path resolveUpload(String fileName);

    /** Full local path of a file in the outputs directory (subtitles, rendered videos). */
    Path resolveOutput(String fileName);

    /**
     * Writes the uploaded bytes to the uploads directory under {@code fileName} and returns the stored path.
     * An existing file of that name is never replaced.
     */
    Path storeUpload(MultipartFile file, String fileName);

    void deleteUpload(String fileName);

    Path rootUploads();

    Path rootOutputs();

    /** Working root for short-lived files that tools reference by relative name. */
    Path rootWork();
}
