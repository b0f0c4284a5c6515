package com.example.subburn_backend.controller;

import com.example.subburn_backend.dto.web.UploadAcceptedResponse;
import com.example.subburn_backend.service.UploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
public class UploadController {
    private final UploadService uploadService;

    public UploadController(UploadService uploadService) {
        this.uploadService = uploadService;
    }

    @Operation(summary = "Upload a video and start transcription and subtitle burning in the background")
    @ApiResponse(responseCode = "200", description = "Stored; progress follows on the subscriber's event stream")
    @ApiResponse(responseCode = "400", description = "No file attached, or a .wav file")
    @ApiResponse(responseCode = "503", description = "Processing pool is full")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadAcceptedResponse upload(
            @RequestPart(value = "video", required = false) MultipartFile video,
            @RequestParam(value = "subscriberId", required = false) String subscriberId) {
        return uploadService.accept(video, subscriberId);
    }
}
