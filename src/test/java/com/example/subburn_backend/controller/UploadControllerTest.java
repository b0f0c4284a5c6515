package com.example.subburn_backend.controller;

import com.example.subburn_backend.dto.web.UploadAcceptedResponse;
import com.example.subburn_backend.exception.IngressValidationException;
import com.example.subburn_backend.exception.PipelineBusyException;
import com.example.subburn_backend.service.UploadService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.concurrent.RejectedExecutionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = UploadController.class)
@AutoConfigureMockMvc(addFilters = false)
class UploadControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private UploadService uploadService;

    @Test
    void acceptedUploadReturnsJobId() throws Exception {
        MockMultipartFile video = new MockMultipartFile("video", "movie.mp4", "video/mp4", new byte[]{1, 2, 3});
        when(uploadService.accept(any(), eq("client-1")))
                .thenReturn(new UploadAcceptedResponse("Upload successful, processing started", "1700000000000-movie"));

        mockMvc.perform(multipart("/upload").file(video).param("subscriberId", "client-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Upload successful, processing started"))
                .andExpect(jsonPath("$.jobId").value("1700000000000-movie"));
    }

    @Test
    void missingFileIsBadRequest() throws Exception {
        when(uploadService.accept(isNull(), eq("client-1")))
                .thenThrow(new IngressValidationException("FILE_MISSING", "No file uploaded"));

        mockMvc.perform(multipart("/upload").param("subscriberId", "client-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No file uploaded"))
                .andExpect(jsonPath("$.code").value("FILE_MISSING"));
    }

    @Test
    void saturatedPipelineIsServiceUnavailable() throws Exception {
        MockMultipartFile video = new MockMultipartFile("video", "movie.mp4", "video/mp4", new byte[]{1});
        when(uploadService.accept(any(), any()))
                .thenThrow(new PipelineBusyException("Too many videos are being processed, try again later",
                        new RejectedExecutionException("full")));

        mockMvc.perform(multipart("/upload").file(video).param("subscriberId", "client-1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("PIPELINE_BUSY"));
    }
}
