package com.example.subburn_backend.config;

import com.example.subburn_backend.service.LocalStorageService;
import com.example.subburn_backend.service.Interfaces.StorageService;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var svc = new LocalStorageService(base, properties.getUploadsPrefix(), properties.getOutputsPrefix());
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, uploadsPrefix={}, outputsPrefix={}", base, properties.getUploadsPrefix(), properties.getOutputsPrefix());
        return svc;
    }
}
