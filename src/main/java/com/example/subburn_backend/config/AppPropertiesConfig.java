package com.example.subburn_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({ToolProperties.class, PipelineProperties.class, SubtitleStyleProperties.class})
public class AppPropertiesConfig {
}
