package com.scholary.mp3.converter.config;

import com.scholary.mp3.converter.extraction.ExtractionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the yt-dlp ExtractionProperties. */
@Configuration
@EnableConfigurationProperties(ExtractionProperties.class)
public class ExtractionConfig {}
