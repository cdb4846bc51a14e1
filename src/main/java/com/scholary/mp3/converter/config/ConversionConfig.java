package com.scholary.mp3.converter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for conversion-related beans.
 *
 * <p>Enables the ConversionProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(ConversionProperties.class)
public class ConversionConfig {}
