package com.scholary.mp3.converter.config;

import com.scholary.mp3.converter.cache.CacheProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Configuration for the result cache.
 *
 * <p>Enables the CacheProperties and scheduling for the eviction sweep.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {}
