package com.scholary.mp3.converter.config;

import com.scholary.mp3.converter.pipe.PipeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(PipeProperties.class)
public class PipeConfig {}
