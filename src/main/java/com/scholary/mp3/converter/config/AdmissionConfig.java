package com.scholary.mp3.converter.config;

import com.scholary.mp3.converter.admission.AdmissionProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(AdmissionProperties.class)
public class AdmissionConfig {}
