package com.scholary.dialogue.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the preparation pipeline.
 *
 * <p>Enables the PrepProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(PrepProperties.class)
public class PrepConfig {}
