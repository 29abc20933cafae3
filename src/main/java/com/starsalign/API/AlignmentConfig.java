package com.starsalign.API;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(StarsAlignProperties.class)
public class AlignmentConfig {
}
