package com.starsalign.API;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "starsalign")
public class StarsAlignProperties {

    /**
     * Strategy used when a request does not name one: fast or precise.
     */
    private String defaultStrategy = "fast";

    /**
     * Directory for the precise strategy's scratch files. Empty means the JVM temp directory.
     */
    private String scratchDirectory = "";
}
