package com.example.demo.ods.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings bound from the {@code ods} prefix of application.yml.
 */
@Data
@Component
@ConfigurationProperties(prefix = "ods")
public class OdsProperties {

    /**
     * Name of the table synthesized when a document contains none
     */
    private String defaultTableName = "Sheet1";

    /**
     * Prefix of generated automatic style names, followed by a counter
     */
    private String autoStylePrefix = "myAutoStyle";

    private String paletteResource = "ods/palette.yaml";

    private String defaultStylesResource = "ods/default-styles.yaml";

    /**
     * Whether the built-in styles are written into every opened document
     */
    private boolean registerDefaultStyles = true;
}
