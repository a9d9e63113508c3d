package com.dcruver.vault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Vault layout and link-inference thresholds.
 */
@ConfigurationProperties(prefix = "vault")
@Data
public class VaultProperties {
    private String outputDir = "vault";
    private String indexPath = ".obsidian/index.json";
    private String defaultFilename = "untitled";

    private Linking linking = new Linking();
    private Generation generation = new Generation();

    @Data
    public static class Linking {
        // Minimum confidence for rewriting a bold mention into an inline link
        private double autoLinkMinConfidence = 0.6;
    }

    @Data
    public static class Generation {
        // Source text beyond this many characters is not sent to the model
        private int maxInputChars = 20000;
    }
}
