package com.dcruver.vault;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Spring Boot root for the knowledge vault.
 *
 * Turns generated notes into an indexed, cross-linked Markdown vault: frontmatter
 * extraction, tag/topic indexing, similarity ranking and link inference.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class KnowledgeVaultApplication {

    public static void main(String[] args) {
        log.info("Starting Knowledge Vault...");
        SpringApplication.run(KnowledgeVaultApplication.class, args);
    }
}
