package com.dcruver.vault.config;

import com.dcruver.vault.domain.KnowledgeIndex;
import com.dcruver.vault.domain.links.LinkInferencer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Wires the single knowledge index instance and the components that share it.
 */
@Configuration
@Slf4j
public class VaultConfiguration {

    /**
     * The index is loaded once here; a malformed snapshot fails startup.
     */
    @Bean
    public KnowledgeIndex knowledgeIndex(VaultProperties properties) throws IOException {
        Path indexPath = Path.of(properties.getIndexPath());
        log.info("Opening knowledge index at {}", indexPath.toAbsolutePath());
        return KnowledgeIndex.open(indexPath);
    }

    @Bean
    public LinkInferencer linkInferencer(KnowledgeIndex knowledgeIndex) {
        return new LinkInferencer(knowledgeIndex);
    }
}
