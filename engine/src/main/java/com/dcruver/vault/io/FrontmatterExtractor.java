package com.dcruver.vault.io;

import java.util.Optional;

/**
 * One attempt at pulling frontmatter out of generated text.
 * Implementations never throw; an empty result means "try the next extractor".
 */
public interface FrontmatterExtractor {

    Optional<MarkdownNote> extract(String text);
}
