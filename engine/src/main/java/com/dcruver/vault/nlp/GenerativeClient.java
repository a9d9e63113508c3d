package com.dcruver.vault.nlp;

/**
 * Produces raw note text (frontmatter plus body) from a source text and a prompt.
 */
@FunctionalInterface
public interface GenerativeClient {

    String generate(String text, String prompt);
}
