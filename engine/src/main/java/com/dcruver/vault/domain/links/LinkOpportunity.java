package com.dcruver.vault.domain.links;

import lombok.Data;

import java.util.Optional;

/**
 * A candidate cross-reference from the note being processed to {@code target}.
 * Mention-based opportunities carry the anchor text; similarity-based ones do not.
 */
@Data
public class LinkOpportunity {
    private final String target;
    private final String anchor;
    private final double confidence;

    public Optional<String> getAnchor() {
        return Optional.ofNullable(anchor);
    }

    public boolean isAnchored() {
        return anchor != null;
    }
}
