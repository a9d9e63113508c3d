package com.dcruver.vault.domain;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Weighted Jaccard relatedness between two file records.
 * Tags weigh 0.6 and topics 0.4.
 */
public final class SimilarityRanker {

    public static final double TAG_WEIGHT = 0.6;
    public static final double TOPIC_WEIGHT = 0.4;

    private SimilarityRanker() {
    }

    public static double relevance(FileRecord a, FileRecord b) {
        return TAG_WEIGHT * jaccard(a.getTags(), b.getTags())
            + TOPIC_WEIGHT * jaccard(a.getTopics(), b.getTopics());
    }

    /**
     * |A ∩ B| / |A ∪ B|, or 0 when both are empty
     */
    public static double jaccard(Collection<String> a, Collection<String> b) {
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        if (union.isEmpty()) {
            return 0.0;
        }

        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(new HashSet<>(b));
        return (double) intersection.size() / union.size();
    }
}
