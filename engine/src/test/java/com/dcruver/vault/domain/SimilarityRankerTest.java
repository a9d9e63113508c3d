package com.dcruver.vault.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityRankerTest {

    @Test
    void testJaccardOfEmptySetsIsZero() {
        assertEquals(0.0, SimilarityRanker.jaccard(Set.of(), Set.of()));
    }

    @Test
    void testJaccardIsSymmetric() {
        List<String> a = List.of("math", "calculus");
        List<String> b = List.of("calculus", "physics", "optics");

        assertEquals(SimilarityRanker.jaccard(a, b), SimilarityRanker.jaccard(b, a));
        assertEquals(0.25, SimilarityRanker.jaccard(a, b), 1e-9);
    }

    @Test
    void testJaccardIgnoresDuplicates() {
        assertEquals(1.0, SimilarityRanker.jaccard(List.of("a", "a"), List.of("a")), 1e-9);
    }

    @Test
    void testRelevanceWeighsTagsOverTopics() {
        FileRecord a = record(List.of("math"), List.of("limits"));
        FileRecord sameTags = record(List.of("math"), List.of("optics"));
        FileRecord sameTopics = record(List.of("art"), List.of("limits"));

        assertEquals(0.6, SimilarityRanker.relevance(a, sameTags), 1e-9);
        assertEquals(0.4, SimilarityRanker.relevance(a, sameTopics), 1e-9);
        assertEquals(1.0, SimilarityRanker.relevance(a, a), 1e-9);
    }

    @Test
    void testDisjointRecordsAreUnrelated() {
        FileRecord a = record(List.of("math"), List.of("limits"));
        FileRecord b = record(List.of("art"), List.of("painting"));

        assertEquals(0.0, SimilarityRanker.relevance(a, b));
    }

    private static FileRecord record(List<String> tags, List<String> topics) {
        return FileRecord.builder().tags(tags).topics(topics).build();
    }
}
