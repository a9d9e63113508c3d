package com.dcruver.vault.domain;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Node/edge view of the index for visualization.
 */
@Data
@Builder
public class GraphExport {
    private final List<Node> nodes;
    private final List<Edge> edges;
    private final IndexStats stats;

    @Data
    @Builder
    public static class Node {
        private final String id;
        private final String label;
        private final List<String> tags;
        private final String group;
    }

    @Data
    @Builder
    public static class Edge {
        private final String source;
        private final String target;
        private final int weight;
    }
}
