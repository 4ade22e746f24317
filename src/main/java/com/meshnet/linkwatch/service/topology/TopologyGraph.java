package com.meshnet.linkwatch.service.topology;

import java.util.List;

/**
 * Nodes and weighted edges of a topology document. Nodes and edge ends are
 * addresses (IP or MAC) still to be resolved to endpoints.
 */
public record TopologyGraph(List<String> nodes, List<TopologyEdge> edges) {

    public TopologyGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
