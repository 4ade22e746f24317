package com.meshnet.linkwatch.service.topology;

/**
 * Edge of a decoded topology; {@code weight} is null when the document has none.
 */
public record TopologyEdge(String source, String target, Double weight) {
}
