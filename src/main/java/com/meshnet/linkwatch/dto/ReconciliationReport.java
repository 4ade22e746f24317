package com.meshnet.linkwatch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one reconciliation run of a topology source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {

    private String topologySourceId;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    private int edges;          // edges in the fetched document
    private int created;
    private int refreshed;      // existing links seen again
    private int disconnected;

    @Builder.Default
    private List<SkippedEdge> skippedEdges = new ArrayList<>();

    // links that could not be disconnected, with the reason
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SkippedEdge {
        private String source;
        private String target;
        private String reason;
    }
}
