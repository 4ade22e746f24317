package com.meshnet.linkwatch.repository;

import com.meshnet.linkwatch.model.LinkStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Criteria for counting links. Null fields match anything.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkFilter {

    private String topologySourceId;
    private LinkStatus status;

    public static LinkFilter ofSource(String topologySourceId) {
        return LinkFilter.builder().topologySourceId(topologySourceId).build();
    }

    public static LinkFilter ofSource(String topologySourceId, LinkStatus status) {
        return LinkFilter.builder().topologySourceId(topologySourceId).status(status).build();
    }
}
