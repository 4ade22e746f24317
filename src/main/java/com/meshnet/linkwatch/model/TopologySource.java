package com.meshnet.linkwatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * An external feed describing the network graph, typically the NetJSON export
 * of a routing protocol daemon. Links produced by reconciling it point back to
 * it through {@link Link#getTopologySourceId()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "topology_sources")
public class TopologySource {

    @Id
    private String id;

    private String name;

    private String url;         // http(s)://, file: or a plain path

    private String protocol;    // e.g. OLSR
    private String version;     // e.g. 0.6
    private String metric;      // e.g. ETX

    @Builder.Default
    private boolean enabled = true;
}
