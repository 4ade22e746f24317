package com.meshnet.linkwatch.dto.netjson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * NetJSON NetworkGraph as exported for a topology source.
 * {@code nodes} and {@code links} are never null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "protocol", "version", "metric", "nodes", "links"})
public class NetworkGraph {

    public static final String TYPE = "NetworkGraph";

    @Builder.Default
    private String type = TYPE;

    private String protocol;
    private String version;
    private String metric;

    @Builder.Default
    private List<NetworkGraphNode> nodes = new ArrayList<>();

    @Builder.Default
    private List<NetworkGraphLink> links = new ArrayList<>();
}
