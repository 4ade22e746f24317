package com.meshnet.linkwatch.service.topology;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshnet.linkwatch.dto.netjson.NetworkGraph;
import com.meshnet.linkwatch.dto.netjson.NetworkGraphLink;
import com.meshnet.linkwatch.dto.netjson.NetworkGraphNode;
import com.meshnet.linkwatch.exception.TopologyDecodeException;
import com.meshnet.linkwatch.model.AddressKind;
import com.meshnet.linkwatch.model.Endpoint;
import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkStatus;
import com.meshnet.linkwatch.model.TopologySource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads NetJSON network graphs into {@link TopologyGraph} and writes the
 * links of a source back as a {@link NetworkGraph}.
 *
 * Accepted input:
 * <pre>
 * {"nodes": [{"id": "10.0.0.1"}, ...],
 *  "links": [{"source": "10.0.0.1", "target": "10.0.0.2", "weight": 1.0}, ...]}
 * </pre>
 * {@code cost} is accepted in place of {@code weight}; other properties are ignored.
 */
@Component
@RequiredArgsConstructor
public class TopologyGraphCodec {

    private final ObjectMapper objectMapper;

    public TopologyGraph decode(String document) {
        if (document == null || document.isBlank()) {
            throw new TopologyDecodeException("Topology document is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new TopologyDecodeException("Topology document is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new TopologyDecodeException("Topology document must be a JSON object");
        }

        return new TopologyGraph(decodeNodes(root.get("nodes")), decodeEdges(root.get("links")));
    }

    private List<String> decodeNodes(JsonNode nodes) {
        List<String> result = new ArrayList<>();
        if (nodes == null || nodes.isNull()) {
            return result;
        }
        if (!nodes.isArray()) {
            throw new TopologyDecodeException("\"nodes\" must be an array");
        }
        for (JsonNode node : nodes) {
            result.add(requireText(node, "id", "node"));
        }
        return result;
    }

    private List<TopologyEdge> decodeEdges(JsonNode links) {
        if (links == null || !links.isArray()) {
            throw new TopologyDecodeException("Topology document has no \"links\" array");
        }
        List<TopologyEdge> result = new ArrayList<>();
        for (JsonNode link : links) {
            String source = requireText(link, "source", "link");
            String target = requireText(link, "target", "link");
            result.add(new TopologyEdge(source, target, weightOf(link)));
        }
        return result;
    }

    private static Double weightOf(JsonNode link) {
        JsonNode weight = link.has("weight") ? link.get("weight") : link.get("cost");
        if (weight == null || weight.isNull()) {
            return null;
        }
        if (!weight.isNumber()) {
            throw new TopologyDecodeException("link weight must be a number, got: " + weight);
        }
        return weight.asDouble();
    }

    private static String requireText(JsonNode node, String field, String element) {
        JsonNode value = node != null ? node.get(field) : null;
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new TopologyDecodeException(element + " without \"" + field + "\": " + node);
        }
        return value.asText().trim();
    }

    /**
     * Graph of the active links of {@code source}, in the order given.
     * Endpoints are named by the kind of address the source used for the link
     * (IPv4, IPv6 or MAC), or by their primary address when it is unknown.
     * Nodes are the distinct addresses of the link endpoints.
     */
    public NetworkGraph encode(TopologySource source, List<Link> links) {
        Set<String> nodes = new LinkedHashSet<>();
        List<NetworkGraphLink> graphLinks = new ArrayList<>();

        for (Link link : links) {
            if (link.getStatus() != LinkStatus.ACTIVE || link.getEndpointA() == null || link.getEndpointB() == null) {
                continue;
            }
            String a = addressOf(link.getEndpointA(), link.getAddressKind());
            String b = addressOf(link.getEndpointB(), link.getAddressKind());
            nodes.add(a);
            nodes.add(b);
            graphLinks.add(NetworkGraphLink.builder()
                    .source(a)
                    .target(b)
                    .weight(link.getMetricValue())
                    .build());
        }

        return NetworkGraph.builder()
                .protocol(source.getProtocol())
                .version(source.getVersion())
                .metric(source.getMetric())
                .nodes(nodes.stream().map(NetworkGraphNode::new).toList())
                .links(graphLinks)
                .build();
    }

    public String toJson(NetworkGraph graph) {
        try {
            return objectMapper.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize network graph", e);
        }
    }

    private static String addressOf(Endpoint endpoint, AddressKind kind) {
        String address = endpoint.getAddress(kind);
        return address != null ? address : endpoint.getId();
    }
}
