package com.meshnet.linkwatch.service.topology;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshnet.linkwatch.dto.netjson.NetworkGraph;
import com.meshnet.linkwatch.dto.netjson.NetworkGraphNode;
import com.meshnet.linkwatch.exception.TopologyDecodeException;
import com.meshnet.linkwatch.model.AddressKind;
import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkStatus;
import com.meshnet.linkwatch.model.TopologySource;
import com.meshnet.linkwatch.support.NetworkFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TopologyGraphCodecTest {

    private final TopologyGraphCodec codec = new TopologyGraphCodec(new ObjectMapper());
    private final NetworkFixture fixture = new NetworkFixture();
    private final TopologySource olsr = fixture.olsrSource();

    @Test
    void decodesNodesAndWeightedEdges() {
        TopologyGraph graph = codec.decode("""
                {"type": "NetworkGraph", "protocol": "OLSR",
                 "nodes": [{"id": "172.16.40.2"}, {"id": "172.16.40.4", "label": "ignored"}],
                 "links": [{"source": "172.16.40.2", "target": "172.16.40.4", "weight": 1.01}]}
                """);

        assertThat(graph.nodes()).containsExactly("172.16.40.2", "172.16.40.4");
        assertThat(graph.edges()).containsExactly(new TopologyEdge("172.16.40.2", "172.16.40.4", 1.01));
    }

    @Test
    void acceptsCostAndMissingWeight() {
        TopologyGraph graph = codec.decode("""
                {"links": [{"source": "a", "target": "b", "cost": 3},
                           {"source": "b", "target": "c"}]}
                """);

        assertThat(graph.nodes()).isEmpty();
        assertThat(graph.edges()).containsExactly(
                new TopologyEdge("a", "b", 3.0),
                new TopologyEdge("b", "c", null));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "",
            "   ",
            "{not json",
            "[]",
            "{\"nodes\": []}",
            "{\"links\": {}}",
            "{\"nodes\": {}, \"links\": []}",
            "{\"nodes\": [{}], \"links\": []}",
            "{\"links\": [{\"source\": \"a\", \"weight\": 1}]}",
            "{\"links\": [{\"source\": \"a\", \"target\": 2}]}",
            "{\"links\": [{\"source\": \"a\", \"target\": \"b\", \"weight\": \"high\"}]}"
    })
    void rejectsDocumentsThatAreNotNetworkGraphs(String document) {
        assertThatThrownBy(() -> codec.decode(document)).isInstanceOf(TopologyDecodeException.class);
    }

    @Test
    void emptySourceExportsAnEmptyGraph() {
        String json = codec.toJson(codec.encode(olsr, List.of()));

        assertThat(json).isEqualTo("{\"type\":\"NetworkGraph\",\"protocol\":\"OLSR\",\"version\":\"0.6\","
                + "\"metric\":\"ETX\",\"nodes\":[],\"links\":[]}");
    }

    @Test
    void exportsActiveLinksByPrimaryAddress() {
        Link active = link(LinkStatus.ACTIVE, 1.01);
        active.setEndpointA(fixture.olsr2Wlan);
        active.setEndpointB(fixture.olsr4Wlan);
        Link disconnected = link(LinkStatus.DISCONNECTED, 2.0);
        disconnected.setEndpointA(fixture.olsr3Wlan);
        disconnected.setEndpointB(fixture.olsr4Wlan);

        NetworkGraph graph = codec.encode(olsr, List.of(active, disconnected));

        assertThat(graph.getType()).isEqualTo("NetworkGraph");
        assertThat(graph.getNodes()).extracting(NetworkGraphNode::getId)
                .containsExactly("172.16.40.2", "172.16.40.4");
        assertThat(graph.getLinks()).hasSize(1);
        assertThat(graph.getLinks().get(0).getSource()).isEqualTo("172.16.40.2");
        assertThat(graph.getLinks().get(0).getTarget()).isEqualTo("172.16.40.4");
        assertThat(graph.getLinks().get(0).getWeight()).isEqualTo(1.01);
    }

    @ParameterizedTest
    @CsvSource({
            "IPV4, 172.16.40.2, 172.16.40.4",
            "IPV6, fd00::2, fd00::4",
            "MAC, 00:27:22:00:40:02, 00:27:22:00:40:04"
    })
    void exportsEndpointsByTheAddressKindOfTheLink(AddressKind kind, String source, String target) {
        Link active = link(LinkStatus.ACTIVE, 1.0);
        active.setAddressKind(kind);
        active.setEndpointA(fixture.olsr2Wlan);
        active.setEndpointB(fixture.olsr4Wlan);

        NetworkGraph graph = codec.encode(olsr, List.of(active));

        assertThat(graph.getNodes()).extracting(NetworkGraphNode::getId).containsExactly(source, target);
        assertThat(graph.getLinks().get(0).getSource()).isEqualTo(source);
        assertThat(graph.getLinks().get(0).getTarget()).isEqualTo(target);
    }

    @Test
    void fallsBackToPrimaryAddressWhenTheKindIsMissing() {
        Link active = link(LinkStatus.ACTIVE, 1.0);
        active.setAddressKind(AddressKind.IPV6);
        active.setEndpointA(fixture.fusolabWlan);
        active.setEndpointB(fixture.pomeziaWlan);

        NetworkGraph graph = codec.encode(olsr, List.of(active));

        assertThat(graph.getNodes()).extracting(NetworkGraphNode::getId)
                .containsExactly("172.16.41.42", "172.16.40.22");
    }

    @Test
    void sharedNodesAreListedOnce() {
        Link first = link(LinkStatus.ACTIVE, 1.0);
        first.setEndpointA(fixture.olsr2Wlan);
        first.setEndpointB(fixture.olsr4Wlan);
        Link second = link(LinkStatus.ACTIVE, 1.5);
        second.setEndpointA(fixture.olsr3Wlan);
        second.setEndpointB(fixture.olsr4Wlan);

        NetworkGraph graph = codec.encode(olsr, List.of(first, second));

        assertThat(graph.getNodes()).extracting(NetworkGraphNode::getId)
                .containsExactly("172.16.40.2", "172.16.40.4", "172.16.40.3");
        assertThat(graph.getLinks()).hasSize(2);
    }

    @Test
    void exportedGraphDecodesBack() {
        Link active = link(LinkStatus.ACTIVE, 1.01);
        active.setEndpointA(fixture.olsr2Wlan);
        active.setEndpointB(fixture.olsr4Wlan);

        TopologyGraph graph = codec.decode(codec.toJson(codec.encode(olsr, List.of(active))));

        assertThat(graph.edges()).containsExactly(new TopologyEdge("172.16.40.2", "172.16.40.4", 1.01));
    }

    private static Link link(LinkStatus status, double weight) {
        return Link.builder().status(status).metricValue(weight).topologySourceId("olsr").build();
    }
}
