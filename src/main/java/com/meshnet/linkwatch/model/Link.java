package com.meshnet.linkwatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.geo.GeoJsonLineString;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.DBRef;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A wireless or wired link between two endpoints.
 *
 * Endpoints are mandatory except for planned links, which only name the two
 * nodes. Node, layer, line and the display values in {@link #data} are derived
 * when the link is saved and are not recomputed afterwards (except the layer
 * slug).
 *
 * Within one topology source a link is identified by its unordered endpoint
 * pair, kept in {@link #endpointPairKey} and covered by a unique index.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "links")
@CompoundIndex(name = "source_pair_idx",
        def = "{'topologySourceId': 1, 'endpointPairKey': 1}",
        unique = true,
        partialFilter = "{'endpointPairKey': {$exists: true}}")
public class Link {

    @Id
    private String id;

    private LinkType type;

    @Builder.Default
    private LinkStatus status = LinkStatus.PLANNED;

    private String endpointAId;
    private String endpointBId;

    @DBRef
    private Endpoint endpointA;

    @DBRef
    private Endpoint endpointB;

    private String endpointPairKey;

    @Indexed
    private String topologySourceId;

    // kind of address the topology source names the endpoints by
    private AddressKind addressKind;

    // shortcuts, mandatory only for planned links
    @DBRef
    private Node nodeA;

    @DBRef
    private Node nodeB;

    @DBRef
    private Layer layer;

    private GeoJsonLineString line;

    private String metricType;
    private Double metricValue;
    private Integer maxRate;
    private Integer minRate;

    // radio links only
    private Integer dbm;
    private Integer noise;

    @Builder.Default
    private LinkData data = new LinkData();

    private Boolean published;

    private LocalDateTime firstSeen;
    private LocalDateTime lastSeen;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    @Builder.Default
    private List<LinkStatusChange> statusHistory = new ArrayList<>();

    /**
     * Link quality from 1 to 6, 0 meaning unknown.
     * Only a placeholder until a metric based estimate exists.
     */
    public int getQuality() {
        if (metricValue == null) {
            return 0;
        }
        return 6;
    }

    public void setEndpointA(Endpoint endpointA) {
        this.endpointA = endpointA;
        this.endpointAId = endpointA != null ? endpointA.getId() : null;
    }

    public void setEndpointB(Endpoint endpointB) {
        this.endpointB = endpointB;
        this.endpointBId = endpointB != null ? endpointB.getId() : null;
    }

    /**
     * Points the link at another endpoint by id. A cached endpoint with a
     * different id is dropped and reloaded when the link is saved.
     */
    public void setEndpointAId(String endpointAId) {
        this.endpointAId = endpointAId;
        if (endpointA != null && !Objects.equals(endpointA.getId(), endpointAId)) {
            this.endpointA = null;
        }
    }

    public void setEndpointBId(String endpointBId) {
        this.endpointBId = endpointBId;
        if (endpointB != null && !Objects.equals(endpointB.getId(), endpointBId)) {
            this.endpointB = null;
        }
    }

    public boolean isPlanned() {
        return status == LinkStatus.PLANNED;
    }

    /**
     * Copy that does not share the mutable data and history with this link.
     */
    public Link copy() {
        return toBuilder()
                .data(data != null ? data.copy() : new LinkData())
                .statusHistory(statusHistory != null ? new ArrayList<>(statusHistory) : new ArrayList<>())
                .build();
    }
}
