package com.meshnet.linkwatch.service.link;

import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkData;
import com.meshnet.linkwatch.model.Node;
import org.springframework.data.mongodb.core.geo.GeoJsonLineString;
import org.springframework.stereotype.Component;

/**
 * Fills the derived fields of a validated link. Every step only writes a field
 * that is still empty, except the layer slug, which always follows the layer.
 */
@Component
public class LinkDerivation {

    public void apply(Link link) {
        if (link.getType() == null && link.getEndpointA() != null && link.getEndpointA().getType() != null) {
            link.setType(link.getEndpointA().getType().impliedLinkType());
        }

        if (link.getNodeA() == null && link.getEndpointA() != null) {
            link.setNodeA(link.getEndpointA().getNode());
        }
        if (link.getNodeB() == null && link.getEndpointB() != null) {
            link.setNodeB(link.getEndpointB().getNode());
        }

        Node nodeA = link.getNodeA();
        Node nodeB = link.getNodeB();

        if (link.getLayer() == null && nodeA != null) {
            link.setLayer(nodeA.getLayer());
        }

        if (link.getLine() == null && nodeA != null && nodeB != null
                && nodeA.getPoint() != null && nodeB.getPoint() != null) {
            link.setLine(new GeoJsonLineString(nodeA.getPoint(), nodeB.getPoint()));
        }

        fillData(link, nodeA, nodeB);
    }

    private void fillData(Link link, Node nodeA, Node nodeB) {
        if (link.getData() == null) {
            link.setData(new LinkData());
        }
        LinkData data = link.getData();

        // names are always written together, keyed on node a alone
        if (data.getNodeAName() == null) {
            data.setNodeAName(nodeA != null ? nodeA.getName() : null);
            data.setNodeBName(nodeB != null ? nodeB.getName() : null);
        }

        if (data.getNodeASlug() == null || data.getNodeBSlug() == null) {
            data.setNodeASlug(nodeA != null ? nodeA.getSlug() : null);
            data.setNodeBSlug(nodeB != null ? nodeB.getSlug() : null);
        }

        if (link.getEndpointA() != null && data.getEndpointAMac() == null) {
            data.setEndpointAMac(link.getEndpointA().getMac());
        }
        if (link.getEndpointB() != null && data.getEndpointBMac() == null) {
            data.setEndpointBMac(link.getEndpointB().getMac());
        }

        data.setLayerSlug(link.getLayer() != null ? link.getLayer().getSlug() : null);
    }
}
