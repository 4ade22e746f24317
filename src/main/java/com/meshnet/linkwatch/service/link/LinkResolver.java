package com.meshnet.linkwatch.service.link;

import com.meshnet.linkwatch.exception.AddressNotFoundException;
import com.meshnet.linkwatch.exception.DuplicateLinkException;
import com.meshnet.linkwatch.exception.InvalidAddressException;
import com.meshnet.linkwatch.exception.LinkNotFoundException;
import com.meshnet.linkwatch.model.EndpointPair;
import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkStatus;
import com.meshnet.linkwatch.model.TopologySource;
import com.meshnet.linkwatch.service.address.AddressIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds links from the pair of addresses (two IPs or two MACs) that a topology
 * document uses to describe an edge.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LinkResolver {

    private final AddressIndex addressIndex;
    private final LinkStore linkStore;

    /**
     * Link between the endpoints owning the two addresses, in either order.
     *
     * @throws InvalidAddressException  when an address is malformed or the kinds differ
     * @throws AddressNotFoundException when an address belongs to no endpoint
     * @throws LinkNotFoundException    when no link joins the two endpoints
     */
    public Link findFromAddressPair(String addressA, String addressB) {
        return findFromAddressPair(addressA, addressB, null);
    }

    /**
     * Same as {@link #findFromAddressPair(String, String)} restricted to the
     * links of one topology source.
     */
    public Link findFromAddressPair(String addressA, String addressB, String topologySourceId) {
        EndpointPair endpoints = addressIndex.resolvePair(addressA, addressB);
        return find(endpoints, topologySourceId);
    }

    /**
     * Same as {@link #findFromAddressPair(String, String)} but creates an active
     * link when the endpoints are not linked yet.
     */
    public Link findOrCreate(String addressA, String addressB) {
        return findOrCreate(addressA, addressB, null);
    }

    /**
     * Finds or creates the link of {@code source} between the two addresses.
     * A link created by a concurrent caller in the meantime is returned instead
     * of a second one.
     */
    public Link findOrCreate(String addressA, String addressB, TopologySource source) {
        String topologySourceId = source != null ? source.getId() : null;
        try {
            return findFromAddressPair(addressA, addressB, topologySourceId);
        } catch (LinkNotFoundException e) {
            return create(e.getEndpoints(), topologySourceId);
        }
    }

    private Link find(EndpointPair endpoints, String topologySourceId) {
        return linkStore.findByEndpointPair(endpoints.a(), endpoints.b(), topologySourceId)
                .orElseThrow(() -> new LinkNotFoundException(endpoints));
    }

    private Link create(EndpointPair endpoints, String topologySourceId) {
        Link link = Link.builder()
                .endpointA(endpoints.a())
                .endpointB(endpoints.b())
                .status(LinkStatus.ACTIVE)
                .topologySourceId(topologySourceId)
                .build();
        try {
            Link created = linkStore.create(link);
            log.info("Created link {} between {} and {}", created.getId(),
                    endpoints.a().getPrimaryAddress(), endpoints.b().getPrimaryAddress());
            return created;
        } catch (DuplicateLinkException e) {
            log.debug("Link {} created concurrently, reusing it", e.getEndpointPairKey());
            return find(endpoints, topologySourceId);
        }
    }
}
