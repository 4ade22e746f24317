package com.meshnet.linkwatch.service.link;

import com.meshnet.linkwatch.config.LinkwatchProperties;
import com.meshnet.linkwatch.exception.DuplicateLinkException;
import com.meshnet.linkwatch.exception.LinkValidationException;
import com.meshnet.linkwatch.model.Endpoint;
import com.meshnet.linkwatch.model.EndpointPair;
import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkStatusChange;
import com.meshnet.linkwatch.repository.EndpointRepository;
import com.meshnet.linkwatch.repository.LinkFilter;
import com.meshnet.linkwatch.repository.LinkRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Owns the link records. Every write goes through the same preparation:
 * <ol>
 *   <li>endpoints are reloaded from their ids, a loaded endpoint always wins
 *       over the object cached on the link</li>
 *   <li>{@link LinkValidator} rules</li>
 *   <li>{@link LinkDerivation} of type, nodes, layer, line and display data</li>
 *   <li>pair key, publication default, timestamps and status history</li>
 * </ol>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LinkStore {

    private final LinkRepository linkRepository;
    private final EndpointRepository endpointRepository;
    private final LinkValidator linkValidator;
    private final LinkDerivation linkDerivation;
    private final LinkwatchProperties properties;
    private final Clock clock;

    public Optional<Link> findById(String id) {
        return linkRepository.findById(id);
    }

    /**
     * Link between the two endpoints in either orientation, whatever its source.
     */
    public Optional<Link> findByEndpointPair(Endpoint a, Endpoint b) {
        return findByEndpointPair(a, b, null);
    }

    /**
     * Link between the two endpoints in either orientation, restricted to one
     * topology source when {@code topologySourceId} is not null.
     */
    public Optional<Link> findByEndpointPair(Endpoint a, Endpoint b, String topologySourceId) {
        // the pair key is the same for (a, b) and (b, a)
        String pairKey = EndpointPair.pairKey(a.getId(), b.getId());
        if (pairKey == null) {
            return Optional.empty();
        }
        if (topologySourceId == null) {
            return linkRepository.findFirstByEndpointPairKeyOrderByCreatedAtAscIdAsc(pairKey);
        }
        return linkRepository.findFirstByTopologySourceIdAndEndpointPairKey(topologySourceId, pairKey);
    }

    /**
     * Links of a topology source in creation order.
     */
    public List<Link> findByTopologySource(String topologySourceId) {
        return linkRepository.findByTopologySourceIdOrderByCreatedAtAscIdAsc(topologySourceId);
    }

    /**
     * Validates and inserts a new link.
     *
     * @throws LinkValidationException when a validation rule fails
     * @throws DuplicateLinkException  when the source already has a link for the pair
     */
    public Link create(Link link) {
        prepare(link);
        Link created;
        try {
            created = linkRepository.insert(link);
        } catch (DuplicateKeyException e) {
            throw new DuplicateLinkException(link.getTopologySourceId(), link.getEndpointPairKey(), e);
        }
        log.debug("Created link {} ({} <> {})", created.getId(),
                created.getData().getNodeAName(), created.getData().getNodeBName());
        return created;
    }

    /**
     * Validates and persists a new or existing link.
     *
     * @throws LinkValidationException when a validation rule fails
     * @throws DuplicateLinkException  when the change collides with another link of the source
     */
    public Link save(Link link) {
        prepare(link);
        try {
            return linkRepository.save(link);
        } catch (DuplicateKeyException e) {
            throw new DuplicateLinkException(link.getTopologySourceId(), link.getEndpointPairKey(), e);
        }
    }

    public void deleteAll() {
        linkRepository.deleteAll();
    }

    public long count() {
        return linkRepository.count();
    }

    public long count(LinkFilter filter) {
        if (filter == null || filter.getTopologySourceId() == null && filter.getStatus() == null) {
            return count();
        }
        if (filter.getTopologySourceId() == null) {
            return linkRepository.countByStatus(filter.getStatus());
        }
        if (filter.getStatus() == null) {
            return linkRepository.countByTopologySourceId(filter.getTopologySourceId());
        }
        return linkRepository.countByTopologySourceIdAndStatus(filter.getTopologySourceId(), filter.getStatus());
    }

    private void prepare(Link link) {
        reconstitute(link);
        linkValidator.validate(link);
        linkDerivation.apply(link);

        link.setEndpointPairKey(EndpointPair.pairKey(link.getEndpointAId(), link.getEndpointBId()));
        if (link.getPublished() == null) {
            link.setPublished(properties.getLinks().isPublishedDefault());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (link.getCreatedAt() == null) {
            link.setCreatedAt(now);
        }
        link.setUpdatedAt(now);

        if (properties.getLinks().isReversionEnabled()) {
            recordStatus(link, now);
        }
    }

    private void reconstitute(Link link) {
        // setEndpointX also copies the id of an endpoint given only as an object
        link.setEndpointA(link.getEndpointAId() != null ? load(link.getEndpointAId()) : link.getEndpointA());
        link.setEndpointB(link.getEndpointBId() != null ? load(link.getEndpointBId()) : link.getEndpointB());
    }

    private Endpoint load(String endpointId) {
        return endpointRepository.findById(endpointId)
                .orElseThrow(() -> new LinkValidationException("endpoint " + endpointId + " does not exist"));
    }

    private void recordStatus(Link link, LocalDateTime now) {
        if (link.getStatusHistory() == null) {
            link.setStatusHistory(new ArrayList<>());
        }
        List<LinkStatusChange> history = link.getStatusHistory();
        LinkStatusChange last = history.isEmpty() ? null : history.get(history.size() - 1);
        if (last != null && last.getTo() == link.getStatus()) {
            return;
        }
        history.add(LinkStatusChange.builder()
                .from(last != null ? last.getTo() : null)
                .to(link.getStatus())
                .changedAt(now)
                .build());

        int limit = properties.getLinks().getStatusHistorySize();
        while (history.size() > limit) {
            history.remove(0);
        }
    }
}
