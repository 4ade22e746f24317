package com.meshnet.linkwatch.support;

import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkStatus;
import com.meshnet.linkwatch.repository.LinkRepository;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Links held as copies, in creation order, with the unique
 * (topologySourceId, endpointPairKey) index of the links collection.
 */
public class InMemoryLinkRepository extends InMemoryMongoRepository<Link> implements LinkRepository {

    public InMemoryLinkRepository() {
        super(Link::getId, Link::setId, Link::copy);
    }

    @Override
    protected void checkUniqueIndexes(Link link) {
        if (link.getEndpointPairKey() == null) {
            return;
        }
        boolean taken = documents.values().stream()
                .filter(other -> !Objects.equals(other.getId(), link.getId()))
                .anyMatch(other -> link.getEndpointPairKey().equals(other.getEndpointPairKey())
                        && Objects.equals(link.getTopologySourceId(), other.getTopologySourceId()));
        if (taken) {
            throw new DuplicateKeyException("E11000 duplicate key error index: source_pair_idx dup key: "
                    + link.getTopologySourceId() + ", " + link.getEndpointPairKey());
        }
    }

    @Override
    public Optional<Link> findFirstByEndpointPairKeyOrderByCreatedAtAscIdAsc(String endpointPairKey) {
        return findFirst(link -> endpointPairKey.equals(link.getEndpointPairKey()));
    }

    @Override
    public Optional<Link> findFirstByTopologySourceIdAndEndpointPairKey(String topologySourceId,
                                                                        String endpointPairKey) {
        return findFirst(link -> Objects.equals(topologySourceId, link.getTopologySourceId())
                && endpointPairKey.equals(link.getEndpointPairKey()));
    }

    @Override
    public List<Link> findByTopologySourceIdOrderByCreatedAtAscIdAsc(String topologySourceId) {
        return findWhere(link -> Objects.equals(topologySourceId, link.getTopologySourceId()));
    }

    @Override
    public long countByTopologySourceId(String topologySourceId) {
        return countWhere(link -> Objects.equals(topologySourceId, link.getTopologySourceId()));
    }

    @Override
    public long countByStatus(LinkStatus status) {
        return countWhere(link -> link.getStatus() == status);
    }

    @Override
    public long countByTopologySourceIdAndStatus(String topologySourceId, LinkStatus status) {
        return countWhere(link -> Objects.equals(topologySourceId, link.getTopologySourceId())
                && link.getStatus() == status);
    }
}
