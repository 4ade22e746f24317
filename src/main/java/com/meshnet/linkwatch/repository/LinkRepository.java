package com.meshnet.linkwatch.repository;

import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Link records. At most one link exists per (topology source, endpoint pair
 * key), enforced by the {@code source_pair_idx} index declared on {@link Link}:
 * a second insert fails with {@link org.springframework.dao.DuplicateKeyException}.
 */
@Repository
public interface LinkRepository extends MongoRepository<Link, String> {

    Optional<Link> findFirstByEndpointPairKeyOrderByCreatedAtAscIdAsc(String endpointPairKey);

    Optional<Link> findFirstByTopologySourceIdAndEndpointPairKey(String topologySourceId, String endpointPairKey);

    // creation order
    List<Link> findByTopologySourceIdOrderByCreatedAtAscIdAsc(String topologySourceId);

    long countByTopologySourceId(String topologySourceId);

    long countByStatus(LinkStatus status);

    long countByTopologySourceIdAndStatus(String topologySourceId, LinkStatus status);
}
