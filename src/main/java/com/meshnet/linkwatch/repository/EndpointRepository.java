package com.meshnet.linkwatch.repository;

import com.meshnet.linkwatch.model.Endpoint;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Network interfaces of the inventory. Addresses are stored and looked up in
 * canonical form (see {@link EndpointAddressNormalizer}).
 */
@Repository
public interface EndpointRepository extends MongoRepository<Endpoint, String> {

    Optional<Endpoint> findFirstByMac(String mac);

    // matches any element of the addresses array
    Optional<Endpoint> findFirstByAddressesContaining(String address);
}
