package com.meshnet.linkwatch.repository;

import com.meshnet.linkwatch.model.TopologySource;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TopologySourceRepository extends MongoRepository<TopologySource, String> {

    List<TopologySource> findByEnabledTrue();
}
