package com.meshnet.linkwatch.service.topology;

import com.meshnet.linkwatch.exception.TopologyFetchException;
import com.meshnet.linkwatch.model.TopologySource;

/**
 * Retrieves the raw topology document of a source.
 */
public interface TopologyFetcher {

    /**
     * @throws TopologyFetchException when the document cannot be retrieved in time
     */
    String fetch(TopologySource source);
}
