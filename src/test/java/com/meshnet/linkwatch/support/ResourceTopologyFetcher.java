package com.meshnet.linkwatch.support;

import com.meshnet.linkwatch.exception.TopologyFetchException;
import com.meshnet.linkwatch.model.TopologySource;
import com.meshnet.linkwatch.service.topology.TopologyFetcher;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Serves the source url as a classpath resource.
 */
public class ResourceTopologyFetcher implements TopologyFetcher {

    private int fetches;

    @Override
    public String fetch(TopologySource source) {
        fetches++;
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(source.getUrl())) {
            if (in == null) {
                throw new TopologyFetchException("No such resource: " + source.getUrl());
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TopologyFetchException("Could not read " + source.getUrl(), e);
        }
    }

    public int getFetches() {
        return fetches;
    }
}
