package com.meshnet.linkwatch.service.topology;

import com.meshnet.linkwatch.config.LinkwatchProperties;
import com.meshnet.linkwatch.exception.TopologyFetchException;
import com.meshnet.linkwatch.model.TopologySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Loads topology documents from {@code http(s)://} URLs, {@code file:} URLs or
 * plain filesystem paths. The whole load runs on the fetch executor and is
 * cancelled when it exceeds the configured timeout.
 */
@Component
@Slf4j
public class DefaultTopologyFetcher implements TopologyFetcher {

    private final RestTemplate restTemplate;
    private final AsyncTaskExecutor fetchExecutor;
    private final Duration fetchTimeout;

    @Autowired
    public DefaultTopologyFetcher(RestTemplateBuilder restTemplateBuilder,
                                  @Qualifier("topologyFetchExecutor") AsyncTaskExecutor fetchExecutor,
                                  LinkwatchProperties properties) {
        this(restTemplateBuilder
                        .setConnectTimeout(properties.getTopology().getConnectTimeout())
                        .setReadTimeout(properties.getTopology().getFetchTimeout())
                        .build(),
                fetchExecutor,
                properties.getTopology().getFetchTimeout());
    }

    public DefaultTopologyFetcher(RestTemplate restTemplate, AsyncTaskExecutor fetchExecutor, Duration fetchTimeout) {
        this.restTemplate = restTemplate;
        this.fetchExecutor = fetchExecutor;
        this.fetchTimeout = fetchTimeout;
    }

    @Override
    public String fetch(TopologySource source) {
        String location = source.getUrl();
        if (location == null || location.isBlank()) {
            throw new TopologyFetchException("Topology " + source.getId() + " has no url");
        }

        Future<String> future = fetchExecutor.submit(() -> load(location));
        try {
            String document = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Fetched topology {} from {} ({} chars)", source.getId(), location, document.length());
            return document;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TopologyFetchException("Timed out after " + fetchTimeout + " fetching " + location, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TopologyFetchException("Interrupted while fetching " + location, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TopologyFetchException fetchException) {
                throw fetchException;
            }
            throw new TopologyFetchException("Could not fetch " + location + ": " + cause.getMessage(), cause);
        }
    }

    private String load(String location) {
        if (location.startsWith("http://") || location.startsWith("https://")) {
            return loadHttp(location);
        }
        Path path = location.startsWith("file:") ? Path.of(URI.create(location)) : Path.of(location);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TopologyFetchException("Could not read " + path + ": " + e.getMessage(), e);
        }
    }

    private String loadHttp(String location) {
        try {
            String body = restTemplate.getForObject(URI.create(location), String.class);
            if (body == null) {
                throw new TopologyFetchException("Empty response from " + location);
            }
            return body;
        } catch (RestClientException e) {
            throw new TopologyFetchException("Request to " + location + " failed: " + e.getMessage(), e);
        }
    }
}
