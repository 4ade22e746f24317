package com.meshnet.linkwatch.service.topology;

import com.meshnet.linkwatch.config.LinkwatchProperties;
import com.meshnet.linkwatch.model.TopologySource;
import com.meshnet.linkwatch.repository.TopologySourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Registers the topology sources declared under {@code linkwatch.topology.sources}
 * on startup. A declared source replaces a stored one with the same id.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TopologySourceInitializer implements CommandLineRunner {

    private final LinkwatchProperties properties;
    private final TopologySourceRepository topologySourceRepository;

    @Override
    public void run(String... args) {
        for (LinkwatchProperties.Source declared : properties.getTopology().getSources()) {
            TopologySource source = TopologySource.builder()
                    .id(declared.getId())
                    .name(declared.getName() != null ? declared.getName() : declared.getId())
                    .url(declared.getUrl())
                    .protocol(declared.getProtocol())
                    .version(declared.getVersion())
                    .metric(declared.getMetric())
                    .enabled(declared.isEnabled())
                    .build();
            topologySourceRepository.save(source);
            log.info("Registered topology source {} ({})", source.getId(), source.getUrl());
        }
    }
}
