package com.meshnet.linkwatch.service.topology;

import com.meshnet.linkwatch.dto.ReconciliationReport;
import com.meshnet.linkwatch.dto.netjson.NetworkGraph;
import com.meshnet.linkwatch.exception.AddressNotFoundException;
import com.meshnet.linkwatch.exception.InvalidAddressException;
import com.meshnet.linkwatch.exception.LinkValidationException;
import com.meshnet.linkwatch.exception.TopologyDecodeException;
import com.meshnet.linkwatch.exception.TopologyFetchException;
import com.meshnet.linkwatch.model.AddressKind;
import com.meshnet.linkwatch.model.Link;
import com.meshnet.linkwatch.model.LinkStatus;
import com.meshnet.linkwatch.model.TopologySource;
import com.meshnet.linkwatch.service.link.LinkResolver;
import com.meshnet.linkwatch.service.link.LinkStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Keeps the links of a topology source in line with the graph it publishes.
 *
 * Flow of {@link #update(TopologySource)}:
 * 1. Fetch and decode the document; a failure here aborts before any change
 * 2. Find or create the link of every edge, mark it active and store its weight
 * 3. Mark the source's active links missing from the document as disconnected
 *
 * Links are never deleted. Runs for the same source are serialised, runs for
 * different sources are independent.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TopologyReconciler {

    private final TopologyFetcher topologyFetcher;
    private final TopologyGraphCodec topologyGraphCodec;
    private final LinkResolver linkResolver;
    private final LinkStore linkStore;
    private final Clock clock;

    private final ConcurrentMap<String, ReentrantLock> sourceLocks = new ConcurrentHashMap<>();

    /**
     * @throws TopologyFetchException  when the document cannot be retrieved
     * @throws TopologyDecodeException when the document is not a network graph
     */
    public ReconciliationReport update(TopologySource source) {
        ReentrantLock lock = sourceLocks.computeIfAbsent(source.getId(), id -> new ReentrantLock());
        lock.lock();
        try {
            return reconcile(source);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Current state of the source as a NetJSON network graph.
     */
    public NetworkGraph export(TopologySource source) {
        return topologyGraphCodec.encode(source, linkStore.findByTopologySource(source.getId()));
    }

    private ReconciliationReport reconcile(TopologySource source) {
        LocalDateTime startedAt = LocalDateTime.now(clock);

        TopologyGraph graph = topologyGraphCodec.decode(topologyFetcher.fetch(source));
        log.info("Reconciling topology {}: {} nodes, {} links", source.getId(),
                graph.nodes().size(), graph.edges().size());

        ReconciliationReport report = ReconciliationReport.builder()
                .topologySourceId(source.getId())
                .startedAt(startedAt)
                .edges(graph.edges().size())
                .build();

        Set<String> known = linkStore.findByTopologySource(source.getId()).stream()
                .map(Link::getId)
                .collect(Collectors.toSet());
        Set<String> seen = new HashSet<>();

        // ========================= SEEN EDGES =========================

        for (TopologyEdge edge : graph.edges()) {
            try {
                Link link = linkResolver.findOrCreate(edge.source(), edge.target(), source);
                markSeen(link, edge, source, startedAt);
                linkStore.save(link);

                if (seen.add(link.getId())) {
                    if (known.contains(link.getId())) {
                        report.setRefreshed(report.getRefreshed() + 1);
                    } else {
                        report.setCreated(report.getCreated() + 1);
                    }
                }
            } catch (InvalidAddressException | AddressNotFoundException | LinkValidationException e) {
                log.warn("Skipping link {} -> {} of topology {}: {}",
                        edge.source(), edge.target(), source.getId(), e.getMessage());
                report.getSkippedEdges().add(ReconciliationReport.SkippedEdge.builder()
                        .source(edge.source())
                        .target(edge.target())
                        .reason(e.getMessage())
                        .build());
            }
        }

        // ========================= MISSING EDGES =========================

        for (Link link : linkStore.findByTopologySource(source.getId())) {
            if (seen.contains(link.getId()) || link.getStatus() != LinkStatus.ACTIVE) {
                continue;
            }
            link.setStatus(LinkStatus.DISCONNECTED);
            try {
                linkStore.save(link);
                report.setDisconnected(report.getDisconnected() + 1);
                log.debug("Link {} ({} <> {}) disconnected", link.getId(),
                        link.getData().getNodeAName(), link.getData().getNodeBName());
            } catch (LinkValidationException e) {
                log.warn("Could not disconnect link {} of topology {}: {}",
                        link.getId(), source.getId(), e.getMessage());
                report.getErrors().add(link.getId() + ": " + e.getMessage());
            }
        }

        report.setCompletedAt(LocalDateTime.now(clock));
        log.info("Topology {} reconciled: {} created, {} refreshed, {} disconnected, {} skipped",
                source.getId(), report.getCreated(), report.getRefreshed(),
                report.getDisconnected(), report.getSkippedEdges().size());
        return report;
    }

    private void markSeen(Link link, TopologyEdge edge, TopologySource source, LocalDateTime now) {
        link.setStatus(LinkStatus.ACTIVE);
        link.setMetricValue(edge.weight());
        AddressKind.classify(edge.source()).ifPresent(link::setAddressKind);
        if (link.getMetricType() == null && source.getMetric() != null) {
            link.setMetricType(source.getMetric().toLowerCase(Locale.ROOT));
        }
        if (link.getFirstSeen() == null) {
            link.setFirstSeen(now);
        }
        link.setLastSeen(now);
    }
}
