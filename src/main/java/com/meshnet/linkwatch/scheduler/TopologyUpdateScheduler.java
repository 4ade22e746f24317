package com.meshnet.linkwatch.scheduler;

import com.meshnet.linkwatch.dto.ReconciliationReport;
import com.meshnet.linkwatch.model.TopologySource;
import com.meshnet.linkwatch.repository.TopologySourceRepository;
import com.meshnet.linkwatch.service.topology.TopologyReconciler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Scheduled task reconciling every enabled topology source.
 * Sources are updated in parallel; the next tick starts only once all of them
 * are done. A failed source is logged and retried on the next tick.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "linkwatch.topology.update-enabled", havingValue = "true", matchIfMissing = true)
public class TopologyUpdateScheduler {

    private final TopologySourceRepository topologySourceRepository;
    private final TopologyReconciler topologyReconciler;
    private final Executor updateExecutor;

    public TopologyUpdateScheduler(TopologySourceRepository topologySourceRepository,
                                   TopologyReconciler topologyReconciler,
                                   @Qualifier("topologyUpdateExecutor") Executor updateExecutor) {
        this.topologySourceRepository = topologySourceRepository;
        this.topologyReconciler = topologyReconciler;
        this.updateExecutor = updateExecutor;
    }

    @Scheduled(initialDelay = 10_000, fixedDelayString = "${linkwatch.topology.update-interval-ms:300000}")
    public void updateTopologies() {
        List<TopologySource> sources = topologySourceRepository.findByEnabledTrue();
        if (sources.isEmpty()) {
            log.debug("No topology source to update");
            return;
        }
        log.debug("Updating {} topology sources...", sources.size());

        List<CompletableFuture<Optional<ReconciliationReport>>> runs = sources.stream()
                .map(source -> CompletableFuture.supplyAsync(() -> updateSource(source), updateExecutor))
                .toList();
        CompletableFuture.allOf(runs.toArray(new CompletableFuture[0])).join();

        long failed = runs.stream().map(CompletableFuture::join).filter(Optional::isEmpty).count();
        if (failed > 0) {
            log.warn("Topology update finished with {} of {} sources failed", failed, sources.size());
        }
    }

    Optional<ReconciliationReport> updateSource(TopologySource source) {
        try {
            return Optional.of(topologyReconciler.update(source));
        } catch (Exception e) {
            log.error("Topology update failed for {}: {}", source.getId(), e.getMessage(), e);
            return Optional.empty();
        }
    }
}
