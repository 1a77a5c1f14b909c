package flowwatch.compute.service;

import flowwatch.analysis.ProcessedDatasetBuilder;
import flowwatch.baseline.HistoricalBaseline;
import flowwatch.compute.client.GaugeFeed;
import flowwatch.compute.client.UsgsWaterServicesClient;
import flowwatch.compute.repository.ProcessedDatasetRepository;
import flowwatch.compute.repository.UpdateLogRepository;
import flowwatch.domain.dto.PipelineRunReport;
import flowwatch.domain.dto.UpdateLogDTO;
import flowwatch.domain.exception.PipelineRunException;
import flowwatch.domain.exception.UpstreamFetchException;
import flowwatch.domain.gauge.ProcessedDataset;
import flowwatch.domain.gauge.ProcessedRow;
import flowwatch.domain.gauge.Reading;
import flowwatch.store.ReadingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Orquesta una ejecución completa del pipeline:
 * <ol>
 *   <li>Descarga incremental de lecturas instantáneas desde la última conocida.</li>
 *   <li>Ingesta en las ventanas deslizantes por estación.</li>
 *   <li>Baseline histórico de cada estación (solo se calcula la primera vez).</li>
 *   <li>Construcción y publicación atómica del dataset, y registro de la actualización.</li>
 * </ol>
 * Las ejecuciones están serializadas: una segunda llamada espera a que termine la primera.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GaugePipelineService {

    private final UsgsWaterServicesClient usgsClient;
    private final ReadingStore store;
    private final HistoricalBaseline historicalBaseline;
    private final ProcessedDatasetBuilder datasetBuilder;
    private final ProcessedDatasetRepository datasetRepository;
    private final UpdateLogRepository updateLogRepository;
    private final ExecutorService baselineExecutor;
    private final Clock clock;

    private final ReentrantLock runLock = new ReentrantLock();

    /**
     * @throws PipelineRunException si falla la descarga incremental, no sale ninguna fila
     *                              o no se puede escribir el dataset; el anterior queda intacto
     */
    public PipelineRunReport run() {
        runLock.lock();
        try {
            return runOnce();
        } finally {
            runLock.unlock();
        }
    }

    public ProcessedDataset currentDataset() {
        return datasetRepository.current();
    }

    public Optional<ProcessedRow> currentRow(String siteId) {
        return datasetRepository.current().rows().stream()
                .filter(row -> row.siteId().equals(siteId))
                .findFirst();
    }

    /**
     * Ventana deslizante actual de una estación, en orden ascendente.
     *
     * @throws flowwatch.domain.exception.UnknownSiteException si la estación nunca se ha ingerido
     */
    public List<Reading> readings(String siteId) {
        return store.window(siteId);
    }

    public UpdateLogDTO updates() {
        return updateLogRepository.read();
    }

    private PipelineRunReport runOnce() {
        Instant startedAt = clock.instant();
        OffsetDateTime end = OffsetDateTime.now(clock);
        OffsetDateTime start = store.latestTimestamp()
                .map(latest -> latest.plusSeconds(1))
                .orElse(end.minus(store.getRetentionHorizon()));
        log.info("=== Pipeline run started (window {} -> {}) ===", start, end);

        GaugeFeed feed;
        try {
            feed = usgsClient.fetchInstantaneous(start, end);
        } catch (UpstreamFetchException e) {
            log.error("Incremental fetch failed, keeping previous dataset: {}", e.getMessage());
            throw new PipelineRunException("Incremental fetch failed: " + e.getMessage(), e);
        }

        feed.sites().values().forEach(store::describe);
        int accepted = 0;
        for (Map.Entry<String, List<Reading>> entry : feed.readings().entrySet()) {
            accepted += store.ingest(entry.getKey(), entry.getValue());
        }
        log.info("Ingested {} new readings from {} sites", accepted, feed.readings().size());

        SortedSet<String> sites = store.sites();
        Map<String, String> baselineFailures = ensureBaselines(sites);

        ProcessedDataset dataset = datasetBuilder.buildDataset(sites);
        if (dataset.size() == 0) {
            throw new PipelineRunException("No site produced a row (" + sites.size() + " known sites)");
        }

        try {
            datasetRepository.publish(dataset);
        } catch (IOException e) {
            log.error("Could not write processed dataset", e);
            throw new PipelineRunException("Could not write processed dataset: " + e.getMessage(), e);
        }

        Instant finishedAt = clock.instant();
        try {
            updateLogRepository.append(finishedAt);
        } catch (IOException e) {
            log.warn("Dataset published but update log not written: {}", e.getMessage());
        }

        Set<String> withRow = dataset.rows().stream().map(ProcessedRow::siteId).collect(Collectors.toSet());
        List<String> skipped = sites.stream().filter(site -> !withRow.contains(site)).toList();

        log.info("=== Pipeline run finished: {} rows, {} skipped, {} without baseline ===",
                dataset.size(), skipped.size(), baselineFailures.size());

        return PipelineRunReport.builder()
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .sitesFetched(feed.readings().size())
                .readingsAccepted(accepted)
                .rowCount(dataset.size())
                .skippedSites(skipped)
                .baselineFailures(baselineFailures)
                .build();
    }

    /**
     * Asegura el baseline de cada estación en paralelo. El fallo de una estación
     * solo deja su P90 vacío.
     *
     * @return estación -> motivo del fallo
     */
    private Map<String, String> ensureBaselines(Set<String> sites) {
        Map<String, Future<?>> pending = new TreeMap<>();
        for (String siteId : sites) {
            pending.put(siteId, baselineExecutor.submit(() -> historicalBaseline.ensure(siteId, usgsClient)));
        }

        Map<String, String> failures = new TreeMap<>();
        List<String> interrupted = new ArrayList<>();
        for (Map.Entry<String, Future<?>> entry : pending.entrySet()) {
            try {
                entry.getValue().get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Baseline unavailable for site {}: {}", entry.getKey(), cause.getMessage());
                failures.put(entry.getKey(), String.valueOf(cause.getMessage()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted.add(entry.getKey());
            }
        }
        if (!interrupted.isEmpty()) {
            pending.values().forEach(future -> future.cancel(true));
            throw new PipelineRunException("Interrupted while computing baselines for " + interrupted);
        }
        return failures;
    }
}
