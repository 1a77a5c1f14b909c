package flowwatch.analysis;

import flowwatch.config.PipelineConfig;
import flowwatch.domain.baseline.HistoricalBaselineTable;
import flowwatch.domain.exception.EmptyWindowException;
import flowwatch.domain.exception.UnknownSiteException;
import flowwatch.domain.gauge.GaugeSite;
import flowwatch.domain.gauge.ProcessedDataset;
import flowwatch.domain.gauge.ProcessedRow;
import flowwatch.domain.gauge.Reading;
import flowwatch.domain.gauge.RocResult;
import flowwatch.store.ReadingStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Une la tasa de cambio de cada estación con su P90 histórico del día.
 * <p>
 * El día del año se toma del calendario local de la estación: una marca UTC
 * cerca de medianoche puede caer en otro día local. Las estaciones sin
 * lecturas no generan fila. Las filas salen ordenadas por estación.
 * <p>
 * La tasa de cambio principal usa el motor recibido; las de desfase corto y
 * largo, el mismo motor con {@link PipelineConfig#getShortLag()} y
 * {@link PipelineConfig#getLongLag()}.
 */
@Slf4j
public class ProcessedDatasetBuilder {

    private final ReadingStore store;
    private final RateOfChangeEngine engine;
    private final RateOfChangeEngine shortLagEngine;
    private final RateOfChangeEngine longLagEngine;
    private final Function<String, Optional<HistoricalBaselineTable>> baselines;
    private final PipelineConfig config;

    public ProcessedDatasetBuilder(ReadingStore store,
                                   RateOfChangeEngine engine,
                                   Function<String, Optional<HistoricalBaselineTable>> baselines,
                                   PipelineConfig config) {
        this.store = store;
        this.engine = engine;
        this.shortLagEngine = engine.withTargetLag(config.getShortLag());
        this.longLagEngine = engine.withTargetLag(config.getLongLag());
        this.baselines = baselines;
        this.config = config;
    }

    public ProcessedDataset buildDataset(Collection<String> siteIds) {
        return new ProcessedDataset(build(siteIds));
    }

    public List<ProcessedRow> build(Collection<String> siteIds) {
        List<ProcessedRow> rows = new ArrayList<>();
        for (String siteId : new TreeSet<>(siteIds)) {
            try {
                rows.add(buildRow(siteId));
            } catch (UnknownSiteException e) {
                log.warn("Skipping site {}: never ingested", siteId);
            } catch (EmptyWindowException e) {
                log.info("Skipping site {}: no readings in window", siteId);
            }
        }
        return rows;
    }

    private ProcessedRow buildRow(String siteId) {
        List<Reading> window = store.window(siteId);
        if (window.isEmpty()) {
            throw new EmptyWindowException(siteId);
        }
        RocResult roc = engine.compute(window);
        RocResult shortRoc = shortLagEngine.compute(window);
        RocResult longRoc = longLagEngine.compute(window);

        int dayOfYear = roc.latestTimestamp()
                .atZoneSameInstant(config.zoneFor(siteId))
                .getDayOfYear();
        Double p90 = lookupP90(siteId, dayOfYear);
        Double ratio = ratio(roc.latestFlow(), p90);
        Optional<GaugeSite> site = store.site(siteId);

        return ProcessedRow.builder()
                .siteId(siteId)
                .siteName(site.map(GaugeSite::siteName).orElse(null))
                .latitude(site.map(GaugeSite::latitude).orElse(null))
                .longitude(site.map(GaugeSite::longitude).orElse(null))
                .latestTimestamp(roc.latestTimestamp())
                .latestFlow(roc.latestFlow())
                .pctChange1h(shortRoc.pctChange())
                .rocStatus1h(shortRoc.status())
                .pctChange3h(roc.pctChange())
                .pctChange6h(longRoc.pctChange())
                .rocStatus6h(longRoc.status())
                .p90Flow(p90)
                .ratio(ratio)
                .highFlow(ratio != null && ratio >= config.getHighFlowRatio())
                .rocStatus(roc.status())
                .build();
    }

    private Double lookupP90(String siteId, int dayOfYear) {
        try {
            return baselines.apply(siteId)
                    .flatMap(table -> table.p90For(dayOfYear, config.getLeapDayPolicy()))
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Baseline lookup failed for site {} (day {}), p90 left empty", siteId, dayOfYear, e);
            return null;
        }
    }

    private static Double ratio(Double latestFlow, Double p90) {
        if (latestFlow == null || p90 == null || p90 == 0.0) {
            return null;
        }
        return latestFlow / p90;
    }
}
