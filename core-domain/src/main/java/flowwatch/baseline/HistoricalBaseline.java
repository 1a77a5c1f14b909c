package flowwatch.baseline;

import flowwatch.analysis.HistoricalBaselineCalculator;
import flowwatch.domain.baseline.HistoricalBaselineTable;
import flowwatch.domain.exception.HistoricalSourceUnavailableException;
import flowwatch.domain.gauge.Reading;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Punto de acceso a los baselines históricos por estación.
 * <p>
 * Si la estación ya tiene tabla guardada se devuelve tal cual, sin volver a
 * pedir el archivo ni recalcular: aceptamos que el baseline envejezca a cambio
 * de no repetir consultas históricas largas. Solo se regenera tras
 * {@link #invalidate(String)}.
 * <p>
 * Dentro del proceso la creación se serializa por estación; entre procesos la
 * garantiza {@link BaselineRepository#createIfAbsent}.
 */
@Slf4j
@RequiredArgsConstructor
public class HistoricalBaseline {

    private final BaselineRepository repository;
    private final HistoricalBaselineCalculator calculator;
    private final ConcurrentMap<String, Object> creationLocks = new ConcurrentHashMap<>();

    /**
     * @throws HistoricalSourceUnavailableException si no hay tabla y el archivo no se puede obtener
     */
    public HistoricalBaselineTable ensure(String siteId, ArchiveSource source) {
        Optional<HistoricalBaselineTable> cached = cached(siteId);
        if (cached.isPresent()) {
            return cached.get();
        }

        synchronized (creationLocks.computeIfAbsent(siteId, k -> new Object())) {
            cached = cached(siteId);
            if (cached.isPresent()) {
                return cached.get();
            }

            log.info("No baseline stored for site {}, fetching historical archive", siteId);
            List<Reading> archive = source.fetchArchive(siteId);
            HistoricalBaselineTable computed = calculator.compute(siteId, archive);
            return repository.createIfAbsent(computed);
        }
    }

    public Optional<HistoricalBaselineTable> find(String siteId) {
        return repository.read(siteId);
    }

    /**
     * Borra la tabla guardada; la siguiente llamada a {@link #ensure} la recalcula.
     */
    public boolean invalidate(String siteId) {
        boolean deleted = repository.delete(siteId);
        if (deleted) {
            log.info("Baseline for site {} invalidated", siteId);
        }
        return deleted;
    }

    private Optional<HistoricalBaselineTable> cached(String siteId) {
        if (!repository.exists(siteId)) {
            return Optional.empty();
        }
        // Puede haberse borrado entre exists y read
        return repository.read(siteId);
    }
}
