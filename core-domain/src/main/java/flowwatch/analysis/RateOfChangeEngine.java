package flowwatch.analysis;

import flowwatch.config.PipelineConfig;
import flowwatch.domain.exception.EmptyWindowException;
import flowwatch.domain.gauge.Reading;
import flowwatch.domain.gauge.RocResult;
import flowwatch.domain.gauge.RocStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Calcula la tasa de cambio porcentual de una estación entre su lectura más
 * reciente y la lectura más cercana a {@code latest - targetLag}.
 * <p>
 * No es una búsqueda exacta del desfase: las estaciones reportan con
 * cadencias irregulares (5 a 60 minutos, huecos, retransmisiones), así que se
 * busca el vecino más cercano dentro de una ventana de tolerancia.
 * <p>
 * Desempates:
 * <ul>
 *     <li>Lectura más reciente con instantes repetidos: la primera vista.</li>
 *     <li>Candidatos a igual distancia del objetivo: el de instante anterior
 *     y, si el instante coincide, el primero visto.</li>
 * </ul>
 * Las lecturas sin caudal no son candidatas. Un porcentaje que no sea finito
 * (referencia cero o tan pequeña que la división desborda) nunca sale como OK.
 */
@Slf4j
public class RateOfChangeEngine {

    public static final Duration DEFAULT_TARGET_LAG = Duration.ofHours(3);
    public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(30);

    private final Duration targetLag;
    private final Duration tolerance;

    public RateOfChangeEngine() {
        this(DEFAULT_TARGET_LAG, DEFAULT_TOLERANCE);
    }

    public RateOfChangeEngine(PipelineConfig config) {
        this(config.getTargetLag(), config.getTolerance());
    }

    public RateOfChangeEngine(Duration targetLag, Duration tolerance) {
        if (targetLag == null || targetLag.isNegative() || targetLag.isZero()) {
            throw new IllegalArgumentException("targetLag must be positive");
        }
        if (tolerance == null || tolerance.isNegative()) {
            throw new IllegalArgumentException("tolerance must be non-negative");
        }
        this.targetLag = targetLag;
        this.tolerance = tolerance;
    }

    /**
     * @param window lecturas de una sola estación, en cualquier orden
     * @throws EmptyWindowException si la ventana está vacía
     */
    public RocResult compute(List<Reading> window) {
        if (window == null || window.isEmpty()) {
            throw new EmptyWindowException();
        }

        Reading latest = findLatest(window);
        Instant target = latest.instant().minus(targetLag);
        Reading candidate = findNearest(window, latest, target);

        RocResult.RocResultBuilder result = RocResult.builder()
                .siteId(latest.siteId())
                .targetLag(targetLag)
                .latestTimestamp(latest.timestamp())
                .latestFlow(latest.flow());

        if (candidate == null) {
            return result.status(RocStatus.NO_EARLIER_READING).build();
        }

        result.lagTimestamp(candidate.timestamp()).lagFlow(candidate.flow());

        if (!latest.hasFlow()) {
            return result.status(RocStatus.MISSING_LATEST_FLOW).build();
        }
        if (candidate.flow() == 0.0) {
            log.debug("Site {}: lag reading at {} has zero flow, rate of change undefined",
                    latest.siteId(), candidate.timestamp());
            return result.status(RocStatus.ZERO_BASELINE).build();
        }

        double pctChange = (latest.flow() - candidate.flow()) / candidate.flow() * 100.0;
        if (!Double.isFinite(pctChange)) {
            log.debug("Site {}: lag flow {} at {} too small, rate of change overflows",
                    latest.siteId(), candidate.flow(), candidate.timestamp());
            return result.status(RocStatus.ZERO_BASELINE).build();
        }
        return result.pctChange(pctChange).status(RocStatus.OK).build();
    }

    /**
     * Mismo motor y misma tolerancia con otro desfase objetivo.
     */
    public RateOfChangeEngine withTargetLag(Duration lag) {
        return new RateOfChangeEngine(lag, tolerance);
    }

    public Duration getTargetLag() {
        return targetLag;
    }

    public Duration getTolerance() {
        return tolerance;
    }

    private Reading findLatest(List<Reading> window) {
        Reading latest = window.get(0);
        for (int i = 1; i < window.size(); i++) {
            Reading reading = window.get(i);
            // Estrictamente posterior: con empate se queda la primera vista
            if (reading.instant().isAfter(latest.instant())) {
                latest = reading;
            }
        }
        return latest;
    }

    private Reading findNearest(List<Reading> window, Reading latest, Instant target) {
        Reading best = null;
        Duration bestDistance = null;

        for (Reading reading : window) {
            if (reading == latest || !reading.hasFlow() || !reading.instant().isBefore(latest.instant())) {
                continue;
            }
            Duration distance = Duration.between(target, reading.instant()).abs();
            if (distance.compareTo(tolerance) > 0) {
                continue;
            }
            if (best == null
                    || distance.compareTo(bestDistance) < 0
                    || (distance.equals(bestDistance) && reading.instant().isBefore(best.instant()))) {
                best = reading;
                bestDistance = distance;
            }
        }
        return best;
    }
}
