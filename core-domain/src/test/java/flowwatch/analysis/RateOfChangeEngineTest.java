package flowwatch.analysis;

import flowwatch.domain.exception.EmptyWindowException;
import flowwatch.domain.gauge.Reading;
import flowwatch.domain.gauge.RocResult;
import flowwatch.domain.gauge.RocStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RateOfChangeEngineTest {

    private static final String SITE = "01646500";
    private static final OffsetDateTime T0 = OffsetDateTime.of(2024, 3, 15, 14, 0, 0, 0, ZoneOffset.UTC);

    private final RateOfChangeEngine engine = new RateOfChangeEngine();

    private static Reading reading(OffsetDateTime timestamp, Double flow) {
        return new Reading(SITE, timestamp, flow);
    }

    @Test
    @DisplayName("Lectura a 3h05m dentro de tolerancia: (10 - 8) / 8 * 100 = 25")
    void compute_shouldUseReadingWithinTolerance() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3).minusMinutes(5), 8.0),
                reading(T0, 10.0));

        RocResult result = engine.compute(window);

        assertThat(result.status()).isEqualTo(RocStatus.OK);
        assertThat(result.pctChange()).isEqualTo(25.0);
        assertThat(result.lagFlow()).isEqualTo(8.0);
        assertThat(result.lagTimestamp()).isEqualTo(T0.minusHours(3).minusMinutes(5));
        assertThat(result.latestTimestamp()).isEqualTo(T0);
        assertThat(result.siteId()).isEqualTo(SITE);
    }

    @Test
    @DisplayName("La lectura anterior más cercana a 3h45m queda fuera de tolerancia")
    void compute_shouldReportNoEarlierReadingOutsideTolerance() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3).minusMinutes(45), 8.0),
                reading(T0, 10.0));

        RocResult result = engine.compute(window);

        assertThat(result.status()).isEqualTo(RocStatus.NO_EARLIER_READING);
        assertThat(result.pctChange()).isNull();
        assertThat(result.lagTimestamp()).isNull();
        assertThat(result.lagFlow()).isNull();
    }

    @Test
    @DisplayName("Una ventana con una sola lectura no tiene referencia")
    void compute_shouldReportNoEarlierReadingForSingleReading() {
        RocResult result = engine.compute(List.of(reading(T0, 10.0)));

        assertThat(result.status()).isEqualTo(RocStatus.NO_EARLIER_READING);
        assertThat(result.latestFlow()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Caudal cero en la referencia: ZERO_BASELINE y sin porcentaje, nunca infinito")
    void compute_shouldGuardZeroBaseline() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3), 0.0),
                reading(T0, 10.0));

        RocResult result = engine.compute(window);

        assertThat(result.status()).isEqualTo(RocStatus.ZERO_BASELINE);
        assertThat(result.pctChange()).isNull();
        assertThat(result.lagFlow()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Se elige el candidato más cercano al objetivo, no el primero de la ventana")
    void compute_shouldPickNearestCandidate() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3).minusMinutes(25), 5.0),
                reading(T0.minusHours(3).plusMinutes(10), 8.0),
                reading(T0.minusHours(3).minusMinutes(5), 4.0),
                reading(T0, 10.0));

        RocResult result = engine.compute(window);

        assertThat(result.lagFlow()).isEqualTo(4.0);
        assertThat(result.pctChange()).isEqualTo(150.0);
    }

    @Test
    @DisplayName("A igual distancia gana el candidato de instante anterior")
    void compute_shouldPreferEarlierCandidateOnEqualDistance() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3).plusMinutes(10), 8.0),
                reading(T0.minusHours(3).minusMinutes(10), 5.0),
                reading(T0, 10.0));

        RocResult result = engine.compute(window);

        assertThat(result.lagTimestamp()).isEqualTo(T0.minusHours(3).minusMinutes(10));
        assertThat(result.pctChange()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Lecturas sin caudal no son candidatas")
    void compute_shouldSkipMissingFlowCandidates() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3).minusMinutes(20), 5.0),
                reading(T0.minusHours(3), null),
                reading(T0, 10.0));

        RocResult result = engine.compute(window);

        assertThat(result.lagFlow()).isEqualTo(5.0);
        assertThat(result.pctChange()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Con instantes repetidos en la más reciente gana la primera vista")
    void compute_shouldBreakLatestTiesByFirstSeen() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3), 10.0),
                reading(T0, 12.0),
                reading(T0.withOffsetSameInstant(ZoneOffset.ofHours(-5)), 50.0));

        RocResult result = engine.compute(window);

        assertThat(result.latestFlow()).isEqualTo(12.0);
        assertThat(result.pctChange()).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("Sin caudal en la lectura más reciente no se calcula porcentaje")
    void compute_shouldReportMissingLatestFlow() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3), 10.0),
                reading(T0, null));

        RocResult result = engine.compute(window);

        assertThat(result.status()).isEqualTo(RocStatus.MISSING_LATEST_FLOW);
        assertThat(result.pctChange()).isNull();
        assertThat(result.lagFlow()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Ventana vacía lanza EmptyWindowException")
    void compute_shouldFailOnEmptyWindow() {
        assertThatThrownBy(() -> engine.compute(List.of()))
                .isInstanceOf(EmptyWindowException.class);
    }

    @Test
    @DisplayName("Referencia positiva pero tan pequeña que el porcentaje desborda: ZERO_BASELINE, nunca infinito")
    void compute_shouldNeverReportInfinitePercentage() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3), Double.MIN_VALUE),
                reading(T0, 10.0));

        RocResult result = engine.compute(window);

        assertThat(result.status()).isEqualTo(RocStatus.ZERO_BASELINE);
        assertThat(result.pctChange()).isNull();
        assertThat(result.lagFlow()).isEqualTo(Double.MIN_VALUE);
    }

    @Test
    @DisplayName("El mismo motor con otro desfase busca la referencia a 1 h y a 6 h")
    void withTargetLag_shouldReuseToleranceWithAnotherLag() {
        List<Reading> window = List.of(
                reading(T0.minusHours(6).plusMinutes(10), 4.0),
                reading(T0.minusHours(3), 8.0),
                reading(T0.minusMinutes(55), 5.0),
                reading(T0, 10.0));

        RocResult oneHour = engine.withTargetLag(Duration.ofHours(1)).compute(window);
        RocResult sixHours = engine.withTargetLag(Duration.ofHours(6)).compute(window);

        assertThat(oneHour.targetLag()).isEqualTo(Duration.ofHours(1));
        assertThat(oneHour.lagFlow()).isEqualTo(5.0);
        assertThat(oneHour.pctChange()).isCloseTo(100.0, within(1e-9));
        assertThat(sixHours.lagTimestamp()).isEqualTo(T0.minusHours(6).plusMinutes(10));
        assertThat(sixHours.pctChange()).isCloseTo(150.0, within(1e-9));
        assertThat(engine.withTargetLag(Duration.ofHours(6)).getTolerance()).isEqualTo(engine.getTolerance());
    }

    @Test
    @DisplayName("Sin referencia cerca del desfase de 6 h el estado es propio de ese desfase")
    void withTargetLag_shouldReportStatusPerLag() {
        List<Reading> window = List.of(
                reading(T0.minusHours(3), 8.0),
                reading(T0, 10.0));

        assertThat(engine.compute(window).status()).isEqualTo(RocStatus.OK);
        assertThat(engine.withTargetLag(Duration.ofHours(6)).compute(window).status())
                .isEqualTo(RocStatus.NO_EARLIER_READING);
    }
}
