package flowwatch.analysis;

import flowwatch.config.PipelineConfig;
import flowwatch.domain.baseline.BaselineEntry;
import flowwatch.domain.baseline.HistoricalBaselineTable;
import flowwatch.domain.exception.HistoricalSourceUnavailableException;
import flowwatch.domain.gauge.Reading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HistoricalBaselineCalculatorTest {

    private static final String SITE = "02035000";
    private static final ZoneId EASTERN = ZoneId.of("America/New_York");
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final HistoricalBaselineCalculator calculator =
            new HistoricalBaselineCalculator(PipelineConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static Reading daily(int year, int month, int day, Double flow) {
        return new Reading(SITE, LocalDate.of(year, month, day).atStartOfDay(EASTERN).toOffsetDateTime(), flow);
    }

    private static double p90Of(HistoricalBaselineTable table, int dayOfYear) {
        return table.entries().stream()
                .filter(e -> e.dayOfYear() == dayOfYear)
                .findFirst()
                .map(BaselineEntry::p90Flow)
                .orElseThrow();
    }

    @Test
    @DisplayName("El P90 de un día del año agrupa ese día de todos los años")
    void compute_shouldGroupByDayOfYearAcrossYears() {
        List<Reading> archive = List.of(
                daily(2001, 1, 10, 5.0),
                daily(2002, 1, 10, 10.0),
                daily(2003, 1, 10, 15.0),
                daily(2005, 1, 10, 20.0),
                daily(2006, 1, 10, 90.0),
                daily(2006, 1, 11, 7.0));

        HistoricalBaselineTable table = calculator.compute(SITE, archive);

        assertThat(p90Of(table, 10)).isCloseTo(62.0, within(1e-9));
        assertThat(p90Of(table, 11)).isEqualTo(7.0);
        assertThat(table.sampleYears()).isEqualTo(5);
        assertThat(table.computedAt()).isEqualTo(NOW);
        assertThat(table.siteId()).isEqualTo(SITE);
    }

    @Test
    @DisplayName("Las muestras subdiarias se reducen al máximo del día local")
    void compute_shouldAggregateSubDailySamplesToDailyMax() {
        OffsetDateTime morning = OffsetDateTime.of(2010, 5, 1, 8, 0, 0, 0, ZoneOffset.ofHours(-4));
        List<Reading> archive = List.of(
                new Reading(SITE, morning, 3.0),
                new Reading(SITE, morning.plusHours(6), 9.0),
                new Reading(SITE, morning.plusHours(10), 4.0));

        HistoricalBaselineTable table = calculator.compute(SITE, archive);

        assertThat(table.entries()).containsExactly(new BaselineEntry(121, 9.0));
    }

    @Test
    @DisplayName("El día se toma en hora local: 03:30Z del 2 de enero es el 1 de enero en Virginia")
    void compute_shouldLocalizeBeforeExtractingDay() {
        OffsetDateTime utc = OffsetDateTime.of(2015, 1, 2, 3, 30, 0, 0, ZoneOffset.UTC);

        HistoricalBaselineTable table = calculator.compute(SITE, List.of(new Reading(SITE, utc, 12.0)));

        assertThat(table.entries()).containsExactly(new BaselineEntry(1, 12.0));
    }

    @Test
    @DisplayName("El día 366 solo recibe muestras de años bisiestos")
    void compute_shouldPopulateDay366OnlyFromLeapYears() {
        List<Reading> archive = List.of(
                daily(2019, 12, 31, 100.0),
                daily(2020, 12, 31, 40.0),
                daily(2021, 12, 31, 200.0));

        HistoricalBaselineTable table = calculator.compute(SITE, archive);

        assertThat(p90Of(table, 366)).isEqualTo(40.0);
        // 2019 y 2021: el 31 de diciembre es el día 365
        assertThat(p90Of(table, 365)).isCloseTo(190.0, within(1e-9));
    }

    @Test
    @DisplayName("Un día con pocas muestras se calcula igualmente y no tumba la tabla")
    void compute_shouldKeepSparseBuckets() {
        HistoricalBaselineTable table = calculator.compute(SITE, List.of(daily(2012, 7, 4, 33.0)));

        assertThat(table.entries()).hasSize(1);
        assertThat(table.entries().get(0).p90Flow()).isEqualTo(33.0);
    }

    @Test
    @DisplayName("Un archivo sin caudales válidos no produce tabla")
    void compute_shouldFailWhenArchiveHasNoValidFlows() {
        List<Reading> archive = List.of(daily(2012, 7, 4, null), daily(2012, 7, 5, null));

        assertThatThrownBy(() -> calculator.compute(SITE, archive))
                .isInstanceOf(HistoricalSourceUnavailableException.class)
                .hasMessageContaining(SITE);
        assertThatThrownBy(() -> calculator.compute(SITE, new ArrayList<>()))
                .isInstanceOf(HistoricalSourceUnavailableException.class);
    }

    @Test
    @DisplayName("Con fillMissingDays se completan los días 1..365 por interpolación lineal")
    void compute_shouldFillMissingDaysWhenEnabled() {
        HistoricalBaselineCalculator filling = new HistoricalBaselineCalculator(
                PipelineConfig.defaults().withFillMissingDays(true), Clock.fixed(NOW, ZoneOffset.UTC));
        List<Reading> archive = List.of(
                daily(2011, 1, 10, 10.0),   // día 10
                daily(2011, 1, 20, 30.0));  // día 20

        HistoricalBaselineTable table = filling.compute(SITE, archive);

        assertThat(table.entries()).hasSize(365);
        assertThat(p90Of(table, 1)).isEqualTo(10.0);
        assertThat(p90Of(table, 15)).isCloseTo(20.0, within(1e-9));
        assertThat(p90Of(table, 365)).isEqualTo(30.0);
        assertThat(table.entries()).noneMatch(e -> e.dayOfYear() == 366);
    }

    @Test
    @DisplayName("El relleno ignora el día 366 como punto de apoyo")
    void fillMissingDays_shouldNotUseLeapDayAsAnchor() {
        TreeMap<Integer, Double> p90ByDay = new TreeMap<>(Map.of(100, 5.0, 366, 500.0));

        HistoricalBaselineCalculator.fillMissingDays(p90ByDay);

        assertThat(p90ByDay.get(365)).isEqualTo(5.0);
        assertThat(p90ByDay.get(366)).isEqualTo(500.0);
    }
}
