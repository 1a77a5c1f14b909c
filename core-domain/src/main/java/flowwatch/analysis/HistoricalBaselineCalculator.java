package flowwatch.analysis;

import flowwatch.config.PipelineConfig;
import flowwatch.domain.baseline.BaselineEntry;
import flowwatch.domain.baseline.HistoricalBaselineTable;
import flowwatch.domain.exception.HistoricalSourceUnavailableException;
import flowwatch.domain.gauge.Reading;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Construye el baseline histórico (P90 por día del año) de una estación a
 * partir de su archivo multianual.
 * <p>
 * Pasos:
 * <ol>
 *     <li>Cada muestra se localiza en la zona horaria de la estación.</li>
 *     <li>Las muestras subdiarias se agregan al máximo de su día local.</li>
 *     <li>Los días se agrupan por día del año a través de todos los años.
 *     El día 366 solo recibe muestras de años bisiestos.</li>
 *     <li>Cada grupo se reduce con {@link PercentileCalculator}.</li>
 * </ol>
 * Un grupo escaso se calcula igualmente con lo que haya.
 */
@Slf4j
public class HistoricalBaselineCalculator {

    private final PipelineConfig config;
    private final Clock clock;

    public HistoricalBaselineCalculator(PipelineConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws HistoricalSourceUnavailableException si el archivo no contiene ningún caudal válido
     */
    public HistoricalBaselineTable compute(String siteId, Collection<Reading> archive) {
        ZoneId zone = config.zoneFor(siteId);

        Map<LocalDate, Double> dailyMax = new TreeMap<>();
        for (Reading reading : archive) {
            if (!reading.hasFlow()) {
                continue;
            }
            LocalDate localDate = reading.timestamp().atZoneSameInstant(zone).toLocalDate();
            dailyMax.merge(localDate, reading.flow(), Math::max);
        }

        if (dailyMax.isEmpty()) {
            throw new HistoricalSourceUnavailableException(siteId, "archive holds no valid discharge values");
        }

        Map<Integer, List<Double>> buckets = new TreeMap<>();
        for (Map.Entry<LocalDate, Double> day : dailyMax.entrySet()) {
            buckets.computeIfAbsent(day.getKey().getDayOfYear(), k -> new ArrayList<>()).add(day.getValue());
        }

        TreeMap<Integer, Double> p90ByDay = new TreeMap<>();
        int sparseBuckets = 0;
        for (Map.Entry<Integer, List<Double>> bucket : buckets.entrySet()) {
            if (bucket.getValue().size() < config.getMinSamplesPerDay()) {
                sparseBuckets++;
            }
            p90ByDay.put(bucket.getKey(), PercentileCalculator.percentile(bucket.getValue(), config.getPercentile()));
        }
        if (sparseBuckets > 0) {
            log.debug("Site {}: {} day-of-year buckets have fewer than {} samples",
                    siteId, sparseBuckets, config.getMinSamplesPerDay());
        }

        if (config.isFillMissingDays()) {
            fillMissingDays(p90ByDay);
        }

        int sampleYears = (int) dailyMax.keySet().stream().mapToInt(LocalDate::getYear).distinct().count();
        List<BaselineEntry> entries = p90ByDay.entrySet().stream()
                .map(e -> new BaselineEntry(e.getKey(), e.getValue()))
                .toList();

        log.info("Baseline computed for site {}: {} days of year from {} daily values over {} years",
                siteId, entries.size(), dailyMax.size(), sampleYears);

        return HistoricalBaselineTable.builder()
                .siteId(siteId)
                .computedAt(clock.instant())
                .sampleYears(sampleYears)
                .entries(entries)
                .build();
    }

    /**
     * Rellena los días 1..365 ausentes: interpolación lineal entre los días
     * conocidos más cercanos y, en los extremos, el valor conocido más próximo.
     * El día 366 nunca se inventa.
     */
    static void fillMissingDays(TreeMap<Integer, Double> p90ByDay) {
        TreeMap<Integer, Double> known = new TreeMap<>(p90ByDay);
        known.remove(366);
        if (known.isEmpty()) {
            return;
        }
        for (int day = 1; day <= 365; day++) {
            if (known.containsKey(day)) {
                continue;
            }
            Map.Entry<Integer, Double> before = known.lowerEntry(day);
            Map.Entry<Integer, Double> after = known.higherEntry(day);
            double value;
            if (before == null) {
                value = after.getValue();
            } else if (after == null) {
                value = before.getValue();
            } else {
                double fraction = (double) (day - before.getKey()) / (after.getKey() - before.getKey());
                value = before.getValue() + fraction * (after.getValue() - before.getValue());
            }
            p90ByDay.put(day, value);
        }
    }
}
