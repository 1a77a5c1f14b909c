package flowwatch.domain.baseline;

import flowwatch.config.PipelineConfig.LeapDayPolicy;
import lombok.Builder;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Baseline histórico de una estación: un P90 por día del año.
 * <p>
 * Se calcula una vez y se reutiliza sin cambios hasta que alguien lo borra.
 *
 * @param siteId      estación a la que pertenece
 * @param computedAt  momento del cálculo
 * @param sampleYears años distintos presentes en el archivo de origen
 * @param entries     pares ordenados por día del año, sin duplicados
 */
@Builder
public record HistoricalBaselineTable(
        String siteId,
        Instant computedAt,
        int sampleYears,
        List<BaselineEntry> entries
) {
    public HistoricalBaselineTable {
        List<BaselineEntry> sorted = entries == null ? List.of() : entries.stream()
                .sorted(Comparator.comparingInt(BaselineEntry::dayOfYear))
                .toList();
        Set<Integer> seen = new HashSet<>();
        for (BaselineEntry entry : sorted) {
            if (!seen.add(entry.dayOfYear())) {
                throw new IllegalArgumentException("Duplicate day of year " + entry.dayOfYear() + " for site " + siteId);
            }
        }
        entries = sorted;
    }

    /**
     * Busca el P90 de un día del año.
     * <p>
     * El día 366 solo existe si hubo muestras de años bisiestos. Con
     * {@link LeapDayPolicy#FALLBACK_TO_365} su ausencia se resuelve con el día 365.
     */
    public Optional<Double> p90For(int dayOfYear, LeapDayPolicy policy) {
        Optional<Double> direct = find(dayOfYear);
        if (direct.isEmpty() && dayOfYear == 366 && policy == LeapDayPolicy.FALLBACK_TO_365) {
            return find(365);
        }
        return direct;
    }

    private Optional<Double> find(int dayOfYear) {
        for (BaselineEntry entry : entries) {
            if (entry.dayOfYear() == dayOfYear) {
                return Optional.of(entry.p90Flow());
            }
        }
        return Optional.empty();
    }
}
