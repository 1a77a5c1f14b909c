package flowwatch.store;

import flowwatch.domain.gauge.Reading;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Ventana deslizante de lecturas de una estación, ordenada por instante ascendente.
 * <p>
 * Solo se añade y se poda por la cabeza; nunca se reordena. Un instante ya
 * presente no se vuelve a insertar: gana la primera lectura vista.
 */
public final class RollingWindow {

    private final String siteId;
    private final List<Reading> readings = new ArrayList<>();

    RollingWindow(String siteId) {
        this.siteId = siteId;
    }

    public String siteId() {
        return siteId;
    }

    /**
     * Inserta el lote y poda lo que queda fuera del horizonte.
     *
     * @return número de lecturas nuevas aceptadas (los duplicados no cuentan)
     */
    synchronized int merge(Collection<Reading> batch, Duration horizon) {
        int accepted = 0;
        for (Reading reading : batch) {
            if (insert(reading)) {
                accepted++;
            }
        }
        prune(horizon);
        return accepted;
    }

    /**
     * Elimina las lecturas anteriores a {@code newest - horizon}. Una lectura
     * exactamente en el corte se conserva.
     *
     * @return número de lecturas eliminadas
     */
    synchronized int prune(Duration horizon) {
        if (readings.isEmpty()) {
            return 0;
        }
        Instant cutoff = readings.get(readings.size() - 1).instant().minus(horizon);
        int firstKept = lowerBound(cutoff);
        if (firstKept > 0) {
            readings.subList(0, firstKept).clear();
        }
        return firstKept;
    }

    synchronized List<Reading> snapshot() {
        return List.copyOf(readings);
    }

    synchronized Optional<Reading> newest() {
        return readings.isEmpty() ? Optional.empty() : Optional.of(readings.get(readings.size() - 1));
    }

    synchronized int size() {
        return readings.size();
    }

    private boolean insert(Reading reading) {
        Instant instant = reading.instant();
        int position = lowerBound(instant);
        if (position < readings.size() && readings.get(position).instant().equals(instant)) {
            return false;
        }
        readings.add(position, reading);
        return true;
    }

    // Primer índice cuyo instante es >= target.
    private int lowerBound(Instant target) {
        int low = 0;
        int high = readings.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (readings.get(mid).instant().isBefore(target)) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }
}
