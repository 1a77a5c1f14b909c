package flowwatch.domain.gauge;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.With;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Lectura de caudal de una estación de aforo.
 * <p>
 * El caudal es nulo cuando el origen marca el dato como ausente.
 *
 * @param siteId    identificador USGS de la estación (dígitos decimales)
 * @param timestamp instante de la medición, con su desplazamiento horario original
 * @param flow      caudal en cfs, mayor o igual que cero, o nulo
 */
@Builder
@With
public record Reading(
        String siteId,
        OffsetDateTime timestamp,
        Double flow
) {
    public Reading {
        Objects.requireNonNull(siteId, "siteId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (flow != null && (flow.isNaN() || flow.isInfinite() || flow < 0)) {
            throw new IllegalArgumentException("Invalid flow " + flow + " for site " + siteId + " at " + timestamp);
        }
    }

    @JsonIgnore
    public Instant instant() {
        return timestamp.toInstant();
    }

    @JsonIgnore
    public boolean hasFlow() {
        return flow != null;
    }
}
