package flowwatch.domain.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Marcas de tiempo de las últimas ejecuciones completadas, de la más antigua a la más reciente.
 */
public record UpdateLogDTO(@JsonProperty("updates") List<Instant> updates) {

    public UpdateLogDTO {
        updates = updates == null ? List.of() : List.copyOf(updates);
    }
}
