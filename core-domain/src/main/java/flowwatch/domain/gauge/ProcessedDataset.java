package flowwatch.domain.gauge;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Dataset completo de una ejecución, ordenado por estación.
 * No lleva marcas de tiempo de ejecución: dos construcciones con la misma
 * entrada producen el mismo contenido.
 */
public record ProcessedDataset(@JsonProperty("rows") List<ProcessedRow> rows) {

    public ProcessedDataset {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public static ProcessedDataset empty() {
        return new ProcessedDataset(List.of());
    }

    public int size() {
        return rows.size();
    }
}
