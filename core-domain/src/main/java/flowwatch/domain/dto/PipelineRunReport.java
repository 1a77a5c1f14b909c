package flowwatch.domain.dto;

import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Resumen de una ejecución del pipeline.
 *
 * @param skippedSites     estaciones conocidas que no produjeron fila
 * @param baselineFailures estación -> motivo, para las que quedaron sin P90 en esta ejecución
 */
@Builder
public record PipelineRunReport(
        Instant startedAt,
        Instant finishedAt,
        int sitesFetched,
        int readingsAccepted,
        int rowCount,
        List<String> skippedSites,
        Map<String, String> baselineFailures
) {}
