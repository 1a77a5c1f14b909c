package flowwatch.domain.gauge;

import lombok.Builder;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Resultado de la tasa de cambio de una estación para un desfase concreto.
 * Se recalcula en cada ejecución.
 *
 * @param targetLag desfase objetivo con el que se buscó la lectura de referencia
 * @param pctChange variación porcentual respecto a la referencia; nula salvo con estado OK
 */
@Builder
public record RocResult(
        String siteId,
        OffsetDateTime latestTimestamp,
        Double latestFlow,
        OffsetDateTime lagTimestamp,
        Double lagFlow,
        Duration targetLag,
        Double pctChange,
        RocStatus status
) {}
