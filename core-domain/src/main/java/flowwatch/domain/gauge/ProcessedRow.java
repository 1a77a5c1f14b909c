package flowwatch.domain.gauge;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.OffsetDateTime;

/**
 * Fila del dataset procesado: una por estación y ejecución.
 * <p>
 * {@code pctChange3h} y {@code rocStatus} son la tasa de cambio principal; las
 * variantes a 1 h y 6 h se calculan con el mismo motor y llevan su propio estado.
 */
@Builder
public record ProcessedRow(
        String siteId,
        String siteName,
        Double latitude,
        Double longitude,
        OffsetDateTime latestTimestamp,
        Double latestFlow,
        @JsonProperty("pct_change_1h") Double pctChange1h,
        @JsonProperty("roc_status_1h") RocStatus rocStatus1h,
        @JsonProperty("pct_change_3h") Double pctChange3h,
        @JsonProperty("pct_change_6h") Double pctChange6h,
        @JsonProperty("roc_status_6h") RocStatus rocStatus6h,
        Double p90Flow,
        Double ratio,
        boolean highFlow,
        RocStatus rocStatus
) {}
