package flowwatch.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.With;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;

/**
 * Contenedor principal para la configuración del pipeline de aforos.
 * Agrupa las ventanas temporales, la política del baseline histórico y la
 * zona horaria local de cada estación.
 */
@Value
@Builder
@With
public class PipelineConfig {

    /**
     * Horizonte de retención de la ventana deslizante, medido desde la lectura
     * más reciente de cada estación (nunca desde el reloj de pared).
     */
    @Builder.Default
    Duration retentionHorizon = Duration.ofHours(24);

    /**
     * Desfase objetivo para la tasa de cambio.
     */
    @Builder.Default
    Duration targetLag = Duration.ofHours(3);

    /**
     * Desfase corto adicional (tasa de cambio a 1 h). Usa la misma tolerancia.
     */
    @Builder.Default
    Duration shortLag = Duration.ofHours(1);

    /**
     * Desfase largo adicional (tasa de cambio a 6 h). Usa la misma tolerancia.
     */
    @Builder.Default
    Duration longLag = Duration.ofHours(6);

    /**
     * Desviación admitida respecto al desfase objetivo (+/-).
     */
    @Builder.Default
    Duration tolerance = Duration.ofMinutes(30);

    /**
     * Percentil del baseline histórico, en [0, 1].
     */
    @Builder.Default
    double percentile = 0.9;

    /**
     * Años de archivo histórico que se piden al origen.
     */
    @Builder.Default
    int historyYears = 20;

    /**
     * Tamaño de cada tramo de descarga del archivo histórico, en años.
     */
    @Builder.Default
    int archiveChunkYears = 5;

    /**
     * Por debajo de este número de muestras un día del año se considera escaso.
     * Se calcula igualmente, solo se deja constancia en el log.
     */
    @Builder.Default
    int minSamplesPerDay = 5;

    /**
     * Rellena los días 1..365 sin muestras interpolando entre días vecinos.
     */
    boolean fillMissingDays;

    @Builder.Default
    LeapDayPolicy leapDayPolicy = LeapDayPolicy.FALLBACK_TO_365;

    /**
     * Zona horaria local por defecto de las estaciones.
     */
    @Builder.Default
    ZoneId defaultZone = ZoneId.of("America/New_York");

    /**
     * Zonas horarias específicas por estación (siteId -> zona).
     */
    @Singular
    Map<String, ZoneId> siteZones;

    /**
     * Ratio caudal / P90 a partir del cual una estación se marca como de caudal alto.
     */
    @Builder.Default
    double highFlowRatio = 1.0;

    /**
     * Número de hilos para el cálculo de baselines en paralelo.
     */
    @Builder.Default
    int workerCount = 4;

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }

    public ZoneId zoneFor(String siteId) {
        return siteZones.getOrDefault(siteId, defaultZone);
    }

    /**
     * Política de consulta para el día 366 del año.
     */
    public enum LeapDayPolicy {
        /**
         * Si la tabla no tiene día 366 se usa el valor del día 365.
         */
        FALLBACK_TO_365,

        /**
         * El día 366 solo se resuelve con muestras de años bisiestos; si faltan, no hay valor.
         */
        STRICT
    }
}
