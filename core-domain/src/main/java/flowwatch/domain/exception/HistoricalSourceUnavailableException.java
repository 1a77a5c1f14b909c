package flowwatch.domain.exception;

import lombok.Getter;

/**
 * No hay baseline guardado y el archivo histórico no se pudo obtener o no tiene datos válidos.
 */
@Getter
public class HistoricalSourceUnavailableException extends GaugeBusinessException {

    private final String siteId;

    public HistoricalSourceUnavailableException(String siteId, String message) {
        super("Historical archive unavailable for site " + siteId + ": " + message);
        this.siteId = siteId;
    }

    public HistoricalSourceUnavailableException(String siteId, String message, Throwable cause) {
        super("Historical archive unavailable for site " + siteId + ": " + message, cause);
        this.siteId = siteId;
    }
}
