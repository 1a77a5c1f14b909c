package flowwatch.domain.exception;

/**
 * Fallo al leer el feed incremental del servicio de aforos.
 */
public class UpstreamFetchException extends GaugeBusinessException {

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
