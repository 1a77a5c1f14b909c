package flowwatch.domain.exception;

/**
 * Raíz de los errores de negocio del pipeline de aforos.
 */
public class GaugeBusinessException extends RuntimeException {

    public GaugeBusinessException(String message) {
        super(message);
    }

    public GaugeBusinessException(String message, Throwable cause) {
        super(message, cause);
    }
}
