package flowwatch.domain.exception;

/**
 * Fallo sistémico de una ejecución completa. El dataset anterior queda intacto.
 */
public class PipelineRunException extends GaugeBusinessException {

    public PipelineRunException(String message) {
        super(message);
    }

    public PipelineRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
