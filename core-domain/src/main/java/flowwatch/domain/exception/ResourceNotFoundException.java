package flowwatch.domain.exception;

public class ResourceNotFoundException extends GaugeBusinessException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
