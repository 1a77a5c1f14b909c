package flowwatch.domain.exception;

import lombok.Getter;

/**
 * La ventana de la estación no contiene lecturas.
 */
@Getter
public class EmptyWindowException extends GaugeBusinessException {

    private final String siteId;

    public EmptyWindowException() {
        this(null);
    }

    public EmptyWindowException(String siteId) {
        super(siteId == null ? "Window holds no readings" : "Window for site " + siteId + " holds no readings");
        this.siteId = siteId;
    }
}
