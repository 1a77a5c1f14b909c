package flowwatch.domain.exception;

import lombok.Getter;

/**
 * Se pidió una estación que nunca se ha ingerido.
 */
@Getter
public class UnknownSiteException extends GaugeBusinessException {

    private final String siteId;

    public UnknownSiteException(String siteId) {
        super("Site " + siteId + " has never been ingested");
        this.siteId = siteId;
    }
}
