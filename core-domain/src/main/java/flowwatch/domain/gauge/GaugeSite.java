package flowwatch.domain.gauge;

import lombok.Builder;
import lombok.With;

/**
 * Metadatos de una estación tal como los publica el servicio de aforos.
 */
@Builder
@With
public record GaugeSite(
        String siteId,
        String siteName,
        Double latitude,
        Double longitude
) {}
