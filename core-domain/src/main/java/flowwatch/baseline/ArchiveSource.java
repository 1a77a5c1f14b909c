package flowwatch.baseline;

import flowwatch.domain.exception.HistoricalSourceUnavailableException;
import flowwatch.domain.gauge.Reading;

import java.util.List;

/**
 * Origen del archivo histórico multianual de una estación.
 */
@FunctionalInterface
public interface ArchiveSource {

    /**
     * @throws HistoricalSourceUnavailableException si el archivo no se puede obtener
     */
    List<Reading> fetchArchive(String siteId);
}
