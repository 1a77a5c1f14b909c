package flowwatch.baseline;

import flowwatch.domain.baseline.HistoricalBaselineTable;

import java.util.Optional;

/**
 * Almacenamiento duradero de baselines, uno por estación.
 * <p>
 * Memoización sin caducidad: una tabla guardada solo desaparece con {@link #delete(String)}.
 */
public interface BaselineRepository {

    boolean exists(String siteId);

    Optional<HistoricalBaselineTable> read(String siteId);

    /**
     * Guarda la tabla si la estación no tiene ninguna. Con escritores
     * concurrentes gana el primero.
     *
     * @return la tabla que quedó guardada (la propia o la del escritor ganador)
     */
    HistoricalBaselineTable createIfAbsent(HistoricalBaselineTable table);

    /**
     * @return {@code true} si había una tabla y se borró
     */
    boolean delete(String siteId);
}
