package flowwatch.store;

import flowwatch.config.PipelineConfig;
import flowwatch.domain.exception.UnknownSiteException;
import flowwatch.domain.gauge.GaugeSite;
import flowwatch.domain.gauge.Reading;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Almacén de ventanas deslizantes, una por estación.
 * <p>
 * Cada estación tiene su propia ventana y su propio cerrojo: ingerir en una
 * estación no toca a las demás. La poda se mide desde la lectura más reciente
 * de la estación, no desde el reloj, para que una reproducción sea determinista.
 */
@Slf4j
public class ReadingStore {

    private final Duration retentionHorizon;
    private final ConcurrentMap<String, RollingWindow> windows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, GaugeSite> sites = new ConcurrentHashMap<>();

    public ReadingStore(PipelineConfig config) {
        this(config.getRetentionHorizon());
    }

    public ReadingStore(Duration retentionHorizon) {
        if (retentionHorizon == null || retentionHorizon.isNegative()) {
            throw new IllegalArgumentException("retentionHorizon must be a non-negative duration");
        }
        this.retentionHorizon = retentionHorizon;
    }

    /**
     * Fusiona un lote en la ventana de la estación y poda lo que quede fuera del horizonte.
     *
     * @return lecturas nuevas aceptadas
     * @throws IllegalArgumentException si alguna lectura pertenece a otra estación
     */
    public int ingest(String siteId, Collection<Reading> batch) {
        Objects.requireNonNull(siteId, "siteId");
        Objects.requireNonNull(batch, "batch");
        for (Reading reading : batch) {
            if (!siteId.equals(reading.siteId())) {
                throw new IllegalArgumentException(
                        "Reading for site " + reading.siteId() + " cannot be ingested into site " + siteId);
            }
        }

        RollingWindow window = windows.computeIfAbsent(siteId, RollingWindow::new);
        int accepted = window.merge(batch, retentionHorizon);
        log.debug("Site {}: {} of {} readings accepted, window size {}",
                window.siteId(), accepted, batch.size(), window.size());
        return accepted;
    }

    /**
     * Devuelve una copia inmutable de la ventana actual, ya podada.
     *
     * @throws UnknownSiteException si la estación nunca se ha ingerido
     */
    public List<Reading> window(String siteId) {
        return requireWindow(siteId).snapshot();
    }

    /**
     * Vuelve a podar la ventana de una estación. Sobre una ventana ya podada no cambia nada.
     *
     * @return lecturas eliminadas
     */
    public int prune(String siteId) {
        return requireWindow(siteId).prune(retentionHorizon);
    }

    public SortedSet<String> sites() {
        return new TreeSet<>(windows.keySet());
    }

    /**
     * Instante de la lectura más reciente de todas las estaciones.
     */
    public Optional<OffsetDateTime> latestTimestamp() {
        return windows.values().stream()
                .map(RollingWindow::newest)
                .flatMap(Optional::stream)
                .map(Reading::timestamp)
                .max(Comparator.comparing(OffsetDateTime::toInstant));
    }

    public void describe(GaugeSite site) {
        Objects.requireNonNull(site.siteId(), "siteId");
        sites.put(site.siteId(), site);
    }

    public Optional<GaugeSite> site(String siteId) {
        return Optional.ofNullable(sites.get(siteId));
    }

    public Duration getRetentionHorizon() {
        return retentionHorizon;
    }

    private RollingWindow requireWindow(String siteId) {
        RollingWindow window = windows.get(siteId);
        if (window == null) {
            throw new UnknownSiteException(siteId);
        }
        return window;
    }
}
