package flowwatch.compute.client;

import flowwatch.domain.gauge.GaugeSite;
import flowwatch.domain.gauge.Reading;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lecturas y metadatos de estación devueltos por una consulta al servicio de aforos.
 * Ambos mapas van ordenados por identificador de estación.
 */
public record GaugeFeed(
        Map<String, GaugeSite> sites,
        Map<String, List<Reading>> readings
) {
    public GaugeFeed {
        sites = Collections.unmodifiableMap(new TreeMap<>(sites));
        readings = Collections.unmodifiableMap(new TreeMap<>(readings));
    }

    public static GaugeFeed empty() {
        return new GaugeFeed(Map.of(), Map.of());
    }

    public List<Reading> readingsFor(String siteId) {
        return readings.getOrDefault(siteId, List.of());
    }

    public int totalReadings() {
        return readings.values().stream().mapToInt(List::size).sum();
    }
}
