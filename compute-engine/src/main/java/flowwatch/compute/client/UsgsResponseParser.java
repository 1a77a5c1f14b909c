package flowwatch.compute.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import flowwatch.domain.gauge.GaugeSite;
import flowwatch.domain.gauge.Reading;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Traduce la respuesta JSON (WaterML-JSON) de USGS Water Services a lecturas del dominio.
 * <p>
 * Estructura esperada:
 * <pre>
 * value.timeSeries[]
 *   .sourceInfo.siteCode[0].value         -> siteId
 *   .sourceInfo.siteName                  -> nombre
 *   .sourceInfo.geoLocation.geogLocation  -> latitude / longitude
 *   .values[].value[] {dateTime, value}   -> lecturas
 * </pre>
 * El feed instantáneo trae fechas con offset; el diario trae solo la fecha
 * local, que se ancla a la zona de la estación.
 */
@Slf4j
public class UsgsResponseParser {

    static final double MISSING_VALUE = -9999.0;

    private final ObjectMapper objectMapper;

    public UsgsResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param zoneForSite zona local de cada estación, para las fechas sin offset
     * @throws IllegalArgumentException si el cuerpo no es JSON válido
     */
    public GaugeFeed parse(String body, Function<String, ZoneId> zoneForSite) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed USGS response: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("Empty USGS response");
        }

        Map<String, GaugeSite> sites = new HashMap<>();
        Map<String, List<Reading>> readings = new HashMap<>();
        int missingValues = 0;

        for (JsonNode series : root.path("value").path("timeSeries")) {
            JsonNode sourceInfo = series.path("sourceInfo");
            String siteId = sourceInfo.path("siteCode").path(0).path("value").asText(null);
            if (siteId == null || siteId.isBlank()) {
                log.warn("Skipping USGS time series without site code");
                continue;
            }

            JsonNode geo = sourceInfo.path("geoLocation").path("geogLocation");
            sites.putIfAbsent(siteId, GaugeSite.builder()
                    .siteId(siteId)
                    .siteName(sourceInfo.path("siteName").asText(null))
                    .latitude(numberOrNull(geo.path("latitude")))
                    .longitude(numberOrNull(geo.path("longitude")))
                    .build());

            ZoneId zone = zoneForSite.apply(siteId);
            List<Reading> siteReadings = readings.computeIfAbsent(siteId, k -> new ArrayList<>());
            for (JsonNode block : series.path("values")) {
                for (JsonNode point : block.path("value")) {
                    OffsetDateTime timestamp = parseTimestamp(point.path("dateTime").asText(null), zone);
                    if (timestamp == null) {
                        log.debug("Site {}: skipping point with unreadable dateTime {}", siteId, point.path("dateTime"));
                        continue;
                    }
                    Double flow = parseFlow(point.path("value"));
                    if (flow == null) {
                        missingValues++;
                    }
                    siteReadings.add(new Reading(siteId, timestamp, flow));
                }
            }
        }

        if (missingValues > 0) {
            log.debug("USGS response carried {} missing or invalid values", missingValues);
        }
        return new GaugeFeed(sites, readings);
    }

    static OffsetDateTime parseTimestamp(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(text);
        } catch (DateTimeParseException withoutOffset) {
            try {
                return LocalDateTime.parse(text).atZone(zone).toOffsetDateTime();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }

    // -9999, "Ice", "Eqp", vacío, negativos o no numéricos -> dato ausente
    static Double parseFlow(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value == MISSING_VALUE || Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            return null;
        }
        return value;
    }

    private static Double numberOrNull(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
