package flowwatch.compute.client;

import flowwatch.baseline.ArchiveSource;
import flowwatch.compute.config.FlowWatchProperties;
import flowwatch.config.PipelineConfig;
import flowwatch.domain.exception.HistoricalSourceUnavailableException;
import flowwatch.domain.exception.UpstreamFetchException;
import flowwatch.domain.gauge.Reading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cliente de USGS Water Services.
 * <ul>
 *   <li>IV (instantaneous values): lecturas recientes de todas las estaciones configuradas.</li>
 *   <li>DV (daily values): archivo histórico de una estación, descargado por tramos.</li>
 * </ul>
 * Todas las peticiones están acotadas por timeout.
 */
@Slf4j
@Component
public class UsgsWaterServicesClient implements ArchiveSource {

    static final DateTimeFormatter IV_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mmxxx");

    private final WebClient webClient;
    private final FlowWatchProperties.Usgs usgs;
    private final PipelineConfig config;
    private final UsgsResponseParser parser;

    public UsgsWaterServicesClient(@Qualifier("usgsWebClient") WebClient webClient,
                                   FlowWatchProperties properties,
                                   PipelineConfig config,
                                   UsgsResponseParser parser) {
        this.webClient = webClient;
        this.usgs = properties.getUsgs();
        this.config = config;
        this.parser = parser;
    }

    /**
     * Lecturas instantáneas entre {@code start} y {@code end}.
     *
     * @throws UpstreamFetchException si la petición falla, expira o la respuesta no se puede leer
     */
    public GaugeFeed fetchInstantaneous(OffsetDateTime start, OffsetDateTime end) {
        Map<String, String> params = baseParams();
        params.put("siteType", "ST");
        params.put("siteStatus", "active");
        if (usgs.getSites().isEmpty()) {
            params.put("stateCd", usgs.getStateCd());
        } else {
            params.put("sites", String.join(",", usgs.getSites()));
        }
        params.put("startDT", start.withOffsetSameInstant(ZoneOffset.UTC).format(IV_DATE_FORMAT));
        params.put("endDT", end.withOffsetSameInstant(ZoneOffset.UTC).format(IV_DATE_FORMAT));

        URI uri = buildUri(usgs.getIvUrl(), params);
        log.info("Fetching USGS instantaneous values {} -> {}", params.get("startDT"), params.get("endDT"));
        try {
            String body = get(uri, usgs.getIvTimeout());
            GaugeFeed feed = parser.parse(body, config::zoneFor);
            log.info("USGS IV returned {} readings for {} sites", feed.totalReadings(), feed.sites().size());
            return feed;
        } catch (RuntimeException e) {
            throw new UpstreamFetchException("USGS instantaneous fetch failed: " + e.getMessage(), e);
        }
    }

    /**
     * Archivo diario de los últimos {@code historyYears} años, en tramos de
     * {@code archiveChunkYears}. Cada tramo empieza el día siguiente al final del anterior.
     */
    @Override
    public List<Reading> fetchArchive(String siteId) {
        LocalDate today = LocalDate.now(config.zoneFor(siteId));
        LocalDate start = today.minusYears(config.getHistoryYears());
        List<Reading> archive = new ArrayList<>();

        while (!start.isAfter(today)) {
            LocalDate chunkEnd = start.plusYears(config.getArchiveChunkYears());
            if (chunkEnd.isAfter(today)) {
                chunkEnd = today;
            }

            Map<String, String> params = baseParams();
            params.put("sites", siteId);
            params.put("startDT", start.toString());
            params.put("endDT", chunkEnd.toString());

            log.debug("Site {}: fetching daily archive {} -> {}", siteId, start, chunkEnd);
            try {
                String body = get(buildUri(usgs.getDvUrl(), params), usgs.getDvTimeout());
                archive.addAll(parser.parse(body, config::zoneFor).readingsFor(siteId));
            } catch (RuntimeException e) {
                throw new HistoricalSourceUnavailableException(siteId,
                        "daily archive " + start + " -> " + chunkEnd + " failed: " + e.getMessage(), e);
            }
            start = chunkEnd.plusDays(1);
        }

        log.info("Site {}: fetched {} archive samples", siteId, archive.size());
        return archive;
    }

    private Map<String, String> baseParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("format", "json");
        params.put("parameterCd", usgs.getParameterCd());
        return params;
    }

    static URI buildUri(String baseUrl, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl);
        params.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
        return builder.encode().buildAndExpand(params).toUri();
    }

    private String get(URI uri, Duration timeout) {
        String body = webClient.get()
                .uri(uri)
                .retrieve()
                .bodyToMono(String.class)
                .block(timeout);
        if (body == null) {
            throw new IllegalStateException("Empty body from " + uri.getHost());
        }
        return body;
    }
}
