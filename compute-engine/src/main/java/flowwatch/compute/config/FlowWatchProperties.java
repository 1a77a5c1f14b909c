package flowwatch.compute.config;

import flowwatch.config.PipelineConfig;
import flowwatch.config.PipelineConfig.LeapDayPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Propiedades {@code flowwatch.*} de application.yml.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "flowwatch")
public class FlowWatchProperties {

    private Usgs usgs = new Usgs();
    private Pipeline pipeline = new Pipeline();
    private Storage storage = new Storage();
    private Scheduler scheduler = new Scheduler();

    public PipelineConfig toPipelineConfig() {
        PipelineConfig.PipelineConfigBuilder builder = PipelineConfig.builder()
                .retentionHorizon(pipeline.getRetentionHorizon())
                .targetLag(pipeline.getTargetLag())
                .shortLag(pipeline.getShortLag())
                .longLag(pipeline.getLongLag())
                .tolerance(pipeline.getTolerance())
                .percentile(pipeline.getPercentile())
                .historyYears(pipeline.getHistoryYears())
                .archiveChunkYears(pipeline.getArchiveChunkYears())
                .minSamplesPerDay(pipeline.getMinSamplesPerDay())
                .fillMissingDays(pipeline.isFillMissingDays())
                .leapDayPolicy(pipeline.getLeapDayPolicy())
                .defaultZone(ZoneId.of(pipeline.getDefaultZone()))
                .highFlowRatio(pipeline.getHighFlowRatio())
                .workerCount(pipeline.getWorkerCount());
        pipeline.getSiteZones().forEach((site, zone) -> builder.siteZone(site, ZoneId.of(zone)));
        return builder.build();
    }

    @Getter
    @Setter
    public static class Usgs {
        private String ivUrl = "https://waterservices.usgs.gov/nwis/iv/";
        private String dvUrl = "https://waterservices.usgs.gov/nwis/dv/";
        /** Código de parámetro USGS: 00060 es caudal en cfs. */
        private String parameterCd = "00060";
        private String stateCd = "VA";
        /** Si no está vacía, se consulta esta lista de estaciones en lugar del estado completo. */
        private List<String> sites = new ArrayList<>();
        private Duration ivTimeout = Duration.ofSeconds(30);
        private Duration dvTimeout = Duration.ofSeconds(60);
        private int maxInMemoryMb = 64;
    }

    @Getter
    @Setter
    public static class Pipeline {
        private Duration retentionHorizon = Duration.ofHours(24);
        private Duration targetLag = Duration.ofHours(3);
        private Duration shortLag = Duration.ofHours(1);
        private Duration longLag = Duration.ofHours(6);
        private Duration tolerance = Duration.ofMinutes(30);
        private double percentile = 0.9;
        private int historyYears = 20;
        private int archiveChunkYears = 5;
        private int minSamplesPerDay = 5;
        private boolean fillMissingDays = false;
        private LeapDayPolicy leapDayPolicy = LeapDayPolicy.FALLBACK_TO_365;
        private String defaultZone = "America/New_York";
        private Map<String, String> siteZones = new LinkedHashMap<>();
        private double highFlowRatio = 1.0;
        private int workerCount = 4;
        private int updateLogSize = 100;
    }

    @Getter
    @Setter
    public static class Storage {
        private String dataDir = "data";
        private String datasetFile = "gauge_data_processed.json";
        private String baselineDir = "historical";
        private String updateLogFile = "update_log.json";
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = false;
        private long fixedDelayMs = 900_000;
        private long initialDelayMs = 10_000;
    }
}
