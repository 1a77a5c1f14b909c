package flowwatch.compute.config;

import flowwatch.analysis.HistoricalBaselineCalculator;
import flowwatch.analysis.ProcessedDatasetBuilder;
import flowwatch.analysis.RateOfChangeEngine;
import flowwatch.baseline.BaselineRepository;
import flowwatch.baseline.HistoricalBaseline;
import flowwatch.baseline.JsonFileBaselineRepository;
import flowwatch.compute.client.UsgsResponseParser;
import flowwatch.compute.repository.ProcessedDatasetRepository;
import flowwatch.compute.repository.UpdateLogRepository;
import flowwatch.config.PipelineConfig;
import flowwatch.io.JsonFileHandler;
import flowwatch.store.ReadingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cableado de los componentes del dominio (core-domain no depende de Spring).
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(FlowWatchProperties.class)
public class PipelineBeans {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PipelineConfig pipelineConfig(FlowWatchProperties properties) {
        PipelineConfig config = properties.toPipelineConfig();
        log.info("Pipeline config: horizon={}, lag={}, tolerance={}, percentile={}, zone={}",
                config.getRetentionHorizon(), config.getTargetLag(), config.getTolerance(),
                config.getPercentile(), config.getDefaultZone());
        return config;
    }

    @Bean
    public JsonFileHandler jsonFileHandler() {
        return new JsonFileHandler();
    }

    @Bean
    public ReadingStore readingStore(PipelineConfig config) {
        return new ReadingStore(config);
    }

    @Bean
    public RateOfChangeEngine rateOfChangeEngine(PipelineConfig config) {
        return new RateOfChangeEngine(config);
    }

    @Bean
    public HistoricalBaselineCalculator historicalBaselineCalculator(PipelineConfig config, Clock clock) {
        return new HistoricalBaselineCalculator(config, clock);
    }

    @Bean
    public BaselineRepository baselineRepository(FlowWatchProperties properties, JsonFileHandler fileHandler) {
        return new JsonFileBaselineRepository(baselineDir(properties), fileHandler);
    }

    @Bean
    public HistoricalBaseline historicalBaseline(BaselineRepository repository, HistoricalBaselineCalculator calculator) {
        return new HistoricalBaseline(repository, calculator);
    }

    @Bean
    public ProcessedDatasetBuilder processedDatasetBuilder(ReadingStore store,
                                                           RateOfChangeEngine engine,
                                                           HistoricalBaseline historicalBaseline,
                                                           PipelineConfig config) {
        return new ProcessedDatasetBuilder(store, engine, historicalBaseline::find, config);
    }

    @Bean
    public ProcessedDatasetRepository processedDatasetRepository(FlowWatchProperties properties,
                                                                 JsonFileHandler fileHandler) {
        Path file = Path.of(properties.getStorage().getDataDir(), properties.getStorage().getDatasetFile());
        ProcessedDatasetRepository repository = new ProcessedDatasetRepository(file, fileHandler);
        repository.load();
        return repository;
    }

    @Bean
    public UpdateLogRepository updateLogRepository(FlowWatchProperties properties, JsonFileHandler fileHandler) {
        Path file = Path.of(properties.getStorage().getDataDir(), properties.getStorage().getUpdateLogFile());
        return new UpdateLogRepository(file, fileHandler, properties.getPipeline().getUpdateLogSize());
    }

    @Bean
    public UsgsResponseParser usgsResponseParser() {
        return new UsgsResponseParser(JsonFileHandler.objectMapper());
    }

    /**
     * WebClient propio para USGS: las respuestas de un estado completo superan el búfer por defecto (256 KB).
     */
    @Bean
    public WebClient usgsWebClient(WebClient.Builder builder, FlowWatchProperties properties) {
        int maxBytes = properties.getUsgs().getMaxInMemoryMb() * 1024 * 1024;
        return builder
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxBytes))
                        .build())
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService baselineExecutor(PipelineConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, config.getWorkerCount()), runnable -> {
            Thread thread = new Thread(runnable, "baseline-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    static Path baselineDir(FlowWatchProperties properties) {
        return Path.of(properties.getStorage().getDataDir(), properties.getStorage().getBaselineDir());
    }
}
