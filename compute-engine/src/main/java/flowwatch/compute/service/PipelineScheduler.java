package flowwatch.compute.service;

import flowwatch.domain.exception.PipelineRunException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Ejecución periódica del pipeline. Desactivado por defecto ({@code flowwatch.scheduler.enabled}).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "flowwatch.scheduler", name = "enabled", havingValue = "true")
public class PipelineScheduler {

    private final GaugePipelineService pipelineService;

    @Scheduled(fixedDelayString = "${flowwatch.scheduler.fixed-delay-ms:900000}",
            initialDelayString = "${flowwatch.scheduler.initial-delay-ms:10000}")
    public void scheduledRun() {
        try {
            var report = pipelineService.run();
            log.info("Scheduled run published {} rows", report.rowCount());
        } catch (PipelineRunException e) {
            log.error("Scheduled pipeline run failed: {}", e.getMessage());
        }
    }
}
