package flowwatch.compute.api;

import flowwatch.baseline.HistoricalBaseline;
import flowwatch.compute.service.GaugePipelineService;
import flowwatch.config.ApiRoutes;
import flowwatch.domain.baseline.BaselineEntry;
import flowwatch.domain.exception.ResourceNotFoundException;
import flowwatch.domain.gauge.ProcessedRow;
import flowwatch.domain.gauge.Reading;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping(ApiRoutes.GAUGES)
@RequiredArgsConstructor
@Tag(name = "Gauges", description = "Dataset procesado y baselines históricos por estación")
public class GaugeController {

    private final GaugePipelineService pipelineService;
    private final HistoricalBaseline historicalBaseline;

    @GetMapping
    @Operation(summary = "Dataset procesado de la última ejecución (vacío antes de la primera)")
    public ResponseEntity<List<ProcessedRow>> getGauges() {
        return ResponseEntity.ok(pipelineService.currentDataset().rows());
    }

    @GetMapping("/{siteId}")
    @Operation(summary = "Fila procesada de una estación")
    public ResponseEntity<ProcessedRow> getGauge(@PathVariable("siteId") String siteId) {
        return pipelineService.currentRow(siteId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("No processed row for site " + siteId));
    }

    @GetMapping("/{siteId}/readings")
    @Operation(summary = "Lecturas de la ventana deslizante de una estación (últimas 24 h)")
    public ResponseEntity<List<Reading>> getReadings(@PathVariable("siteId") String siteId) {
        return ResponseEntity.ok(pipelineService.readings(siteId));
    }

    @GetMapping("/{siteId}/baseline")
    @Operation(summary = "Tabla P90 por día del año de una estación")
    public ResponseEntity<List<BaselineEntry>> getBaseline(@PathVariable("siteId") String siteId) {
        return historicalBaseline.find(siteId)
                .map(table -> ResponseEntity.ok(table.entries()))
                .orElseThrow(() -> new ResourceNotFoundException("No baseline stored for site " + siteId));
    }

    @DeleteMapping("/{siteId}/baseline")
    @Operation(summary = "Borra el baseline guardado; se recalcula en la siguiente ejecución")
    public ResponseEntity<Void> invalidateBaseline(@PathVariable("siteId") String siteId) {
        if (!historicalBaseline.invalidate(siteId)) {
            throw new ResourceNotFoundException("No baseline stored for site " + siteId);
        }
        return ResponseEntity.noContent().build();
    }
}
