package flowwatch.compute.api;

import flowwatch.compute.service.GaugePipelineService;
import flowwatch.config.ApiRoutes;
import flowwatch.domain.dto.PipelineRunReport;
import flowwatch.domain.dto.UpdateLogDTO;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(ApiRoutes.PIPELINE)
@RequiredArgsConstructor
@Tag(name = "Pipeline", description = "Control manual del pipeline de aforos")
public class PipelineController {

    private final GaugePipelineService pipelineService;

    @PostMapping("/run")
    @Operation(summary = "Ejecuta el pipeline ahora y devuelve el resumen")
    public ResponseEntity<PipelineRunReport> run() {
        return ResponseEntity.ok(pipelineService.run());
    }

    @GetMapping("/updates")
    @Operation(summary = "Últimas ejecuciones completadas")
    public ResponseEntity<UpdateLogDTO> updates() {
        return ResponseEntity.ok(pipelineService.updates());
    }
}
