package flowwatch.compute.api;

import flowwatch.domain.exception.GaugeBusinessException;
import flowwatch.domain.exception.PipelineRunException;
import flowwatch.domain.exception.ResourceNotFoundException;
import flowwatch.domain.exception.UnknownSiteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Recurso inexistente (estación sin fila o sin baseline).
     * Log: WARN (error de la petición, no del sistema).
     */
    @ExceptionHandler({ResourceNotFoundException.class, UnknownSiteException.class})
    public ResponseEntity<Object> handleNotFound(GaugeBusinessException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    /**
     * Ejecución del pipeline fallida (origen caído, escritura imposible).
     * El dataset anterior sigue publicado.
     */
    @ExceptionHandler(PipelineRunException.class)
    public ResponseEntity<Object> handlePipelineFailure(PipelineRunException ex) {
        log.error("Pipeline run failed: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Pipeline Unavailable", ex.getMessage());
    }

    /**
     * Reglas de negocio y argumentos inválidos (ej: siteId con caracteres no numéricos).
     */
    @ExceptionHandler({GaugeBusinessException.class, IllegalArgumentException.class})
    public ResponseEntity<Object> handleBadRequest(RuntimeException ex) {
        log.warn("Business Rule Violation: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Invalid Gauge Request", ex.getMessage());
    }

    /**
     * Todo lo demás. Log: ERROR con traza completa.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
