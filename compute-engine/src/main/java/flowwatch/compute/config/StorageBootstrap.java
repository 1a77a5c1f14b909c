package flowwatch.compute.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Comprobación de arranque ("Fail Fast"): el directorio de datos debe existir y ser escribible
 * antes de que el pipeline intente publicar nada.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StorageBootstrap implements CommandLineRunner {

    private final FlowWatchProperties properties;

    @Override
    public void run(String... args) {
        Path dataDir = Path.of(properties.getStorage().getDataDir());
        Path baselineDir = PipelineBeans.baselineDir(properties);
        log.info(">>> BOOTSTRAP: Verificando almacenamiento en {}", dataDir.toAbsolutePath());
        try {
            Files.createDirectories(baselineDir);
        } catch (IOException e) {
            log.error(">>> FATAL: No se pudo crear el directorio de datos {}", baselineDir, e);
            throw new IllegalStateException("Data directory not available: " + baselineDir, e);
        }
        if (!Files.isWritable(dataDir)) {
            log.error(">>> FATAL: El directorio de datos {} no es escribible", dataDir);
            throw new IllegalStateException("Data directory not writable: " + dataDir);
        }
        log.info(">>> BOOTSTRAP: Almacenamiento listo (baselines en {}).", baselineDir);
    }
}
