package flowwatch.compute.repository;

import flowwatch.domain.gauge.ProcessedDataset;
import flowwatch.io.JsonFileHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dataset procesado publicado: copia en memoria para la API y fichero JSON para consumidores externos.
 * <p>
 * Se escribe primero el fichero (temporal + movimiento atómico) y solo después
 * se sustituye la copia en memoria. Si la escritura falla, ambos conservan la
 * versión anterior.
 */
@Slf4j
public class ProcessedDatasetRepository {

    private final Path file;
    private final JsonFileHandler fileHandler;
    private final AtomicReference<ProcessedDataset> current = new AtomicReference<>(ProcessedDataset.empty());

    public ProcessedDatasetRepository(Path file, JsonFileHandler fileHandler) {
        this.file = file;
        this.fileHandler = fileHandler;
    }

    /**
     * Recupera el último dataset escrito, si existe. Un fichero ilegible se ignora.
     */
    public ProcessedDataset load() {
        if (!Files.exists(file)) {
            return current.get();
        }
        try {
            ProcessedDataset stored = fileHandler.readFromFile(file, ProcessedDataset.class);
            current.set(stored);
            log.info("Loaded processed dataset with {} rows from {}", stored.size(), file);
        } catch (IOException e) {
            log.warn("Could not read processed dataset {}, starting empty: {}", file, e.getMessage());
        }
        return current.get();
    }

    public void publish(ProcessedDataset dataset) throws IOException {
        fileHandler.writeToFile(dataset, file);
        current.set(dataset);
    }

    public ProcessedDataset current() {
        return current.get();
    }

    public Path getFile() {
        return file;
    }
}
