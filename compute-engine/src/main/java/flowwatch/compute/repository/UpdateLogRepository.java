package flowwatch.compute.repository;

import flowwatch.domain.dto.UpdateLogDTO;
import flowwatch.io.JsonFileHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Registro de ejecuciones completadas del pipeline. Conserva solo las últimas {@code maxEntries}.
 */
@Slf4j
public class UpdateLogRepository {

    private final Path file;
    private final JsonFileHandler fileHandler;
    private final int maxEntries;

    public UpdateLogRepository(Path file, JsonFileHandler fileHandler, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.file = file;
        this.fileHandler = fileHandler;
        this.maxEntries = maxEntries;
    }

    public synchronized UpdateLogDTO append(Instant completedAt) throws IOException {
        List<Instant> updates = new ArrayList<>(read().updates());
        updates.add(completedAt);
        if (updates.size() > maxEntries) {
            updates = updates.subList(updates.size() - maxEntries, updates.size());
        }
        UpdateLogDTO updated = new UpdateLogDTO(updates);
        fileHandler.writeToFile(updated, file);
        return updated;
    }

    public synchronized UpdateLogDTO read() {
        if (!Files.exists(file)) {
            return new UpdateLogDTO(List.of());
        }
        try {
            return fileHandler.readFromFile(file, UpdateLogDTO.class);
        } catch (IOException e) {
            log.warn("Update log {} unreadable, starting a new one: {}", file, e.getMessage());
            return new UpdateLogDTO(List.of());
        }
    }
}
