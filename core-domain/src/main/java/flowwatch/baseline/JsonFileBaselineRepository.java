package flowwatch.baseline;

import flowwatch.domain.baseline.HistoricalBaselineTable;
import flowwatch.io.JsonFileHandler;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Baselines guardados como un archivo JSON por estación: {@code p90_<siteId>.json}.
 */
@Slf4j
public class JsonFileBaselineRepository implements BaselineRepository {

    // Los identificadores USGS son dígitos; cualquier otra cosa no llega al sistema de ficheros
    private static final Pattern SITE_ID = Pattern.compile("\\d{1,20}");

    private final Path directory;
    private final JsonFileHandler fileHandler;

    public JsonFileBaselineRepository(Path directory, JsonFileHandler fileHandler) {
        this.directory = directory;
        this.fileHandler = fileHandler;
    }

    @Override
    public boolean exists(String siteId) {
        return isStored(pathFor(siteId));
    }

    @Override
    public Optional<HistoricalBaselineTable> read(String siteId) {
        Path path = pathFor(siteId);
        if (!isStored(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(fileHandler.readFromFile(path, HistoricalBaselineTable.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read baseline for site " + siteId, e);
        }
    }

    @Override
    public HistoricalBaselineTable createIfAbsent(HistoricalBaselineTable table) {
        Path path = pathFor(table.siteId());
        try {
            discardIfEmpty(path);
            if (fileHandler.writeIfAbsent(table, path)) {
                log.info("Baseline for site {} stored at {}", table.siteId(), path);
                return table;
            }
            log.info("Baseline for site {} already stored by another writer, keeping it", table.siteId());
            return fileHandler.readFromFile(path, HistoricalBaselineTable.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot store baseline for site " + table.siteId(), e);
        }
    }

    @Override
    public boolean delete(String siteId) {
        try {
            return Files.deleteIfExists(pathFor(siteId));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot delete baseline for site " + siteId, e);
        }
    }

    // Un archivo vacío es un resto de una escritura que no llegó a completarse: cuenta como ausente
    private static boolean isStored(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (NoSuchFileException e) {
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot inspect baseline file " + path, e);
        }
    }

    private static void discardIfEmpty(Path path) throws IOException {
        if (Files.isRegularFile(path) && Files.size(path) == 0) {
            log.warn("Discarding empty baseline file {}", path);
            Files.deleteIfExists(path);
        }
    }

    private Path pathFor(String siteId) {
        if (siteId == null || !SITE_ID.matcher(siteId).matches()) {
            throw new IllegalArgumentException("Invalid site id: " + siteId);
        }
        return directory.resolve("p90_" + siteId + ".json");
    }
}
