package flowwatch.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Gestiona la serialización (escritura) y deserialización (lectura) de objetos
 * hacia y desde archivos JSON.
 * <p>
 * Toda escritura pasa por un archivo temporal en el mismo directorio: el
 * destino nunca queda a medio escribir. Los nombres de propiedad salen en
 * snake_case y las fechas en ISO-8601 conservando su desplazamiento.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y es thread-safe: uno para toda la clase.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        // Registra módulos para tipos modernos de Java, como fechas de Java 8.
        mapper.findAndRegisterModules();
        return mapper;
    }

    public static ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Serializa un objeto a JSON y sustituye el destino de forma atómica.
     * Si el archivo ya existe, será sobrescrito.
     *
     * @throws IOException si ocurre un error durante la escritura
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.debug("Serializando objeto de tipo {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        Path temp = writeTemp(data, path);
        try {
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, falling back to plain replace", path);
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            Files.deleteIfExists(temp);
            throw e;
        }
    }

    /**
     * Escribe el archivo solo si no existe todavía. La creación es atómica:
     * con dos escritores a la vez, exactamente uno gana.
     *
     * @return {@code true} si este llamador creó el archivo
     * @throws IOException si ocurre un error durante la escritura
     */
    public <T> boolean writeIfAbsent(T data, Path path) throws IOException {
        if (Files.exists(path)) {
            return false;
        }
        Path temp = writeTemp(data, path);
        try {
            // Un hard link falla si el destino existe, sin ventana entre comprobación y creación
            Files.createLink(path, temp);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("Archivo {} creado por otro escritor", path);
            return false;
        } catch (UnsupportedOperationException e) {
            try {
                Files.move(temp, path);
                return true;
            } catch (FileAlreadyExistsException raced) {
                return false;
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Deserializa un archivo JSON para reconstruir un objeto de un tipo específico.
     *
     * @throws IOException si el archivo no existe o hay un error de lectura o formato
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.debug("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public <T> byte[] toBytes(T data) throws IOException {
        return objectMapper.writeValueAsBytes(data);
    }

    private <T> Path writeTemp(T data, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), data);
            return temp;
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
    }
}
