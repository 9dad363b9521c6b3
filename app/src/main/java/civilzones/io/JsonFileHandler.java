package civilzones.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Guarda y carga partidas (y cualquier otro objeto compatible con Jackson)
 * como archivos JSON.
 */
@Slf4j
public class JsonFileHandler {

    // Reutilizado entre llamadas; es thread-safe una vez configurado.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Partidas antiguas pueden traer campos que ya no existen.
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo ya existe, será sobrescrito.
     *
     * @param data     El objeto a serializar. No puede ser nulo.
     * @param filePath La ruta completa del archivo de destino (ej: "saves/partida_42.json").
     * @param <T>      El tipo del objeto a serializar.
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Guardando {} en {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un archivo JSON a una instancia del tipo indicado.
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Cargando {} desde {}", objectType.getSimpleName(), path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Guarda una partida completa.
     *
     * @throws IOException Si ocurre un error durante la escritura del archivo.
     */
    public void saveSnapshot(WorldSnapshot snapshot, Path path) throws IOException {
        log.info("Guardando partida (semilla {}, {} edificios, nivel del mar {})",
                snapshot.seed(), snapshot.buildings().size(), snapshot.geology().getCurrentSeaLevel());
        writeToFile(snapshot, path.toString());
    }

    /**
     * Carga una partida y vuelve a enlazar cada casilla con su edificio.
     *
     * @throws IOException Si el archivo no existe o su contenido no es válido.
     */
    public WorldSnapshot loadSnapshot(Path path) throws IOException {
        WorldSnapshot snapshot = readFromFile(path.toString(), WorldSnapshot.class);
        snapshot.restoreBuildingLinks();
        log.info("Partida cargada: semilla {}, rejilla {}x{}, {} edificios",
                snapshot.seed(), snapshot.grid().getWidth(), snapshot.grid().getHeight(), snapshot.buildings().size());
        return snapshot;
    }
}
