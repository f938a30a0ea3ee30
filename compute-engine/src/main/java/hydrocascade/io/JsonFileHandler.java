package hydrocascade.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import hydrocascade.domain.simulation.CascadeSimulationResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serializa y deserializa objetos a archivos JSON.
 * <p>
 * Se usa sobre todo para exportar {@link CascadeSimulationResult} a herramientas de
 * informes, pero admite cualquier POJO o record compatible con Jackson.
 */
@Slf4j
public class JsonFileHandler {

    // Thread-safe; se reutiliza en todas las llamadas.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Los resultados exponen propiedades derivadas (p. ej. "complete") sin constructor.
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa un objeto a un archivo JSON. Si el archivo existe, se sobrescribe.
     *
     * @throws IOException si falla la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), path.toAbsolutePath());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura a JSON completada.");
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Exporta el resultado de una simulación.
     */
    public void exportResult(CascadeSimulationResult result, String filePath) throws IOException {
        log.info("Exportando resultado: {} pasos de {}, {} embalses.",
                result.completedSteps(), result.horizon(), result.series().size());
        writeToFile(result, filePath);
    }

    /**
     * Reconstruye un objeto de un tipo concreto desde un archivo JSON.
     *
     * @throws IOException si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = requireExisting(filePath);
        log.info("Deserializando archivo {} a {}", path.toAbsolutePath(), objectType.getSimpleName());

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Lee un archivo JSON como árbol genérico, sin ligarlo a un tipo.
     */
    public JsonNode readTree(String filePath) throws IOException {
        Path path = requireExisting(filePath);
        try {
            return objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            log.error("Error fatal al parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private static Path requireExisting(String filePath) throws IOException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        return path;
    }
}
