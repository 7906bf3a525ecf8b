package tpcsim.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import tpcsim.config.EventGeneratorConfig;
import tpcsim.config.MinimizerConfig;
import tpcsim.domain.simulation.MinimizationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Lectura y escritura de configuraciones y resultados en ficheros JSON.
 * <p>
 * Permite cargar la descripción del detector y del minimizador desde disco y guardar
 * el resultado de un ajuste para analizarlo después.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y thread-safe: se reutiliza
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public EventGeneratorConfig readDetectorConfig(String filePath) throws IOException {
        return readFromFile(filePath, EventGeneratorConfig.class);
    }

    public MinimizerConfig readMinimizerConfig(String filePath) throws IOException {
        return readFromFile(filePath, MinimizerConfig.class);
    }

    public void writeResult(MinimizationResult result, String filePath) throws IOException {
        writeToFile(result, filePath);
    }

    /**
     * Serializa un objeto a JSON en la ruta indicada, sobrescribiendo el fichero si existe.
     *
     * @throws IOException Si ocurre un error durante la escritura.
     */
    public <T> void writeToFile(T data, String filePath) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Serializando {} a archivo: {}", data.getClass().getSimpleName(), path);

        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            objectMapper.writeValue(path.toFile(), data);
        } catch (IOException e) {
            log.error("Error al escribir el archivo JSON en {}", path, e);
            throw e;
        }
    }

    /**
     * Deserializa un fichero JSON a un objeto del tipo indicado.
     *
     * @throws IOException Si el fichero no existe o su contenido no es válido.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath).toAbsolutePath();
        log.info("Deserializando archivo {} a {}", path, objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path);
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error al leer o parsear el archivo JSON desde {}", path, e);
            throw e;
        }
    }
}
