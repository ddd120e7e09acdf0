package centralizer.io;

import centralizer.config.StudyConfig;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Carga de configuraciones de estudio desde archivos JSON.
 * <p>
 * Genérica sobre el tipo leído: cualquier record o POJO compatible con Jackson.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // Rechaza parámetros con nombres desconocidos.
        mapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Lee un {@link StudyConfig} ({@code {"orderL": 2, "orderP": 3, ...}}).
     *
     * @throws IOException Si el archivo no existe o el JSON no es válido.
     */
    public StudyConfig readStudyConfig(String filePath) throws IOException {
        return readFromFile(filePath, StudyConfig.class);
    }

    /**
     * Deserializa un archivo JSON en un objeto del tipo indicado.
     *
     * @param filePath   La ruta del archivo JSON a leer.
     * @param objectType El tipo al que se debe convertir el JSON (ej: StudyConfig.class).
     * @throws IOException Si el archivo no se encuentra o hay un error de lectura o formato.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

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
}
