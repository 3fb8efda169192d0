package phoenixgrid.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import phoenixgrid.domain.report.ConversionReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializa (y relee) el informe de una ejecución en formato JSON.
 */
@Slf4j
public class ConversionReportWriter {

    // El ObjectMapper es costoso de crear y es thread-safe: se reutiliza.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Instantes como texto ISO-8601, no como números.
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Escribe el informe, sobrescribiendo uno anterior con el mismo nombre.
     *
     * @throws IOException si falla la escritura.
     */
    public void write(ConversionReport report, Path filePath) throws IOException {
        log.info("Escribiendo informe de la conversión en {}", filePath.toAbsolutePath());
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(filePath.toFile(), report);
        } catch (IOException e) {
            log.error("Error fatal al escribir el informe JSON en {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }

    public ConversionReport read(Path filePath) throws IOException {
        if (!Files.exists(filePath)) {
            throw new IOException("El informe especificado no existe: " + filePath.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(filePath.toFile(), ConversionReport.class);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el informe JSON desde {}", filePath.toAbsolutePath(), e);
            throw e;
        }
    }
}
