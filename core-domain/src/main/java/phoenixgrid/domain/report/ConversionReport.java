package phoenixgrid.domain.report;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;

import java.time.Instant;
import java.util.List;

/**
 * Resumen de una ejecución: tablas producidas, grupos descartados y ficheros rechazados.
 *
 * @param startedAt         Instante de inicio.
 * @param finishedAt        Instante de fin.
 * @param modelDirectory    Directorio de entrada.
 * @param outputDirectory   Directorio de salida.
 * @param producedArtifacts Nombres de los ficheros FITS escritos, en orden de procesamiento.
 * @param skippedGroups     Grupos que fallaron, con el motivo.
 * @param rejectedFiles     Ficheros cuyo nombre no respeta el esquema.
 */
@Builder
@JsonPropertyOrder({"startedAt", "finishedAt", "modelDirectory", "outputDirectory",
        "producedArtifacts", "skippedGroups", "rejectedFiles"})
public record ConversionReport(
        Instant startedAt,
        Instant finishedAt,
        String modelDirectory,
        String outputDirectory,
        @Singular List<String> producedArtifacts,
        @Singular List<SkippedGroup> skippedGroups,
        @Singular List<RejectedFile> rejectedFiles
) {

    @JsonIgnore
    public boolean isComplete() {
        return skippedGroups.isEmpty() && rejectedFiles.isEmpty();
    }

    /**
     * @param groupKey  Clave del grupo, ej: "030/-1.0".
     * @param errorKind Tipo de error (ej: "InvalidGravityCode").
     * @param reason    Mensaje del error.
     */
    public record SkippedGroup(String groupKey, String errorKind, String reason) {
    }

    /**
     * @param fileName Nombre del fichero rechazado.
     * @param reason   Mensaje del error de nombre.
     */
    public record RejectedFile(String fileName, String reason) {
    }
}
