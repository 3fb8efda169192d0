package phoenixgrid.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Contenedor principal para todas las configuraciones de una conversión.
 * Se construye una sola vez (normalmente desde la línea de comandos) y se pasa
 * explícitamente a cada etapa del pipeline.
 */
@Value
@Builder
@With
public class ConversionConfig {

    /**
     * Directorio donde se encuentran los ficheros de modelo PHOENIX.
     */
    Path modelDirectory;

    /**
     * Directorio en el que se escriben las tablas FITS y el informe de la ejecución.
     */
    Path outputDirectory;

    /**
     * Patrón glob que identifica los ficheros de modelo candidatos (ej: "lte*").
     */
    String modelFilePattern;

    /**
     * Número de hilos del pool de trabajo compartido por la carga y el remuestreo.
     */
    int workerThreads;

    /**
     * Algoritmo de proyección sobre la rejilla canónica.
     */
    ResamplingStrategy resamplingStrategy;

    /**
     * Si es falso, un fichero FITS ya existente hace fallar su grupo en lugar de sobrescribirse.
     */
    boolean overwriteExisting;

    /**
     * Nombre del informe JSON de la ejecución dentro del directorio de salida. Nulo lo desactiva.
     */
    String reportFileName;

    /**
     * Metadatos de procedencia que se copian en la cabecera de cada tabla.
     */
    HeaderMetadata headerMetadata;

    public enum ResamplingStrategy {
        /** Interpolación lineal punto a punto. Idempotente sobre la propia rejilla. */
        LINEAR_INTERPOLATION,
        /** Media de la interpolación lineal sobre cada bin de la rejilla. Conserva el flujo integrado. */
        FLUX_CONSERVING_REBIN
    }

    /**
     * Configuración por defecto: directorio de trabajo para entrada y salida.
     */
    public static ConversionConfig defaults() {
        Path workingDirectory = Paths.get("").toAbsolutePath();
        return ConversionConfig.builder()
                .modelDirectory(workingDirectory)
                .outputDirectory(workingDirectory)
                .modelFilePattern("lte*")
                .workerThreads(Runtime.getRuntime().availableProcessors())
                .resamplingStrategy(ResamplingStrategy.LINEAR_INTERPOLATION)
                .overwriteExisting(false)
                .reportFileName("conversion_report.json")
                .headerMetadata(HeaderMetadata.defaults())
                .build();
    }

    /**
     * Valores descriptivos de la cabecera primaria (identificación y procedencia).
     */
    @Value
    @Builder
    @With
    public static class HeaderMetadata {
        String mapKey;
        String contact;
        String description;
        String fileType;
        String systems;
        String reason;
        String comment;
        /**
         * Líneas HISTORY, en orden.
         */
        List<String> history;

        public static HeaderMetadata defaults() {
            return HeaderMetadata.builder()
                    .mapKey("phoenix")
                    .contact("J. White/M. McMaster")
                    .description("Phoenix Models BT-settl Allard et al. 03, 07, 09")
                    .fileType("Atmosphere Grid Model")
                    .systems("ETC, CDBS, PYSYNPHOT")
                    .reason("Delivered to support JWST")
                    .comment("= Files translated to CDBS format by J. White")
                    .history(List.of(
                            " ",
                            "Phoenix Models computed by France Allard",
                            "These models use static, spherically symmetric, 1D simulations to",
                            "completely describe the atmospheric emission spectrum. The",
                            "models account for the formation of molecular bands such as",
                            "those of water vapor, methane, or titanium oxide, solving",
                            "for the transfer equation over more than 20000 wavelength",
                            "points on average, producing synthetic spectra with 2 A reso-",
                            "lution. The line selection is repeated at each iteration of",
                            "the model. When the model is converged and the thermal struc-",
                            "ture obtained. The models here are calculated with a cloud mo-",
                            "del, valid across the entire parameter range. More information",
                            "can  be found at http://perso.ens-lyon.fr/france.allard/ refe-",
                            "rences: Allard et al. '03, Allard et al. '07, Allard et al. '09",
                            "(http://perso.ens-lyon.fr/france.allard/) All these models can",
                            "be found in the 'Star, Brown Dwarf & Planet Simulator'",
                            "(http://phoenix.ens-lyon.fr/simulator/index.faces)",
                            " ",
                            "These files were provided to the ReDCaT team by Aaron Dotter and",
                            "Jason Kalirai.",
                            " ",
                            "The wavelength range is a fixed grid of three logarithmic bands",
                            "shared by all temperature/metallicity files. Every log g model",
                            "is resampled onto that grid; missing log g values are zero-",
                            "filled and flagged with -999 in the LOGGn keywords."))
                    .build();
        }
    }
}
