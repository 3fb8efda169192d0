package phoenixgrid;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.config.CommandLineArguments;
import phoenixgrid.config.ConversionConfig;
import phoenixgrid.domain.exception.PhoenixGridException;
import phoenixgrid.domain.report.ConversionReport;
import phoenixgrid.pipeline.GridConversionOrchestrator;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Punto de entrada: convierte un directorio de modelos PHOENIX en tablas espectrales FITS.
 * <p>
 * Códigos de salida: {@value #EXIT_OK} todos los grupos producidos; {@value #EXIT_PARTIAL}
 * la ejecución terminó pero algún grupo o fichero se descartó; {@value #EXIT_FATAL} error
 * fatal de la ejecución o argumentos no válidos.
 */
@Slf4j
public class PhoenixGridApplication {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FATAL = 1;
    public static final int EXIT_PARTIAL = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        ConversionConfig config;
        try {
            config = CommandLineArguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}. {}", e.getMessage(), CommandLineArguments.USAGE);
            return EXIT_FATAL;
        }
        return run(config);
    }

    public static int run(ConversionConfig config) {
        log.info("Convirtiendo modelos de {} en {}", config.getModelDirectory().toAbsolutePath(),
                config.getOutputDirectory().toAbsolutePath());

        try (GridConversionOrchestrator orchestrator = new GridConversionOrchestrator(config)) {
            ConversionReport report = orchestrator.run();
            return report.isComplete() ? EXIT_OK : EXIT_PARTIAL;
        } catch (PhoenixGridException e) {
            log.error("Conversión abortada ({}): {}", e.getErrorKind(), e.getMessage(), e);
            return EXIT_FATAL;
        } catch (IOException | UncheckedIOException e) {
            log.error("Conversión abortada por error de E/S: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }
}
