package phoenixgrid.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Traduce los argumentos de línea de comandos a una {@link ConversionConfig}.
 * <p>
 * Solo existen dos parámetros opcionales, ambos con el directorio de trabajo por defecto:
 * <ul>
 * <li>{@code --model_directory DIR} / {@code -d DIR}: directorio de los modelos;</li>
 * <li>{@code --output_directory DIR} / {@code -o DIR}: directorio de salida.</li>
 * </ul>
 * También se acepta la forma {@code --nombre=valor}.
 */
public final class CommandLineArguments {

    public static final String USAGE =
            "uso: phoenix-grid [--model_directory|-d DIR] [--output_directory|-o DIR]";

    /**
     * Prohibido construir esta clase utilidad
     */
    private CommandLineArguments() {
    }

    public static ConversionConfig parse(String[] args) {
        return parse(args, ConversionConfig.defaults());
    }

    /**
     * @param args     Argumentos recibidos.
     * @param defaults Configuración de partida.
     * @throws IllegalArgumentException si hay una opción desconocida, repetida o sin valor.
     */
    public static ConversionConfig parse(String[] args, ConversionConfig defaults) {
        Path modelDirectory = null;
        Path outputDirectory = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String option = arg;
            String value = null;

            int equals = arg.indexOf('=');
            if (arg.startsWith("--") && equals > 0) {
                option = arg.substring(0, equals);
                value = arg.substring(equals + 1);
            }

            boolean isModel = option.equals("--model_directory") || option.equals("-d");
            boolean isOutput = option.equals("--output_directory") || option.equals("-o");
            if (!isModel && !isOutput) {
                throw new IllegalArgumentException("Opción desconocida: " + arg);
            }

            if (value == null) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("Falta el valor de " + option);
                }
                value = args[++i];
            }
            if (value.isBlank()) {
                throw new IllegalArgumentException("Valor vacío para " + option);
            }

            if (isModel) {
                if (modelDirectory != null) {
                    throw new IllegalArgumentException("Opción repetida: " + option);
                }
                modelDirectory = Paths.get(value);
            } else {
                if (outputDirectory != null) {
                    throw new IllegalArgumentException("Opción repetida: " + option);
                }
                outputDirectory = Paths.get(value);
            }
        }

        ConversionConfig config = defaults;
        if (modelDirectory != null) {
            config = config.withModelDirectory(modelDirectory);
        }
        if (outputDirectory != null) {
            config = config.withOutputDirectory(outputDirectory);
        }
        return config;
    }
}
