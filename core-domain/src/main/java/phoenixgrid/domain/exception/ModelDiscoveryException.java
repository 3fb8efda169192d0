package phoenixgrid.domain.exception;

import java.nio.file.Path;

/**
 * No se ha encontrado ningún fichero de modelo candidato. Fatal para toda la ejecución.
 */
public class ModelDiscoveryException extends PhoenixGridException {

    private final Path modelDirectory;
    private final String pattern;

    public ModelDiscoveryException(Path modelDirectory, String pattern) {
        super("No se han encontrado modelos '" + pattern + "' en " + modelDirectory);
        this.modelDirectory = modelDirectory;
        this.pattern = pattern;
    }

    public Path getModelDirectory() {
        return modelDirectory;
    }

    public String getPattern() {
        return pattern;
    }

    @Override
    public String getErrorKind() {
        return "DiscoveryEmpty";
    }
}
