package phoenixgrid.domain.exception;

import java.nio.file.Path;

/**
 * El nombre de un fichero de modelo no respeta el esquema de offsets fijos.
 */
public class ModelFileNameException extends PhoenixGridException {

    private final Path path;

    public ModelFileNameException(Path path, String reason) {
        super("Nombre de modelo no válido '" + path + "': " + reason);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getErrorKind() {
        return "ParseError";
    }
}
