package phoenixgrid.domain.exception;

import java.nio.file.Path;

/**
 * El código de gravedad superficial extraído del nombre no es uno de los doce canónicos.
 */
public class InvalidGravityCodeException extends PhoenixGridException {

    private final Path path;
    private final String gravityCode;

    public InvalidGravityCodeException(Path path, String gravityCode) {
        super("Código log g '" + gravityCode + "' no estándar en " + path);
        this.path = path;
        this.gravityCode = gravityCode;
    }

    public Path getPath() {
        return path;
    }

    public String getGravityCode() {
        return gravityCode;
    }

    @Override
    public String getErrorKind() {
        return "InvalidGravityCode";
    }
}
