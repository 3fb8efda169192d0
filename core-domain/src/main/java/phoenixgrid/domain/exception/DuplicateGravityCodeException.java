package phoenixgrid.domain.exception;

import phoenixgrid.domain.model.GravityCode;

import java.nio.file.Path;

/**
 * Dos ficheros de un mismo grupo resuelven al mismo código de gravedad.
 */
public class DuplicateGravityCodeException extends PhoenixGridException {

    private final GravityCode gravityCode;
    private final Path firstPath;
    private final Path secondPath;

    public DuplicateGravityCodeException(GravityCode gravityCode, Path firstPath, Path secondPath) {
        super("log g " + gravityCode.getCode() + " duplicado: " + firstPath + " y " + secondPath);
        this.gravityCode = gravityCode;
        this.firstPath = firstPath;
        this.secondPath = secondPath;
    }

    public GravityCode getGravityCode() {
        return gravityCode;
    }

    public Path getFirstPath() {
        return firstPath;
    }

    public Path getSecondPath() {
        return secondPath;
    }

    @Override
    public String getErrorKind() {
        return "DuplicateGravityCode";
    }
}
