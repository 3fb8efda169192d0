package phoenixgrid.domain.exception;

import java.nio.file.Path;

/**
 * El cuerpo de un fichero de modelo contiene una fila que no se puede interpretar.
 */
public class SpectrumFormatException extends PhoenixGridException {

    private final Path path;
    private final int lineNumber;

    public SpectrumFormatException(Path path, int lineNumber, String reason) {
        super("Fila " + lineNumber + " no válida en " + path + ": " + reason);
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public SpectrumFormatException(Path path, int lineNumber, String reason, Throwable cause) {
        super("Fila " + lineNumber + " no válida en " + path + ": " + reason, cause);
        this.path = path;
        this.lineNumber = lineNumber;
    }

    public Path getPath() {
        return path;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    @Override
    public String getErrorKind() {
        return "SpectrumFormatError";
    }
}
