package phoenixgrid.domain.exception;

/**
 * Excepción base de todos los errores propios de la conversión.
 * <p>
 * El orquestador captura esta jerarquía en la frontera de cada grupo para decidir
 * si se descarta el grupo o se aborta la ejecución completa.
 */
public class PhoenixGridException extends RuntimeException {

    public PhoenixGridException(String message) {
        super(message);
    }

    public PhoenixGridException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Nombre corto del tipo de error, usado en el resumen final y en el informe JSON.
     */
    public String getErrorKind() {
        return "PipelineError";
    }
}
