package phoenixgrid.domain.exception;

/**
 * La rejilla canónica de longitudes de onda no cumple sus invariantes. Fatal para toda la ejecución.
 */
public class GridConstructionException extends PhoenixGridException {

    public GridConstructionException(String message) {
        super(message);
    }

    @Override
    public String getErrorKind() {
        return "GridConstructionError";
    }
}
