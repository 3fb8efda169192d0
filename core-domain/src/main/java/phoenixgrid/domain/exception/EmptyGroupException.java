package phoenixgrid.domain.exception;

import phoenixgrid.domain.model.GroupKey;

/**
 * Un grupo no conserva ningún espectro real con datos tras la limpieza.
 */
public class EmptyGroupException extends PhoenixGridException {

    private final GroupKey groupKey;

    public EmptyGroupException(GroupKey groupKey) {
        super("El grupo " + groupKey + " no contiene ningún espectro utilizable");
        this.groupKey = groupKey;
    }

    public GroupKey getGroupKey() {
        return groupKey;
    }

    @Override
    public String getErrorKind() {
        return "EmptyGroupError";
    }
}
