package phoenixgrid.io;

import phoenixgrid.domain.exception.ModelFileNameException;
import phoenixgrid.domain.model.ModelFile;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Único punto del sistema que conoce el esquema de offsets fijos de los nombres de modelo.
 *
 * <pre>
 *  lte030-2.0-1.0a+0.0.BT-Settl.7
 *  0  3  6 7  10  14
 *  |  |    |  |
 *  |  |    |  +-- metalicidad  [10, 14)  "-1.0"
 *  |  |    +----- gravedad     [7, 10)   "2.0"
 *  |  +---------- temperatura  [3, 6)    "030"
 *  +------------- prefijo      [0, 3)    "lte"
 * </pre>
 * <p>
 * El campo de gravedad se extrae sin validar; la validación contra los doce valores
 * canónicos corresponde a la carga del grupo.
 */
public final class ModelFileNameParser {

    public static final int TEMPERATURE_OFFSET = 3;
    public static final int TEMPERATURE_LENGTH = 3;
    public static final int GRAVITY_OFFSET = 7;
    public static final int GRAVITY_LENGTH = 3;
    public static final int METALLICITY_OFFSET = 10;
    public static final int METALLICITY_LENGTH = 4;

    public static final int MINIMUM_NAME_LENGTH = METALLICITY_OFFSET + METALLICITY_LENGTH;

    private static final Pattern TEMPERATURE_FIELD = Pattern.compile("\\d{3}");
    private static final Pattern METALLICITY_FIELD = Pattern.compile("[+-]\\d\\.\\d");

    /**
     * Prohibido construir esta clase utilidad
     */
    private ModelFileNameParser() {
    }

    /**
     * Extrae los campos del nombre base del fichero.
     *
     * @param path Ruta del modelo.
     * @return El modelo con sus códigos.
     * @throws ModelFileNameException si el nombre es demasiado corto o algún campo tiene un formato inesperado.
     */
    public static ModelFile parse(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            throw new ModelFileNameException(path, "la ruta no tiene nombre de fichero");
        }
        String name = fileName.toString();
        if (name.length() < MINIMUM_NAME_LENGTH) {
            throw new ModelFileNameException(path,
                    "se necesitan al menos " + MINIMUM_NAME_LENGTH + " caracteres y hay " + name.length());
        }

        String temperature = field(name, TEMPERATURE_OFFSET, TEMPERATURE_LENGTH);
        String gravity = field(name, GRAVITY_OFFSET, GRAVITY_LENGTH);
        String metallicity = field(name, METALLICITY_OFFSET, METALLICITY_LENGTH);

        if (!TEMPERATURE_FIELD.matcher(temperature).matches()) {
            throw new ModelFileNameException(path, "campo de temperatura no numérico '" + temperature + "'");
        }
        if (!METALLICITY_FIELD.matcher(metallicity).matches()) {
            throw new ModelFileNameException(path, "campo de metalicidad no válido '" + metallicity + "'");
        }
        return new ModelFile(path, temperature, metallicity, gravity);
    }

    private static String field(String name, int offset, int length) {
        return name.substring(offset, offset + length);
    }
}
