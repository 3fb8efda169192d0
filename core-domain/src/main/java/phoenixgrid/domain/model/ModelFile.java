package phoenixgrid.domain.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Un fichero de modelo PHOENIX y los campos extraídos de su nombre.
 *
 * @param path             Ruta del fichero.
 * @param temperatureCode  Código de temperatura de 3 caracteres (ej: "030" para 3000 K).
 * @param metallicityCode  Código de metalicidad de 4 caracteres con signo (ej: "-1.0").
 * @param gravityCode      Código de gravedad superficial de 3 caracteres, aún sin validar (ej: "4.5").
 */
public record ModelFile(
        Path path,
        String temperatureCode,
        String metallicityCode,
        String gravityCode
) {
    public ModelFile {
        Objects.requireNonNull(path, "La ruta del modelo no puede ser nula.");
        Objects.requireNonNull(temperatureCode, "El código de temperatura no puede ser nulo.");
        Objects.requireNonNull(metallicityCode, "El código de metalicidad no puede ser nulo.");
        Objects.requireNonNull(gravityCode, "El código de gravedad no puede ser nulo.");
    }

    public GroupKey groupKey() {
        return new GroupKey(temperatureCode, metallicityCode);
    }

    public String fileName() {
        return path.getFileName().toString();
    }
}
