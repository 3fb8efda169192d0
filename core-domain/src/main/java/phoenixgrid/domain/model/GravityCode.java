package phoenixgrid.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Optional;

/**
 * Los doce valores canónicos de gravedad superficial (log g) de la rejilla PHOENIX.
 * <p>
 * El orden de declaración es el orden fijo de las columnas de flujo y de las
 * palabras clave {@code LOGGn} de la cabecera.
 */
@Getter
@RequiredArgsConstructor
public enum GravityCode {
    G00("0.0", "g00", "LOGG1"),
    G05("0.5", "g05", "LOGG2"),
    G10("1.0", "g10", "LOGG3"),
    G15("1.5", "g15", "LOGG4"),
    G20("2.0", "g20", "LOGG5"),
    G25("2.5", "g25", "LOGG6"),
    G30("3.0", "g30", "LOGG7"),
    G35("3.5", "g35", "LOGG8"),
    G40("4.0", "g40", "LOGG9"),
    G45("4.5", "g45", "LOGG10"),
    G50("5.0", "g50", "LOGG11"),
    G55("5.5", "g55", "LOGG12");

    /**
     * Texto exacto tal y como aparece en el nombre del fichero (ej: "2.0").
     */
    private final String code;

    /**
     * Nombre de la columna de flujo en la tabla binaria.
     */
    private final String columnName;

    /**
     * Palabra clave de la cabecera que marca si la columna contiene datos.
     */
    private final String headerKeyword;

    /**
     * Resuelve el código textual extraído del nombre de fichero.
     *
     * @param code Campo de gravedad de 3 caracteres.
     * @return El valor canónico o vacío si no es uno de los doce.
     */
    public static Optional<GravityCode> fromCode(String code) {
        for (GravityCode gravity : values()) {
            if (gravity.code.equals(code)) {
                return Optional.of(gravity);
            }
        }
        return Optional.empty();
    }

    public double getValue() {
        return Double.parseDouble(code);
    }
}
