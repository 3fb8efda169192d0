package phoenixgrid.domain.grid;

import java.util.Objects;

/**
 * Una entrada clave/valor de la cabecera de salida.
 *
 * @param keyword Palabra clave FITS (máximo 8 caracteres).
 * @param value   Valor: {@link String}, {@link Integer}, {@link Long}, {@link Double} o {@link Boolean}.
 * @param comment Comentario opcional, puede ser nulo.
 */
public record HeaderCard(String keyword, Object value, String comment) {

    public HeaderCard {
        Objects.requireNonNull(keyword, "La palabra clave no puede ser nula.");
        Objects.requireNonNull(value, "El valor de " + keyword + " no puede ser nulo.");
        if (keyword.isEmpty() || keyword.length() > 8) {
            throw new IllegalArgumentException("Palabra clave FITS no válida: '" + keyword + "'");
        }
    }
}
