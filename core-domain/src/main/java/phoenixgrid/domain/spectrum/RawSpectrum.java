package phoenixgrid.domain.spectrum;

import phoenixgrid.domain.model.GravityCode;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Contenido numérico de un fichero de modelo tal y como se leyó, sin convertir.
 *
 * @param gravity      Gravedad superficial del modelo.
 * @param wavelength   Longitudes de onda en Angstrom, en el orden del fichero.
 * @param storedFlux   Flujo almacenado (logaritmo en base 10, desplazado en 8 órdenes).
 * @param sourcePath   Fichero de origen, para los mensajes de error.
 */
public record RawSpectrum(
        GravityCode gravity,
        double[] wavelength,
        double[] storedFlux,
        Path sourcePath
) {
    public RawSpectrum {
        Objects.requireNonNull(gravity, "La gravedad no puede ser nula.");
        Objects.requireNonNull(wavelength, "El array de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(storedFlux, "El array de flujo no puede ser nulo.");
        if (wavelength.length != storedFlux.length) {
            throw new IllegalArgumentException("Longitud de onda y flujo deben tener la misma longitud.");
        }
    }

    public int size() {
        return wavelength.length;
    }
}
