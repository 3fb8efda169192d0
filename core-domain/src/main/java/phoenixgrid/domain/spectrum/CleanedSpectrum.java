package phoenixgrid.domain.spectrum;

import phoenixgrid.domain.model.GravityCode;

import java.util.Objects;

/**
 * Espectro en unidades físicas, sin filas degeneradas y ordenado por longitud de onda.
 *
 * @param gravity     Gravedad superficial.
 * @param wavelength  Longitudes de onda ascendentes [Angstrom].
 * @param flux        Densidad de flujo [erg/cm^2/s/Angstrom].
 * @param placeholder {@code true} si es un relleno sintético de flujo cero para una gravedad ausente.
 */
public record CleanedSpectrum(
        GravityCode gravity,
        double[] wavelength,
        double[] flux,
        boolean placeholder
) {
    public CleanedSpectrum {
        Objects.requireNonNull(gravity, "La gravedad no puede ser nula.");
        Objects.requireNonNull(wavelength, "El array de longitudes de onda no puede ser nulo.");
        Objects.requireNonNull(flux, "El array de flujo no puede ser nulo.");
        if (wavelength.length != flux.length) {
            throw new IllegalArgumentException("Longitud de onda y flujo deben tener la misma longitud.");
        }
    }

    public int size() {
        return wavelength.length;
    }

    public boolean isEmpty() {
        return wavelength.length == 0;
    }
}
