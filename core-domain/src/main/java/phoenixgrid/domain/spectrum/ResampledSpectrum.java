package phoenixgrid.domain.spectrum;

import phoenixgrid.domain.model.GravityCode;

import java.util.Objects;

/**
 * Flujo de una gravedad proyectado sobre la rejilla canónica, índice a índice.
 *
 * @param gravity Gravedad superficial.
 * @param flux    Densidad de flujo en cada punto de la rejilla canónica.
 */
public record ResampledSpectrum(GravityCode gravity, double[] flux) {

    public ResampledSpectrum {
        Objects.requireNonNull(gravity, "La gravedad no puede ser nula.");
        Objects.requireNonNull(flux, "El array de flujo no puede ser nulo.");
    }

    /**
     * Indica si la columna tiene algún valor distinto de cero.
     */
    public boolean hasData() {
        for (double value : flux) {
            if (value != 0.0) {
                return true;
            }
        }
        return false;
    }
}
