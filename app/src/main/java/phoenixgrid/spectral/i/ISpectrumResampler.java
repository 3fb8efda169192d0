package phoenixgrid.spectral.i;

import phoenixgrid.domain.spectrum.CanonicalGrid;

/**
 * Proyecta un espectro definido sobre longitudes de onda irregulares en la rejilla canónica.
 * <p>
 * Contrato común a todas las implementaciones:
 * <ul>
 * <li>la entrada está ordenada de forma ascendente;</li>
 * <li>fuera del dominio de la entrada el resultado es 0;</li>
 * <li>un flujo idénticamente nulo produce una salida exactamente nula.</li>
 * </ul>
 * Las implementaciones deben ser thread safe.
 */
public interface ISpectrumResampler extends ISpectralComponent {

    /**
     * @param wavelength Longitudes de onda de la entrada, ascendentes.
     * @param flux       Flujo en cada longitud de onda.
     * @param grid       Rejilla canónica de destino.
     * @return Un nuevo array de {@code grid.size()} valores.
     */
    double[] resample(double[] wavelength, double[] flux, CanonicalGrid grid);
}
