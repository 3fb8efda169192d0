package phoenixgrid.spectral.impl;

import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.spectral.i.ISpectrumResampler;

/**
 * Evalúa la interpolación lineal de la entrada en cada punto de la rejilla.
 * <p>
 * Recorre entrada y rejilla a la vez (ambas ascendentes), coste O(n + m). Un punto de la
 * rejilla que coincide exactamente con uno de la entrada devuelve su valor sin interpolar,
 * por lo que remuestrear un espectro ya definido sobre la rejilla lo devuelve intacto.
 */
public class LinearInterpolationResampler implements ISpectrumResampler {

    @Override
    public String getName() {
        return "linear-interpolation";
    }

    @Override
    public String getDescription() {
        return "Interpolación lineal punto a punto, flujo 0 fuera del dominio de la entrada";
    }

    @Override
    public double[] resample(double[] wavelength, double[] flux, CanonicalGrid grid) {
        int n = wavelength.length;
        double[] result = new double[grid.size()];
        if (n == 0) {
            return result;
        }

        double lower = wavelength[0];
        double upper = wavelength[n - 1];
        int j = 0;

        for (int i = 0; i < result.length; i++) {
            double x = grid.valueAt(i);
            if (x < lower || x > upper) {
                continue;
            }
            // Avanzar hasta el último punto estrictamente menor que x.
            while (j < n - 1 && wavelength[j + 1] < x) {
                j++;
            }

            if (wavelength[j] == x || j == n - 1) {
                result[i] = flux[j];
            } else if (wavelength[j + 1] == x) {
                result[i] = flux[j + 1];
            } else {
                double t = (x - wavelength[j]) / (wavelength[j + 1] - wavelength[j]);
                result[i] = flux[j] + t * (flux[j + 1] - flux[j]);
            }
        }
        return result;
    }
}
