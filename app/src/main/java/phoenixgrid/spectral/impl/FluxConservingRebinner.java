package phoenixgrid.spectral.impl;

import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.spectral.i.ISpectrumResampler;

import java.util.Arrays;

/**
 * Rebinning que conserva el flujo integrado.
 * <p>
 * Cada punto de la rejilla representa un bin cuyos bordes son los puntos medios con sus
 * vecinos (los extremos se reflejan). El valor del bin es la media, sobre el bin, de la
 * interpolación lineal de la entrada (nula fuera de su dominio). La integral se evalúa con
 * una primitiva acumulada, así que la suma de valor * anchura de todos los bins coincide con
 * la integral trapezoidal de la entrada sobre el tramo cubierto por la rejilla.
 * <p>
 * Con menos de dos puntos de entrada no hay área que repartir y el resultado es nulo.
 */
public class FluxConservingRebinner implements ISpectrumResampler {

    @Override
    public String getName() {
        return "flux-conserving-rebin";
    }

    @Override
    public String getDescription() {
        return "Media de la interpolación lineal sobre cada bin de la rejilla (integral trapezoidal)";
    }

    @Override
    public double[] resample(double[] wavelength, double[] flux, CanonicalGrid grid) {
        double[] result = new double[grid.size()];
        int n = wavelength.length;
        if (n < 2 || grid.size() < 2) {
            return result;
        }

        double[] cumulative = cumulativeIntegral(wavelength, flux);
        double previousPrimitive = primitive(wavelength, flux, cumulative, lowerEdge(grid, 0));

        for (int i = 0; i < result.length; i++) {
            double lo = lowerEdge(grid, i);
            double hi = upperEdge(grid, i);
            double currentPrimitive = primitive(wavelength, flux, cumulative, hi);
            result[i] = (currentPrimitive - previousPrimitive) / (hi - lo);
            previousPrimitive = currentPrimitive;
        }
        return result;
    }

    private static double lowerEdge(CanonicalGrid grid, int i) {
        if (i == 0) {
            return grid.valueAt(0) - (grid.valueAt(1) - grid.valueAt(0)) / 2.0;
        }
        return (grid.valueAt(i - 1) + grid.valueAt(i)) / 2.0;
    }

    private static double upperEdge(CanonicalGrid grid, int i) {
        int last = grid.size() - 1;
        if (i == last) {
            return grid.valueAt(last) + (grid.valueAt(last) - grid.valueAt(last - 1)) / 2.0;
        }
        return (grid.valueAt(i) + grid.valueAt(i + 1)) / 2.0;
    }

    /**
     * cumulative[k] = integral de la entrada entre wavelength[0] y wavelength[k].
     */
    private static double[] cumulativeIntegral(double[] wavelength, double[] flux) {
        double[] cumulative = new double[wavelength.length];
        for (int k = 1; k < wavelength.length; k++) {
            double width = wavelength[k] - wavelength[k - 1];
            cumulative[k] = cumulative[k - 1] + width * (flux[k] + flux[k - 1]) / 2.0;
        }
        return cumulative;
    }

    /**
     * Integral de la entrada entre wavelength[0] y x.
     */
    private static double primitive(double[] wavelength, double[] flux, double[] cumulative, double x) {
        int n = wavelength.length;
        if (x <= wavelength[0]) {
            return 0.0;
        }
        if (x >= wavelength[n - 1]) {
            return cumulative[n - 1];
        }

        int idx = Arrays.binarySearch(wavelength, x);
        if (idx >= 0) {
            return cumulative[idx];
        }
        // x cae entre wavelength[j] y wavelength[j + 1]
        int j = -idx - 2;
        double width = wavelength[j + 1] - wavelength[j];
        double t = (x - wavelength[j]) / width;
        double fx = flux[j] + t * (flux[j + 1] - flux[j]);
        return cumulative[j] + (x - wavelength[j]) * (flux[j] + fx) / 2.0;
    }
}
