package phoenixgrid.spectral.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import phoenixgrid.domain.spectrum.CanonicalGrid;

import static org.junit.jupiter.api.Assertions.*;

class FluxConservingRebinnerTest {

    private final FluxConservingRebinner rebinner = new FluxConservingRebinner();

    private static CanonicalGrid uniformGrid() {
        double[] points = new double[10];
        for (int i = 0; i < points.length; i++) {
            points[i] = i + 1.0;
        }
        return new CanonicalGrid(points);
    }

    @Test
    @DisplayName("La suma de valor por anchura de bin conserva la integral de la entrada")
    void resample_conservesIntegratedFlux() {
        // ARRANGE: bins de anchura 1 entre 0.5 y 10.5; entrada f(x) = x en ese tramo
        CanonicalGrid grid = uniformGrid();
        int n = 41;
        double[] wavelength = new double[n];
        double[] flux = new double[n];
        for (int i = 0; i < n; i++) {
            wavelength[i] = 0.5 + i * 0.25;
            flux[i] = wavelength[i];
        }

        // ACT
        double[] result = rebinner.resample(wavelength, flux, grid);

        // ASSERT
        double total = 0.0;
        for (double value : result) {
            total += value * 1.0;
        }
        double expected = (10.5 * 10.5 - 0.5 * 0.5) / 2.0;
        assertEquals(expected, total, 1e-9);
        // La media de f(x) = x sobre cada bin es su centro
        for (int i = 0; i < result.length; i++) {
            assertEquals(grid.valueAt(i), result[i], 1e-9);
        }
    }

    @Test
    @DisplayName("Un flujo constante que cubre toda la rejilla se mantiene constante")
    void resample_constantFlux() {
        double[] result = rebinner.resample(new double[]{0.0, 20.0}, new double[]{3.0, 3.0}, uniformGrid());

        for (double value : result) {
            assertEquals(3.0, value, 1e-12);
        }
    }

    @Test
    @DisplayName("Los bins fuera del dominio de la entrada quedan a 0")
    void resample_zeroOutsideDomain() {
        double[] result = rebinner.resample(new double[]{3.5, 5.5}, new double[]{2.0, 2.0}, uniformGrid());

        assertEquals(0.0, result[0], 0.0);
        assertEquals(0.0, result[1], 0.0);
        assertEquals(2.0, result[3], 1e-12);
        assertEquals(2.0, result[4], 1e-12);
        assertEquals(0.0, result[9], 0.0);
    }

    @Test
    @DisplayName("Con menos de dos puntos de entrada el resultado es nulo")
    void resample_degenerateInput() {
        assertArrayEquals(new double[10], rebinner.resample(new double[]{2.0}, new double[]{5.0}, uniformGrid()), 0.0);
        assertArrayEquals(new double[10], rebinner.resample(new double[0], new double[0], uniformGrid()), 0.0);
    }
}
