package phoenixgrid.spectral.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.factory.CanonicalGridFactory;

import static org.junit.jupiter.api.Assertions.*;

class LinearInterpolationResamplerTest {

    private final LinearInterpolationResampler resampler = new LinearInterpolationResampler();

    @Test
    @DisplayName("Interpola linealmente entre puntos de la entrada")
    void resample_interpolatesBetweenPoints() {
        CanonicalGrid grid = new CanonicalGrid(new double[]{1.5, 2.25, 3.0});

        double[] result = resampler.resample(new double[]{1.0, 2.0, 3.0}, new double[]{10.0, 20.0, 40.0}, grid);

        assertArrayEquals(new double[]{15.0, 25.0, 40.0}, result, 1e-12);
    }

    @Test
    @DisplayName("Fuera del dominio de la entrada el flujo es 0")
    void resample_zeroOutsideDomain() {
        CanonicalGrid grid = new CanonicalGrid(new double[]{0.5, 1.0, 2.0, 3.5});

        double[] result = resampler.resample(new double[]{1.0, 2.0}, new double[]{5.0, 7.0}, grid);

        assertArrayEquals(new double[]{0.0, 5.0, 7.0, 0.0}, result, 1e-12);
    }

    @Test
    @DisplayName("Remuestrear sobre la propia rejilla devuelve la entrada sin cambios")
    void resample_isIdempotentOnCanonicalGrid() {
        CanonicalGrid grid = CanonicalGridFactory.createStandardGrid();
        double[] wavelength = grid.toArray();
        double[] flux = new double[wavelength.length];
        for (int i = 0; i < flux.length; i++) {
            flux[i] = Math.sin(i * 0.01) + 2.0;
        }

        double[] once = resampler.resample(wavelength, flux, grid);
        double[] twice = resampler.resample(wavelength, once, grid);

        assertArrayEquals(flux, once, 0.0);
        assertArrayEquals(once, twice, 0.0);
    }

    @Test
    @DisplayName("Una entrada vacía o de flujo nulo produce una columna nula del tamaño de la rejilla")
    void resample_emptyAndZeroInput() {
        CanonicalGrid grid = new CanonicalGrid(new double[]{1.0, 2.0, 3.0});

        assertArrayEquals(new double[3], resampler.resample(new double[0], new double[0], grid), 0.0);
        assertArrayEquals(new double[3],
                resampler.resample(new double[]{1.0, 3.0}, new double[]{0.0, 0.0}, grid), 0.0);
    }

    @Test
    @DisplayName("Un único punto de entrada solo aporta flujo en su longitud de onda exacta")
    void resample_singlePoint() {
        CanonicalGrid grid = new CanonicalGrid(new double[]{1.0, 2.0, 3.0});

        double[] result = resampler.resample(new double[]{2.0}, new double[]{8.0}, grid);

        assertArrayEquals(new double[]{0.0, 8.0, 0.0}, result, 0.0);
    }
}
