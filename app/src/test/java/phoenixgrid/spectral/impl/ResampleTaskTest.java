package phoenixgrid.spectral.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.domain.spectrum.CleanedSpectrum;
import phoenixgrid.domain.spectrum.ResampledSpectrum;
import phoenixgrid.spectral.i.ISpectrumResampler;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResampleTaskTest {

    private final CanonicalGrid grid = new CanonicalGrid(new double[]{1.0, 2.0, 3.0});

    @Test
    @DisplayName("Un relleno produce una columna nula sin invocar al remuestreador")
    void call_placeholderSkipsResampler() {
        ISpectrumResampler resampler = mock(ISpectrumResampler.class);
        CleanedSpectrum filler = new CleanedSpectrum(GravityCode.G05, new double[]{1.0}, new double[]{0.0}, true);

        ResampledSpectrum result = new ResampleTask(filler, grid, resampler).call();

        assertEquals(GravityCode.G05, result.gravity());
        assertArrayEquals(new double[3], result.flux(), 0.0);
        assertFalse(result.hasData());
        verifyNoInteractions(resampler);
    }

    @Test
    @DisplayName("Un espectro real se delega al remuestreador y conserva su gravedad")
    void call_delegatesToResampler() {
        ISpectrumResampler resampler = mock(ISpectrumResampler.class);
        double[] wavelength = {1.0, 3.0};
        double[] flux = {2.0, 4.0};
        when(resampler.resample(wavelength, flux, grid)).thenReturn(new double[]{2.0, 3.0, 4.0});
        CleanedSpectrum spectrum = new CleanedSpectrum(GravityCode.G40, wavelength, flux, false);

        ResampledSpectrum result = new ResampleTask(spectrum, grid, resampler).call();

        assertEquals(GravityCode.G40, result.gravity());
        assertArrayEquals(new double[]{2.0, 3.0, 4.0}, result.flux(), 0.0);
        assertTrue(result.hasData());
        verify(resampler).resample(wavelength, flux, grid);
    }
}
