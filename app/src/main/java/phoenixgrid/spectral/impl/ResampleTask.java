package phoenixgrid.spectral.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.domain.spectrum.CleanedSpectrum;
import phoenixgrid.domain.spectrum.ResampledSpectrum;
import phoenixgrid.spectral.i.ISpectrumResampler;

import java.util.concurrent.Callable;

/**
 * Tarea que proyecta un espectro limpio sobre la rejilla canónica.
 * La rejilla se comparte entre tareas en modo solo lectura.
 */
@Getter
@RequiredArgsConstructor
public class ResampleTask implements Callable<ResampledSpectrum> {

    private final CleanedSpectrum spectrum;
    private final CanonicalGrid grid;
    private final ISpectrumResampler resampler;

    @Override
    public ResampledSpectrum call() {
        // Los rellenos son nulos por construcción: no hace falta recorrer la rejilla.
        if (spectrum.placeholder()) {
            return new ResampledSpectrum(spectrum.gravity(), new double[grid.size()]);
        }
        double[] flux = resampler.resample(spectrum.wavelength(), spectrum.flux(), grid);
        return new ResampledSpectrum(spectrum.gravity(), flux);
    }
}
