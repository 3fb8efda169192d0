package phoenixgrid.factory;

import phoenixgrid.config.ConversionConfig.ResamplingStrategy;
import phoenixgrid.spectral.i.ISpectrumResampler;
import phoenixgrid.spectral.impl.FluxConservingRebinner;
import phoenixgrid.spectral.impl.LinearInterpolationResampler;

/**
 * Traduce la estrategia de configuración a la implementación de remuestreo.
 * Desacopla la capa de configuración de la capa numérica.
 */
public final class ResamplerFactory {

    /**
     * Prohibido construir esta clase utilidad
     */
    private ResamplerFactory() {
    }

    public static ISpectrumResampler create(ResamplingStrategy strategy) {
        if (strategy == null) return new LinearInterpolationResampler();

        switch (strategy) {
            case FLUX_CONSERVING_REBIN: return new FluxConservingRebinner();
            case LINEAR_INTERPOLATION:
            default:                    return new LinearInterpolationResampler();
        }
    }
}
