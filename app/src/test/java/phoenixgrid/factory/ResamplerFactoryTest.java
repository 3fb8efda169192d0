package phoenixgrid.factory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import phoenixgrid.config.ConversionConfig.ResamplingStrategy;
import phoenixgrid.spectral.impl.FluxConservingRebinner;
import phoenixgrid.spectral.impl.LinearInterpolationResampler;

import static org.junit.jupiter.api.Assertions.*;

class ResamplerFactoryTest {

    @Test
    @DisplayName("Cada estrategia produce su implementación; sin estrategia se usa la interpolación lineal")
    void create_byStrategy() {
        assertInstanceOf(LinearInterpolationResampler.class, ResamplerFactory.create(ResamplingStrategy.LINEAR_INTERPOLATION));
        assertInstanceOf(FluxConservingRebinner.class, ResamplerFactory.create(ResamplingStrategy.FLUX_CONSERVING_REBIN));
        assertInstanceOf(LinearInterpolationResampler.class, ResamplerFactory.create(null));
    }
}
