package phoenixgrid.spectral.impl;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.model.ModelFile;
import phoenixgrid.domain.spectrum.RawSpectrum;
import phoenixgrid.io.SpectrumTextReader;

import java.util.concurrent.Callable;

/**
 * Tarea que lee un único fichero de modelo. Pensada para ejecutarse en el pool de trabajo;
 * solo accede a su propio fichero.
 */
@Getter
@RequiredArgsConstructor
public class SpectrumLoadTask implements Callable<RawSpectrum> {

    private final ModelFile model;
    private final GravityCode gravity;
    private final SpectrumTextReader reader;

    @Override
    public RawSpectrum call() throws Exception {
        return reader.read(model, gravity);
    }
}
