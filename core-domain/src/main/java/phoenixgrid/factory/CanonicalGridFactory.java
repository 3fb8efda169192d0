package phoenixgrid.factory;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.domain.exception.GridConstructionException;
import phoenixgrid.domain.spectrum.CanonicalGrid;

import java.util.List;

/**
 * Fábrica de la rejilla canónica de longitudes de onda.
 * <p>
 * La rejilla es la concatenación de tres tramos logarítmicos: azul (10 A - ~5 000 A, 1000 puntos),
 * verde (~5 000 A - ~285 000 A, 3000 puntos) y rojo (~285 000 A - ~10^7 A, 1000 puntos).
 * Es función pura de constantes fijas, sin ninguna entrada externa.
 */
@Slf4j
public final class CanonicalGridFactory {

    public static final WavelengthBand BLUE_BAND = new WavelengthBand(1.0, 3.695, 1000);
    public static final WavelengthBand GREEN_BAND = new WavelengthBand(3.696, 5.455, 3000);
    public static final WavelengthBand RED_BAND = new WavelengthBand(5.456, 6.998, 1000);

    public static final List<WavelengthBand> STANDARD_BANDS = List.of(BLUE_BAND, GREEN_BAND, RED_BAND);

    /**
     * Prohibido construir esta clase utilidad
     */
    private CanonicalGridFactory() {
    }

    public static CanonicalGrid createStandardGrid() {
        return createGrid(STANDARD_BANDS);
    }

    /**
     * Concatena los tramos en el orden recibido.
     *
     * @throws GridConstructionException si el resultado no es estrictamente creciente.
     */
    public static CanonicalGrid createGrid(List<WavelengthBand> bands) {
        if (bands.isEmpty()) {
            throw new GridConstructionException("La rejilla canónica necesita al menos un tramo.");
        }
        int total = bands.stream().mapToInt(WavelengthBand::points).sum();
        double[] wavelengths = new double[total];

        int ptr = 0;
        for (WavelengthBand band : bands) {
            for (int i = 0; i < band.points(); i++) {
                wavelengths[ptr++] = band.wavelengthAt(i);
            }
        }

        CanonicalGrid grid = new CanonicalGrid(wavelengths);
        if (!grid.isStrictlyIncreasing()) {
            throw new GridConstructionException("La rejilla canónica no es estrictamente creciente: revisar solapes entre tramos " + bands);
        }
        log.info("Rejilla canónica construida: {}", grid);
        return grid;
    }
}
