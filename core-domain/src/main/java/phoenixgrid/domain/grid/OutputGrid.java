package phoenixgrid.domain.grid;

import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.model.GroupKey;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.domain.spectrum.ResampledSpectrum;

import java.util.List;
import java.util.Objects;

/**
 * Tabla espectral completa de un grupo, lista para escribirse.
 * <p>
 * Contiene siempre exactamente doce columnas de flujo en el orden de {@link GravityCode},
 * todas alineadas con la rejilla canónica compartida.
 *
 * @param fileName        Nombre del fichero de salida.
 * @param groupKey        Grupo del que procede.
 * @param header          Cabecera descriptiva.
 * @param wavelengthGrid  Rejilla canónica (la misma instancia para todos los grupos).
 * @param fluxColumns     Doce espectros remuestreados, en orden canónico.
 */
public record OutputGrid(
        String fileName,
        GroupKey groupKey,
        GridHeader header,
        CanonicalGrid wavelengthGrid,
        List<ResampledSpectrum> fluxColumns
) {
    public static final String WAVELENGTH_COLUMN = "WAVELENGTH";
    public static final String WAVELENGTH_UNIT = "ANGSTROM";
    public static final String FLUX_UNIT = "FLAM";

    public OutputGrid {
        Objects.requireNonNull(fileName, "El nombre del fichero no puede ser nulo.");
        Objects.requireNonNull(groupKey, "La clave del grupo no puede ser nula.");
        Objects.requireNonNull(header, "La cabecera no puede ser nula.");
        Objects.requireNonNull(wavelengthGrid, "La rejilla canónica no puede ser nula.");
        Objects.requireNonNull(fluxColumns, "Las columnas de flujo no pueden ser nulas.");

        GravityCode[] expected = GravityCode.values();
        if (fluxColumns.size() != expected.length) {
            throw new IllegalArgumentException("Se esperaban " + expected.length + " columnas de flujo y hay " + fluxColumns.size());
        }
        for (int i = 0; i < expected.length; i++) {
            ResampledSpectrum column = fluxColumns.get(i);
            if (column.gravity() != expected[i]) {
                throw new IllegalArgumentException("Columna " + i + " fuera de orden: " + column.gravity());
            }
            if (column.flux().length != wavelengthGrid.size()) {
                throw new IllegalArgumentException("La columna " + column.gravity().getColumnName() + " no está alineada con la rejilla.");
            }
        }
        fluxColumns = List.copyOf(fluxColumns);
    }

    public ResampledSpectrum column(GravityCode gravity) {
        return fluxColumns.get(gravity.ordinal());
    }
}
