package phoenixgrid.domain.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.model.GroupKey;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.domain.spectrum.ResampledSpectrum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputGridTest {

    private final CanonicalGrid grid = new CanonicalGrid(new double[]{1.0, 2.0, 3.0});
    private final GridHeader header = GridHeader.builder().card("FILENAME", "x.fits").build();
    private final GroupKey key = new GroupKey("030", "-1.0");

    private List<ResampledSpectrum> columns() {
        List<ResampledSpectrum> columns = new ArrayList<>();
        for (GravityCode gravity : GravityCode.values()) {
            columns.add(new ResampledSpectrum(gravity, new double[grid.size()]));
        }
        return columns;
    }

    @Test
    @DisplayName("Acepta doce columnas alineadas en orden canónico")
    void constructor_validColumns() {
        OutputGrid output = new OutputGrid("x.fits", key, header, grid, columns());
        assertEquals(12, output.fluxColumns().size());
        assertSame(grid, output.wavelengthGrid());
        assertEquals(GravityCode.G35, output.column(GravityCode.G35).gravity());
    }

    @Test
    @DisplayName("Rechaza menos de doce columnas")
    void constructor_missingColumn() {
        List<ResampledSpectrum> columns = columns();
        columns.remove(11);
        assertThrows(IllegalArgumentException.class, () -> new OutputGrid("x.fits", key, header, grid, columns));
    }

    @Test
    @DisplayName("Rechaza columnas fuera de orden")
    void constructor_outOfOrder() {
        List<ResampledSpectrum> columns = columns();
        Collections.swap(columns, 0, 1);
        assertThrows(IllegalArgumentException.class, () -> new OutputGrid("x.fits", key, header, grid, columns));
    }

    @Test
    @DisplayName("Rechaza columnas no alineadas con la rejilla")
    void constructor_misaligned() {
        List<ResampledSpectrum> columns = columns();
        columns.set(4, new ResampledSpectrum(GravityCode.G20, new double[2]));
        assertThrows(IllegalArgumentException.class, () -> new OutputGrid("x.fits", key, header, grid, columns));
    }

    @Test
    @DisplayName("La cabecera no admite palabras clave repetidas ni de más de 8 caracteres")
    void header_validation() {
        GridHeader.Builder builder = GridHeader.builder().card("TEFF", 3000);
        assertThrows(IllegalArgumentException.class, () -> builder.card("TEFF", 4000));
        assertThrows(IllegalArgumentException.class, () -> GridHeader.builder().card("TOOLONGKEY", "x"));
    }
}
