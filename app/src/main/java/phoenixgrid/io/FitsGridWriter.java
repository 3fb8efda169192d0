package phoenixgrid.io;

import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import phoenixgrid.domain.grid.GridHeader;
import phoenixgrid.domain.grid.HeaderCard;
import phoenixgrid.domain.grid.OutputGrid;
import phoenixgrid.domain.spectrum.ResampledSpectrum;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Escribe una {@link OutputGrid} como fichero FITS: HDU primaria con la cabecera descriptiva
 * y una extensión BINTABLE con la columna WAVELENGTH y las doce columnas de flujo (formato D).
 * <p>
 * El fichero se escribe primero con la extensión {@value #PARTIAL_SUFFIX} y después se mueve
 * a su nombre final, de modo que un fallo nunca deja una tabla a medias con el nombre definitivo.
 */
@Slf4j
public class FitsGridWriter {

    static final String PARTIAL_SUFFIX = ".part";

    private final boolean overwriteExisting;

    public FitsGridWriter(boolean overwriteExisting) {
        this.overwriteExisting = overwriteExisting;
    }

    /**
     * @param grid            Tabla a escribir.
     * @param outputDirectory Directorio de destino; se crea si no existe.
     * @return Ruta del fichero escrito.
     * @throws FileAlreadyExistsException si el fichero existe y no se permite sobrescribir.
     * @throws IOException                si falla la escritura o la codificación FITS.
     */
    public Path write(OutputGrid grid, Path outputDirectory) throws IOException {
        Path target = outputDirectory.resolve(grid.fileName());
        Path partial = outputDirectory.resolve(grid.fileName() + PARTIAL_SUFFIX);
        log.info("Escribiendo tabla FITS {}", target.toAbsolutePath());

        Files.createDirectories(outputDirectory);
        if (!overwriteExisting && Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString(), null, "la tabla ya existe y no se permite sobrescribir");
        }

        try {
            Fits fits = toFits(grid);
            try (BufferedFile out = new BufferedFile(partial.toFile(), "rw")) {
                fits.write(out);
            }
            moveIntoPlace(partial, target);
            log.debug("Escritura FITS completada con éxito.");
            return target;
        } catch (FitsException e) {
            log.error("Error fatal al codificar la tabla FITS {}", target.toAbsolutePath(), e);
            throw new IOException("No se pudo codificar la tabla FITS " + target, e);
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    private Fits toFits(OutputGrid grid) throws FitsException {
        BasicHDU<?> primary = BasicHDU.getDummyHDU();
        writeHeader(primary.getHeader(), grid.header());

        List<ResampledSpectrum> fluxColumns = grid.fluxColumns();
        Object[] columns = new Object[fluxColumns.size() + 1];
        columns[0] = grid.wavelengthGrid().toArray();
        for (int i = 0; i < fluxColumns.size(); i++) {
            columns[i + 1] = fluxColumns.get(i).flux();
        }

        BinaryTableHDU table = (BinaryTableHDU) Fits.makeHDU(new BinaryTable(columns));
        Header tableHeader = table.getHeader();
        table.setColumnName(0, OutputGrid.WAVELENGTH_COLUMN, "wavelength");
        tableHeader.addValue("TUNIT1", OutputGrid.WAVELENGTH_UNIT, "physical unit of field");
        for (int i = 0; i < fluxColumns.size(); i++) {
            ResampledSpectrum column = fluxColumns.get(i);
            table.setColumnName(i + 1, column.gravity().getColumnName(), "flux for log g = " + column.gravity().getCode());
            tableHeader.addValue("TUNIT" + (i + 2), OutputGrid.FLUX_UNIT, "physical unit of field");
        }

        Fits fits = new Fits();
        fits.addHDU(primary);
        fits.addHDU(table);
        return fits;
    }

    private void writeHeader(Header target, GridHeader source) throws FitsException {
        for (HeaderCard card : source.getCards()) {
            Object value = card.value();
            if (value instanceof String) {
                target.addValue(card.keyword(), (String) value, card.comment());
            } else if (value instanceof Integer || value instanceof Long) {
                target.addValue(card.keyword(), ((Number) value).longValue(), card.comment());
            } else if (value instanceof Number) {
                target.addValue(card.keyword(), ((Number) value).doubleValue(), card.comment());
            } else if (value instanceof Boolean) {
                target.addValue(card.keyword(), (Boolean) value, card.comment());
            } else {
                throw new IllegalArgumentException("Tipo de valor no soportado en " + card.keyword() + ": " + value.getClass());
            }
        }
        for (String comment : source.getComments()) {
            target.insertComment(comment);
        }
        for (String line : source.getHistory()) {
            target.insertHistory(line);
        }
    }

    /**
     * Mueve el fichero temporal a su nombre final.
     * <p>
     * Sin permiso de sobrescritura el movimiento no lleva {@code ATOMIC_MOVE} ni
     * {@code REPLACE_EXISTING}: un rename atómico reemplaza el destino en POSIX, y así es el
     * propio sistema de ficheros el que rechaza un destino aparecido después de la comprobación inicial.
     *
     * @throws FileAlreadyExistsException si el destino existe y no se permite sobrescribir.
     */
    void moveIntoPlace(Path partial, Path target) throws IOException {
        if (!overwriteExisting) {
            Files.move(partial, target);
            return;
        }
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Movimiento atómico no soportado en {}, se usa movimiento simple", target.getParent());
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
