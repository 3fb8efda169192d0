package phoenixgrid.factory;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.config.ConversionConfig.HeaderMetadata;
import phoenixgrid.domain.grid.GridHeader;
import phoenixgrid.domain.grid.OutputGrid;
import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.model.GroupKey;
import phoenixgrid.domain.spectrum.CanonicalGrid;
import phoenixgrid.domain.spectrum.ResampledSpectrum;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ensambla la {@link OutputGrid} de un grupo: cabecera descriptiva más las doce columnas
 * de flujo en orden canónico.
 * <p>
 * Por cada gravedad la cabecera lleva una marca {@code LOGGn}: el valor literal de log g si
 * la columna tiene algún flujo distinto de cero, o {@value #SENTINEL_MARKER} si no hay datos
 * para esa gravedad en el bin temperatura/metalicidad.
 */
@Slf4j
public class OutputGridFactory {

    public static final String SENTINEL_MARKER = "-999";

    private final HeaderMetadata metadata;
    private final Clock clock;

    public OutputGridFactory(HeaderMetadata metadata) {
        this(metadata, Clock.systemUTC());
    }

    public OutputGridFactory(HeaderMetadata metadata, Clock clock) {
        this.metadata = metadata;
        this.clock = clock;
    }

    /**
     * @param key     Grupo de origen.
     * @param grid    Rejilla canónica compartida.
     * @param spectra Los doce espectros remuestreados, en cualquier orden.
     * @return La tabla lista para escribir.
     * @throws IllegalStateException si falta alguna gravedad o hay repetidas.
     */
    public OutputGrid create(GroupKey key, CanonicalGrid grid, List<ResampledSpectrum> spectra) {
        Map<GravityCode, ResampledSpectrum> byGravity = new EnumMap<>(GravityCode.class);
        for (ResampledSpectrum spectrum : spectra) {
            if (byGravity.put(spectrum.gravity(), spectrum) != null) {
                throw new IllegalStateException("Grupo " + key + ": columna " + spectrum.gravity().getColumnName() + " repetida");
            }
        }

        List<ResampledSpectrum> ordered = new ArrayList<>(GravityCode.values().length);
        for (GravityCode gravity : GravityCode.values()) {
            ResampledSpectrum column = byGravity.get(gravity);
            if (column == null) {
                throw new IllegalStateException("Grupo " + key + ": falta la columna " + gravity.getColumnName());
            }
            ordered.add(column);
        }

        String fileName = key.outputFileName();
        log.info("Creando tabla {} para temperatura/metalicidad {}", fileName, key);
        return new OutputGrid(fileName, key, buildHeader(key, fileName, ordered), grid, ordered);
    }

    private GridHeader buildHeader(GroupKey key, String fileName, List<ResampledSpectrum> ordered) {
        GridHeader.Builder header = GridHeader.builder()
                .card("FILENAME", fileName, "Name of file")
                .card("MAPKEY", metadata.getMapKey(), "Mapping identifier for filetype")
                .card("CONTACT", metadata.getContact(), "ReDCaT Team Deputy/Lead")
                .card("CREATED", LocalDate.now(clock).toString(), "Date of file creation")
                .card("DESCRIP", metadata.getDescription())
                .card("FILE_TYP", metadata.getFileType(), "Type of file")
                .card("SYSTEMS", metadata.getSystems(), "Systems that will use this filetype")
                .card("REASON", metadata.getReason())
                .card("TEFF", key.effectiveTemperature(), "Effective temperature in K")
                .card("LOG_Z", key.metallicity(), "Log of stellar metallicity")
                .card("FLUXUNT", "Flambda", "erg/cm^2/s/Angstrom")
                .comment(metadata.getComment())
                .history(metadata.getHistory());

        for (ResampledSpectrum column : ordered) {
            GravityCode gravity = column.gravity();
            String marker = column.hasData() ? gravity.getCode() : SENTINEL_MARKER;
            header.card(gravity.getHeaderKeyword(), marker, "log g of column " + gravity.getColumnName());
        }
        return header.build();
    }
}
