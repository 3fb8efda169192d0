package phoenixgrid.spectral.impl;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.domain.exception.DuplicateGravityCodeException;
import phoenixgrid.domain.exception.EmptyGroupException;
import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.model.GroupKey;
import phoenixgrid.domain.spectrum.CleanedSpectrum;
import phoenixgrid.domain.spectrum.RawSpectrum;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Convierte los espectros leídos a unidades físicas y completa las doce gravedades de un grupo.
 * <p>
 * Por cada espectro:
 * <ol>
 * <li>flujo = 1e-8 * 10^(valor almacenado);</li>
 * <li>un flujo igual a 1e-8 (valor almacenado 0) significa "sin flujo registrado": la fila
 * entera se anula y se elimina, no es una medida;</li>
 * <li>se eliminan las filas con longitud de onda 0;</li>
 * <li>se ordena por longitud de onda ascendente (orden estable).</li>
 * </ol>
 * Después, cada gravedad canónica ausente recibe un relleno de flujo cero con las longitudes
 * de onda del primer espectro real con datos, en orden canónico.
 */
@Slf4j
public class SpectrumCleaner {

    /**
     * Suelo de la conversión: el flujo de un valor almacenado igual a 0.
     */
    public static final double FLUX_FLOOR = 1e-8;

    /**
     * Interpreta un número que puede venir con el marcador de exponente Fortran 'D' (ej: "0.1234D+05").
     *
     * @throws NumberFormatException si el texto no es un número.
     */
    public static double parseNumber(String token) {
        return Double.parseDouble(token.replace('D', 'E').replace('d', 'e'));
    }

    /**
     * Convierte un valor almacenado a densidad de flujo [erg/cm^2/s/A].
     */
    public static double toPhysicalFlux(double storedValue) {
        double flux = FLUX_FLOOR * Math.pow(10.0, storedValue);
        return flux == FLUX_FLOOR ? 0.0 : flux;
    }

    /**
     * Indica si el valor almacenado es el centinela "sin flujo registrado".
     */
    public static boolean isSentinel(double storedValue) {
        return FLUX_FLOOR * Math.pow(10.0, storedValue) == FLUX_FLOOR;
    }

    public CleanedSpectrum clean(RawSpectrum raw) {
        double[] wavelength = raw.wavelength();
        double[] stored = raw.storedFlux();

        List<Integer> kept = new ArrayList<>(raw.size());
        int sentinels = 0;
        for (int i = 0; i < raw.size(); i++) {
            if (isSentinel(stored[i])) {
                sentinels++;
            } else if (wavelength[i] != 0.0) {
                kept.add(i);
            }
        }
        // List.sort es estable: filas con la misma longitud de onda conservan el orden del fichero.
        kept.sort(Comparator.comparingDouble(i -> wavelength[i]));

        double[] cleanWavelength = new double[kept.size()];
        double[] cleanFlux = new double[kept.size()];
        for (int k = 0; k < kept.size(); k++) {
            int row = kept.get(k);
            cleanWavelength[k] = wavelength[row];
            cleanFlux[k] = toPhysicalFlux(stored[row]);
        }

        int dropped = raw.size() - kept.size();
        if (dropped > 0) {
            log.debug("log g {}: descartadas {} filas ({} sin flujo registrado, {} con longitud de onda 0)",
                    raw.gravity().getCode(), dropped, sentinels, dropped - sentinels);
        }
        return new CleanedSpectrum(raw.gravity(), cleanWavelength, cleanFlux, false);
    }

    /**
     * Limpia todos los espectros de un grupo y sintetiza los rellenos.
     *
     * @param key     Grupo al que pertenecen.
     * @param spectra Espectros leídos, en cualquier orden.
     * @return Exactamente doce espectros, en el orden de {@link GravityCode}.
     * @throws DuplicateGravityCodeException si dos espectros comparten gravedad.
     * @throws EmptyGroupException           si ningún espectro real conserva filas.
     */
    public List<CleanedSpectrum> cleanGroup(GroupKey key, List<RawSpectrum> spectra) {
        Map<GravityCode, CleanedSpectrum> cleaned = new EnumMap<>(GravityCode.class);
        Map<GravityCode, Path> sources = new EnumMap<>(GravityCode.class);

        for (RawSpectrum raw : spectra) {
            Path previous = sources.putIfAbsent(raw.gravity(), raw.sourcePath());
            if (previous != null) {
                throw new DuplicateGravityCodeException(raw.gravity(), previous, raw.sourcePath());
            }
            cleaned.put(raw.gravity(), clean(raw));
        }

        CleanedSpectrum template = cleaned.values().stream()
                .filter(spectrum -> !spectrum.isEmpty())
                .findFirst()
                .orElseThrow(() -> new EmptyGroupException(key));

        List<CleanedSpectrum> complete = new ArrayList<>(GravityCode.values().length);
        for (GravityCode gravity : GravityCode.values()) {
            CleanedSpectrum spectrum = cleaned.get(gravity);
            if (spectrum == null) {
                log.info("Grupo {}: log g {} sin datos, flujo a 0", key, gravity.getCode());
                spectrum = placeholder(gravity, template);
            }
            complete.add(spectrum);
        }
        return complete;
    }

    private CleanedSpectrum placeholder(GravityCode gravity, CleanedSpectrum template) {
        double[] wavelength = Arrays.copyOf(template.wavelength(), template.size());
        return new CleanedSpectrum(gravity, wavelength, new double[wavelength.length], true);
    }
}
