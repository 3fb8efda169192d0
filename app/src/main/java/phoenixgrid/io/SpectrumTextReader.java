package phoenixgrid.io;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.domain.exception.SpectrumFormatException;
import phoenixgrid.domain.model.GravityCode;
import phoenixgrid.domain.model.ModelFile;
import phoenixgrid.domain.spectrum.RawSpectrum;
import phoenixgrid.spectral.impl.SpectrumCleaner;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Lee el cuerpo de texto de un modelo PHOENIX: columnas separadas por espacios, la primera
 * es la longitud de onda y la segunda el flujo almacenado. El resto de columnas se ignora.
 * <p>
 * Las líneas vacías y las que empiezan por '#' se saltan. Esta clase es thread safe.
 */
@Slf4j
public class SpectrumTextReader {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int INITIAL_CAPACITY = 4096;

    /**
     * @param model   Fichero a leer.
     * @param gravity Gravedad ya validada del fichero.
     * @return El espectro sin convertir, en el orden del fichero.
     * @throws IOException             si el fichero no se puede leer.
     * @throws SpectrumFormatException si alguna fila no tiene dos números válidos.
     */
    public RawSpectrum read(ModelFile model, GravityCode gravity) throws IOException {
        Path path = model.path();
        double[] wavelength = new double[INITIAL_CAPACITY];
        double[] storedFlux = new double[INITIAL_CAPACITY];
        int rows = 0;
        int lineNumber = 0;

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.ISO_8859_1)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }

                String[] tokens = WHITESPACE.split(trimmed);
                if (tokens.length < 2) {
                    throw new SpectrumFormatException(path, lineNumber, "se esperaban al menos 2 columnas");
                }

                if (rows == wavelength.length) {
                    wavelength = Arrays.copyOf(wavelength, rows * 2);
                    storedFlux = Arrays.copyOf(storedFlux, rows * 2);
                }
                try {
                    wavelength[rows] = SpectrumCleaner.parseNumber(tokens[0]);
                    storedFlux[rows] = SpectrumCleaner.parseNumber(tokens[1]);
                } catch (NumberFormatException e) {
                    throw new SpectrumFormatException(path, lineNumber, "número no válido", e);
                }
                rows++;
            }
        }

        log.debug("Leídas {} filas de {} (log g = {})", rows, model.fileName(), gravity.getCode());
        return new RawSpectrum(gravity, Arrays.copyOf(wavelength, rows), Arrays.copyOf(storedFlux, rows), path);
    }
}
