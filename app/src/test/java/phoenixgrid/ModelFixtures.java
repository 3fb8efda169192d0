package phoenixgrid;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Crea ficheros de modelo PHOENIX sintéticos para los tests.
 */
public final class ModelFixtures {

    private ModelFixtures() {
    }

    /**
     * Nombre con el esquema real de la rejilla BT-Settl, ej: "lte030-2.0-1.0a+0.0.BT-Settl.7".
     */
    public static String modelName(String temperature, String gravity, String metallicity) {
        return "lte" + temperature + "-" + gravity + metallicity + "a+0.0.BT-Settl.7";
    }

    /**
     * Escribe un modelo con filas "longitud_de_onda valor_almacenado" en notación Fortran.
     *
     * @param rows Pares {longitud de onda, valor almacenado}.
     */
    public static Path writeModel(Path directory, String temperature, String gravity, String metallicity,
                                  double[]... rows) throws IOException {
        StringBuilder body = new StringBuilder();
        for (double[] row : rows) {
            body.append(String.format(Locale.ROOT, " %.7E %.7E 0.0000D+00%n", row[0], row[1])
                    .replace('E', 'D'));
        }
        Path path = directory.resolve(modelName(temperature, gravity, metallicity));
        Files.writeString(path, body.toString(), StandardCharsets.ISO_8859_1);
        return path;
    }

    /**
     * Espectro plano: flujo almacenado constante en las longitudes de onda dadas.
     */
    public static Path writeFlatModel(Path directory, String temperature, String gravity, String metallicity,
                                      double storedValue, double... wavelengths) throws IOException {
        double[][] rows = new double[wavelengths.length][];
        for (int i = 0; i < wavelengths.length; i++) {
            rows[i] = new double[]{wavelengths[i], storedValue};
        }
        return writeModel(directory, temperature, gravity, metallicity, rows);
    }
}
