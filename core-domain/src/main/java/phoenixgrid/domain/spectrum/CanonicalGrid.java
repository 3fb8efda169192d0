package phoenixgrid.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * Eje de longitudes de onda común a todas las tablas de salida.
 * <p>
 * Inmutable: se construye una vez por ejecución y se comparte por referencia entre grupos
 * y entre hilos. Los valores solo salen al exterior como copia.
 */
public final class CanonicalGrid {

    private final double[] wavelengths;

    public CanonicalGrid(double[] wavelengths) {
        Objects.requireNonNull(wavelengths, "El array de longitudes de onda no puede ser nulo.");
        this.wavelengths = wavelengths.clone();
    }

    public int size() {
        return wavelengths.length;
    }

    public double valueAt(int index) {
        return wavelengths[index];
    }

    public double first() {
        return wavelengths[0];
    }

    public double last() {
        return wavelengths[wavelengths.length - 1];
    }

    public boolean isStrictlyIncreasing() {
        for (int i = 1; i < wavelengths.length; i++) {
            if (!(wavelengths[i] > wavelengths[i - 1])) {
                return false;
            }
        }
        return true;
    }

    public double[] toArray() {
        return wavelengths.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(wavelengths, ((CanonicalGrid) o).wavelengths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(wavelengths);
    }

    @Override
    public String toString() {
        return "CanonicalGrid[" + wavelengths.length + " puntos, " + first() + " - " + last() + " A]";
    }
}
