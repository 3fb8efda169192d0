package phoenixgrid.factory;

/**
 * Tramo logarítmico (base 10) de la rejilla canónica, con ambos extremos incluidos.
 *
 * @param startExponent Exponente inicial.
 * @param stopExponent  Exponente final.
 * @param points        Número de puntos del tramo.
 */
public record WavelengthBand(double startExponent, double stopExponent, int points) {

    public WavelengthBand {
        if (points < 2) {
            throw new IllegalArgumentException("Un tramo necesita al menos 2 puntos: " + points);
        }
        if (!(stopExponent > startExponent)) {
            throw new IllegalArgumentException("El exponente final debe superar al inicial.");
        }
    }

    public double wavelengthAt(int index) {
        if (index == points - 1) {
            return Math.pow(10.0, stopExponent);
        }
        double step = (stopExponent - startExponent) / (points - 1);
        return Math.pow(10.0, startExponent + index * step);
    }
}
