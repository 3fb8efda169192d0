package phoenixgrid.domain.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Clave (temperatura, metalicidad) que identifica un grupo de modelos y su tabla de salida.
 *
 * @param temperatureCode Código de temperatura de 3 dígitos, en centenas de Kelvin.
 * @param metallicityCode Código de metalicidad con signo, ej: "-1.0" o "+0.5".
 */
public record GroupKey(String temperatureCode, String metallicityCode) {

    public GroupKey {
        Objects.requireNonNull(temperatureCode, "El código de temperatura no puede ser nulo.");
        Objects.requireNonNull(metallicityCode, "El código de metalicidad no puede ser nulo.");
    }

    /**
     * Temperatura efectiva en Kelvin ("030" -> 3000).
     */
    public int effectiveTemperature() {
        return Integer.parseInt(temperatureCode) * 100;
    }

    /**
     * Logaritmo de la metalicidad ("-1.0" -> -1.0).
     */
    public double metallicity() {
        return Double.parseDouble(metallicityCode);
    }

    /**
     * "-0.0" también cuenta como negativo: así se nombran los modelos solares en la rejilla original.
     */
    public boolean isMetallicityNegative() {
        return metallicityCode.startsWith("-");
    }

    /**
     * Nombre de la tabla FITS: {@code phoenix{m|p}{dígitos}_{temperatura}.fits},
     * con la temperatura rellenada a 5 cifras (ej: phoenixm10_03000.fits).
     */
    public String outputFileName() {
        String sign = isMetallicityNegative() ? "m" : "p";
        String digits = metallicityCode.replace("-", "").replace("+", "").replace(".", "");
        return String.format(Locale.ROOT, "phoenix%s%s_%05d.fits", sign, digits, effectiveTemperature());
    }

    @Override
    public String toString() {
        return temperatureCode + "/" + metallicityCode;
    }
}
