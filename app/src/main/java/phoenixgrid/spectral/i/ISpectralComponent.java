package phoenixgrid.spectral.i;

/**
 * Contrato base para cualquier componente numérico del pipeline.
 * Permite identificar los algoritmos en el log sin importar su implementación.
 */
public interface ISpectralComponent {
    /**
     * Nombre corto del algoritmo (ej: "linear-interpolation").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
