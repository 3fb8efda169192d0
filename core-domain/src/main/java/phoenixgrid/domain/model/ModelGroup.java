package phoenixgrid.domain.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Conjunto ordenado de modelos que comparten temperatura y metalicidad.
 * <p>
 * Conserva el orden de primera aparición y descarta los ficheros repetidos por ruta.
 *
 * @param key   Clave del grupo.
 * @param files Ficheros del grupo, sin duplicados.
 */
public record ModelGroup(GroupKey key, List<ModelFile> files) {

    public ModelGroup {
        Objects.requireNonNull(key, "La clave del grupo no puede ser nula.");
        Objects.requireNonNull(files, "La lista de ficheros no puede ser nula.");

        Set<Path> seen = new LinkedHashSet<>();
        List<ModelFile> unique = new ArrayList<>(files.size());
        for (ModelFile file : files) {
            if (!key.equals(file.groupKey())) {
                throw new IllegalArgumentException("El fichero " + file.path() + " no pertenece al grupo " + key);
            }
            if (seen.add(file.path())) {
                unique.add(file);
            }
        }
        files = Collections.unmodifiableList(unique);
    }

    public int size() {
        return files.size();
    }
}
