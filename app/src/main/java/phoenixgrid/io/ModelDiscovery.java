package phoenixgrid.io;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Localiza los ficheros de modelo candidatos en un directorio.
 * <p>
 * Una lista vacía no es un error aquí: el orquestador decide que la ejecución no puede continuar.
 */
@Slf4j
public class ModelDiscovery {

    /**
     * Lista los ficheros regulares cuyo nombre cumple el patrón glob, ordenados por nombre
     * para que dos ejecuciones sobre el mismo directorio procesen los grupos en el mismo orden.
     *
     * @param modelDirectory Directorio de modelos.
     * @param globPattern    Patrón glob sobre el nombre del fichero (ej: "lte*").
     * @return Rutas candidatas, posiblemente vacía.
     * @throws IOException si el directorio no existe o no se puede leer.
     */
    public List<Path> findModels(Path modelDirectory, String globPattern) throws IOException {
        log.info("Buscando modelos '{}' en {}", globPattern, modelDirectory.toAbsolutePath());

        if (!Files.isDirectory(modelDirectory)) {
            throw new NoSuchFileException(modelDirectory.toAbsolutePath().toString(), null, "no es un directorio");
        }

        List<Path> models = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(modelDirectory, globPattern)) {
            for (Path candidate : stream) {
                if (Files.isRegularFile(candidate)) {
                    models.add(candidate);
                }
            }
        }
        models.sort(Comparator.comparing(path -> path.getFileName().toString()));

        log.info("Total de ficheros encontrados: {}", models.size());
        return models;
    }
}
