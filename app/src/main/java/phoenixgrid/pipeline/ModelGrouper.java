package phoenixgrid.pipeline;

import lombok.extern.slf4j.Slf4j;
import phoenixgrid.domain.exception.ModelFileNameException;
import phoenixgrid.domain.model.GroupKey;
import phoenixgrid.domain.model.ModelFile;
import phoenixgrid.domain.model.ModelGroup;
import phoenixgrid.io.ModelFileNameParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reparte los ficheros de modelo en grupos (temperatura, metalicidad).
 * <p>
 * Los grupos conservan el orden de primera aparición de su clave, así que los logs de dos
 * ejecuciones sobre la misma entrada son comparables. Los ficheros con nombre no válido no
 * entran en ningún grupo y se devuelven aparte.
 */
@Slf4j
public class ModelGrouper {

    /**
     * @param groups   Grupos en orden de primera aparición.
     * @param rejected Ficheros cuyo nombre no respeta el esquema, con su error.
     */
    public record GroupingResult(Map<GroupKey, ModelGroup> groups, List<ModelFileNameException> rejected) {
    }

    public GroupingResult group(List<Path> modelPaths) {
        log.info("Agrupando {} ficheros por temperatura y metalicidad", modelPaths.size());

        Map<GroupKey, List<ModelFile>> members = new LinkedHashMap<>();
        List<ModelFileNameException> rejected = new ArrayList<>();

        for (Path path : modelPaths) {
            ModelFile model;
            try {
                model = ModelFileNameParser.parse(path);
            } catch (ModelFileNameException e) {
                log.error("Fichero descartado: {}", e.getMessage());
                rejected.add(e);
                continue;
            }
            members.computeIfAbsent(model.groupKey(), key -> new ArrayList<>()).add(model);
        }

        Map<GroupKey, ModelGroup> groups = new LinkedHashMap<>();
        members.forEach((key, files) -> {
            ModelGroup group = new ModelGroup(key, files);
            groups.put(key, group);
            log.info("Encontrados {} modelos para temperatura/metalicidad {}", group.size(), key);
        });

        return new GroupingResult(groups, List.copyOf(rejected));
    }
}
