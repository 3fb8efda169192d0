package phoenixgrid.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelGroupTest {

    private static final GroupKey KEY = new GroupKey("030", "-1.0");

    private static ModelFile model(String name, String gravity) {
        Path path = Paths.get("/models", name);
        return new ModelFile(path, "030", "-1.0", gravity);
    }

    @Test
    @DisplayName("Conserva el orden de llegada y descarta duplicados por ruta")
    void constructor_shouldKeepOrderAndDropDuplicates() {
        ModelFile a = model("lte030-4.5-1.0a+0.4.BT-Settl.7", "4.5");
        ModelFile b = model("lte030-2.0-1.0a+0.4.BT-Settl.7", "2.0");
        ModelFile aAgain = model("lte030-4.5-1.0a+0.4.BT-Settl.7", "4.5");

        ModelGroup group = new ModelGroup(KEY, List.of(a, b, aAgain));

        assertEquals(2, group.size());
        assertEquals(List.of(a, b), group.files());
    }

    @Test
    @DisplayName("La lista de ficheros no se puede modificar desde fuera")
    void files_shouldBeUnmodifiable() {
        ModelGroup group = new ModelGroup(KEY, List.of(model("lte030-4.5-1.0a", "4.5")));
        assertThrows(UnsupportedOperationException.class, () -> group.files().add(model("lte030-5.0-1.0a", "5.0")));
    }

    @Test
    @DisplayName("Un fichero de otro grupo no se admite")
    void constructor_shouldRejectForeignFiles() {
        ModelFile foreign = new ModelFile(Paths.get("/models/lte031-4.5-1.0a"), "031", "-1.0", "4.5");
        assertThrows(IllegalArgumentException.class, () -> new ModelGroup(KEY, List.of(foreign)));
    }
}
