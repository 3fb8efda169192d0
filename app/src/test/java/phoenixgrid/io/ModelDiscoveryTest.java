package phoenixgrid.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelDiscoveryTest {

    @TempDir
    Path tempDir;

    private final ModelDiscovery discovery = new ModelDiscovery();

    @Test
    @DisplayName("Devuelve solo ficheros regulares que cumplen el patrón, ordenados por nombre")
    void findModels_shouldFilterAndSort() throws IOException {
        // ARRANGE
        Files.createFile(tempDir.resolve("lte031-2.0-1.0a+0.0.BT-Settl.7"));
        Files.createFile(tempDir.resolve("lte030-2.0-1.0a+0.0.BT-Settl.7"));
        Files.createFile(tempDir.resolve("README.txt"));
        Files.createDirectory(tempDir.resolve("lte-directory"));

        // ACT
        List<Path> models = discovery.findModels(tempDir, "lte*");

        // ASSERT
        assertEquals(2, models.size());
        assertEquals("lte030-2.0-1.0a+0.0.BT-Settl.7", models.get(0).getFileName().toString());
        assertEquals("lte031-2.0-1.0a+0.0.BT-Settl.7", models.get(1).getFileName().toString());
    }

    @Test
    @DisplayName("Un directorio sin coincidencias devuelve una lista vacía")
    void findModels_empty() throws IOException {
        Files.createFile(tempDir.resolve("notes.txt"));
        assertTrue(discovery.findModels(tempDir, "lte*").isEmpty());
    }

    @Test
    @DisplayName("Un directorio inexistente es un error de E/S")
    void findModels_missingDirectory() {
        assertThrows(NoSuchFileException.class, () -> discovery.findModels(tempDir.resolve("nope"), "lte*"));
    }
}
