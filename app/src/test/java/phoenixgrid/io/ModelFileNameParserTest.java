package phoenixgrid.io;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import phoenixgrid.domain.exception.ModelFileNameException;
import phoenixgrid.domain.model.GroupKey;
import phoenixgrid.domain.model.ModelFile;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class ModelFileNameParserTest {

    @Test
    @DisplayName("Extrae temperatura, gravedad y metalicidad de los offsets fijos")
    void parse_validName() {
        Path path = Paths.get("/models/lte030-2.0-1.0a+0.0.BT-Settl.7");

        ModelFile model = ModelFileNameParser.parse(path);

        assertEquals("030", model.temperatureCode());
        assertEquals("2.0", model.gravityCode());
        assertEquals("-1.0", model.metallicityCode());
        assertEquals(new GroupKey("030", "-1.0"), model.groupKey());
        assertEquals(path, model.path());
    }

    @Test
    @DisplayName("Metalicidad positiva y temperatura alta")
    void parse_positiveMetallicity() {
        ModelFile model = ModelFileNameParser.parse(Paths.get("lte120-5.5+0.5a+0.0.BT-Settl.7"));
        assertEquals("120", model.temperatureCode());
        assertEquals("5.5", model.gravityCode());
        assertEquals("+0.5", model.metallicityCode());
    }

    @Test
    @DisplayName("La gravedad se extrae sin validar: un código no canónico no es error de nombre")
    void parse_nonCanonicalGravity_isNotRejected() {
        ModelFile model = ModelFileNameParser.parse(Paths.get("lte030-9.9-1.0a+0.0.BT-Settl.7"));
        assertEquals("9.9", model.gravityCode());
    }

    @Test
    @DisplayName("Un nombre demasiado corto se rechaza")
    void parse_shortName() {
        ModelFileNameException e = assertThrows(ModelFileNameException.class,
                () -> ModelFileNameParser.parse(Paths.get("lte030-2.0")));
        assertEquals("ParseError", e.getErrorKind());
        assertEquals(Paths.get("lte030-2.0"), e.getPath());
    }

    @Test
    @DisplayName("Temperatura no numérica o metalicidad mal formada se rechazan")
    void parse_malformedFields() {
        assertThrows(ModelFileNameException.class,
                () -> ModelFileNameParser.parse(Paths.get("lteABC-2.0-1.0a+0.0.BT-Settl.7")));
        assertThrows(ModelFileNameException.class,
                () -> ModelFileNameParser.parse(Paths.get("lte030-2.0x1.0a+0.0.BT-Settl.7")));
    }
}
