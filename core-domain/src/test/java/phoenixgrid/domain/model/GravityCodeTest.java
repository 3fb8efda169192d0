package phoenixgrid.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GravityCodeTest {

    @Test
    @DisplayName("Hay exactamente doce gravedades canónicas, de 0.0 a 5.5 en pasos de 0.5")
    void values_shouldCoverCanonicalRange() {
        GravityCode[] values = GravityCode.values();
        assertEquals(12, values.length);
        for (int i = 0; i < values.length; i++) {
            assertEquals(i * 0.5, values[i].getValue(), 1e-12);
            assertEquals("LOGG" + (i + 1), values[i].getHeaderKeyword());
        }
    }

    @Test
    @DisplayName("fromCode resuelve el texto exacto del nombre de fichero")
    void fromCode_shouldResolveKnownCodes() {
        assertEquals(GravityCode.G00, GravityCode.fromCode("0.0").orElseThrow());
        assertEquals(GravityCode.G20, GravityCode.fromCode("2.0").orElseThrow());
        assertEquals(GravityCode.G55, GravityCode.fromCode("5.5").orElseThrow());
        assertEquals("g45", GravityCode.fromCode("4.5").orElseThrow().getColumnName());
    }

    @Test
    @DisplayName("fromCode rechaza valores fuera de la rejilla o con otro formato")
    void fromCode_shouldRejectUnknownCodes() {
        assertTrue(GravityCode.fromCode("9.9").isEmpty());
        assertTrue(GravityCode.fromCode("6.0").isEmpty());
        assertTrue(GravityCode.fromCode("2.00").isEmpty());
        assertTrue(GravityCode.fromCode("+2.").isEmpty());
        assertTrue(GravityCode.fromCode("").isEmpty());
    }
}
