package io.github.yok.if97.core.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReferencePointCsvLoaderTest {

    private final ReferencePointCsvLoader loader = new ReferencePointCsvLoader();

    @Test
    void loadsBundledReferenceTable() {
        List<ReferencePoint> points = loader.load("reference/if97-verification.csv");
        assertEquals(14, points.size());
        assertEquals(8, points.stream().filter(p -> p.getKind() == ReferenceKind.PT).count());
        assertEquals(3, points.stream().filter(p -> p.getKind() == ReferenceKind.SAT_T).count());
        assertEquals(3, points.stream().filter(p -> p.getKind() == ReferenceKind.SAT_P).count());

        ReferencePoint first = points.get(0);
        assertEquals(3.0e6, first.getPressure(), 0.0);
        assertEquals(300.0, first.getTemperature(), 0.0);
        assertEquals(115.331273, first.getEnthalpy(), 0.0);
    }

    @Test
    void blankColumnsBecomeNaN() throws Exception {
        String csv = "kind,pressure_pa,temperature_k,enthalpy,entropy,internal_energy,density\n"
                + "# comment\n" + "sat_t, 3536.58941 , 300,,,,\n";
        List<ReferencePoint> points = loader.read(new StringReader(csv));
        assertEquals(1, points.size());
        ReferencePoint p = points.get(0);
        assertEquals(ReferenceKind.SAT_T, p.getKind());
        assertEquals(3536.58941, p.getPressure(), 0.0);
        assertTrue(Double.isNaN(p.getEnthalpy()));
        assertTrue(Double.isNaN(p.getDensity()));
    }

    @Test
    void rejectsUnknownKind() {
        String csv = "kind,pressure_pa,temperature_k,enthalpy,entropy,internal_energy,density\n"
                + "PH,1000000,400,,,,\n";
        assertThrows(IllegalArgumentException.class, () -> loader.read(new StringReader(csv)));
    }

    @Test
    void rejectsNonNumericValue() {
        String csv = "kind,pressure_pa,temperature_k,enthalpy,entropy,internal_energy,density\n"
                + "PT,abc,400,,,,\n";
        assertThrows(IllegalArgumentException.class, () -> loader.read(new StringReader(csv)));
    }

    @Test
    void rejectsMissingResource() {
        assertThrows(IllegalArgumentException.class, () -> loader.load("reference/missing.csv"));
        assertThrows(IllegalArgumentException.class, () -> loader.load(""));
    }
}
