package io.github.yok.if97.core.saturation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.if97.EngineFixtures;
import io.github.yok.if97.core.solver.RootFindResult;
import org.junit.jupiter.api.Test;

class SaturationLineTest {

    private final SaturationLine line = EngineFixtures.saturationLine();

    @Test
    void saturationPressureMatchesPublishedValues() {
        assertEquals(0.353658941e4, line.saturationPressure(300.0), 0.353658941e4 * 1.0e-8);
        assertEquals(0.263889776e7, line.saturationPressure(500.0), 0.263889776e7 * 1.0e-8);
        assertEquals(0.123443146e8, line.saturationPressure(600.0), 0.123443146e8 * 1.0e-8);
    }

    @Test
    void saturationTemperatureMatchesPublishedValues() {
        assertRoot(0.372755919e3, line.saturationTemperature(0.1e6));
        assertRoot(0.453035632e3, line.saturationTemperature(1.0e6));
        assertRoot(0.584149488e3, line.saturationTemperature(10.0e6));
    }

    @Test
    void temperatureAndPressureAreMutuallyInverse() {
        for (double p = 1.0e3; p < 22.0e6; p *= 3.0) {
            RootFindResult r = line.saturationTemperature(p);
            assertTrue(r.isConverged(), "P=" + p);
            assertEquals(p, line.saturationPressure(r.getRoot()), p * 1.0e-6, "P=" + p);
        }
    }

    @Test
    void acceptsEnvelopeEndpoints() {
        RootFindResult triple = line.saturationTemperature(611.657);
        assertTrue(triple.isConverged());
        assertEquals(273.16, triple.getRoot(), 1.0e-5);

        RootFindResult critical = line.saturationTemperature(22.064e6);
        assertTrue(critical.isConverged());
        assertEquals(647.096, critical.getRoot(), 1.0e-3);
    }

    @Test
    void rejectsOutOfRangeInput() {
        assertThrows(IllegalArgumentException.class, () -> line.saturationPressure(200.0));
        assertThrows(IllegalArgumentException.class, () -> line.saturationPressure(700.0));
        assertThrows(IllegalArgumentException.class, () -> line.saturationTemperature(100.0));
        assertThrows(IllegalArgumentException.class, () -> line.saturationTemperature(30.0e6));
    }

    private static void assertRoot(double expected, RootFindResult r) {
        assertTrue(r.isConverged());
        assertEquals(expected, r.getRoot(), 1.0e-5);
    }
}
