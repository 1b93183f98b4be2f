package io.github.yok.if97.core.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.if97.core.model.PhaseState;
import org.junit.jupiter.api.Test;

class Region1EquationTest {

    private final Region1Equation equation = new Region1Equation();

    @Test
    void matchesPublishedValuesAt3MPa300K() {
        PhaseState s = equation.evaluate(3.0e6, 300.0);
        assertRelative(0.115331273e3, s.getEnthalpy(), 1.0e-8);
        assertRelative(0.392294792, s.getEntropy(), 1.0e-8);
        assertRelative(0.112324818e3, s.getInternalEnergy(), 1.0e-8);
        assertRelative(1.0 / 0.100215168e-2, s.getDensity(), 1.0e-8);
    }

    @Test
    void matchesPublishedValuesAt80MPa300K() {
        PhaseState s = equation.evaluate(80.0e6, 300.0);
        assertRelative(0.184142828e3, s.getEnthalpy(), 1.0e-8);
        assertRelative(0.368563852, s.getEntropy(), 1.0e-8);
        assertRelative(0.106448356e3, s.getInternalEnergy(), 1.0e-8);
        assertRelative(1.0 / 0.971180894e-3, s.getDensity(), 1.0e-8);
    }

    @Test
    void matchesPublishedValuesAt3MPa500K() {
        PhaseState s = equation.evaluate(3.0e6, 500.0);
        assertRelative(0.975542239e3, s.getEnthalpy(), 1.0e-8);
        assertRelative(0.258041912e1, s.getEntropy(), 1.0e-8);
        assertRelative(0.971934985e3, s.getInternalEnergy(), 1.0e-8);
        assertRelative(1.0 / 0.120241800e-2, s.getDensity(), 1.0e-8);
    }

    @Test
    void enthalpyIncreasesWithTemperatureAlongIsobar() {
        double previous = Double.NEGATIVE_INFINITY;
        for (double t = 280.0; t <= 560.0; t += 20.0) {
            double h = equation.evaluate(10.0e6, t).getEnthalpy();
            assertTrue(h > previous, "T=" + t);
            previous = h;
        }
    }

    @Test
    void rejectsNonFiniteResult() {
        assertThrows(IllegalStateException.class, () -> equation.evaluate(3.0e6, 0.0));
    }

    static void assertRelative(double expected, double actual, double tolerance) {
        assertEquals(expected, actual, Math.abs(expected) * tolerance);
    }
}
