package io.github.yok.if97.core.equation;

import static io.github.yok.if97.core.equation.Region1EquationTest.assertRelative;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.if97.core.model.PhaseState;
import org.junit.jupiter.api.Test;

class Region2EquationTest {

    private final Region2Equation equation = new Region2Equation();

    @Test
    void matchesPublishedValuesAt3500Pa300K() {
        PhaseState s = equation.evaluate(3500.0, 300.0);
        assertRelative(0.254991145e4, s.getEnthalpy(), 1.0e-8);
        assertRelative(0.852238967e1, s.getEntropy(), 1.0e-8);
        assertRelative(0.241169160e4, s.getInternalEnergy(), 1.0e-8);
        assertRelative(1.0 / 0.394913866e2, s.getDensity(), 1.0e-8);
    }

    @Test
    void matchesPublishedValuesAt3500Pa700K() {
        PhaseState s = equation.evaluate(3500.0, 700.0);
        assertRelative(0.333568375e4, s.getEnthalpy(), 1.0e-8);
        assertRelative(0.101749996e2, s.getEntropy(), 1.0e-8);
        assertRelative(0.301262819e4, s.getInternalEnergy(), 1.0e-8);
        assertRelative(1.0 / 0.923015898e2, s.getDensity(), 1.0e-8);
    }

    @Test
    void matchesPublishedValuesAt30MPa700K() {
        PhaseState s = equation.evaluate(30.0e6, 700.0);
        assertRelative(0.263149474e4, s.getEnthalpy(), 1.0e-8);
        assertRelative(0.517540298e1, s.getEntropy(), 1.0e-8);
        assertRelative(0.246861076e4, s.getInternalEnergy(), 1.0e-8);
        assertRelative(1.0 / 0.542946619e-2, s.getDensity(), 1.0e-8);
    }

    @Test
    void enthalpyIncreasesWithTemperatureAlongIsobar() {
        double previous = Double.NEGATIVE_INFINITY;
        for (double t = 380.0; t <= 860.0; t += 40.0) {
            double h = equation.evaluate(1.0e5, t).getEnthalpy();
            assertTrue(h > previous, "T=" + t);
            previous = h;
        }
    }

    @Test
    void subZoneFollowsPressureAndB2bcLine() {
        assertEquals(Region2SubZone.A, Region2SubZone.of(3.0e6, 3000.0));
        assertEquals(Region2SubZone.B, Region2SubZone.of(5.0e6, 2800.0));

        // 20 MPa / 650 K は h ≈ 2624.9 で B2bc 線（≈ 3000.2）より低い
        double h = equation.evaluate(20.0e6, 650.0).getEnthalpy();
        assertEquals(Region2SubZone.C, Region2SubZone.of(20.0e6, h));

        double hb = equation.evaluate(10.0e6, 800.0).getEnthalpy();
        assertEquals(Region2SubZone.B, Region2SubZone.of(10.0e6, hb));
    }

    @Test
    void b2bcEnthalpyMatchesBoundaryEquation() {
        assertEquals(3000.231, Region2SubZone.b2bcEnthalpy(20.0e6), 1.0e-3);
        assertEquals(2859.388, Region2SubZone.b2bcEnthalpy(10.0e6), 1.0e-3);
    }
}
