package io.github.yok.if97.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.if97.core.linearalgebra.AnalyticCubicEquationSolver;
import io.github.yok.if97.core.linearalgebra.EjmlCompanionMatrixCubicSolver;
import org.junit.jupiter.api.Test;

class PengRobinsonEquationTest {

    private final PengRobinsonEquation equation =
            new PengRobinsonEquation(new AnalyticCubicEquationSolver());

    @Test
    void liquidEstimateIsDenserThanVaporEstimateOnSaturationLine() {
        // T = 640 K の飽和圧力
        double p = 20.265942e6;
        double liquid = equation.estimateDensity(p, 640.0, DensityBranch.LIQUID_LIKE);
        double vapor = equation.estimateDensity(p, 640.0, DensityBranch.VAPOR_LIKE);
        assertEquals(328.70, liquid, 0.05);
        assertEquals(156.98, vapor, 0.05);
        assertTrue(liquid > vapor);
    }

    @Test
    void approachesIdealGasAtLowPressure() {
        double ideal = 1.0e5 / (461.526 * 473.15);
        double rho = equation.estimateDensity(1.0e5, 473.15, DensityBranch.VAPOR_LIKE);
        assertEquals(ideal, rho, ideal * 0.01);
    }

    @Test
    void companionMatrixBackendGivesSameEstimate() {
        PengRobinsonEquation ejml = new PengRobinsonEquation(new EjmlCompanionMatrixCubicSolver());
        double p = 25.5837018e6;
        double expected = equation.estimateDensity(p, 650.0, DensityBranch.SUPERCRITICAL);
        double actual = ejml.estimateDensity(p, 650.0, DensityBranch.SUPERCRITICAL);
        assertEquals(expected, actual, 1.0e-6);
    }

    @Test
    void rejectsNonPositiveState() {
        assertThrows(IllegalArgumentException.class,
                () -> equation.estimateDensity(0.0, 650.0, DensityBranch.SUPERCRITICAL));
        assertThrows(NullPointerException.class,
                () -> equation.estimateDensity(1.0e6, 650.0, null));
    }
}
