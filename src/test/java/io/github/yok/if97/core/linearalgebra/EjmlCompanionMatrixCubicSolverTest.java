package io.github.yok.if97.core.linearalgebra;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class EjmlCompanionMatrixCubicSolverTest {

    private final CubicEquationSolver solver = new EjmlCompanionMatrixCubicSolver();

    @Test
    void threeDistinctRootsAreSortedAscending() {
        double[] roots = solver.realRoots(-6.0, 11.0, -6.0);
        assertArrayEquals(new double[] {1.0, 2.0, 3.0}, roots, 1.0e-9);
    }

    @Test
    void complexPairIsDiscarded() {
        double[] roots = solver.realRoots(-2.0, 1.0, -2.0);
        assertEquals(1, roots.length);
        assertEquals(2.0, roots[0], 1.0e-9);
    }

    @Test
    void agreesWithAnalyticSolver() {
        CubicEquationSolver analytic = new AnalyticCubicEquationSolver();
        double a2 = -0.95;
        double a1 = 0.12;
        double a0 = -0.004;
        double[] expected = analytic.realRoots(a2, a1, a0);
        double[] actual = solver.realRoots(a2, a1, a0);
        assertArrayEquals(expected, actual, 1.0e-9);
    }

    @Test
    void rejectsNonFiniteCoefficients() {
        assertThrows(IllegalArgumentException.class,
                () -> solver.realRoots(1.0, 1.0, Double.NaN));
    }
}
