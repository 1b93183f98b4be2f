package io.github.yok.if97.core.verification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.if97.EngineFixtures;
import io.github.yok.if97.core.model.Region;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReferencePointVerifierTest {

    private final ReferencePointVerifier verifier =
            new ReferencePointVerifier(EngineFixtures.engine());

    @Test
    void bundledReferenceTablePasses() {
        List<ReferencePoint> points =
                new ReferencePointCsvLoader().load("reference/if97-verification.csv");
        VerificationReport report = verifier.verify(points);
        assertTrue(report.allPassed(), report.toString());
        assertEquals(points.size(), report.passedCount());
    }

    @Test
    void categoriesFollowRegionAndKind() {
        List<ReferencePoint> points = Arrays.asList(
                new ReferencePoint(ReferenceKind.PT, 3.0e6, 300.0, 115.331273, Double.NaN,
                        Double.NaN, Double.NaN),
                new ReferencePoint(ReferenceKind.PT, 25.5837018e6, 650.0, 1863.43019, Double.NaN,
                        Double.NaN, 500.0),
                new ReferencePoint(ReferenceKind.SAT_P, 1.0e6, 453.035632, Double.NaN,
                        Double.NaN, Double.NaN, Double.NaN));
        List<VerificationOutcome> outcomes = verifier.verify(points).getOutcomes();
        assertEquals("LIQUID", outcomes.get(0).getCategory());
        assertEquals(3.0e-4, outcomes.get(0).getTolerance(), 0.0);
        assertEquals("SUPERCRITICAL", outcomes.get(1).getCategory());
        assertEquals(1.0e-3, outcomes.get(1).getTolerance(), 0.0);
        assertEquals("SATURATION", outcomes.get(2).getCategory());
    }

    @Test
    void deviationBeyondToleranceFails() {
        ReferencePoint wrong = new ReferencePoint(ReferenceKind.PT, 1.0e5, 473.15, 2900.0,
                Double.NaN, Double.NaN, Double.NaN);
        VerificationOutcome outcome = verifier.verify(Arrays.asList(wrong)).getOutcomes().get(0);
        assertFalse(outcome.isPassed());
        assertEquals("VAPOR", outcome.getCategory());
        assertTrue(outcome.getMaxRelativeDeviation() > 6.0e-4);
    }

    @Test
    void engineFailureIsReportedAsFailedOutcome() {
        ReferencePoint outside = new ReferencePoint(ReferenceKind.PT, 1.0e6, 900.0, 3000.0,
                Double.NaN, Double.NaN, Double.NaN);
        VerificationReport report = verifier.verify(Arrays.asList(outside));
        VerificationOutcome outcome = report.getOutcomes().get(0);
        assertFalse(outcome.isPassed());
        assertEquals("FAILED", outcome.getCategory());
        assertNotNull(outcome.getFailureMessage());
        assertFalse(report.allPassed());
    }

    @Test
    void toleranceByRegion() {
        assertEquals(3.0e-4, ReferencePointVerifier.toleranceOf(Region.LIQUID), 0.0);
        assertEquals(6.0e-4, ReferencePointVerifier.toleranceOf(Region.VAPOR), 0.0);
        assertEquals(1.0e-3, ReferencePointVerifier.toleranceOf(Region.SUPERCRITICAL), 0.0);
    }
}
