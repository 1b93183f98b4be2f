package io.github.yok.if97.core.router;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.if97.EngineFixtures;
import io.github.yok.if97.core.model.Region;
import io.github.yok.if97.core.saturation.SaturationLine;
import org.junit.jupiter.api.Test;

class RegionClassifierTest {

    private final SaturationLine line = EngineFixtures.saturationLine();

    private final RegionClassifier classifier = EngineFixtures.regionClassifier();

    @Test
    void subcooledAndSuperheatedBelowRegion3() {
        assertEquals(Region.LIQUID, classifier.classify(1.0e5, 300.0));
        assertEquals(Region.LIQUID, classifier.classify(3.0e6, 500.0));
        assertEquals(Region.LIQUID, classifier.classify(100.0e6, 300.0));
        assertEquals(Region.VAPOR, classifier.classify(1.0e5, 473.15));
        assertEquals(Region.VAPOR, classifier.classify(3500.0, 300.0));
    }

    @Test
    void normalBoilingPointSeparatesPhases() {
        // P_sat(373.15 K) ≈ 101418 Pa
        assertEquals(Region.LIQUID, classifier.classify(101418.0 * 1.001, 373.15));
        assertEquals(Region.VAPOR, classifier.classify(1.0e5, 373.15));
    }

    @Test
    void pointsWithinToleranceOfSaturationLineAreBoundary() {
        double ps = line.saturationPressure(373.15);
        assertEquals(Region.SATURATION_BOUNDARY, classifier.classify(ps, 373.15));
        assertEquals(Region.SATURATION_BOUNDARY, classifier.classify(ps * (1.0 + 1.0e-7), 373.15));
        assertEquals(Region.LIQUID, classifier.classify(ps * (1.0 + 1.0e-5), 373.15));
        assertEquals(Region.VAPOR, classifier.classify(ps * (1.0 - 1.0e-5), 373.15));
    }

    @Test
    void b23LineSeparatesVaporFromRegion3() {
        // B23(640 K) ≈ 18.557 MPa, B23(700 K) ≈ 30.477 MPa
        assertEquals(Region.VAPOR, classifier.classify(18.0e6, 640.0));
        assertEquals(Region.SUPERCRITICAL, classifier.classify(19.0e6, 640.0));
        assertEquals(Region.SUPERCRITICAL, classifier.classify(30.0e6, 640.0));
        assertEquals(Region.VAPOR, classifier.classify(20.0e6, 700.0));
        assertEquals(Region.SUPERCRITICAL, classifier.classify(50.0e6, 700.0));
        assertEquals(Region.VAPOR, classifier.classify(10.0e6, 863.15));
    }

    @Test
    void region3StartsAbove623K() {
        assertEquals(Region.LIQUID, classifier.classify(50.0e6, 623.15));
        assertEquals(Region.SUPERCRITICAL, classifier.classify(50.0e6, 623.16));
    }

    @Test
    void rejectsNegativeTolerance() {
        assertThrows(IllegalArgumentException.class,
                () -> new RegionClassifier(line, -1.0, 1.0e-3));
        assertThrows(NullPointerException.class, () -> new RegionClassifier(null, 1.0e-6, 1.0e-3));
    }
}
