package io.github.yok.if97.core.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.if97.EngineFixtures;
import io.github.yok.if97.app.If97Properties;
import io.github.yok.if97.core.constant.B23Boundary;
import io.github.yok.if97.core.model.EngineFailure;
import io.github.yok.if97.core.model.EngineResult;
import io.github.yok.if97.core.model.FailureKind;
import io.github.yok.if97.core.model.PropertyResult;
import io.github.yok.if97.core.model.Region;
import io.github.yok.if97.core.model.SaturationResult;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class If97SteamPropertyEngineTest {

    private final SteamPropertyEngine engine = EngineFixtures.engine();

    @Test
    void superheatedSteamAtOneBar() {
        PropertyResult r = engine.propertiesAt(1.0e5, 473.15).getValue();
        assertEquals(Region.VAPOR, r.getRegion());
        assertEquals(2875.475, r.getEnthalpy(), 0.01);
        assertEquals(7.83556, r.getEntropy(), 1.0e-4);
        assertEquals(0.46030, r.getDensity(), 1.0e-4);
        assertEquals(1.0e5, r.getPressure(), 0.0);
        assertEquals(473.15, r.getTemperature(), 0.0);
        assertEquals(1.0 / r.getDensity(), r.specificVolume(), 0.0);
    }

    @Test
    void compressedLiquid() {
        PropertyResult r = engine.propertiesAt(3.0e6, 300.0).getValue();
        assertEquals(Region.LIQUID, r.getRegion());
        assertEquals(115.331273, r.getEnthalpy(), 1.0e-5);
    }

    @Test
    void region3PointRecoversPublishedValues() {
        PropertyResult r = engine.propertiesAt(25.5837018e6, 650.0).getValue();
        assertEquals(Region.SUPERCRITICAL, r.getRegion());
        assertEquals(500.0, r.getDensity(), 1.0e-3);
        assertEquals(1863.43019, r.getEnthalpy(), 1.0e-3);
        assertEquals(4.05427273, r.getEntropy(), 1.0e-6);
    }

    @Test
    void negativePressureIsOutOfRange() {
        EngineResult<PropertyResult> result = engine.propertiesAt(-1.0, 300.0);
        assertTrue(result.isFailure());
        EngineFailure f = result.getFailure();
        assertEquals(FailureKind.OUT_OF_RANGE, f.getKind());
        assertEquals("pressure", f.getParameterName());
        assertEquals(-1.0, f.getValue(), 0.0);
        assertEquals(611.657, f.getMinValue(), 0.0);
        assertEquals(100.0e6, f.getMaxValue(), 0.0);
        assertTrue(f.getMessage().startsWith("pressure"));
    }

    @Test
    void temperatureOutsideEnvelopeIsOutOfRange() {
        EngineFailure hot = engine.propertiesAt(1.0e6, 900.0).getFailure();
        assertEquals(FailureKind.OUT_OF_RANGE, hot.getKind());
        assertEquals("temperature", hot.getParameterName());

        EngineFailure nan = engine.propertiesAt(1.0e6, Double.NaN).getFailure();
        assertEquals(FailureKind.OUT_OF_RANGE, nan.getKind());
        assertEquals("temperature", nan.getParameterName());
        assertTrue(Double.isNaN(nan.getValue()));
    }

    @Test
    void pressureIsValidatedBeforeTemperature() {
        EngineFailure f = engine.propertiesAt(Double.POSITIVE_INFINITY, -5.0).getFailure();
        assertEquals("pressure", f.getParameterName());
    }

    @Test
    void nearCriticalStateIsNumericallyUnstable() {
        EngineFailure f = engine.propertiesAt(22.1e6, 647.15).getFailure();
        assertEquals(FailureKind.NUMERICAL_INSTABILITY, f.getKind());
        assertTrue(f.getMetric() < 0.05);
        assertTrue(f.getSuggestion().contains("5%"));
        assertNull(f.getParameterName());
    }

    @Test
    void saturationBoundaryIsInvalidState() {
        double ps = engine.saturationAtTemperature(373.15).getValue().getSaturationPressure();
        EngineFailure f = engine.propertiesAt(ps, 373.15).getFailure();
        assertEquals(FailureKind.INVALID_STATE, f.getKind());
        assertTrue(f.getSuggestion().contains("saturationAtPressure"));
    }

    @Test
    void repeatedCallsReturnIdenticalResults() {
        assertEquals(engine.propertiesAt(19.0e6, 640.0).getValue(),
                engine.propertiesAt(19.0e6, 640.0).getValue());
        assertEquals(engine.saturationAtPressure(5.0e6).getValue(),
                engine.saturationAtPressure(5.0e6).getValue());
    }

    @Test
    void concurrentCallsAgreeWithSequentialResult() {
        PropertyResult expected = engine.propertiesAt(30.0e6, 640.0).getValue();
        List<PropertyResult> results = IntStream.range(0, 32).parallel()
                .mapToObj(i -> engine.propertiesAt(30.0e6, 640.0).getValue())
                .collect(Collectors.toList());
        for (PropertyResult r : results) {
            assertEquals(expected, r);
        }
    }

    @Test
    void enthalpyIncreasesWithTemperature() {
        double previous = Double.NEGATIVE_INFINITY;
        for (double t = 280.0; t <= 580.0; t += 20.0) {
            double h = engine.propertiesAt(10.0e6, t).getValue().getEnthalpy();
            assertTrue(h > previous, "T=" + t);
            previous = h;
        }
        previous = Double.NEGATIVE_INFINITY;
        for (double t = 380.0; t <= 860.0; t += 20.0) {
            double h = engine.propertiesAt(1.0e5, t).getValue().getEnthalpy();
            assertTrue(h > previous, "T=" + t);
            previous = h;
        }
    }

    @Test
    void internalEnergyIsConsistentWithEnthalpy() {
        double[][] states = {{1.0e5, 300.0}, {1.0e5, 473.15}, {25.5837018e6, 650.0},
                {50.0e6, 700.0}, {10.0e6, 863.15}};
        for (double[] s : states) {
            PropertyResult r = engine.propertiesAt(s[0], s[1]).getValue();
            double flowWork = r.getPressure() / r.getDensity() / 1000.0;
            assertEquals(r.getEnthalpy() - flowWork, r.getInternalEnergy(),
                    1.0e-6 * r.getEnthalpy(), "P=" + s[0] + ", T=" + s[1]);
        }
    }

    @Test
    void continuousAcrossRegion1And3Boundary() {
        for (double p : new double[] {20.0e6, 50.0e6, 100.0e6}) {
            PropertyResult liquid = engine.propertiesAt(p, 623.15).getValue();
            PropertyResult dense = engine.propertiesAt(p, 623.15 + 1.0e-6).getValue();
            assertEquals(Region.LIQUID, liquid.getRegion());
            assertEquals(Region.SUPERCRITICAL, dense.getRegion());
            assertEquals(liquid.getEnthalpy(), dense.getEnthalpy(), liquid.getEnthalpy() * 1.0e-3);
            assertEquals(liquid.getDensity(), dense.getDensity(), liquid.getDensity() * 1.0e-3);
        }
    }

    @Test
    void continuousAcrossB23Line() {
        for (double t : new double[] {700.0, 750.0, 800.0}) {
            double p = B23Boundary.pressureAt(t);
            PropertyResult vapor = engine.propertiesAt(p * (1.0 - 1.0e-9), t).getValue();
            PropertyResult dense = engine.propertiesAt(p * (1.0 + 1.0e-9), t).getValue();
            assertEquals(Region.VAPOR, vapor.getRegion());
            assertEquals(Region.SUPERCRITICAL, dense.getRegion());
            assertEquals(vapor.getEnthalpy(), dense.getEnthalpy(), vapor.getEnthalpy() * 1.0e-3);
            assertEquals(vapor.getDensity(), dense.getDensity(), vapor.getDensity() * 2.0e-3);
        }
    }

    @Test
    void approachesSaturatedPhasesFromEitherSide() {
        SaturationResult sat = engine.saturationAtTemperature(400.0).getValue();
        double ps = sat.getSaturationPressure();
        PropertyResult liquid = engine.propertiesAt(ps * (1.0 + 1.0e-4), 400.0).getValue();
        PropertyResult vapor = engine.propertiesAt(ps * (1.0 - 1.0e-4), 400.0).getValue();
        assertEquals(Region.LIQUID, liquid.getRegion());
        assertEquals(Region.VAPOR, vapor.getRegion());
        assertEquals(sat.getEnthalpyLiquid(), liquid.getEnthalpy(), 1.0e-3);
        assertEquals(sat.getEnthalpyVapor(), vapor.getEnthalpy(), 1.0e-2);
    }

    @Test
    void saturationAtOneMegapascal() {
        SaturationResult r = engine.saturationAtPressure(1.0e6).getValue();
        assertEquals(453.035632, r.getSaturationTemperature(), 1.0e-5);
        assertEquals(1.0e6, r.getSaturationPressure(), 0.0);
        assertEquals(887.127, r.getDensityLiquid(), 1.0e-2);
        assertEquals(5.14539, r.getDensityVapor(), 1.0e-4);
        assertTrue(r.heatOfVaporization() > 0.0);
    }

    @Test
    void saturationByPressureAndTemperatureAgree() {
        for (double p : new double[] {1.0e3, 1.0e4, 1.0e5, 1.0e6, 5.0e6, 1.0e7, 1.6e7}) {
            SaturationResult byPressure = engine.saturationAtPressure(p).getValue();
            SaturationResult byTemperature = engine
                    .saturationAtTemperature(byPressure.getSaturationTemperature()).getValue();
            assertEquals(p, byTemperature.getSaturationPressure(), p * 1.0e-6, "P=" + p);
            assertEquals(byPressure.getEnthalpyVapor(), byTemperature.getEnthalpyVapor(),
                    byPressure.getEnthalpyVapor() * 1.0e-6, "P=" + p);
        }
    }

    @Test
    void saturationInRegion3() {
        SaturationResult r = engine.saturationAtTemperature(640.0).getValue();
        assertEquals(481.61, r.getDensityLiquid(), 0.05);
        assertEquals(177.40, r.getDensityVapor(), 0.05);
    }

    @Test
    void saturationFailures() {
        EngineFailure low = engine.saturationAtPressure(100.0).getFailure();
        assertEquals(FailureKind.OUT_OF_RANGE, low.getKind());
        assertEquals("pressure", low.getParameterName());

        EngineFailure hot = engine.saturationAtTemperature(700.0).getFailure();
        assertEquals(FailureKind.OUT_OF_RANGE, hot.getKind());
        assertEquals("temperature", hot.getParameterName());

        assertEquals(FailureKind.NUMERICAL_INSTABILITY,
                engine.saturationAtPressure(22.064e6).getFailure().getKind());
        assertEquals(FailureKind.NUMERICAL_INSTABILITY,
                engine.saturationAtTemperature(647.0).getFailure().getKind());
    }

    @Test
    void orElseThrowMapsFailureKinds() {
        assertThrows(IllegalArgumentException.class,
                () -> engine.propertiesAt(-1.0, 300.0).orElseThrow());
        assertThrows(IllegalStateException.class,
                () -> engine.propertiesAt(22.1e6, 647.15).orElseThrow());
    }

    @Test
    void companionMatrixBackendGivesSameProperties() {
        If97Properties properties = new If97Properties();
        properties.getRegion3().setCubicSolver(If97Properties.Region3.CubicSolverType.EJML);
        SteamPropertyEngine ejml = EngineFixtures.engine(properties);

        PropertyResult expected = engine.propertiesAt(30.0e6, 640.0).getValue();
        PropertyResult actual = ejml.propertiesAt(30.0e6, 640.0).getValue();
        assertEquals(expected.getDensity(), actual.getDensity(), 1.0e-6);
        assertEquals(expected.getEnthalpy(), actual.getEnthalpy(), 1.0e-6);
    }
}
