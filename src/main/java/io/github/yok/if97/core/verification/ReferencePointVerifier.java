package io.github.yok.if97.core.verification;

import com.google.common.base.Preconditions;
import io.github.yok.if97.core.engine.SteamPropertyEngine;
import io.github.yok.if97.core.model.EngineResult;
import io.github.yok.if97.core.model.PropertyResult;
import io.github.yok.if97.core.model.Region;
import io.github.yok.if97.core.model.SaturationResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 参照値に対して物性エンジンの計算結果を検証するクラスです。
 *
 * <p>
 * 許容する相対偏差は領域 1 が 0.03%、領域 2 が 0.06%、領域 3 と飽和計算が 0.1% です。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class ReferencePointVerifier {

    /**
     * 領域 1 の許容相対偏差です。
     */
    static final double LIQUID_TOLERANCE = 3.0e-4;

    /**
     * 領域 2 の許容相対偏差です。
     */
    static final double VAPOR_TOLERANCE = 6.0e-4;

    /**
     * 領域 3 の許容相対偏差です。
     */
    static final double SUPERCRITICAL_TOLERANCE = 1.0e-3;

    /**
     * 飽和計算の許容相対偏差です。
     */
    static final double SATURATION_TOLERANCE = 1.0e-3;

    /**
     * 飽和計算の分類名です。
     */
    static final String SATURATION = "SATURATION";

    /**
     * 検証対象の物性エンジンです。
     */
    private final SteamPropertyEngine engine;

    /**
     * 参照値の一覧を検証します。
     *
     * @param points 参照値の一覧です
     * @return 検証結果です
     * @throws NullPointerException points が null の場合
     */
    public VerificationReport verify(List<ReferencePoint> points) {
        Preconditions.checkNotNull(points, "参照値の一覧が null です。");

        log.info("参照値の検証を開始します。件数={}", points.size());
        List<VerificationOutcome> outcomes = new ArrayList<>(points.size());
        for (ReferencePoint point : points) {
            VerificationOutcome outcome = verify(point);
            if (outcome.isPassed()) {
                log.debug("参照値を検証しました。種類={}、P={}、T={}、分類={}、最大相対偏差={}", point.getKind(),
                        point.getPressure(), point.getTemperature(), outcome.getCategory(),
                        fmtRatio(outcome.getMaxRelativeDeviation()));
            } else {
                log.warn("参照値が許容範囲を外れました。種類={}、P={}、T={}、分類={}、最大相対偏差={}、許容値={}、失敗={}",
                        point.getKind(), point.getPressure(), point.getTemperature(),
                        outcome.getCategory(), fmtRatio(outcome.getMaxRelativeDeviation()),
                        fmtRatio(outcome.getTolerance()), outcome.getFailureMessage());
            }
            outcomes.add(outcome);
        }

        VerificationReport report = new VerificationReport(Collections.unmodifiableList(outcomes));
        log.info("参照値の検証を終了します。合格={}/{}", report.passedCount(), outcomes.size());
        return report;
    }

    /**
     * 参照値 1 件を検証します。
     *
     * @param point 参照値です
     * @return 検証結果です
     */
    private VerificationOutcome verify(ReferencePoint point) {
        switch (point.getKind()) {
            case PT:
                return verifyProperties(point);
            case SAT_T:
                return verifySaturation(point,
                        engine.saturationAtTemperature(point.getTemperature()), true);
            case SAT_P:
            default:
                return verifySaturation(point, engine.saturationAtPressure(point.getPressure()),
                        false);
        }
    }

    /**
     * 単相の参照値を検証します。
     *
     * @param point 参照値です
     * @return 検証結果です
     */
    private VerificationOutcome verifyProperties(ReferencePoint point) {
        EngineResult<PropertyResult> result =
                engine.propertiesAt(point.getPressure(), point.getTemperature());
        if (result.isFailure()) {
            return new VerificationOutcome(point, "FAILED", Double.NaN, 0.0, false,
                    result.getFailure().getMessage());
        }

        PropertyResult value = result.getValue();
        double deviation = 0.0;
        deviation =
                Math.max(deviation, relativeDeviation(value.getEnthalpy(), point.getEnthalpy()));
        deviation = Math.max(deviation, relativeDeviation(value.getEntropy(), point.getEntropy()));
        deviation = Math.max(deviation,
                relativeDeviation(value.getInternalEnergy(), point.getInternalEnergy()));
        deviation = Math.max(deviation, relativeDeviation(value.getDensity(), point.getDensity()));

        double tolerance = toleranceOf(value.getRegion());
        return new VerificationOutcome(point, value.getRegion().name(), deviation, tolerance,
                deviation <= tolerance, null);
    }

    /**
     * 飽和計算の参照値を検証します。
     *
     * @param point 参照値です
     * @param result 飽和計算の結果です
     * @param byTemperature 温度指定なら true（期待値は飽和圧力）です
     * @return 検証結果です
     */
    private VerificationOutcome verifySaturation(ReferencePoint point,
            EngineResult<SaturationResult> result, boolean byTemperature) {
        if (result.isFailure()) {
            return new VerificationOutcome(point, SATURATION, Double.NaN, SATURATION_TOLERANCE,
                    false, result.getFailure().getMessage());
        }
        SaturationResult value = result.getValue();
        double deviation = byTemperature
                ? relativeDeviation(value.getSaturationPressure(), point.getPressure())
                : relativeDeviation(value.getSaturationTemperature(), point.getTemperature());
        return new VerificationOutcome(point, SATURATION, deviation, SATURATION_TOLERANCE,
                deviation <= SATURATION_TOLERANCE, null);
    }

    /**
     * 領域に応じた許容相対偏差を返します。
     *
     * @param region 領域です
     * @return 許容相対偏差です
     */
    static double toleranceOf(Region region) {
        switch (region) {
            case LIQUID:
                return LIQUID_TOLERANCE;
            case VAPOR:
                return VAPOR_TOLERANCE;
            case SUPERCRITICAL:
            default:
                return SUPERCRITICAL_TOLERANCE;
        }
    }

    /**
     * 相対偏差を計算します。期待値が NaN の場合は 0 とします。
     *
     * @param actual 計算値です
     * @param expected 期待値です
     * @return 相対偏差です
     */
    private static double relativeDeviation(double actual, double expected) {
        if (Double.isNaN(expected)) {
            return 0.0;
        }
        return Math.abs(actual - expected) / Math.abs(expected);
    }

    /**
     * 相対偏差をパーセント表記に整形します。
     *
     * @param v 相対偏差です
     * @return 整形文字列です
     */
    private static String fmtRatio(double v) {
        return String.format(Locale.ROOT, "%.5f%%", v * 100.0);
    }
}
