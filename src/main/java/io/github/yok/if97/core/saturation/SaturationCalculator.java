package io.github.yok.if97.core.saturation;

import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.equation.Region1Equation;
import io.github.yok.if97.core.equation.Region2Equation;
import io.github.yok.if97.core.equation.Region3Equation;
import io.github.yok.if97.core.guard.SingularityGuard;
import io.github.yok.if97.core.guard.SingularityGuard.SingularityCheck;
import io.github.yok.if97.core.model.EngineFailure;
import io.github.yok.if97.core.model.EngineResult;
import io.github.yok.if97.core.model.PhaseState;
import io.github.yok.if97.core.model.SaturationResult;
import io.github.yok.if97.core.solver.DensityBranch;
import io.github.yok.if97.core.solver.DensitySolution;
import io.github.yok.if97.core.solver.Region3DensitySolver;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 飽和温度・飽和圧力の組から、飽和液と飽和蒸気の物性値を計算するクラスです。
 *
 * <p>
 * 飽和温度が 623.15 K 以下なら液相を領域 1、気相を領域 2 の式で評価します。 それより高温（飽和圧力が約 16.53 MPa 超）では特異点ガードを通したうえで、
 * 領域 3 の液相的・気相的な密度根からそれぞれ評価します。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class SaturationCalculator {

    /**
     * 領域 1 の状態式です。
     */
    private final Region1Equation region1Equation;

    /**
     * 領域 2 の状態式です。
     */
    private final Region2Equation region2Equation;

    /**
     * 領域 3 の状態式です。
     */
    private final Region3Equation region3Equation;

    /**
     * 領域 3 の密度逆算器です。
     */
    private final Region3DensitySolver densitySolver;

    /**
     * 特異点ガードです。
     */
    private final SingularityGuard singularityGuard;

    /**
     * 飽和液・飽和蒸気の物性値を計算します。
     *
     * @param saturationTemperatureK 飽和温度 [K] です
     * @param saturationPressurePa 飽和圧力 [Pa] です
     * @return 飽和物性値、または数値的不安定の失敗です
     */
    public EngineResult<SaturationResult> calculate(double saturationTemperatureK,
            double saturationPressurePa) {
        PhaseState liquid;
        PhaseState vapor;

        if (saturationTemperatureK <= If97Constants.REGION3_TEMPERATURE_MIN_K) {
            liquid = region1Equation.evaluate(saturationPressurePa, saturationTemperatureK);
            vapor = region2Equation.evaluate(saturationPressurePa, saturationTemperatureK);
        } else {
            SingularityCheck check =
                    singularityGuard.check(saturationPressurePa, saturationTemperatureK);
            if (!check.isPassed()) {
                return EngineResult.failure(check.toFailure());
            }

            DensitySolution liquidDensity = densitySolver.solve(saturationPressurePa,
                    saturationTemperatureK, DensityBranch.LIQUID_LIKE);
            if (!liquidDensity.isConverged()) {
                return EngineResult.failure(
                        liquidDensity.toFailure(saturationPressurePa, saturationTemperatureK));
            }
            DensitySolution vaporDensity = densitySolver.solve(saturationPressurePa,
                    saturationTemperatureK, DensityBranch.VAPOR_LIKE);
            if (!vaporDensity.isConverged()) {
                return EngineResult.failure(
                        vaporDensity.toFailure(saturationPressurePa, saturationTemperatureK));
            }

            liquid = region3Equation.evaluate(liquidDensity.getDensity(), saturationTemperatureK);
            vapor = region3Equation.evaluate(vaporDensity.getDensity(), saturationTemperatureK);
        }

        if (!(liquid.getEnthalpy() < vapor.getEnthalpy())
                || !(liquid.getDensity() > vapor.getDensity())) {
            String reason = String.format(Locale.ROOT,
                    "飽和液と飽和蒸気を区別できません（T=%.3f K, h_l=%.5f, h_v=%.5f, ρ_l=%.5f, ρ_v=%.5f）",
                    saturationTemperatureK, liquid.getEnthalpy(), vapor.getEnthalpy(),
                    liquid.getDensity(), vapor.getDensity());
            return EngineResult.failure(EngineFailure.numericalInstability(reason,
                    vapor.getEnthalpy() - liquid.getEnthalpy(), "臨界点から離れた飽和条件を指定してください"));
        }

        SaturationResult result = SaturationResult.of(saturationTemperatureK,
                saturationPressurePa, liquid, vapor);
        log.debug("飽和物性を計算しました。T_sat={} K、P_sat={} Pa、h_fg={}", saturationTemperatureK,
                saturationPressurePa, result.heatOfVaporization());
        return EngineResult.success(result);
    }
}
