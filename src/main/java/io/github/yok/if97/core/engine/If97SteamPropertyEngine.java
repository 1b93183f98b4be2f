package io.github.yok.if97.core.engine;

import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.equation.Region1Equation;
import io.github.yok.if97.core.equation.Region2Equation;
import io.github.yok.if97.core.equation.Region3Equation;
import io.github.yok.if97.core.guard.SingularityGuard;
import io.github.yok.if97.core.guard.SingularityGuard.SingularityCheck;
import io.github.yok.if97.core.model.EngineFailure;
import io.github.yok.if97.core.model.EngineResult;
import io.github.yok.if97.core.model.PhaseState;
import io.github.yok.if97.core.model.PropertyResult;
import io.github.yok.if97.core.model.Region;
import io.github.yok.if97.core.model.SaturationResult;
import io.github.yok.if97.core.router.RegionClassifier;
import io.github.yok.if97.core.saturation.SaturationCalculator;
import io.github.yok.if97.core.saturation.SaturationLine;
import io.github.yok.if97.core.solver.DensityBranch;
import io.github.yok.if97.core.solver.DensitySolution;
import io.github.yok.if97.core.solver.Region3DensitySolver;
import io.github.yok.if97.core.solver.RootFindResult;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * IAPWS-IF97 に基づく物性エンジンです。
 *
 * <p>
 * 1 回の呼び出しは「入力検証 → 領域判定 → （領域 3 なら）特異点ガード → 状態式の評価 → 結果の組み立て」の順に進み、 成功か失敗のどちらかで終わります。
 * 再試行やキャッシュは行いません。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class If97SteamPropertyEngine implements SteamPropertyEngine {

    /**
     * 失敗内容で使うパラメータ名（圧力）です。
     */
    static final String PRESSURE = "pressure";

    /**
     * 失敗内容で使うパラメータ名（温度）です。
     */
    static final String TEMPERATURE = "temperature";

    /**
     * 領域判定器です。
     */
    private final RegionClassifier regionClassifier;

    /**
     * 飽和線です。
     */
    private final SaturationLine saturationLine;

    /**
     * 飽和物性の計算器です。
     */
    private final SaturationCalculator saturationCalculator;

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
     * 飽和温度の逆算結果を検算するときの圧力の相対許容値です。
     */
    private final double saturationConsistencyTolerance;

    /**
     * 圧力・温度を指定して単相の物性値を計算します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 物性値、または失敗です
     */
    @Override
    public EngineResult<PropertyResult> propertiesAt(double pressurePa, double temperatureK) {
        EngineFailure invalid = validate(PRESSURE, pressurePa,
                If97Constants.GLOBAL_PRESSURE_MIN_PA, If97Constants.GLOBAL_PRESSURE_MAX_PA);
        if (invalid == null) {
            invalid = validate(TEMPERATURE, temperatureK, If97Constants.GLOBAL_TEMPERATURE_MIN_K,
                    If97Constants.GLOBAL_TEMPERATURE_MAX_K);
        }
        if (invalid != null) {
            return reject(invalid);
        }

        Region region = regionClassifier.classify(pressurePa, temperatureK);
        PhaseState state;
        switch (region) {
            case LIQUID:
                state = region1Equation.evaluate(pressurePa, temperatureK);
                break;
            case VAPOR:
                state = region2Equation.evaluate(pressurePa, temperatureK);
                break;
            case SUPERCRITICAL:
                SingularityCheck check = singularityGuard.check(pressurePa, temperatureK);
                if (!check.isPassed()) {
                    return reject(check.toFailure());
                }
                DensityBranch branch = DensityBranch.select(pressurePa, temperatureK,
                        temperatureK < If97Constants.CRITICAL_TEMPERATURE_K
                                ? saturationLine.saturationPressure(temperatureK)
                                : Double.NaN);
                DensitySolution density = densitySolver.solve(pressurePa, temperatureK, branch);
                if (!density.isConverged()) {
                    return reject(density.toFailure(pressurePa, temperatureK));
                }
                state = region3Equation.evaluate(density.getDensity(), temperatureK);
                break;
            case SATURATION_BOUNDARY:
            default:
                return reject(EngineFailure.invalidState(pressurePa, temperatureK));
        }

        PropertyResult result = PropertyResult.of(pressurePa, temperatureK, region, state);
        log.debug("物性値を計算しました。P={} Pa、T={} K、領域={}、h={}、s={}、ρ={}", pressurePa, temperatureK,
                region, fmt5(result.getEnthalpy()), fmt5(result.getEntropy()),
                fmt5(result.getDensity()));
        return EngineResult.success(result);
    }

    /**
     * 圧力を指定して飽和物性値を計算します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @return 飽和物性値、または失敗です
     */
    @Override
    public EngineResult<SaturationResult> saturationAtPressure(double pressurePa) {
        EngineFailure invalid = validate(PRESSURE, pressurePa,
                If97Constants.SATURATION_PRESSURE_MIN_PA, If97Constants.SATURATION_PRESSURE_MAX_PA);
        if (invalid != null) {
            return reject(invalid);
        }

        RootFindResult root = saturationLine.saturationTemperature(pressurePa);
        if (!root.isConverged()) {
            String reason = String.format(Locale.ROOT, "飽和温度の逆算が収束しませんでした（P=%.6e Pa, 反復回数=%d）",
                    pressurePa, root.getIterations());
            return reject(EngineFailure.numericalInstability(reason, root.getResidual(),
                    "三重点・臨界点から離れた圧力を指定してください"));
        }

        double saturationTemperature = root.getRoot();
        double recomputed = saturationLine.saturationPressure(saturationTemperature);
        double mismatch = Math.abs(recomputed - pressurePa);
        if (mismatch > saturationConsistencyTolerance * pressurePa) {
            String reason = String.format(Locale.ROOT,
                    "飽和温度と飽和圧力が整合しません（P=%.6e Pa, T_sat=%.6f K, P_sat(T_sat)=%.6e Pa）",
                    pressurePa, saturationTemperature, recomputed);
            return reject(EngineFailure.numericalInstability(reason, mismatch,
                    "三重点・臨界点から離れた圧力を指定してください"));
        }

        return logged(saturationCalculator.calculate(saturationTemperature, pressurePa));
    }

    /**
     * 温度を指定して飽和物性値を計算します。
     *
     * @param temperatureK 温度 [K] です
     * @return 飽和物性値、または失敗です
     */
    @Override
    public EngineResult<SaturationResult> saturationAtTemperature(double temperatureK) {
        EngineFailure invalid = validate(TEMPERATURE, temperatureK,
                If97Constants.SATURATION_TEMPERATURE_MIN_K,
                If97Constants.SATURATION_TEMPERATURE_MAX_K);
        if (invalid != null) {
            return reject(invalid);
        }

        double saturationPressure = saturationLine.saturationPressure(temperatureK);
        return logged(saturationCalculator.calculate(temperatureK, saturationPressure));
    }

    /**
     * 値が有限かつ範囲内であるかを検証します。
     *
     * @param name パラメータ名です
     * @param value 値です
     * @param min 下限です
     * @param max 上限です
     * @return 範囲外の場合は失敗内容、範囲内なら null です
     */
    private static EngineFailure validate(String name, double value, double min, double max) {
        if (!Double.isFinite(value) || value < min || value > max) {
            return EngineFailure.outOfRange(name, value, min, max);
        }
        return null;
    }

    /**
     * 失敗を記録して失敗結果を返します。
     *
     * @param <T> 値の型です
     * @param failure 失敗内容です
     * @return 失敗結果です
     */
    private static <T> EngineResult<T> reject(EngineFailure failure) {
        log.warn("物性計算に失敗しました。種別={}、内容={}", failure.getKind(), failure.getMessage());
        return EngineResult.failure(failure);
    }

    /**
     * 飽和計算の失敗を記録して結果をそのまま返します。
     *
     * @param result 飽和計算の結果です
     * @return 引数の結果です
     */
    private static EngineResult<SaturationResult> logged(EngineResult<SaturationResult> result) {
        if (result.isFailure()) {
            log.warn("飽和物性の計算に失敗しました。種別={}、内容={}", result.getFailure().getKind(),
                    result.getFailure().getMessage());
        }
        return result;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
