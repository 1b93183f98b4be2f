package io.github.yok.if97.core.saturation;

import com.google.common.base.Preconditions;
import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.solver.BrentRootFinder;
import io.github.yok.if97.core.solver.RootFindResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * IAPWS-IF97 領域 4 の飽和線（飽和圧力式とその逆算）です。
 *
 * <p>
 * 飽和圧力は閉形式の 10 係数の式で求め、飽和温度は Brent 法で逆算します。 三重点・臨界点の端点で丸め誤差により符号が揃った場合は、相対誤差が十分小さければ端点を解とします。
 * </p>
 */
@Slf4j
@RequiredArgsConstructor
public final class SaturationLine {

    private static final double N1 = 0.11670521452767e4;
    private static final double N2 = -0.72421316703206e6;
    private static final double N3 = -0.17073846940092e2;
    private static final double N4 = 0.12020824702470e5;
    private static final double N5 = -0.32325550322333e7;
    private static final double N6 = 0.14915108613530e2;
    private static final double N7 = -0.48232657361591e4;
    private static final double N8 = 0.40511340542057e6;
    private static final double N9 = -0.23855557567849;
    private static final double N10 = 0.65017534844798e3;

    /**
     * 端点を解とみなす圧力の相対誤差です。
     */
    private static final double ENDPOINT_RELATIVE_TOLERANCE = 1.0e-9;

    /**
     * 飽和温度の逆算に使う求根器です。
     */
    private final BrentRootFinder rootFinder;

    /**
     * 温度から飽和圧力を求めます。
     *
     * @param temperatureK 温度 [K] です（273.15 K 以上 647.096 K 以下）
     * @return 飽和圧力 [Pa] です
     * @throws IllegalArgumentException 温度が有効範囲外の場合に発生します
     */
    public double saturationPressure(double temperatureK) {
        Preconditions.checkArgument(
                temperatureK >= If97Constants.GLOBAL_TEMPERATURE_MIN_K
                        && temperatureK <= If97Constants.CRITICAL_TEMPERATURE_K,
                "飽和圧力式の温度範囲外です。T=%s", temperatureK);

        double theta = temperatureK + N9 / (temperatureK - N10);
        double a = theta * theta + N1 * theta + N2;
        double b = N3 * theta * theta + N4 * theta + N5;
        double c = N6 * theta * theta + N7 * theta + N8;
        double x = 2.0 * c / (-b + Math.sqrt(b * b - 4.0 * a * c));
        return x * x * x * x * 1.0e6;
    }

    /**
     * 圧力から飽和温度を逆算します。
     *
     * @param pressurePa 圧力 [Pa] です（611.657 Pa 以上 22.064 MPa 以下）
     * @return 求根結果（根が飽和温度 [K]、残差が圧力差 [Pa]）です
     * @throws IllegalArgumentException 圧力が有効範囲外の場合に発生します
     */
    public RootFindResult saturationTemperature(double pressurePa) {
        Preconditions.checkArgument(
                pressurePa >= If97Constants.SATURATION_PRESSURE_MIN_PA
                        && pressurePa <= If97Constants.SATURATION_PRESSURE_MAX_PA,
                "飽和温度の逆算の圧力範囲外です。P=%s", pressurePa);

        double lower = If97Constants.SATURATION_TEMPERATURE_MIN_K;
        double upper = If97Constants.SATURATION_TEMPERATURE_MAX_K;
        double fLower = saturationPressure(lower) - pressurePa;
        double fUpper = saturationPressure(upper) - pressurePa;

        // 端点の丸め誤差で符号が揃った場合
        if (fLower * fUpper > 0.0) {
            double endpoint = Math.abs(fLower) < Math.abs(fUpper) ? lower : upper;
            double residual = Math.min(Math.abs(fLower), Math.abs(fUpper));
            boolean ok = residual <= ENDPOINT_RELATIVE_TOLERANCE * pressurePa;
            log.debug("飽和温度の区間端で符号が揃いました。P={} Pa、端点={} K、残差={} Pa、端点採用={}", pressurePa,
                    endpoint, residual, ok);
            return new RootFindResult(ok, endpoint, 0,
                    Math.abs(fLower) < Math.abs(fUpper) ? fLower : fUpper);
        }

        RootFindResult result =
                rootFinder.solve(t -> saturationPressure(t) - pressurePa, lower, upper);
        log.debug("飽和温度を逆算しました。P={} Pa、T_sat={} K、反復回数={}、収束={}", pressurePa,
                result.getRoot(), result.getIterations(), result.isConverged());
        return result;
    }
}
