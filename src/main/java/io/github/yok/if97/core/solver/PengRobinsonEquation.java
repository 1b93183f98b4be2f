package io.github.yok.if97.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.linearalgebra.CubicEquationSolver;
import lombok.RequiredArgsConstructor;

/**
 * 水に対する Peng-Robinson 状態方程式です。
 *
 * <p>
 * 領域 3 の密度逆算でニュートン法が失敗した場合の初期値推定に使います。 圧縮係数 Z の 3 次方程式
 * {@code Z³ - (1 - B) Z² + (A - 3B² - 2B) Z - (AB - B² - B³) = 0} を解きます。
 * </p>
 */
@RequiredArgsConstructor
public final class PengRobinsonEquation {

    /**
     * 水の偏心因子 ω です。
     */
    static final double ACENTRIC_FACTOR = 0.3443;

    /**
     * 3 次方程式の解法です。
     */
    private final CubicEquationSolver cubicSolver;

    /**
     * 分岐に応じた密度の推定値 [kg/m³] を返します。
     *
     * <p>
     * 液相的分岐では共存体積 B より大きい最小の Z、それ以外では最大の Z を採用します。 妥当な根がない場合は NaN を返します。
     * </p>
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @param branch 分岐です
     * @return 密度の推定値 [kg/m³] です（推定できない場合は NaN）
     * @throws IllegalArgumentException 圧力・温度が正でない場合に発生します
     */
    public double estimateDensity(double pressurePa, double temperatureK, DensityBranch branch) {
        Preconditions.checkArgument(pressurePa > 0.0 && temperatureK > 0.0,
                "圧力・温度は正の値である必要があります。P=%s, T=%s", pressurePa, temperatureK);
        Preconditions.checkNotNull(branch, "分岐が null です。");

        double r = If97Constants.SPECIFIC_GAS_CONSTANT * 1000.0;
        double tc = If97Constants.CRITICAL_TEMPERATURE_K;
        double pc = If97Constants.CRITICAL_PRESSURE_PA;

        double omega = ACENTRIC_FACTOR;
        double kappa = 0.37464 + 1.54226 * omega - 0.26992 * omega * omega;
        double sqrtAlpha = 1.0 + kappa * (1.0 - Math.sqrt(temperatureK / tc));
        double a = 0.45724 * r * r * tc * tc / pc * sqrtAlpha * sqrtAlpha;
        double b = 0.07780 * r * tc / pc;

        double rt = r * temperatureK;
        double coefA = a * pressurePa / (rt * rt);
        double coefB = b * pressurePa / rt;

        double[] roots = cubicSolver.realRoots(-(1.0 - coefB),
                coefA - 3.0 * coefB * coefB - 2.0 * coefB,
                -(coefA * coefB - coefB * coefB - coefB * coefB * coefB));

        double z = Double.NaN;
        if (branch == DensityBranch.LIQUID_LIKE) {
            for (double root : roots) {
                if (root > coefB) {
                    z = root;
                    break;
                }
            }
        } else {
            double largest = roots[roots.length - 1];
            if (largest > coefB) {
                z = largest;
            }
        }
        return Double.isNaN(z) ? Double.NaN : pressurePa / (z * rt);
    }
}
