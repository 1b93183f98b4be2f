package io.github.yok.if97.core.linearalgebra;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * カルダノの公式（3 実根の場合は三角関数解）で 3 次方程式を解くクラスです。
 *
 * <p>
 * 得られた各根にはニュートン法を 1 回だけ適用して丸め誤差を抑えます。
 * </p>
 */
public final class AnalyticCubicEquationSolver implements CubicEquationSolver {

    /**
     * モニックな 3 次方程式の実根を昇順で返します。
     *
     * @param a2 2 次の係数です
     * @param a1 1 次の係数です
     * @param a0 定数項です
     * @return 実根の昇順配列です
     * @throws IllegalArgumentException 係数が有限値でない場合に発生します
     */
    @Override
    public double[] realRoots(double a2, double a1, double a0) {
        Preconditions.checkArgument(
                Double.isFinite(a2) && Double.isFinite(a1) && Double.isFinite(a0),
                "3 次方程式の係数は有限値である必要があります。a2=%s, a1=%s, a0=%s", a2, a1, a0);

        double shift = a2 / 3.0;
        double q = (3.0 * a1 - a2 * a2) / 9.0;
        double r = (9.0 * a2 * a1 - 27.0 * a0 - 2.0 * a2 * a2 * a2) / 54.0;
        double discriminant = q * q * q + r * r;

        double[] roots;
        if (discriminant > 0.0) {
            // 実根 1 つ
            double sqrtDisc = Math.sqrt(discriminant);
            double s = Math.cbrt(r + sqrtDisc);
            double t = Math.cbrt(r - sqrtDisc);
            roots = new double[] {s + t - shift};
        } else if (q == 0.0) {
            // 3 重根
            roots = new double[] {-shift, -shift, -shift};
        } else {
            // 実根 3 つ（重根を含む）
            double ratio = r / Math.sqrt(-q * q * q);
            double theta = Math.acos(Math.max(-1.0, Math.min(1.0, ratio)));
            double m = 2.0 * Math.sqrt(-q);
            roots = new double[3];
            for (int k = 0; k < 3; k++) {
                roots[k] = m * Math.cos((theta + 2.0 * Math.PI * k) / 3.0) - shift;
            }
        }

        for (int k = 0; k < roots.length; k++) {
            roots[k] = polish(roots[k], a2, a1, a0);
        }
        Arrays.sort(roots);
        return roots;
    }

    /**
     * ニュートン法を 1 回適用します。導関数が 0（重根）の場合はそのまま返します。
     *
     * @param x 根の近似値です
     * @param a2 2 次の係数です
     * @param a1 1 次の係数です
     * @param a0 定数項です
     * @return 補正後の根です
     */
    private static double polish(double x, double a2, double a1, double a0) {
        double f = ((x + a2) * x + a1) * x + a0;
        double df = (3.0 * x + 2.0 * a2) * x + a1;
        if (df == 0.0 || !Double.isFinite(df)) {
            return x;
        }
        double next = x - f / df;
        return Double.isFinite(next) ? next : x;
    }
}
