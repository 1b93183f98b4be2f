package io.github.yok.if97.core.linearalgebra;

/**
 * 実係数の 3 次方程式 {@code x³ + a2 x² + a1 x + a0 = 0} の実根を求めるインタフェースです。
 *
 * <p>
 * 解析解と固有値計算（コンパニオン行列）の実装を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface CubicEquationSolver {

    /**
     * モニックな 3 次方程式の実根を昇順で返します。
     *
     * @param a2 2 次の係数です
     * @param a1 1 次の係数です
     * @param a0 定数項です
     * @return 実根の昇順配列です（要素数は 1 以上 3 以下）
     * @throws IllegalArgumentException 係数が有限値でない場合に発生します
     * @throws IllegalStateException 実根が得られない場合に発生します
     */
    double[] realRoots(double a2, double a1, double a0);
}
