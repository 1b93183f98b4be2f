package io.github.yok.if97.core.solver;

import com.google.common.base.Preconditions;
import java.util.function.DoubleUnaryOperator;
import lombok.extern.slf4j.Slf4j;

/**
 * Brent 法で 1 変数関数の根を求めるクラスです。
 *
 * <p>
 * 逆 2 次補間・割線法・二分法を組み合わせ、挟み込み区間を常に維持します。 区間幅が許容誤差以下になるか、関数値が厳密に 0 になった時点で収束とします。
 * </p>
 */
@Slf4j
public final class BrentRootFinder {

    /**
     * 根の絶対許容誤差です。
     */
    private final double tolerance;

    /**
     * 最大反復回数です。
     */
    private final int maxIterations;

    /**
     * Brent 法の求根器を生成します。
     *
     * @param tolerance 根の絶対許容誤差（正の値）です
     * @param maxIterations 最大反復回数（1 以上）です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BrentRootFinder(double tolerance, int maxIterations) {
        Preconditions.checkArgument(tolerance > 0.0, "許容誤差は正の値である必要があります。tol=%s", tolerance);
        Preconditions.checkArgument(maxIterations > 0, "最大反復回数は 1 以上である必要があります。maxIter=%s",
                maxIterations);
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
    }

    /**
     * 区間 [lower, upper] で関数の根を求めます。
     *
     * <p>
     * 両端で符号が変わらない場合は未収束の結果を返します（|f| の小さい端点を近似値とします）。
     * </p>
     *
     * @param function 対象関数です
     * @param lower 区間の下端です
     * @param upper 区間の上端です
     * @return 求根結果です
     * @throws NullPointerException function が null の場合
     * @throws IllegalArgumentException 区間が不正な場合
     */
    public RootFindResult solve(DoubleUnaryOperator function, double lower, double upper) {
        Preconditions.checkNotNull(function, "対象関数が null です。");
        Preconditions.checkArgument(lower < upper, "区間の下端は上端より小さい必要があります。lower=%s, upper=%s",
                lower, upper);

        double a = lower;
        double b = upper;
        double fa = function.applyAsDouble(a);
        double fb = function.applyAsDouble(b);

        if (fa == 0.0) {
            return new RootFindResult(true, a, 0, 0.0);
        }
        if (fb == 0.0) {
            return new RootFindResult(true, b, 0, 0.0);
        }
        if (fa * fb > 0.0) {
            log.debug("区間の両端で符号が変わりません。lower={}、upper={}、f(lower)={}、f(upper)={}", a, b, fa, fb);
            return Math.abs(fa) < Math.abs(fb) ? new RootFindResult(false, a, 0, fa)
                    : new RootFindResult(false, b, 0, fb);
        }

        double c = a;
        double fc = fa;
        double d = b - a;
        double e = d;

        for (int iter = 1; iter <= maxIterations; iter++) {
            if (fb * fc > 0.0) {
                // b と c で根を挟むように c を取り直します。
                c = a;
                fc = fa;
                d = b - a;
                e = d;
            }
            if (Math.abs(fc) < Math.abs(fb)) {
                a = b;
                b = c;
                c = a;
                fa = fb;
                fb = fc;
                fc = fa;
            }

            double tol1 = 2.0 * Math.ulp(b) + 0.5 * tolerance;
            double xm = 0.5 * (c - b);
            if (Math.abs(xm) <= tol1 || fb == 0.0) {
                log.debug("Brent 法が収束しました。反復回数={}、根={}、残差={}", iter, b, fb);
                return new RootFindResult(true, b, iter, fb);
            }

            if (Math.abs(e) >= tol1 && Math.abs(fa) > Math.abs(fb)) {
                double s = fb / fa;
                double p;
                double q;
                if (a == c) {
                    // 割線法
                    p = 2.0 * xm * s;
                    q = 1.0 - s;
                } else {
                    // 逆 2 次補間
                    double qa = fa / fc;
                    double r = fb / fc;
                    p = s * (2.0 * xm * qa * (qa - r) - (b - a) * (r - 1.0));
                    q = (qa - 1.0) * (r - 1.0) * (s - 1.0);
                }
                if (p > 0.0) {
                    q = -q;
                }
                p = Math.abs(p);
                double min1 = 3.0 * xm * q - Math.abs(tol1 * q);
                double min2 = Math.abs(e * q);
                if (2.0 * p < Math.min(min1, min2)) {
                    e = d;
                    d = p / q;
                } else {
                    d = xm;
                    e = d;
                }
            } else {
                // 二分法
                d = xm;
                e = d;
            }

            a = b;
            fa = fb;
            b += Math.abs(d) > tol1 ? d : Math.copySign(tol1, xm);
            fb = function.applyAsDouble(b);
        }

        log.debug("Brent 法が最大反復回数に達しました。最大反復回数={}、近似根={}、残差={}", maxIterations, b, fb);
        return new RootFindResult(false, b, maxIterations, fb);
    }
}
