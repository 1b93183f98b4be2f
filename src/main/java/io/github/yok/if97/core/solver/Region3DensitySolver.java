package io.github.yok.if97.core.solver;

import com.google.common.base.Preconditions;
import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.equation.Region3Equation;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * 領域 3 の状態式 {@code P(ρ, T)} を圧力について逆算し、密度を求めるクラスです。
 *
 * <p>
 * まず理想気体の密度を初期値としたニュートン法を試し、 得られた根が正・力学的に安定（∂P/∂δ &gt; 0）・指定分岐上であれば採用します。 そうでない場合は
 * Peng-Robinson 式の分岐に応じた根を初期値とし、挟み込み区間を作ってから 二分法で保護したニュートン法（rtsafe）で詰めます。
 * </p>
 */
@Slf4j
public final class Region3DensitySolver {

    /**
     * 挟み込み区間を広げる回数の上限です。
     */
    private static final int MAX_BRACKET_EXPANSIONS = 60;

    /**
     * 下端を広げるときの倍率です。
     */
    private static final double BRACKET_SHRINK = 0.95;

    /**
     * 上端を広げるときの倍率です。
     */
    private static final double BRACKET_GROW = 1.05;

    /**
     * 停滞とみなす δ の相対変化量です。
     */
    private static final double STAGNATION_RELATIVE_STEP = 1.0e-14;

    /**
     * 停滞時に収束とみなす圧力残差の相対値です。
     */
    private static final double STAGNATION_RELATIVE_RESIDUAL = 1.0e-9;

    /**
     * 領域 3 の状態式です。
     */
    private final Region3Equation equation;

    /**
     * 補助初期値を与える 3 次状態方程式です。
     */
    private final PengRobinsonEquation seedEquation;

    /**
     * 圧力残差の許容誤差 [Pa] です。
     */
    private final double pressureTolerance;

    /**
     * 各段階の最大反復回数です。
     */
    private final int maxIterations;

    /**
     * 密度逆算器を生成します。
     *
     * @param equation 領域 3 の状態式です
     * @param seedEquation 補助初期値を与える 3 次状態方程式です
     * @param pressureTolerance 圧力残差の許容誤差 [Pa]（正の値）です
     * @param maxIterations 最大反復回数（1 以上）です
     * @throws NullPointerException 状態式が null の場合
     * @throws IllegalArgumentException 許容誤差・反復回数が不正な場合
     */
    public Region3DensitySolver(Region3Equation equation, PengRobinsonEquation seedEquation,
            double pressureTolerance, int maxIterations) {
        this.equation = Preconditions.checkNotNull(equation, "領域 3 の状態式が null です。");
        this.seedEquation = Preconditions.checkNotNull(seedEquation, "3 次状態方程式が null です。");
        Preconditions.checkArgument(pressureTolerance > 0.0, "圧力の許容誤差は正の値である必要があります。tol=%s",
                pressureTolerance);
        Preconditions.checkArgument(maxIterations > 0, "最大反復回数は 1 以上である必要があります。maxIter=%s",
                maxIterations);
        this.pressureTolerance = pressureTolerance;
        this.maxIterations = maxIterations;
    }

    /**
     * 圧力・温度から指定分岐の密度を求めます。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @param branch 採用する根の分岐です
     * @return 密度逆算の結果です（未収束でも例外にはしません）
     * @throws NullPointerException branch が null の場合
     * @throws IllegalArgumentException 圧力・温度が正の有限値でない場合
     */
    public DensitySolution solve(double pressurePa, double temperatureK, DensityBranch branch) {
        Preconditions.checkNotNull(branch, "分岐が null です。");
        Preconditions.checkArgument(Double.isFinite(pressurePa) && pressurePa > 0.0,
                "圧力は正の有限値である必要があります。P=%s", pressurePa);
        Preconditions.checkArgument(Double.isFinite(temperatureK) && temperatureK > 0.0,
                "温度は正の有限値である必要があります。T=%s", temperatureK);

        double rhoC = If97Constants.CRITICAL_DENSITY_KG_M3;

        // 1) 理想気体の密度を初期値としたニュートン法
        double idealDelta =
                pressurePa / (If97Constants.SPECIFIC_GAS_CONSTANT * 1000.0 * temperatureK * rhoC);
        Attempt newton = newton(pressurePa, temperatureK, idealDelta);
        if (newton.converged && isAcceptable(newton.delta, temperatureK, branch)) {
            log.debug("密度をニュートン法で求めました。P={} Pa、T={} K、分岐={}、ρ={}、反復回数={}", pressurePa,
                    temperatureK, branch, fmt5(newton.delta * rhoC), newton.iterations);
            return new DensitySolution(true, newton.delta * rhoC, newton.delta, newton.iterations,
                    newton.residual, false);
        }

        // 2) 3 次状態方程式の根を初期値とした挟み込み付きニュートン法
        double seedDensity = seedEquation.estimateDensity(pressurePa, temperatureK, branch);
        double seedDelta = Double.isFinite(seedDensity) ? seedDensity / rhoC
                : 0.5 * (branch.minDelta() + branch.maxDelta());
        seedDelta = Math.max(branch.minDelta(), Math.min(branch.maxDelta(), seedDelta));
        log.debug("ニュートン法の根を採用できないため補助初期値で再計算します。P={} Pa、T={} K、分岐={}、初期δ={}", pressurePa,
                temperatureK, branch, fmt5(seedDelta));

        Attempt refined = bracketedNewton(pressurePa, temperatureK, seedDelta, branch);
        int iterations = newton.iterations + refined.iterations;
        boolean converged = refined.converged && isAcceptable(refined.delta, temperatureK, branch);
        if (converged) {
            log.debug("密度を補助初期値から求めました。P={} Pa、T={} K、分岐={}、ρ={}、反復回数={}", pressurePa,
                    temperatureK, branch, fmt5(refined.delta * rhoC), iterations);
        } else {
            log.debug("密度の逆算が収束しませんでした。P={} Pa、T={} K、分岐={}、最良δ={}、残差={} Pa", pressurePa,
                    temperatureK, branch, fmt5(refined.delta), refined.residual);
        }
        return new DensitySolution(converged, refined.delta * rhoC, refined.delta, iterations,
                refined.residual, true);
    }

    /**
     * 根が正・安定・指定分岐上であるかどうかを判定します。
     *
     * @param delta 換算密度です
     * @param temperatureK 温度 [K] です
     * @param branch 分岐です
     * @return 採用できる場合は true です
     */
    private boolean isAcceptable(double delta, double temperatureK, DensityBranch branch) {
        return Double.isFinite(delta) && delta > 0.0
                && equation.pressureDerivativeByDelta(delta, temperatureK) > 0.0
                && branch.accepts(delta);
    }

    /**
     * 区間制約のないニュートン法で δ を求めます。
     *
     * @param pressurePa 目標圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @param initialDelta δ の初期値です
     * @return 試行結果です
     */
    private Attempt newton(double pressurePa, double temperatureK, double initialDelta) {
        double delta = initialDelta;
        double residual = residual(delta, pressurePa, temperatureK);

        for (int iter = 1; iter <= maxIterations; iter++) {
            if (!Double.isFinite(residual)) {
                return new Attempt(false, delta, iter, residual);
            }
            if (Math.abs(residual) < pressureTolerance) {
                return new Attempt(true, delta, iter, residual);
            }

            double slope = equation.pressureDerivativeByDelta(delta, temperatureK);
            if (!(slope > 0.0) || !Double.isFinite(slope)) {
                // 不安定領域に入ったので打ち切ります。
                return new Attempt(false, delta, iter, residual);
            }

            double next = delta - residual / slope;
            if (next <= 0.0) {
                next = 0.5 * delta;
            }
            double step = Math.abs(next - delta);
            delta = next;
            residual = residual(delta, pressurePa, temperatureK);

            if (step <= STAGNATION_RELATIVE_STEP * delta) {
                boolean ok = Math.abs(residual) <= STAGNATION_RELATIVE_RESIDUAL * pressurePa;
                return new Attempt(ok, delta, iter, residual);
            }
        }
        return new Attempt(false, delta, maxIterations, residual);
    }

    /**
     * 初期値の周りに挟み込み区間を作り、二分法で保護したニュートン法で δ を求めます。
     *
     * @param pressurePa 目標圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @param seedDelta δ の初期値です
     * @param branch 区間の上下限を与える分岐です
     * @return 試行結果です
     */
    private Attempt bracketedNewton(double pressurePa, double temperatureK, double seedDelta,
            DensityBranch branch) {
        double lo = seedDelta;
        double hi = seedDelta;
        double fLo = residual(lo, pressurePa, temperatureK);
        double fHi = fLo;
        int expansions = 0;

        // 圧力は安定分岐上で δ に対して単調増加なので、下端は残差が負、上端は正になるまで広げます。
        while (fLo > 0.0 && lo > branch.minDelta() && expansions < MAX_BRACKET_EXPANSIONS) {
            lo = Math.max(branch.minDelta(), lo * BRACKET_SHRINK);
            fLo = residual(lo, pressurePa, temperatureK);
            expansions++;
        }
        while (fHi < 0.0 && hi < branch.maxDelta() && expansions < MAX_BRACKET_EXPANSIONS) {
            hi = Math.min(branch.maxDelta(), hi * BRACKET_GROW);
            fHi = residual(hi, pressurePa, temperatureK);
            expansions++;
        }

        if (!(fLo <= 0.0 && fHi >= 0.0)) {
            log.debug("挟み込み区間を作れませんでした。δ区間=[{}, {}]、残差=[{}, {}]", fmt5(lo), fmt5(hi), fLo,
                    fHi);
            return Math.abs(fLo) < Math.abs(fHi) ? new Attempt(false, lo, expansions, fLo)
                    : new Attempt(false, hi, expansions, fHi);
        }
        if (fLo == 0.0) {
            return new Attempt(true, lo, expansions, 0.0);
        }
        if (fHi == 0.0) {
            return new Attempt(true, hi, expansions, 0.0);
        }

        double x = Math.max(lo, Math.min(hi, seedDelta));
        double dxOld = hi - lo;
        double dx = dxOld;
        double f = residual(x, pressurePa, temperatureK);
        double df = equation.pressureDerivativeByDelta(x, temperatureK);

        for (int iter = 1; iter <= maxIterations; iter++) {
            boolean outside = ((x - hi) * df - f) * ((x - lo) * df - f) > 0.0;
            boolean slow = Math.abs(2.0 * f) > Math.abs(dxOld * df);
            if (outside || slow || !Double.isFinite(df)) {
                // 二分法
                dxOld = dx;
                dx = 0.5 * (hi - lo);
                x = lo + dx;
            } else {
                // ニュートン法
                dxOld = dx;
                dx = f / df;
                x -= dx;
            }

            f = residual(x, pressurePa, temperatureK);
            df = equation.pressureDerivativeByDelta(x, temperatureK);

            if (Math.abs(f) < pressureTolerance) {
                return new Attempt(true, x, expansions + iter, f);
            }
            if (Math.abs(dx) <= STAGNATION_RELATIVE_STEP * x) {
                boolean ok = Math.abs(f) <= STAGNATION_RELATIVE_RESIDUAL * pressurePa;
                return new Attempt(ok, x, expansions + iter, f);
            }

            if (f < 0.0) {
                lo = x;
            } else {
                hi = x;
            }
        }
        return new Attempt(false, x, expansions + maxIterations, f);
    }

    /**
     * 圧力残差 {@code P(δ) - P} [Pa] を計算します。
     *
     * @param delta 換算密度です
     * @param pressurePa 目標圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 圧力残差です
     */
    private double residual(double delta, double pressurePa, double temperatureK) {
        return equation.pressure(delta * If97Constants.CRITICAL_DENSITY_KG_M3, temperatureK)
                - pressurePa;
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

    /**
     * 1 回の求根試行の結果です。
     */
    private static final class Attempt {

        /**
         * 収束したかどうかです。
         */
        private final boolean converged;

        /**
         * 換算密度 δ です。
         */
        private final double delta;

        /**
         * 反復回数です。
         */
        private final int iterations;

        /**
         * 圧力残差 [Pa] です。
         */
        private final double residual;

        private Attempt(boolean converged, double delta, int iterations, double residual) {
            this.converged = converged;
            this.delta = delta;
            this.iterations = iterations;
            this.residual = residual;
        }
    }
}
