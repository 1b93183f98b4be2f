package io.github.yok.if97.core.equation;

import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.model.PhaseState;

/**
 * IAPWS-IF97 領域 3（臨界点近傍・超臨界）のヘルムホルツ自由エネルギー式です。
 *
 * <p>
 * {@code φ(δ, τ) = n1 ln δ + Σ n_i δ^I_i τ^J_i}（i = 2..40）を用い、 {@code δ = ρ / 322 kg/m³},
 * {@code τ = 647.096 K / T} とします。 密度と温度が独立変数なので、圧力からの逆算は
 * {@link io.github.yok.if97.core.solver.Region3DensitySolver} が行います。
 * </p>
 */
public final class Region3Equation {

    private static final double N1 = 0.10658070028513e1;

    private static final int[] I = {0, 0, 0, 0, 0, 0, 0, 1, 1, 1, 1, 2, 2, 2, 2, 2, 2, 3, 3, 3, 3,
            3, 4, 4, 4, 4, 5, 5, 5, 6, 6, 6, 7, 8, 9, 9, 10, 10, 11};

    private static final int[] J = {0, 1, 2, 7, 10, 12, 23, 2, 6, 15, 17, 0, 2, 6, 7, 22, 26, 0,
            2, 4, 16, 26, 0, 2, 4, 26, 1, 3, 26, 0, 2, 26, 2, 26, 2, 26, 0, 1, 26};

    private static final double[] N = {-0.15732845290239e2, 0.20944396974307e2,
            -0.76867707878716e1, 0.26185947787954e1, -0.28080781148620e1, 0.12053369696517e1,
            -0.84566812812502e-2, -0.12654315477714e1, -0.11524407806681e1, 0.88521043984318,
            -0.64207765181607, 0.38493460186671, -0.85214708824206, 0.48972281541877e1,
            -0.30502617256965e1, 0.39420536879154e-1, 0.12558408424308, -0.27999329698710,
            0.13899799569460e1, -0.20189915023570e1, -0.82147637173963e-2, -0.47596035734923,
            0.43984074473500e-1, -0.44476435428739, 0.90572070719733, 0.70522450087967,
            0.10770512626332, -0.32913623258954, -0.50871062041158, -0.22175400873096e-1,
            0.94260751665092e-1, 0.16436278447961, -0.13503372241348e-1, -0.14834345352472e-1,
            0.57922953628084e-3, 0.32308904703711e-2, 0.80964802996215e-4,
            -0.16557679795037e-3, -0.44923899061815e-4};

    /**
     * 密度・温度から圧力 {@code P = ρ R T δ φ_δ} [Pa] を計算します。
     *
     * @param densityKgM3 密度 [kg/m³] です
     * @param temperatureK 温度 [K] です
     * @return 圧力 [Pa] です
     */
    public double pressure(double densityKgM3, double temperatureK) {
        double delta = densityKgM3 / If97Constants.CRITICAL_DENSITY_KG_M3;
        double tau = If97Constants.CRITICAL_TEMPERATURE_K / temperatureK;
        return densityKgM3 * gasConstantJoules() * temperatureK * delta * phiDelta(delta, tau);
    }

    /**
     * 換算密度に対する圧力の偏微分 {@code ∂P/∂δ = ρ_c R T (2 δ φ_δ + δ² φ_δδ)} [Pa] を計算します。
     *
     * <p>
     * 正であれば力学的に安定な分岐です。
     * </p>
     *
     * @param delta 換算密度 δ です
     * @param temperatureK 温度 [K] です
     * @return ∂P/∂δ [Pa] です
     */
    public double pressureDerivativeByDelta(double delta, double temperatureK) {
        double tau = If97Constants.CRITICAL_TEMPERATURE_K / temperatureK;
        return If97Constants.CRITICAL_DENSITY_KG_M3 * gasConstantJoules() * temperatureK
                * (2.0 * delta * phiDelta(delta, tau)
                        + delta * delta * phiDeltaDelta(delta, tau));
    }

    /**
     * 密度・温度から状態量を計算します。
     *
     * @param densityKgM3 密度 [kg/m³] です
     * @param temperatureK 温度 [K] です
     * @return 状態量です
     * @throws IllegalStateException 計算結果が有限値にならない場合に発生します
     */
    public PhaseState evaluate(double densityKgM3, double temperatureK) {
        double delta = densityKgM3 / If97Constants.CRITICAL_DENSITY_KG_M3;
        double tau = If97Constants.CRITICAL_TEMPERATURE_K / temperatureK;

        double phi = N1 * Math.log(delta);
        double phiTau = 0.0;
        for (int k = N.length - 1; k >= 0; k--) {
            double dPow = Math.pow(delta, I[k]);
            phi += N[k] * dPow * Math.pow(tau, J[k]);
            if (J[k] != 0) {
                phiTau += N[k] * dPow * J[k] * Math.pow(tau, J[k] - 1);
            }
        }
        double deltaPhiDelta = delta * phiDelta(delta, tau);

        double r = If97Constants.SPECIFIC_GAS_CONSTANT;
        double rt = r * temperatureK;
        double enthalpy = rt * (tau * phiTau + deltaPhiDelta);
        double internalEnergy = rt * tau * phiTau;
        double entropy = r * (tau * phiTau - phi);
        double pressure = densityKgM3 * gasConstantJoules() * temperatureK * deltaPhiDelta;

        return new PhaseState(enthalpy, entropy, internalEnergy, densityKgM3)
                .requireFinite("領域 3", pressure, temperatureK);
    }

    /**
     * {@code φ_δ = n1/δ + Σ n I δ^(I-1) τ^J} を計算します。
     *
     * @param delta 換算密度です
     * @param tau 逆換算温度です
     * @return φ_δ です
     */
    private static double phiDelta(double delta, double tau) {
        double sum = 0.0;
        for (int k = N.length - 1; k >= 0; k--) {
            if (I[k] != 0) {
                sum += N[k] * I[k] * Math.pow(delta, I[k] - 1) * Math.pow(tau, J[k]);
            }
        }
        return N1 / delta + sum;
    }

    /**
     * {@code φ_δδ = -n1/δ² + Σ n I (I-1) δ^(I-2) τ^J} を計算します。
     *
     * @param delta 換算密度です
     * @param tau 逆換算温度です
     * @return φ_δδ です
     */
    private static double phiDeltaDelta(double delta, double tau) {
        double sum = 0.0;
        for (int k = N.length - 1; k >= 0; k--) {
            int i = I[k];
            if (i > 1) {
                sum += N[k] * i * (i - 1) * Math.pow(delta, i - 2) * Math.pow(tau, J[k]);
            }
        }
        return -N1 / (delta * delta) + sum;
    }

    /**
     * 比気体定数を J/(kg·K) 単位で返します。
     *
     * @return 比気体定数 [J/(kg·K)] です
     */
    private static double gasConstantJoules() {
        return If97Constants.SPECIFIC_GAS_CONSTANT * 1000.0;
    }
}
