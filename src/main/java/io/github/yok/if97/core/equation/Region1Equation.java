package io.github.yok.if97.core.equation;

import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.model.PhaseState;

/**
 * IAPWS-IF97 領域 1（圧縮液）のギブス自由エネルギー式です。
 *
 * <p>
 * 無次元ギブス自由エネルギー {@code γ(π, τ) = Σ n_i (7.1 - π)^I_i (τ - 1.222)^J_i}（34 項）を用い、
 * {@code π = P / 16.53 MPa}, {@code τ = 1386 K / T} とします。 偏導関数は項ごとに解析的に求めます。
 * </p>
 */
public final class Region1Equation implements SinglePhaseEquation {

    /**
     * 基準圧力 p* [Pa] です。
     */
    static final double REDUCING_PRESSURE_PA = 16.53e6;

    /**
     * 基準温度 T* [K] です。
     */
    static final double REDUCING_TEMPERATURE_K = 1386.0;

    private static final int[] I = {0, 0, 0, 0, 0, 0, 0, 0, 1, 1, 1, 1, 1, 1, 2, 2, 2, 2, 2, 3, 3,
            3, 4, 4, 4, 5, 8, 8, 21, 23, 29, 30, 31, 32};

    private static final int[] J = {-2, -1, 0, 1, 2, 3, 4, 5, -9, -7, -1, 0, 1, 3, -3, 0, 1, 3, 17,
            -4, 0, 6, -5, -2, 10, -8, -11, -6, -29, -31, -38, -39, -40, -41};

    private static final double[] N = {0.14632971213167, -0.84548187169114, -0.37563603672040e1,
            0.33855169168385e1, -0.95791963387872, 0.15772038513228, -0.16616417199501e-1,
            0.81214629983568e-3, 0.28319080123804e-3, -0.60706301565874e-3, -0.18990068218419e-1,
            -0.32529748770505e-1, -0.21841717175414e-1, -0.52838357969930e-4,
            -0.47184321073267e-3, -0.30001780793026e-3, 0.47661393906987e-4,
            -0.44141845330846e-5, -0.72694996297594e-15, -0.31679644845054e-4,
            -0.28270797985312e-5, -0.85205128120103e-9, -0.22425281908000e-5,
            -0.65171222895601e-6, -0.14341729937924e-12, -0.40516996860117e-6,
            -0.12734301741641e-8, -0.17424871230634e-9, -0.68762131295531e-18,
            0.14478307828521e-19, 0.26335781662795e-22, -0.11947622640071e-22,
            0.18228094581404e-23, -0.93537087292458e-25};

    /**
     * 圧力・温度から状態量を計算します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 状態量です
     * @throws IllegalStateException 計算結果が有限値にならない場合に発生します
     */
    @Override
    public PhaseState evaluate(double pressurePa, double temperatureK) {
        double pi = pressurePa / REDUCING_PRESSURE_PA;
        double tau = REDUCING_TEMPERATURE_K / temperatureK;
        double a = 7.1 - pi;
        double b = tau - 1.222;

        double gamma = 0.0;
        double gammaPi = 0.0;
        double gammaTau = 0.0;

        // 絶対値の小さい高次項から足し込みます。
        for (int k = N.length - 1; k >= 0; k--) {
            double n = N[k];
            int i = I[k];
            int j = J[k];
            double aPow = Math.pow(a, i);
            double bPow = Math.pow(b, j);
            gamma += n * aPow * bPow;
            if (i != 0) {
                gammaPi -= n * i * Math.pow(a, i - 1) * bPow;
            }
            if (j != 0) {
                gammaTau += n * aPow * j * Math.pow(b, j - 1);
            }
        }

        double r = If97Constants.SPECIFIC_GAS_CONSTANT;
        double rt = r * temperatureK;

        // 比体積 [m³/kg]。R は kJ 単位なので 1000 倍します。
        double specificVolume = r * 1000.0 * temperatureK * pi * gammaPi / pressurePa;
        double enthalpy = rt * tau * gammaTau;
        double internalEnergy = rt * (tau * gammaTau - pi * gammaPi);
        double entropy = r * (tau * gammaTau - gamma);

        return new PhaseState(enthalpy, entropy, internalEnergy, 1.0 / specificVolume)
                .requireFinite("領域 1", pressurePa, temperatureK);
    }
}
