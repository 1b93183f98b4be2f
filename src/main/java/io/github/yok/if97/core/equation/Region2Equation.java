package io.github.yok.if97.core.equation;

import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.model.PhaseState;
import lombok.extern.slf4j.Slf4j;

/**
 * IAPWS-IF97 領域 2（過熱蒸気）のギブス自由エネルギー式です。
 *
 * <p>
 * {@code γ = γ⁰ + γʳ} を理想気体部 {@code ln π + Σ n⁰ τ^J⁰}（9 項）と 残余部
 * {@code Σ n π^I (τ - 0.5)^J}（43 項）の和で表し、{@code π = P / 1 MPa}, {@code τ = 540 K / T} とします。
 * </p>
 */
@Slf4j
public final class Region2Equation implements SinglePhaseEquation {

    /**
     * 基準圧力 p* [Pa] です。
     */
    static final double REDUCING_PRESSURE_PA = 1.0e6;

    /**
     * 基準温度 T* [K] です。
     */
    static final double REDUCING_TEMPERATURE_K = 540.0;

    private static final int[] J0 = {0, 1, -5, -4, -3, -2, -1, 2, 3};

    private static final double[] N0 = {-0.96927686500217e1, 0.10086655968018e2,
            -0.56087911283020e-2, 0.71452738081455e-1, -0.40710498223928, 0.14240819171444e1,
            -0.43839511319450e1, -0.28408632460772, 0.21268463753307e-1};

    private static final int[] IR = {1, 1, 1, 1, 1, 2, 2, 2, 2, 2, 3, 3, 3, 3, 3, 4, 4, 4, 5, 6, 6,
            6, 7, 7, 7, 8, 8, 9, 10, 10, 10, 16, 16, 18, 20, 20, 20, 21, 22, 23, 24, 24, 24};

    private static final int[] JR = {0, 1, 2, 3, 6, 1, 2, 4, 7, 36, 0, 1, 3, 6, 35, 1, 2, 3, 7, 3,
            16, 35, 0, 11, 25, 8, 36, 13, 4, 10, 14, 29, 50, 57, 20, 35, 48, 21, 53, 39, 26, 40,
            58};

    private static final double[] NR = {-0.17731742473213e-2, -0.17834862292358e-1,
            -0.45996013696365e-1, -0.57581259083432e-1, -0.50325278727930e-1,
            -0.33032641670203e-4, -0.18948987516315e-3, -0.39392777243355e-2,
            -0.43797295650573e-1, -0.26674547914087e-4, 0.20481737692309e-7,
            0.43870667284435e-6, -0.32277677238570e-4, -0.15033924542148e-2,
            -0.40668253562649e-1, -0.78847309559367e-9, 0.12790717852285e-7,
            0.48225372718507e-6, 0.22922076337661e-5, -0.16714766451061e-10,
            -0.21171472321355e-2, -0.23895741934104e2, -0.59059564324270e-17,
            -0.12621808899101e-5, -0.38946842435739e-1, 0.11256211360459e-10,
            -0.82311340897998e1, 0.19809712802088e-7, 0.10406965210174e-18,
            -0.10234747095929e-12, -0.10018179379511e-8, -0.80882908646985e-10,
            0.10693031879409, -0.33662250574171, 0.89185845355421e-24, 0.30629316876232e-12,
            -0.42002467698208e-5, -0.59056029685639e-25, 0.37826947613457e-5,
            -0.12768608934681e-14, 0.73087610595061e-28, 0.55414715350778e-16,
            -0.94369707241210e-6};

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

        // 理想気体部
        double gamma0 = Math.log(pi);
        double gamma0Tau = 0.0;
        for (int k = N0.length - 1; k >= 0; k--) {
            int j = J0[k];
            gamma0 += N0[k] * Math.pow(tau, j);
            if (j != 0) {
                gamma0Tau += N0[k] * j * Math.pow(tau, j - 1);
            }
        }
        double gamma0Pi = 1.0 / pi;

        // 残余部
        double b = tau - 0.5;
        double gammaR = 0.0;
        double gammaRPi = 0.0;
        double gammaRTau = 0.0;
        for (int k = NR.length - 1; k >= 0; k--) {
            double n = NR[k];
            int i = IR[k];
            int j = JR[k];
            double piPow = Math.pow(pi, i);
            double bPow = Math.pow(b, j);
            gammaR += n * piPow * bPow;
            gammaRPi += n * i * Math.pow(pi, i - 1) * bPow;
            if (j != 0) {
                gammaRTau += n * piPow * j * Math.pow(b, j - 1);
            }
        }

        double r = If97Constants.SPECIFIC_GAS_CONSTANT;
        double rt = r * temperatureK;
        double piGammaPi = pi * (gamma0Pi + gammaRPi);
        double tauGammaTau = tau * (gamma0Tau + gammaRTau);

        double specificVolume = r * 1000.0 * temperatureK * piGammaPi / pressurePa;
        double enthalpy = rt * tauGammaTau;
        double internalEnergy = rt * (tauGammaTau - piGammaPi);
        double entropy = r * (tauGammaTau - (gamma0 + gammaR));

        if (log.isDebugEnabled()) {
            log.debug("領域 2 の細区分を判定しました。P={} Pa、T={} K、細区分={}", pressurePa, temperatureK,
                    Region2SubZone.of(pressurePa, enthalpy));
        }

        return new PhaseState(enthalpy, entropy, internalEnergy, 1.0 / specificVolume)
                .requireFinite("領域 2", pressurePa, temperatureK);
    }
}
