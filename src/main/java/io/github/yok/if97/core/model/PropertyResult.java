package io.github.yok.if97.core.model;

import lombok.Value;

/**
 * 圧力・温度を指定した単相物性値の計算結果です。
 *
 * <p>
 * 入力の圧力・温度をそのまま保持し、比内部エネルギーは {@code u ≈ h - P/ρ} を満たします。
 * </p>
 */
@Value
public class PropertyResult {

    /**
     * 入力圧力 [Pa] です。
     */
    double pressure;

    /**
     * 入力温度 [K] です。
     */
    double temperature;

    /**
     * 割り当てられた領域です。
     */
    Region region;

    /**
     * 比エンタルピー [kJ/kg] です。
     */
    double enthalpy;

    /**
     * 比エントロピー [kJ/(kg·K)] です。
     */
    double entropy;

    /**
     * 比内部エネルギー [kJ/kg] です。
     */
    double internalEnergy;

    /**
     * 密度 [kg/m³] です。
     */
    double density;

    /**
     * 単相の状態量から結果を組み立てます。
     *
     * @param pressure 入力圧力 [Pa] です
     * @param temperature 入力温度 [K] です
     * @param region 領域です
     * @param state 状態量です
     * @return 計算結果です
     */
    public static PropertyResult of(double pressure, double temperature, Region region,
            PhaseState state) {
        return new PropertyResult(pressure, temperature, region, state.getEnthalpy(),
                state.getEntropy(), state.getInternalEnergy(), state.getDensity());
    }

    /**
     * 比体積 [m³/kg] を返します。
     *
     * @return 比体積です
     */
    public double specificVolume() {
        return 1.0 / density;
    }
}
