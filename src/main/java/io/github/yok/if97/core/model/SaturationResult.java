package io.github.yok.if97.core.model;

import lombok.Value;

/**
 * 飽和線上の液相・気相の物性値です。
 *
 * <p>
 * 飽和温度と飽和圧力は飽和圧力式で相互に整合しています。 臨界点から離れた条件では
 * {@code enthalpyLiquid < enthalpyVapor} かつ {@code densityLiquid > densityVapor} です。
 * </p>
 */
@Value
public class SaturationResult {

    /**
     * 飽和温度 [K] です。
     */
    double saturationTemperature;

    /**
     * 飽和圧力 [Pa] です。
     */
    double saturationPressure;

    /**
     * 飽和液の比エンタルピー [kJ/kg] です。
     */
    double enthalpyLiquid;

    /**
     * 飽和液の比エントロピー [kJ/(kg·K)] です。
     */
    double entropyLiquid;

    /**
     * 飽和液の密度 [kg/m³] です。
     */
    double densityLiquid;

    /**
     * 飽和蒸気の比エンタルピー [kJ/kg] です。
     */
    double enthalpyVapor;

    /**
     * 飽和蒸気の比エントロピー [kJ/(kg·K)] です。
     */
    double entropyVapor;

    /**
     * 飽和蒸気の密度 [kg/m³] です。
     */
    double densityVapor;

    /**
     * 液相・気相の状態量から結果を組み立てます。
     *
     * @param temperature 飽和温度 [K] です
     * @param pressure 飽和圧力 [Pa] です
     * @param liquid 飽和液の状態量です
     * @param vapor 飽和蒸気の状態量です
     * @return 飽和物性値です
     */
    public static SaturationResult of(double temperature, double pressure, PhaseState liquid,
            PhaseState vapor) {
        return new SaturationResult(temperature, pressure, liquid.getEnthalpy(),
                liquid.getEntropy(), liquid.getDensity(), vapor.getEnthalpy(), vapor.getEntropy(),
                vapor.getDensity());
    }

    /**
     * 蒸発潜熱 {@code h_fg = h_vapor - h_liquid} [kJ/kg] を返します。
     *
     * @return 蒸発潜熱です
     */
    public double heatOfVaporization() {
        return enthalpyVapor - enthalpyLiquid;
    }
}
