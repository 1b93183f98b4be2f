package io.github.yok.if97.core.solver;

import io.github.yok.if97.core.constant.If97Constants;

/**
 * 領域 3 で密度を逆算する際に採用する根の分岐です。
 *
 * <p>
 * 臨界温度未満では同じ圧力に液相的・気相的な 2 つの安定根が存在し得るため、 飽和圧力との大小で分岐を選びます。 δ の範囲はブラケット探索の上下限にも使います。
 * </p>
 */
public enum DensityBranch {

    /**
     * 液相的な根（δ &gt; 1）です。
     */
    LIQUID_LIKE(1.0, 3.6),

    /**
     * 気相的な根（δ &lt; 1）です。
     */
    VAPOR_LIKE(1.0e-6, 1.0),

    /**
     * 臨界温度以上の唯一の安定根です。
     */
    SUPERCRITICAL(1.0e-6, 3.6);

    /**
     * 換算密度 δ の下限です。
     */
    private final double minDelta;

    /**
     * 換算密度 δ の上限です。
     */
    private final double maxDelta;

    DensityBranch(double minDelta, double maxDelta) {
        this.minDelta = minDelta;
        this.maxDelta = maxDelta;
    }

    /**
     * 換算密度 δ の下限を返します。
     *
     * @return δ の下限です
     */
    public double minDelta() {
        return minDelta;
    }

    /**
     * 換算密度 δ の上限を返します。
     *
     * @return δ の上限です
     */
    public double maxDelta() {
        return maxDelta;
    }

    /**
     * 換算密度がこの分岐の根として妥当かどうかを返します。
     *
     * @param delta 換算密度です
     * @return 妥当なら true です
     */
    public boolean accepts(double delta) {
        switch (this) {
            case LIQUID_LIKE:
                return delta > 1.0;
            case VAPOR_LIKE:
                return delta > 0.0 && delta < 1.0;
            case SUPERCRITICAL:
            default:
                return delta > 0.0;
        }
    }

    /**
     * 圧力・温度と飽和圧力から分岐を選びます。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @param saturationPressurePa 温度に対する飽和圧力 [Pa] です（臨界温度以上では参照しません）
     * @return 分岐です
     */
    public static DensityBranch select(double pressurePa, double temperatureK,
            double saturationPressurePa) {
        if (temperatureK >= If97Constants.CRITICAL_TEMPERATURE_K) {
            return SUPERCRITICAL;
        }
        return pressurePa > saturationPressurePa ? LIQUID_LIKE : VAPOR_LIKE;
    }
}
