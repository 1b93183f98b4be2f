package io.github.yok.if97.core.constant;

/**
 * IAPWS-IF97 の物理定数と各領域の境界値を保持するクラスです。
 *
 * <p>
 * 単位はすべて SI（Pa, K, kg/m³）です。比気体定数のみ kJ/(kg·K) で保持します。
 * </p>
 */
public final class If97Constants {

    /**
     * インスタンス化を禁止します。
     */
    private If97Constants() {}

    /**
     * 比気体定数 R [kJ/(kg·K)] です。
     */
    public static final double SPECIFIC_GAS_CONSTANT = 0.461526;

    /**
     * 臨界圧力 P_c [Pa] です。
     */
    public static final double CRITICAL_PRESSURE_PA = 22.064e6;

    /**
     * 臨界温度 T_c [K] です。
     */
    public static final double CRITICAL_TEMPERATURE_K = 647.096;

    /**
     * 臨界密度 ρ_c [kg/m³] です。
     */
    public static final double CRITICAL_DENSITY_KG_M3 = 322.0;

    /**
     * 三重点圧力 [Pa] です。
     */
    public static final double TRIPLE_POINT_PRESSURE_PA = 611.657;

    /**
     * 三重点温度 [K] です。
     */
    public static final double TRIPLE_POINT_TEMPERATURE_K = 273.16;

    /** 全体の圧力下限 [Pa] です。 */
    public static final double GLOBAL_PRESSURE_MIN_PA = TRIPLE_POINT_PRESSURE_PA;

    /** 全体の圧力上限 [Pa] です。 */
    public static final double GLOBAL_PRESSURE_MAX_PA = 100.0e6;

    /** 全体の温度下限 [K] です。 */
    public static final double GLOBAL_TEMPERATURE_MIN_K = 273.15;

    /** 全体の温度上限 [K] です。 */
    public static final double GLOBAL_TEMPERATURE_MAX_K = 863.15;

    /** 飽和計算の圧力下限 [Pa] です。 */
    public static final double SATURATION_PRESSURE_MIN_PA = TRIPLE_POINT_PRESSURE_PA;

    /** 飽和計算の圧力上限 [Pa] です。 */
    public static final double SATURATION_PRESSURE_MAX_PA = CRITICAL_PRESSURE_PA;

    /** 飽和計算の温度下限 [K] です。 */
    public static final double SATURATION_TEMPERATURE_MIN_K = TRIPLE_POINT_TEMPERATURE_K;

    /** 飽和計算の温度上限 [K] です。 */
    public static final double SATURATION_TEMPERATURE_MAX_K = CRITICAL_TEMPERATURE_K;

    /**
     * 領域 1 と領域 3 の境界温度 [K] です。
     *
     * <p>
     * これを超える温度で B23 境界より高圧の状態は領域 3 になります。
     * </p>
     */
    public static final double REGION3_TEMPERATURE_MIN_K = 623.15;

    /**
     * 領域 3 の代表的な下限圧力 [Pa] です（623.15 K での飽和圧力に相当）。
     */
    public static final double REGION3_PRESSURE_MIN_PA = 16.5292e6;

    /**
     * 特異点ガードの既定しきい値（臨界点からの正規化距離）です。
     */
    public static final double DEFAULT_SINGULARITY_THRESHOLD = 0.05;
}
