package io.github.yok.if97.core.constant;

/**
 * 領域 2 と領域 3 の境界（B23 境界）を表す補助式です。
 *
 * <p>
 * {@code π = n1 + n2 θ + n3 θ²}（π = P/1 MPa, θ = T/1 K）と、その逆関数
 * {@code θ = n4 + sqrt((π - n5) / n3)} を提供します。 有効範囲は 623.15 K ≤ T ≤ 863.15 K です。
 * </p>
 */
public final class B23Boundary {

    private static final double N1 = 0.34805185628969e3;
    private static final double N2 = -0.11671859879975e1;
    private static final double N3 = 0.10192970039326e-2;
    private static final double N4 = 0.57254459862746e3;
    private static final double N5 = 0.13918839778870e2;

    /**
     * インスタンス化を禁止します。
     */
    private B23Boundary() {}

    /**
     * 温度から境界圧力を求めます。
     *
     * @param temperatureK 温度 [K] です
     * @return 境界圧力 [Pa] です
     */
    public static double pressureAt(double temperatureK) {
        double theta = temperatureK;
        double pi = N1 + theta * (N2 + theta * N3);
        return pi * 1.0e6;
    }

    /**
     * 圧力から境界温度を求めます。
     *
     * @param pressurePa 圧力 [Pa] です（16.5292 MPa 以上）
     * @return 境界温度 [K] です
     * @throws IllegalArgumentException 圧力が境界式の定義域外の場合
     */
    public static double temperatureAt(double pressurePa) {
        double pi = pressurePa / 1.0e6;
        if (pi < N5) {
            throw new IllegalArgumentException("B23 境界式の定義域外の圧力です: " + pressurePa);
        }
        return N4 + Math.sqrt((pi - N5) / N3);
    }
}
