package io.github.yok.if97.core.equation;

/**
 * 領域 2 の細区分（2a / 2b / 2c）です。
 *
 * <p>
 * 順方向の物性計算は細区分によらず同一の式を使うため、診断ログにのみ用います。
 * </p>
 */
enum Region2SubZone {

    /**
     * 4 MPa 以下です。
     */
    A,

    /**
     * 4 MPa 超で B2bc 線より高エンタルピー側です。
     */
    B,

    /**
     * 4 MPa 超で B2bc 線以下のエンタルピー側です。
     */
    C;

    /**
     * 2a と 2b/2c を分ける圧力 [Pa] です。
     */
    static final double AB_PRESSURE_PA = 4.0e6;

    /**
     * この圧力未満の 4 MPa 超の状態は常に 2b です [Pa]。
     */
    static final double B_ONLY_BELOW_PA = 6.546e6;

    private static final double N3 = 0.12809002730136e-3;
    private static final double N4 = 0.26526571908428e4;
    private static final double N5 = 0.45257578905948e1;

    /**
     * 圧力と比エンタルピーから細区分を判定します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param enthalpy 比エンタルピー [kJ/kg] です
     * @return 細区分です
     */
    static Region2SubZone of(double pressurePa, double enthalpy) {
        if (pressurePa <= AB_PRESSURE_PA) {
            return A;
        }
        if (pressurePa < B_ONLY_BELOW_PA) {
            return B;
        }
        return enthalpy > b2bcEnthalpy(pressurePa) ? B : C;
    }

    /**
     * B2bc 線上の比エンタルピー {@code η = n4 + sqrt((π - n5) / n3)} [kJ/kg] を返します。
     *
     * @param pressurePa 圧力 [Pa] です（6.546 MPa 以上）
     * @return 境界の比エンタルピーです
     */
    static double b2bcEnthalpy(double pressurePa) {
        double pi = pressurePa / 1.0e6;
        return N4 + Math.sqrt((pi - N5) / N3);
    }
}
