package io.github.yok.if97.core.model;

/**
 * 圧力・温度の組が属する領域です。
 *
 * <p>
 * 領域分類器だけが割り当て、呼び出し側が指定することはありません。
 * </p>
 */
public enum Region {

    /**
     * 圧縮液（IF97 領域 1）です。
     */
    LIQUID("領域1（圧縮液）"),

    /**
     * 過熱蒸気・低圧蒸気（IF97 領域 2）です。
     */
    VAPOR("領域2（過熱蒸気）"),

    /**
     * 超臨界・臨界近傍（IF97 領域 3）です。
     */
    SUPERCRITICAL("領域3（超臨界）"),

    /**
     * 飽和線上（気液二相境界）です。
     */
    SATURATION_BOUNDARY("飽和線");

    /**
     * ログ表示用のラベルです。
     */
    private final String label;

    Region(String label) {
        this.label = label;
    }

    /**
     * ログ表示用のラベルを返します。
     *
     * @return ラベルです
     */
    public String label() {
        return label;
    }
}
