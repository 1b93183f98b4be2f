package io.github.yok.if97.core.model;

import java.util.Locale;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 計算失敗の内容です。
 *
 * <p>
 * 種別ごとに以下の診断情報を持ちます（該当しない数値項目は NaN、文字列項目は null です）。
 * </p>
 *
 * <ul>
 * <li>{@link FailureKind#OUT_OF_RANGE}: パラメータ名、値、有効範囲の下限・上限</li>
 * <li>{@link FailureKind#NUMERICAL_INSTABILITY}: 距離や残差などの診断指標と、対処の提案</li>
 * <li>{@link FailureKind#INVALID_STATE}: 飽和計算を使うよう促す案内</li>
 * </ul>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EngineFailure {

    /**
     * 失敗の種別です。
     */
    FailureKind kind;

    /**
     * 人が読むためのメッセージです。
     */
    String message;

    /**
     * 範囲外となったパラメータ名（pressure / temperature）です。
     */
    String parameterName;

    /**
     * 範囲外となった値です。
     */
    double value;

    /**
     * 有効範囲の下限です。
     */
    double minValue;

    /**
     * 有効範囲の上限です。
     */
    double maxValue;

    /**
     * 診断指標（臨界点からの正規化距離、または最終残差）です。
     */
    double metric;

    /**
     * 対処の提案、または使用すべき操作の案内です。
     */
    String suggestion;

    /**
     * 入力範囲外の失敗を生成します。
     *
     * @param parameterName パラメータ名です
     * @param value 入力値です
     * @param minValue 有効範囲の下限です
     * @param maxValue 有効範囲の上限です
     * @return 失敗内容です
     */
    public static EngineFailure outOfRange(String parameterName, double value, double minValue,
            double maxValue) {
        String message = String.format(Locale.ROOT, "%s: %.6e は有効範囲外です。有効範囲: %.6e – %.6e",
                parameterName, value, minValue, maxValue);
        return new EngineFailure(FailureKind.OUT_OF_RANGE, message, parameterName, value, minValue,
                maxValue, Double.NaN, null);
    }

    /**
     * 数値的不安定（特異点・未収束）の失敗を生成します。
     *
     * @param reason 失敗理由です
     * @param metric 診断指標（距離または残差）です
     * @param suggestion 対処の提案です
     * @return 失敗内容です
     */
    public static EngineFailure numericalInstability(String reason, double metric,
            String suggestion) {
        String message = String.format(Locale.ROOT, "%s（診断指標=%.6e）。提案: %s", reason, metric,
                suggestion);
        return new EngineFailure(FailureKind.NUMERICAL_INSTABILITY, message, null, Double.NaN,
                Double.NaN, Double.NaN, metric, suggestion);
    }

    /**
     * 飽和線上で単相計算を呼び出した失敗を生成します。
     *
     * @param pressurePa 入力圧力 [Pa] です
     * @param temperatureK 入力温度 [K] です
     * @return 失敗内容です
     */
    public static EngineFailure invalidState(double pressurePa, double temperatureK) {
        String guidance = "飽和物性は saturationAtPressure / saturationAtTemperature で計算してください";
        String message = String.format(Locale.ROOT, "P=%.6e Pa, T=%.2f K は飽和線上（気液二相）です。%s",
                pressurePa, temperatureK, guidance);
        return new EngineFailure(FailureKind.INVALID_STATE, message, null, Double.NaN, Double.NaN,
                Double.NaN, Double.NaN, guidance);
    }
}
