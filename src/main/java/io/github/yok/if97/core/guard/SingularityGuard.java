package io.github.yok.if97.core.guard;

import com.google.common.base.Preconditions;
import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.model.EngineFailure;
import java.util.Locale;
import lombok.Getter;
import lombok.Value;

/**
 * 臨界点近傍の特異性を検出するガードです。
 *
 * <p>
 * 正規化距離 {@code d = sqrt(((P - P_c)/P_c)² + ((T - T_c)/T_c)²)} がしきい値未満の条件は、 領域 3 の計算が数値的に不安定になるため拒否します。
 * </p>
 */
public final class SingularityGuard {

    /**
     * 拒否する正規化距離のしきい値です。
     */
    @Getter
    private final double threshold;

    /**
     * ガードを生成します。
     *
     * @param threshold 正規化距離のしきい値（正の有限値）です
     * @throws IllegalArgumentException しきい値が不正な場合に発生します
     */
    public SingularityGuard(double threshold) {
        Preconditions.checkArgument(Double.isFinite(threshold) && threshold > 0.0,
                "特異点ガードのしきい値は正の有限値である必要があります。threshold=%s", threshold);
        this.threshold = threshold;
    }

    /**
     * 臨界点からの正規化距離を計算します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 正規化距離です
     */
    public static double normalizedDistance(double pressurePa, double temperatureK) {
        double dp = (pressurePa - If97Constants.CRITICAL_PRESSURE_PA)
                / If97Constants.CRITICAL_PRESSURE_PA;
        double dt = (temperatureK - If97Constants.CRITICAL_TEMPERATURE_K)
                / If97Constants.CRITICAL_TEMPERATURE_K;
        return Math.sqrt(dp * dp + dt * dt);
    }

    /**
     * 圧力・温度が臨界点から十分離れているかを判定します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 判定結果です
     */
    public SingularityCheck check(double pressurePa, double temperatureK) {
        double distance = normalizedDistance(pressurePa, temperatureK);
        return new SingularityCheck(distance >= threshold, distance, threshold, pressurePa,
                temperatureK);
    }

    /**
     * 特異点ガードの判定結果です。
     */
    @Value
    public static class SingularityCheck {

        /**
         * 通過（計算可能）なら true です。
         */
        boolean passed;

        /**
         * 臨界点からの正規化距離です。
         */
        double distance;

        /**
         * 判定に使ったしきい値です。
         */
        double threshold;

        /**
         * 判定した圧力 [Pa] です。
         */
        double pressure;

        /**
         * 判定した温度 [K] です。
         */
        double temperature;

        /**
         * 拒否された判定結果を失敗内容に変換します。
         *
         * @return 数値的不安定の失敗内容です
         */
        public EngineFailure toFailure() {
            String reason = String.format(Locale.ROOT,
                    "臨界点近傍のため計算できません（P=%.6e Pa, T=%.3f K, 距離=%.5f, しきい値=%.5f）", pressure,
                    temperature, distance, threshold);
            String suggestion = String.format(Locale.ROOT, "臨界点から %.0f%% 以上離れた条件を指定してください",
                    threshold * 100.0);
            return EngineFailure.numericalInstability(reason, distance, suggestion);
        }
    }
}
