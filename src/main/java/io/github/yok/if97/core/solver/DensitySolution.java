package io.github.yok.if97.core.solver;

import io.github.yok.if97.core.model.EngineFailure;
import java.util.Locale;
import lombok.Value;

/**
 * 領域 3 の密度逆算の結果です。
 */
@Value
public class DensitySolution {

    /**
     * 許容誤差内に収束し、分岐と安定性の条件も満たしたかどうかです。
     */
    boolean converged;

    /**
     * 密度 [kg/m³]（未収束の場合は最良の近似値）です。
     */
    double density;

    /**
     * 換算密度 δ です。
     */
    double delta;

    /**
     * ニュートン法と補助計算を合わせた反復回数です。
     */
    int iterations;

    /**
     * 最終的な圧力残差 {@code P(δ) - P} [Pa] です。
     */
    double residual;

    /**
     * 3 次状態方程式による補助初期値を使ったかどうかです。
     */
    boolean fallbackUsed;

    /**
     * 未収束の結果を失敗内容に変換します。
     *
     * @param pressurePa 目標圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 数値的不安定の失敗内容です
     */
    public EngineFailure toFailure(double pressurePa, double temperatureK) {
        String reason = String.format(Locale.ROOT,
                "領域 3 の密度の逆算が収束しませんでした（P=%.6e Pa, T=%.3f K, 反復回数=%d）", pressurePa,
                temperatureK, iterations);
        return EngineFailure.numericalInstability(reason, residual,
                "臨界点から離れた条件を指定するか、region3 の許容誤差・反復回数を見直してください");
    }
}
