package io.github.yok.if97.core.model;

import lombok.Value;

/**
 * 各領域の状態式が返す単相の状態量です。
 *
 * <p>
 * 単位は比エンタルピー・比内部エネルギーが kJ/kg、比エントロピーが kJ/(kg·K)、密度が kg/m³ です。
 * </p>
 */
@Value
public class PhaseState {

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
     * 4 つの状態量がすべて有限値であることを検証して返します。
     *
     * <p>
     * 有効領域内で非有限値が出るのは実装の欠陥なので、実行時エラーではなく内部不変条件違反として扱います。
     * </p>
     *
     * @param source 計算元（ログ・例外メッセージ用）です
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 自身です
     * @throws IllegalStateException いずれかが非有限値の場合
     */
    public PhaseState requireFinite(String source, double pressurePa, double temperatureK) {
        if (!Double.isFinite(enthalpy) || !Double.isFinite(entropy)
                || !Double.isFinite(internalEnergy) || !Double.isFinite(density)) {
            throw new IllegalStateException(source + " の計算結果が有限値ではありません。P=" + pressurePa + " Pa, T="
                    + temperatureK + " K, " + this);
        }
        return this;
    }
}
