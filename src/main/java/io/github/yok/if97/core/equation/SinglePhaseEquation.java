package io.github.yok.if97.core.equation;

import io.github.yok.if97.core.model.PhaseState;

/**
 * 圧力・温度を入力とする単相の状態式（ギブス自由エネルギー式）を表すインタフェースです。
 *
 * <p>
 * 領域 1（液相）と領域 2（気相）の実装を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface SinglePhaseEquation {

    /**
     * 圧力・温度から状態量を計算します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 状態量です
     * @throws IllegalStateException 計算結果が有限値にならない場合に発生します
     */
    PhaseState evaluate(double pressurePa, double temperatureK);
}
