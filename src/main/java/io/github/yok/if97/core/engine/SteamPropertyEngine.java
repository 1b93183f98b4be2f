package io.github.yok.if97.core.engine;

import io.github.yok.if97.core.model.EngineResult;
import io.github.yok.if97.core.model.PropertyResult;
import io.github.yok.if97.core.model.SaturationResult;

/**
 * 水・水蒸気の熱力学物性を計算するエンジンのインタフェースです。
 *
 * <p>
 * 入出力はすべて SI 単位（Pa, K, kJ/kg, kJ/(kg·K), kg/m³）です。 想定内の失敗（範囲外・数値的不安定・飽和線上）は例外ではなく
 * {@link EngineResult} の失敗として返します。 実装は状態を持たず、複数スレッドから同時に呼び出せます。
 * </p>
 */
public interface SteamPropertyEngine {

    /**
     * 圧力・温度を指定して単相の物性値を計算します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 物性値、または失敗です
     */
    EngineResult<PropertyResult> propertiesAt(double pressurePa, double temperatureK);

    /**
     * 圧力を指定して飽和物性値を計算します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @return 飽和物性値、または失敗です
     */
    EngineResult<SaturationResult> saturationAtPressure(double pressurePa);

    /**
     * 温度を指定して飽和物性値を計算します。
     *
     * @param temperatureK 温度 [K] です
     * @return 飽和物性値、または失敗です
     */
    EngineResult<SaturationResult> saturationAtTemperature(double temperatureK);
}
