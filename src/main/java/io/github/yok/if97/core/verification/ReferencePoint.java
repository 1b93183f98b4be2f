package io.github.yok.if97.core.verification;

import lombok.Value;

/**
 * 検証用の参照値 1 件です。
 *
 * <p>
 * 種類によって入力と期待値の列の意味が変わります。 期待値が空欄の項目は NaN とし、検証の対象外にします。
 * </p>
 *
 * <ul>
 * <li>{@link ReferenceKind#PT}: 入力は圧力・温度、期待値は h, s, u, ρ</li>
 * <li>{@link ReferenceKind#SAT_T}: 入力は温度、期待値は圧力（飽和圧力）</li>
 * <li>{@link ReferenceKind#SAT_P}: 入力は圧力、期待値は温度（飽和温度）</li>
 * </ul>
 */
@Value
public class ReferencePoint {

    /**
     * 参照値の種類です。
     */
    ReferenceKind kind;

    /**
     * 圧力 [Pa] です。
     */
    double pressure;

    /**
     * 温度 [K] です。
     */
    double temperature;

    /**
     * 比エンタルピー [kJ/kg] の期待値です。
     */
    double enthalpy;

    /**
     * 比エントロピー [kJ/(kg·K)] の期待値です。
     */
    double entropy;

    /**
     * 比内部エネルギー [kJ/kg] の期待値です。
     */
    double internalEnergy;

    /**
     * 密度 [kg/m³] の期待値です。
     */
    double density;
}
