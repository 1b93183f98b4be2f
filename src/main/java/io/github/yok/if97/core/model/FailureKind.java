package io.github.yok.if97.core.model;

/**
 * 計算失敗の種別です。
 *
 * <p>
 * いずれも入力に対して決定的で、再試行しても結果は変わりません。
 * </p>
 */
public enum FailureKind {

    /**
     * 圧力・温度が有効範囲外です。
     */
    OUT_OF_RANGE,

    /**
     * 臨界点近傍の特異性、または反復計算の未収束です。
     */
    NUMERICAL_INSTABILITY,

    /**
     * 単相の計算を飽和線上の条件で呼び出しました。
     */
    INVALID_STATE
}
