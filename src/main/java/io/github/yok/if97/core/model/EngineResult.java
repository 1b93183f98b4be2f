package io.github.yok.if97.core.model;

import com.google.common.base.Preconditions;

/**
 * 物性エンジンの公開操作が返す結果です。
 *
 * <p>
 * 成功時は計算値、失敗時は {@link EngineFailure} のどちらか一方だけを保持します。 想定内の失敗（範囲外・数値的不安定・飽和線上）は例外ではなくこの型で返します。
 * </p>
 *
 * @param <T> 成功時の値の型です
 */
public final class EngineResult<T> {

    /**
     * 成功時の値です（失敗時は null）。
     */
    private final T value;

    /**
     * 失敗内容です（成功時は null）。
     */
    private final EngineFailure failure;

    private EngineResult(T value, EngineFailure failure) {
        this.value = value;
        this.failure = failure;
    }

    /**
     * 成功結果を生成します。
     *
     * @param <T> 値の型です
     * @param value 計算値です（null 不可）
     * @return 成功結果です
     */
    public static <T> EngineResult<T> success(T value) {
        Preconditions.checkNotNull(value, "成功結果の値が null です。");
        return new EngineResult<>(value, null);
    }

    /**
     * 失敗結果を生成します。
     *
     * @param <T> 値の型です
     * @param failure 失敗内容です（null 不可）
     * @return 失敗結果です
     */
    public static <T> EngineResult<T> failure(EngineFailure failure) {
        Preconditions.checkNotNull(failure, "失敗内容が null です。");
        return new EngineResult<>(null, failure);
    }

    /**
     * 成功かどうかを返します。
     *
     * @return 成功なら true です
     */
    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * 失敗かどうかを返します。
     *
     * @return 失敗なら true です
     */
    public boolean isFailure() {
        return failure != null;
    }

    /**
     * 成功時の値を返します。
     *
     * @return 計算値です
     * @throws IllegalStateException 失敗結果の場合
     */
    public T getValue() {
        Preconditions.checkState(isSuccess(), "失敗結果から値は取得できません: %s",
                failure == null ? "" : failure.getMessage());
        return value;
    }

    /**
     * 失敗内容を返します。
     *
     * @return 失敗内容です
     * @throws IllegalStateException 成功結果の場合
     */
    public EngineFailure getFailure() {
        Preconditions.checkState(isFailure(), "成功結果に失敗内容はありません。");
        return failure;
    }

    /**
     * 成功時の値を返し、失敗時は種別に応じた例外に変換して送出します。
     *
     * <p>
     * 範囲外・飽和線上は入力検証エラー（{@link IllegalArgumentException}）、 数値的不安定は計算失敗（{@link IllegalStateException}）に対応させます。
     * </p>
     *
     * @return 計算値です
     * @throws IllegalArgumentException 範囲外または飽和線上の場合
     * @throws IllegalStateException 数値的不安定の場合
     */
    public T orElseThrow() {
        if (isSuccess()) {
            return value;
        }
        switch (failure.getKind()) {
            case OUT_OF_RANGE:
            case INVALID_STATE:
                throw new IllegalArgumentException(failure.getMessage());
            case NUMERICAL_INSTABILITY:
            default:
                throw new IllegalStateException(failure.getMessage());
        }
    }

    @Override
    public String toString() {
        return isSuccess() ? "EngineResult.success(" + value + ")"
                : "EngineResult.failure(" + failure + ")";
    }
}
