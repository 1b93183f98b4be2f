package io.github.yok.if97.core.verification;

import lombok.Value;

/**
 * 参照値 1 件の検証結果です。
 */
@Value
public class VerificationOutcome {

    /**
     * 参照値です。
     */
    ReferencePoint point;

    /**
     * 判定に使った分類（領域名または SATURATION）です。
     */
    String category;

    /**
     * 期待値との最大相対偏差です（計算に失敗した場合は NaN）。
     */
    double maxRelativeDeviation;

    /**
     * 許容する相対偏差です。
     */
    double tolerance;

    /**
     * 許容範囲内なら true です。
     */
    boolean passed;

    /**
     * 計算に失敗した場合のメッセージです（成功時は null）。
     */
    String failureMessage;
}
