package io.github.yok.if97.core.solver;

import lombok.Value;

/**
 * 1 変数の求根計算の結果です。
 *
 * <p>
 * 未収束の場合も最良の近似値と残差を保持し、呼び出し側が失敗の内容を組み立てられるようにします。
 * </p>
 */
@Value
public class RootFindResult {

    /**
     * 許容誤差内に収束したかどうかです。
     */
    boolean converged;

    /**
     * 根（未収束の場合は最良の近似値）です。
     */
    double root;

    /**
     * 反復回数です。
     */
    int iterations;

    /**
     * 根における関数値（残差）です。
     */
    double residual;
}
