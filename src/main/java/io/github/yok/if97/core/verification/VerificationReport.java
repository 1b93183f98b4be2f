package io.github.yok.if97.core.verification;

import java.util.List;
import lombok.Value;

/**
 * 参照値の検証結果一覧です。
 */
@Value
public class VerificationReport {

    /**
     * 参照値ごとの検証結果です。
     */
    List<VerificationOutcome> outcomes;

    /**
     * 許容範囲内だった件数を返します。
     *
     * @return 合格件数です
     */
    public long passedCount() {
        return outcomes.stream().filter(VerificationOutcome::isPassed).count();
    }

    /**
     * すべての参照値が許容範囲内かどうかを返します。
     *
     * @return すべて合格なら true です
     */
    public boolean allPassed() {
        return passedCount() == outcomes.size();
    }
}
