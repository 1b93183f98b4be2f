package io.github.yok.if97.out;

import io.github.yok.if97.core.model.PropertyResult;
import io.github.yok.if97.core.model.SaturationResult;
import io.github.yok.if97.core.verification.VerificationReport;
import java.nio.file.Path;

/**
 * 計算結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 単相の物性値を出力します。
     *
     * @param result 物性値です
     * @return 出力したファイルです
     */
    Path writeProperties(PropertyResult result);

    /**
     * 飽和物性値を出力します。
     *
     * @param result 飽和物性値です
     * @return 出力したファイルです
     */
    Path writeSaturation(SaturationResult result);

    /**
     * 参照値の検証結果を出力します。
     *
     * @param report 検証結果です
     * @return 出力したファイルです
     */
    Path writeVerification(VerificationReport report);
}
