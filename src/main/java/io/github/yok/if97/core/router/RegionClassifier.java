package io.github.yok.if97.core.router;

import com.google.common.base.Preconditions;
import io.github.yok.if97.core.constant.B23Boundary;
import io.github.yok.if97.core.constant.If97Constants;
import io.github.yok.if97.core.model.Region;
import io.github.yok.if97.core.saturation.SaturationLine;
import lombok.extern.slf4j.Slf4j;

/**
 * 圧力・温度から IF97 の領域を判定するクラスです。
 *
 * <p>
 * 判定は以下の順に行います（入力は全体の有効範囲内であることが前提です）。
 * </p>
 *
 * <ol>
 * <li>臨界温度以下で飽和圧力との差が許容誤差以内なら飽和線上</li>
 * <li>623.15 K 以下で飽和圧力未満なら気相（領域 2）</li>
 * <li>623.15 K 超では B23 境界圧力以下なら気相、超えれば領域 3</li>
 * <li>それ以外は液相（領域 1）</li>
 * </ol>
 */
@Slf4j
public final class RegionClassifier {

    /**
     * 飽和線です。
     */
    private final SaturationLine saturationLine;

    /**
     * 飽和線上とみなす圧力差の相対許容値です。
     */
    private final double boundaryRelativeTolerance;

    /**
     * 飽和線上とみなす圧力差の絶対許容値 [Pa] です。
     */
    private final double boundaryAbsoluteTolerance;

    /**
     * 領域判定器を生成します。
     *
     * @param saturationLine 飽和線です
     * @param boundaryRelativeTolerance 飽和線上とみなす相対許容値（0 以上）です
     * @param boundaryAbsoluteTolerance 飽和線上とみなす絶対許容値 [Pa]（0 以上）です
     * @throws NullPointerException 飽和線が null の場合
     * @throws IllegalArgumentException 許容値が負の場合
     */
    public RegionClassifier(SaturationLine saturationLine, double boundaryRelativeTolerance,
            double boundaryAbsoluteTolerance) {
        this.saturationLine = Preconditions.checkNotNull(saturationLine, "飽和線が null です。");
        Preconditions.checkArgument(boundaryRelativeTolerance >= 0.0,
                "相対許容値は 0 以上である必要があります。relTol=%s", boundaryRelativeTolerance);
        Preconditions.checkArgument(boundaryAbsoluteTolerance >= 0.0,
                "絶対許容値は 0 以上である必要があります。absTol=%s", boundaryAbsoluteTolerance);
        this.boundaryRelativeTolerance = boundaryRelativeTolerance;
        this.boundaryAbsoluteTolerance = boundaryAbsoluteTolerance;
    }

    /**
     * 圧力・温度から領域を判定します。
     *
     * @param pressurePa 圧力 [Pa] です
     * @param temperatureK 温度 [K] です
     * @return 領域です
     */
    public Region classify(double pressurePa, double temperatureK) {
        Region region = doClassify(pressurePa, temperatureK);
        log.debug("領域を判定しました。P={} Pa、T={} K、領域={}", pressurePa, temperatureK, region);
        return region;
    }

    private Region doClassify(double pressurePa, double temperatureK) {
        double saturationPressure = Double.NaN;
        if (temperatureK <= If97Constants.CRITICAL_TEMPERATURE_K) {
            saturationPressure = saturationLine.saturationPressure(temperatureK);
            double tolerance = Math.max(boundaryAbsoluteTolerance,
                    boundaryRelativeTolerance * saturationPressure);
            if (Math.abs(pressurePa - saturationPressure) <= tolerance) {
                return Region.SATURATION_BOUNDARY;
            }
        }

        if (temperatureK <= If97Constants.REGION3_TEMPERATURE_MIN_K) {
            return pressurePa < saturationPressure ? Region.VAPOR : Region.LIQUID;
        }

        return pressurePa <= B23Boundary.pressureAt(temperatureK) ? Region.VAPOR
                : Region.SUPERCRITICAL;
    }
}
