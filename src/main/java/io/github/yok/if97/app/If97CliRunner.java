package io.github.yok.if97.app;

import io.github.yok.if97.core.engine.SteamPropertyEngine;
import io.github.yok.if97.core.model.PropertyResult;
import io.github.yok.if97.core.model.SaturationResult;
import io.github.yok.if97.core.verification.ReferencePoint;
import io.github.yok.if97.core.verification.ReferencePointCsvLoader;
import io.github.yok.if97.core.verification.ReferencePointVerifier;
import io.github.yok.if97.core.verification.VerificationReport;
import io.github.yok.if97.out.ResultWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で if97-solver を実行するクラスです。
 *
 * <p>
 * 設定 {@code if97.query.*} に従って物性値・飽和物性値の計算、または参照値の検証を行い、 結果を標準出力と CSV に出力します。
 * 計算の失敗は、範囲外・飽和線上なら {@link IllegalArgumentException}、 数値的不安定なら {@link IllegalStateException} として送出します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class If97CliRunner implements CommandLineRunner {

    /**
     * if97-solver の設定値（if97.*）です。
     */
    private final If97Properties properties;

    /**
     * 物性エンジンです。
     */
    private final SteamPropertyEngine engine;

    /**
     * 参照値 CSV の読み込み器です。
     */
    private final ReferencePointCsvLoader referencePointCsvLoader;

    /**
     * 参照値の検証器です。
     */
    private final ReferencePointVerifier referencePointVerifier;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        If97Properties.Query query = properties.getQuery();
        System.out.println("=== if97-solver start: " + query.getType() + " ===");
        System.out.print(properties.toMultilineString());

        Path file;
        switch (query.getType()) {
            case PROPERTIES: {
                double p = required(query.getPressure(), "query.pressure");
                double t = required(query.getTemperature(), "query.temperature");
                PropertyResult r = engine.propertiesAt(p, t).orElseThrow();
                System.out.println("結果: 領域=" + r.getRegion().label() + "（" + r.getRegion() + "）");
                System.out.println("結果: h=" + fmt5(r.getEnthalpy()) + " kJ/kg, s="
                        + fmt5(r.getEntropy()) + " kJ/(kg·K), u=" + fmt5(r.getInternalEnergy())
                        + " kJ/kg, ρ=" + fmt5(r.getDensity()) + " kg/m³");
                file = resultWriter.writeProperties(r);
                break;
            }
            case SATURATION_AT_PRESSURE: {
                double p = required(query.getPressure(), "query.pressure");
                file = printSaturation(engine.saturationAtPressure(p).orElseThrow());
                break;
            }
            case SATURATION_AT_TEMPERATURE: {
                double t = required(query.getTemperature(), "query.temperature");
                file = printSaturation(engine.saturationAtTemperature(t).orElseThrow());
                break;
            }
            case VERIFICATION:
            default: {
                List<ReferencePoint> points =
                        referencePointCsvLoader.load(properties.getVerification().getResource());
                VerificationReport report = referencePointVerifier.verify(points);
                System.out.println("結果: 合格=" + report.passedCount() + "/"
                        + report.getOutcomes().size());
                file = resultWriter.writeVerification(report);
                break;
            }
        }
        System.out.println("出力: " + file);
    }

    /**
     * 飽和物性値を表示し、CSV に出力します。
     *
     * @param r 飽和物性値です
     * @return 出力したファイルです
     */
    private Path printSaturation(SaturationResult r) {
        System.out.println("結果: T_sat=" + fmt5(r.getSaturationTemperature()) + " K, P_sat="
                + fmt5(r.getSaturationPressure()) + " Pa");
        System.out.println("結果: 飽和液 h=" + fmt5(r.getEnthalpyLiquid()) + ", s="
                + fmt5(r.getEntropyLiquid()) + ", ρ=" + fmt5(r.getDensityLiquid()));
        System.out.println("結果: 飽和蒸気 h=" + fmt5(r.getEnthalpyVapor()) + ", s="
                + fmt5(r.getEntropyVapor()) + ", ρ=" + fmt5(r.getDensityVapor()));
        System.out.println("結果: 蒸発潜熱=" + fmt5(r.heatOfVaporization()) + " kJ/kg");
        return resultWriter.writeSaturation(r);
    }

    /**
     * 必須の設定値を取り出します。
     *
     * @param value 設定値です
     * @param name 設定名です
     * @return 設定値です
     * @throws IllegalStateException 設定値が未指定の場合
     */
    private static double required(Double value, String name) {
        if (value == null) {
            throw new IllegalStateException(name + " は必須です");
        }
        return value;
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
