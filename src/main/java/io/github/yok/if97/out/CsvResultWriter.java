package io.github.yok.if97.out;

import io.github.yok.if97.core.model.PropertyResult;
import io.github.yok.if97.core.model.SaturationResult;
import io.github.yok.if97.core.verification.ReferencePoint;
import io.github.yok.if97.core.verification.VerificationOutcome;
import io.github.yok.if97.core.verification.VerificationReport;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（P は圧力 [Pa]、T は温度 [K]）。
 * </p>
 *
 * <ul>
 * <li>{@code if97_properties_P=1.000000e+05_T=473.150.csv}（key,value 形式）</li>
 * <li>{@code if97_saturation_T=453.036.csv}（key,value 形式）</li>
 * <li>{@code if97_verification.csv}（参照値 1 件につき 1 行）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "if97";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 単相の物性値を出力します。
     *
     * @param result 物性値です
     * @return 出力したファイルです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public Path writeProperties(PropertyResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        Path file = outputDir.resolve(FILE_HEAD + "_properties_P="
                + formatPressure(result.getPressure())
                + "_T=" + formatTemperature(result.getTemperature()) + ".csv");

        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("key", "value").build().print(w)) {

                pr.printRecord("pressure_pa", result.getPressure());
                pr.printRecord("temperature_k", result.getTemperature());
                pr.printRecord("region", result.getRegion());
                pr.printRecord("enthalpy_kj_kg", result.getEnthalpy());
                pr.printRecord("entropy_kj_kg_k", result.getEntropy());
                pr.printRecord("internal_energy_kj_kg", result.getInternalEnergy());
                pr.printRecord("density_kg_m3", result.getDensity());
                pr.printRecord("specific_volume_m3_kg", result.specificVolume());
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
        return file;
    }

    /**
     * 飽和物性値を出力します。
     *
     * @param result 飽和物性値です
     * @return 出力したファイルです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public Path writeSaturation(SaturationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("result は null 不可です");
        }
        Path file = outputDir.resolve(FILE_HEAD + "_saturation_T="
                + formatTemperature(result.getSaturationTemperature()) + ".csv");

        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("key", "value").build().print(w)) {

                pr.printRecord("saturation_temperature_k", result.getSaturationTemperature());
                pr.printRecord("saturation_pressure_pa", result.getSaturationPressure());
                pr.printRecord("enthalpy_liquid_kj_kg", result.getEnthalpyLiquid());
                pr.printRecord("entropy_liquid_kj_kg_k", result.getEntropyLiquid());
                pr.printRecord("density_liquid_kg_m3", result.getDensityLiquid());
                pr.printRecord("enthalpy_vapor_kj_kg", result.getEnthalpyVapor());
                pr.printRecord("entropy_vapor_kj_kg_k", result.getEntropyVapor());
                pr.printRecord("density_vapor_kg_m3", result.getDensityVapor());
                pr.printRecord("heat_of_vaporization_kj_kg", result.heatOfVaporization());
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
        return file;
    }

    /**
     * 参照値の検証結果を出力します。
     *
     * @param report 検証結果です
     * @return 出力したファイルです
     * @throws IllegalArgumentException 引数が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public Path writeVerification(VerificationReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report は null 不可です");
        }
        Path file = outputDir.resolve(FILE_HEAD + "_verification.csv");

        try {
            Files.createDirectories(outputDir);
            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                            .setHeader("kind", "pressure_pa", "temperature_k", "category",
                                    "max_relative_deviation", "tolerance", "passed", "failure")
                            .build().print(w)) {

                for (VerificationOutcome o : report.getOutcomes()) {
                    ReferencePoint point = o.getPoint();
                    pr.printRecord(point.getKind(), point.getPressure(), point.getTemperature(),
                            o.getCategory(), o.getMaxRelativeDeviation(), o.getTolerance(),
                            o.isPassed(),
                            o.getFailureMessage() == null ? "" : o.getFailureMessage());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
        return file;
    }

    /**
     * 圧力を指数表記に整形します（ファイル名用）。
     *
     * @param pressurePa 圧力 [Pa] です
     * @return 整形文字列（例: 1.000000e+05）
     */
    private static String formatPressure(double pressurePa) {
        return String.format(Locale.ROOT, "%.6e", pressurePa);
    }

    /**
     * 温度を小数点以下3桁に整形します（ファイル名用）。
     *
     * @param temperatureK 温度 [K] です
     * @return 整形文字列（例: 473.150）
     */
    private static String formatTemperature(double temperatureK) {
        return String.format(Locale.ROOT, "%.3f", temperatureK);
    }
}
