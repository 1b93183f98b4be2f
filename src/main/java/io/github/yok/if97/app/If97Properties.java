package io.github.yok.if97.app;

import io.github.yok.if97.core.constant.If97Constants;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * if97-solver の設定値（if97.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、物性エンジンの組み立てと CLI 実行に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "if97")
public class If97Properties {

    /**
     * 飽和計算の設定です。
     */
    @Valid
    private Saturation saturation = new Saturation();

    /**
     * 領域 3 の密度逆算の設定です。
     */
    @Valid
    private Region3 region3 = new Region3();

    /**
     * 特異点ガードの設定です。
     */
    @Valid
    private Singularity singularity = new Singularity();

    /**
     * CLI で実行する計算の設定です。
     */
    @Valid
    private Query query = new Query();

    /**
     * 参照値検証の設定です。
     */
    @Valid
    private Verification verification = new Verification();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "if97")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Saturation sat = getSaturation();
        Region3 r3 = getRegion3();
        Query q = getQuery();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "saturation",
                // boundaryRelativeTolerance: 飽和線上とみなす圧力差の相対許容値
                "boundaryRelativeTolerance", sat.getBoundaryRelativeTolerance(),
                // boundaryAbsoluteTolerance: 飽和線上とみなす圧力差の絶対許容値 [Pa]
                "boundaryAbsoluteTolerance", sat.getBoundaryAbsoluteTolerance(),
                // temperatureTolerance: 飽和温度の逆算の許容誤差 [K]
                "temperatureTolerance", sat.getTemperatureTolerance(),
                // maxIterations: 飽和温度の逆算の最大反復回数
                "maxIterations", sat.getMaxIterations(),
                // consistencyTolerance: P_sat(T_sat) と入力圧力の相対許容値
                "consistencyTolerance", sat.getConsistencyTolerance());

        appendSection(sb, nl, "region3",
                // pressureTolerance: 密度逆算の圧力残差の許容誤差 [Pa]
                "pressureTolerance", r3.getPressureTolerance(),
                // maxIterations: 密度逆算の最大反復回数
                "maxIterations", r3.getMaxIterations(),
                // cubicSolver: 補助初期値の 3 次方程式の解法（ANALYTIC/EJML）
                "cubicSolver", r3.getCubicSolver());

        appendSection(sb, nl, "singularity",
                // threshold: 臨界点からの正規化距離のしきい値
                "threshold", getSingularity().getThreshold());

        appendSection(sb, nl, "query",
                // type: 計算の種類
                "type", q.getType(),
                // pressure: 圧力 [Pa]
                "pressure", q.getPressure(),
                // temperature: 温度 [K]
                "temperature", q.getTemperature());

        appendSection(sb, nl, "verification",
                // resource: 参照値 CSV のクラスパス上のパス
                "resource", getVerification().getResource());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", getOutput().getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Saturation {

        /**
         * 飽和線上とみなす圧力差の相対許容値です。
         */
        @PositiveOrZero
        private double boundaryRelativeTolerance = 1.0e-6;

        /**
         * 飽和線上とみなす圧力差の絶対許容値 [Pa] です。
         */
        @PositiveOrZero
        private double boundaryAbsoluteTolerance = 1.0e-3;

        /**
         * 飽和温度の逆算（Brent 法）の許容誤差 [K] です。
         */
        @Positive
        private double temperatureTolerance = 1.0e-6;

        /**
         * 飽和温度の逆算の最大反復回数です。
         */
        @Min(1)
        private int maxIterations = 100;

        /**
         * 逆算した飽和温度の飽和圧力と入力圧力の相対許容値です。
         */
        @Positive
        private double consistencyTolerance = 1.0e-6;
    }

    @Data
    public static class Region3 {

        /**
         * 密度逆算の圧力残差の許容誤差 [Pa] です。
         */
        @Positive
        private double pressureTolerance = 1.0e-3;

        /**
         * 密度逆算の最大反復回数です。
         */
        @Min(1)
        private int maxIterations = 100;

        /**
         * 補助初期値の 3 次方程式の解法です。
         */
        @NotNull
        private CubicSolverType cubicSolver = CubicSolverType.ANALYTIC;

        public enum CubicSolverType {
            ANALYTIC, EJML
        }
    }

    @Data
    public static class Singularity {

        /**
         * 臨界点からの正規化距離のしきい値です。
         */
        @Positive
        private double threshold = If97Constants.DEFAULT_SINGULARITY_THRESHOLD;
    }

    /**
     * CLI で実行する計算の設定です。
     *
     * <p>
     * 種類に応じて pressure / temperature の一方または両方を指定します。
     * </p>
     */
    @Data
    public static class Query {

        /**
         * 計算の種類です。
         */
        @NotNull
        private QueryType type = QueryType.PROPERTIES;

        /**
         * 圧力 [Pa] です。
         */
        private Double pressure;

        /**
         * 温度 [K] です。
         */
        private Double temperature;

        public enum QueryType {
            PROPERTIES, SATURATION_AT_PRESSURE, SATURATION_AT_TEMPERATURE, VERIFICATION
        }
    }

    @Data
    public static class Verification {

        /**
         * 参照値 CSV のクラスパス上のパスです。
         */
        @NotBlank
        private String resource = "reference/if97-verification.csv";
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        @NotBlank
        private String dir = "out";
    }
}
