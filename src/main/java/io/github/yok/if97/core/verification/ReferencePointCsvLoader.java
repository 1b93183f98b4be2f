package io.github.yok.if97.core.verification;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * 検証用の参照値をクラスパス上の CSV から読み込むクラスです。
 *
 * <p>
 * 列は {@code kind,pressure_pa,temperature_k,enthalpy,entropy,internal_energy,density} です。 先頭行はヘッダ、
 * {@code #} で始まる行はコメントとして読み飛ばします。
 * </p>
 */
@Slf4j
public final class ReferencePointCsvLoader {

    /**
     * CSV のヘッダです。
     */
    static final String[] HEADER = {"kind", "pressure_pa", "temperature_k", "enthalpy",
            "entropy", "internal_energy", "density"};

    /**
     * クラスパス上のリソースから参照値を読み込みます。
     *
     * @param resource リソースのパス（例: {@code reference/if97-verification.csv}）です
     * @return 参照値の一覧です
     * @throws IllegalArgumentException リソースが存在しない、または内容が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    public List<ReferencePoint> load(String resource) {
        Preconditions.checkArgument(resource != null && !resource.isEmpty(), "リソースのパスは必須です");

        ClassLoader loader = ReferencePointCsvLoader.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("参照値のリソースが見つかりません: " + resource);
            }
            List<ReferencePoint> points =
                    read(new InputStreamReader(in, StandardCharsets.UTF_8));
            log.info("参照値を読み込みました。リソース={}、件数={}", resource, points.size());
            return points;
        } catch (IOException e) {
            throw new IllegalStateException("参照値の読み込みに失敗しました: " + resource, e);
        }
    }

    /**
     * Reader から参照値を読み込みます。
     *
     * @param reader CSV の Reader です
     * @return 参照値の一覧です
     * @throws IOException 読み込みに失敗した場合に発生します
     * @throws IllegalArgumentException 内容が不正な場合に発生します
     */
    public List<ReferencePoint> read(Reader reader) throws IOException {
        Preconditions.checkNotNull(reader, "reader が null です。");

        CSVFormat format = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader(HEADER)
                .setSkipHeaderRecord(true).setCommentMarker('#').setIgnoreEmptyLines(true)
                .setTrim(true).build();

        List<ReferencePoint> points = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                points.add(toPoint(record));
            }
        }
        return Collections.unmodifiableList(points);
    }

    /**
     * CSV の 1 行を参照値に変換します。
     *
     * @param record CSV の行です
     * @return 参照値です
     * @throws IllegalArgumentException 内容が不正な場合に発生します
     */
    private static ReferencePoint toPoint(CSVRecord record) {
        String kindText = record.get("kind");
        ReferenceKind kind;
        try {
            kind = ReferenceKind.valueOf(kindText.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "参照値の種類が不正です: 行=" + record.getRecordNumber() + ", kind=" + kindText, e);
        }
        return new ReferencePoint(kind, number(record, "pressure_pa"),
                number(record, "temperature_k"), number(record, "enthalpy"),
                number(record, "entropy"), number(record, "internal_energy"),
                number(record, "density"));
    }

    /**
     * 数値列を読み取ります。空欄は NaN とします。
     *
     * @param record CSV の行です
     * @param column 列名です
     * @return 数値です
     * @throws IllegalArgumentException 数値として解釈できない場合に発生します
     */
    private static double number(CSVRecord record, String column) {
        String text = record.isSet(column) ? record.get(column) : "";
        if (text.isEmpty()) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("数値として解釈できません: 行=" + record.getRecordNumber()
                    + ", 列=" + column + ", 値=" + text, e);
        }
    }
}
