package io.github.yok.bksf.in;

import io.github.yok.bksf.core.fermion.FermionicOperator;
import io.github.yok.bksf.core.pauli.Coefficients;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * CSV からフェルミオン演算子を読み込むクラスです。
 *
 * <p>
 * 1 行が 1 項です。ヘッダ {@code label,real,imag} を必須とし、{@code imag} 列は省略できます（省略時は 0）。 {@code #}
 * で始まる行はコメントとして読み飛ばします。
 * </p>
 *
 * <pre>
 * label,real,imag
 * NIII,-1.2524635735648986,0.0
 * +-+-,0.18128880821149607,0.0
 * </pre>
 */
@Slf4j
public final class CsvFermionicOperatorReader implements FermionicOperatorReader {

    private static final String LABEL = "label";

    private static final String REAL = "real";

    private static final String IMAG = "imag";

    /**
     * 入力ファイルです。
     */
    private final Path file;

    /**
     * CSV 入力を生成します。
     *
     * @param file 入力ファイルのパスです
     * @throws IllegalArgumentException パスが空の場合に発生します
     */
    public CsvFermionicOperatorReader(String file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("input.file は必須です");
        }
        this.file = Paths.get(file);
    }

    /**
     * CSV を読み込みます。
     *
     * @return フェルミオン演算子です
     * @throws IllegalArgumentException ヘッダ・行の内容が不正な場合に発生します
     * @throws IllegalStateException 読み込みに失敗した場合に発生します
     */
    @Override
    public FermionicOperator read() {
        FermionicOperator.Builder builder = FermionicOperator.builder();
        int count = 0;
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8);
                CSVParser parser = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader()
                        .setSkipHeaderRecord(true).setIgnoreSurroundingSpaces(true)
                        .setCommentMarker('#').build().parse(r)) {

            if (!parser.getHeaderNames().contains(LABEL)
                    || !parser.getHeaderNames().contains(REAL)) {
                throw new IllegalArgumentException(
                        "ヘッダに label, real 列が必要です: " + parser.getHeaderNames() + " in " + file);
            }
            boolean hasImag = parser.getHeaderNames().contains(IMAG);

            for (CSVRecord record : parser) {
                String label = record.isSet(LABEL) ? record.get(LABEL) : "";
                if (label.isEmpty() || !record.isConsistent()) {
                    throw new IllegalArgumentException(
                            "CSV の列数が不正です: record=" + record.getRecordNumber() + " in " + file);
                }
                double re = parseNumber(record, REAL);
                double im = hasImag ? parseNumber(record, IMAG) : 0.0;
                try {
                    builder.add(label, Coefficients.of(re, im));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException(
                            e.getMessage() + ": record=" + record.getRecordNumber(), e);
                }
                count++;
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 入力に失敗しました: " + file, e);
        }
        FermionicOperator operator = builder.build();
        log.info("フェルミオン演算子を読み込みました。ファイル={}、項数={}、モード数={}", file, count,
                operator.registerLength());
        return operator;
    }

    /**
     * 入力ファイル名から拡張子を除いたものを返します。
     *
     * @return 識別名です
     */
    @Override
    public String name() {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private double parseNumber(CSVRecord record, String column) {
        String text = record.get(column);
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("数値として解釈できません: " + column + "=" + text
                    + ", record=" + record.getRecordNumber() + " in " + file, e);
        }
    }
}
