package io.github.yok.bksf.out;

import io.github.yok.bksf.core.graph.EdgeList;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 写像結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（name は入力の識別名）。
 * </p>
 *
 * <ul>
 * <li>{@code bksf_pauli_h2_sto3g.csv}（label,real,imag。正準形の順序）</li>
 * <li>{@code bksf_meta_h2_sto3g.csv}（モード数・量子ビット数・項数・符号・辺リスト）</li>
 * </ul>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "bksf";

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
     * 写像結果を出力します。
     *
     * @param report 写像結果と補助情報です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(MappingReport report) {
        if (report == null) {
            throw new IllegalArgumentException("report は null 不可です");
        }
        if (report.getName() == null || report.getName().isEmpty()) {
            throw new IllegalArgumentException("name は必須です");
        }
        if (report.getResult() == null || report.getEdges() == null) {
            throw new IllegalArgumentException("result/edges は null 不可です");
        }
        if (report.getResult().getNumQubits() != report.getEdges().size()) {
            throw new IllegalArgumentException("量子ビット数と辺数が一致しません: qubits="
                    + report.getResult().getNumQubits() + ", edges=" + report.getEdges().size());
        }

        try {
            Files.createDirectories(outputDir);

            // 1) Pauli 演算子
            writePauliCsv(report);

            // 2) メタ（モード数、辺リストなど）
            writeMetaCsv(report);

        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
    }

    /**
     * Pauli 演算子の各項を出力します。
     *
     * @param report 写像結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writePauliCsv(MappingReport report) throws IOException {
        Path file = outputDir.resolve(buildFileName("pauli", report.getName()));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("label", "real", "imag").build().print(w)) {

            for (PauliSumOperator.Term t : report.getResult().getTerms()) {
                pr.printRecord(t.getPauli().label(), positiveZero(t.getCoefficient().real),
                        positiveZero(t.getCoefficient().imaginary));
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * <p>
     * 辺 k は量子ビット k に対応し、{@code edge.k} の値は {@code i-j} 形式です。
     * </p>
     *
     * @param report 写像結果です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(MappingReport report) throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", report.getName()));
        EdgeList edges = report.getEdges();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("modes", report.getModeCount());
            pr.printRecord("qubits", edges.size());
            pr.printRecord("input.terms", report.getInputTermCount());
            pr.printRecord("output.terms", report.getResult().size());
            pr.printRecord("doubleExcitationSign", report.getDoubleExcitationSign());

            for (int k = 0; k < edges.size(); k++) {
                pr.printRecord("edge." + k, edges.from(k) + "-" + edges.to(k));
            }
        }
    }

    /**
     * 負のゼロ（-0.0）を 0.0 に揃えます。
     *
     * @param v 数値です
     * @return 数値です
     */
    private static double positiveZero(double v) {
        return v + 0.0;
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * @param kind 出力の種類（pauli/meta）です
     * @param name 入力の識別名です
     * @return ファイル名です（例: {@code bksf_pauli_h2_sto3g.csv}）
     */
    private static String buildFileName(String kind, String name) {
        return FILE_HEAD + "_" + kind + "_" + name + ".csv";
    }
}
