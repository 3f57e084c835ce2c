package io.github.yok.bksf.app;

import io.github.yok.bksf.core.fermion.FermionicOperator;
import io.github.yok.bksf.core.graph.EdgeList;
import io.github.yok.bksf.core.mapper.BravyiKitaevSuperFastMapper;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import io.github.yok.bksf.in.FermionicOperatorReader;
import io.github.yok.bksf.out.MappingReport;
import io.github.yok.bksf.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で bksf-mapper を実行するクラスです。
 *
 * <p>
 * CSV からフェルミオン演算子を読み込み、BKSF 写像で量子ビット演算子へ変換して CSV に出力します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class BksfCliRunner implements CommandLineRunner {

    /**
     * bksf-mapper の設定値（bksf.*）です。
     */
    private final BksfProperties properties;

    /**
     * フェルミオン演算子の入力ロジックです。
     */
    private final FermionicOperatorReader reader;

    /**
     * BKSF 写像です。
     */
    private final BravyiKitaevSuperFastMapper mapper;

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
        System.out.println("=== bksf-mapper start: fermion-to-qubit mapping ===");
        System.out.print(properties.toMultilineString());

        FermionicOperator operator = reader.read();
        EdgeList edges = mapper.edgeList(operator);

        System.out.println("入力: name=" + reader.name() + ", modes=" + operator.registerLength()
                + ", terms=" + operator.size());
        System.out.println("辺リスト（量子ビット順）: " + edges);

        PauliSumOperator result = mapper.map(operator);

        resultWriter.write(new MappingReport(reader.name(), operator.registerLength(),
                operator.size(), edges, mapper.getDoubleExcitationSign(), result));

        System.out.println("結果: qubits=" + result.getNumQubits() + ", terms=" + result.size());
        for (PauliSumOperator.Term t : result.getTerms()) {
            System.out.println("  " + t.getPauli().label() + "  " + fmt5(t.getCoefficient().real)
                    + " " + fmt5(t.getCoefficient().imaginary) + "j");
        }
    }

    /**
     * 数値を小数点以下5桁までの文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt5(double v) {
        return String.format(java.util.Locale.ROOT, "%+.5f", v);
    }
}
