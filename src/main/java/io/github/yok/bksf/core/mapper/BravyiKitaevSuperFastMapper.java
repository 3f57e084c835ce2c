package io.github.yok.bksf.core.mapper;

import io.github.yok.bksf.core.convert.DoubleExcitationSign;
import io.github.yok.bksf.core.convert.TermConverter;
import io.github.yok.bksf.core.edge.EdgeOperators;
import io.github.yok.bksf.core.fermion.FermionicOperator;
import io.github.yok.bksf.core.fermion.FermionicTerm;
import io.github.yok.bksf.core.fermion.SecondQuantizedOperator;
import io.github.yok.bksf.core.graph.EdgeList;
import io.github.yok.bksf.core.graph.InteractionGraphBuilder;
import io.github.yok.bksf.core.pauli.Coefficients;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import io.github.yok.bksf.core.term.Factor;
import io.github.yok.bksf.core.term.PhysicistOrdering;
import io.github.yok.bksf.core.term.PhysicistOrdering.Reordered;
import io.github.yok.bksf.core.term.TermAnalysis;
import io.github.yok.bksf.core.term.TermClassifier;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.Complex_F64;

/**
 * Bravyi-Kitaev Super-Fast（BKSF）写像を行うクラスです。
 *
 * <p>
 * 相互作用グラフの辺 1 本を量子ビット 1 個に対応させ、各項を辺演算子 B, A の多項式へ変換して足し合わせます。 エルミート共役の組は片方だけを変換します。
 * </p>
 *
 * <p>
 * 状態は不変な設定値のみのため、異なる入力に対する並行呼び出しが可能です。
 * </p>
 */
@Getter
@Slf4j
public final class BravyiKitaevSuperFastMapper implements QubitMapper {

    /**
     * 2 体励起の最終項の符号です。
     */
    private final DoubleExcitationSign doubleExcitationSign;

    /**
     * 同類項をまとめた後に係数をゼロとみなす絶対許容誤差です。
     */
    private final double simplifyTolerance;

    /**
     * 既定設定（最終項の符号 -、許容誤差 1e-8）の写像を生成します。
     */
    public BravyiKitaevSuperFastMapper() {
        this(DoubleExcitationSign.NEGATIVE, 1e-8);
    }

    /**
     * 写像を生成します。
     *
     * @param doubleExcitationSign 2 体励起の最終項の符号です（null 不可）
     * @param simplifyTolerance 係数をゼロとみなす絶対許容誤差です（0 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BravyiKitaevSuperFastMapper(DoubleExcitationSign doubleExcitationSign,
            double simplifyTolerance) {
        if (doubleExcitationSign == null) {
            throw new IllegalArgumentException("doubleExcitationSign は null 不可です");
        }
        if (!(simplifyTolerance >= 0.0) || Double.isInfinite(simplifyTolerance)) {
            throw new IllegalArgumentException(
                    "simplifyTolerance は 0 以上の有限値が必要です: " + simplifyTolerance);
        }
        this.doubleExcitationSign = doubleExcitationSign;
        this.simplifyTolerance = simplifyTolerance;
    }

    @Override
    public PauliSumOperator map(SecondQuantizedOperator operator) {
        FermionicOperator fermionic = requireFermionic(operator);
        long start = System.nanoTime();

        EdgeList edges = edgeList(fermionic);
        TermConverter converter =
                new TermConverter(new EdgeOperators(edges), doubleExcitationSign);

        PauliSumOperator sum = PauliSumOperator.zero(edges.size());
        int converted = 0;
        for (FermionicTerm term : fermionic.terms()) {
            TermAnalysis analysis = TermClassifier.analyze(term);
            if (isConjugateHalf(analysis.getFactors())) {
                log.debug("エルミート共役の片割れとして読み飛ばします: {}", term.label());
                continue;
            }
            sum = sum.add(convert(converter, term, analysis));
            converted++;
        }

        PauliSumOperator result = sum.canonicalize(simplifyTolerance);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        log.info("BKSF 写像が完了しました。モード数={}、量子ビット数={}、入力項数={}、変換項数={}、出力項数={}、所要時間={}ms",
                fermionic.registerLength(), edges.size(), fermionic.size(), converted,
                result.size(), elapsedMs);
        return result;
    }

    /**
     * 演算子の相互作用グラフから辺リスト（量子ビットの割り当て）を求めます。
     *
     * @param operator フェルミオン演算子です（null 不可）
     * @return 辺リストです
     * @throws IllegalArgumentException 項の形が不正な場合に発生します
     */
    public EdgeList edgeList(FermionicOperator operator) {
        return InteractionGraphBuilder.build(operator).toEdgeList();
    }

    /**
     * 1 項を種別に応じた公式で変換します。
     */
    private PauliSumOperator convert(TermConverter converter, FermionicTerm term,
            TermAnalysis analysis) {
        List<Factor> factors = analysis.getFactors();
        Complex_F64 h = term.getCoefficient();
        log.debug("項を変換します: {} 種別={} 係数={}", term.label(), analysis.getType(),
                Coefficients.format(h));
        switch (analysis.getType()) {
            case NUMBER:
                return converter.number(factors.get(0).getMode(), h);
            case EXCITATION:
                return converter.excitation(factors.get(0).getMode(), factors.get(1).getMode(), h);
            case COULOMB_EXCHANGE: {
                Reordered r = PhysicistOrdering.reorder(factors);
                return converter.coulombExchange(r.modeAt(0), r.modeAt(1), r.modeAt(3),
                        Coefficients.scale(h, r.getPhase()));
            }
            case NUMBER_EXCITATION: {
                Reordered r = PhysicistOrdering.reorder(factors);
                return converter.numberExcitation(r.modeAt(0), r.modeAt(1), r.modeAt(2),
                        r.modeAt(3), Coefficients.scale(h, r.getPhase()));
            }
            case DOUBLE_EXCITATION: {
                Reordered r = PhysicistOrdering.reorder(factors);
                return converter.doubleExcitation(r.modeAt(0), r.modeAt(1), r.modeAt(2),
                        r.modeAt(3), Coefficients.scale(h, r.getPhase()));
            }
            default:
                throw new IllegalArgumentException("想定外の相互作用種別です: " + analysis.getType());
        }
    }

    /**
     * エルミート共役の組のうち、変換しない側の項かを判定します。
     *
     * <p>
     * 先頭の因子が消滅演算子なら読み飛ばします。先頭 2 因子が同じモードの数演算子を展開したものなら、 その次の因子で判定します。
     * </p>
     *
     * @param factors 数演算子を展開済みの因子列です
     * @return 読み飛ばす場合は true です
     */
    static boolean isConjugateHalf(List<Factor> factors) {
        if (factors.isEmpty()) {
            return false;
        }
        if (factors.get(0).isAnnihilation()) {
            return true;
        }
        return factors.size() > 2 && factors.get(0).getMode() == factors.get(1).getMode()
                && factors.get(2).isAnnihilation();
    }

    private static FermionicOperator requireFermionic(SecondQuantizedOperator operator) {
        if (!(operator instanceof FermionicOperator)) {
            throw new IllegalArgumentException("FermionicOperator のみ写像できます: "
                    + (operator == null ? "null" : operator.getClass().getName()));
        }
        return (FermionicOperator) operator;
    }
}
