package io.github.yok.bksf.core.graph;

import io.github.yok.bksf.core.fermion.FermionicOperator;
import io.github.yok.bksf.core.fermion.FermionicTerm;
import io.github.yok.bksf.core.term.Factor;
import io.github.yok.bksf.core.term.TermAnalysis;
import io.github.yok.bksf.core.term.TermClassifier;
import java.util.List;
import java.util.stream.Collectors;

/**
 * フェルミオン演算子の全項を走査し、相互作用グラフを構築するクラスです。
 *
 * <ul>
 * <li>励起・数演算子付き励起: 生成・消滅演算子のモード間に 1 辺</li>
 * <li>2 体励起: 生成演算子 2 個のモード間に 1 辺、消滅演算子 2 個のモード間に 1 辺</li>
 * <li>数演算子・クーロン交換: 辺なし</li>
 * </ul>
 */
public final class InteractionGraphBuilder {

    private InteractionGraphBuilder() {
    }

    /**
     * 相互作用グラフを構築します。
     *
     * @param operator フェルミオン演算子です（null 不可）
     * @return 相互作用グラフです
     * @throws IllegalArgumentException 項の形が不正な場合に発生します
     * @throws IllegalStateException 同一モード間の辺を追加しようとした場合に発生します
     */
    public static InteractionGraph build(FermionicOperator operator) {
        if (operator == null) {
            throw new IllegalArgumentException("operator は null 不可です");
        }
        int n = operator.registerLength();
        boolean[][] adjacency = new boolean[n][n];
        for (FermionicTerm term : operator.terms()) {
            addEdgesForTerm(adjacency, term);
        }
        return new InteractionGraph(adjacency);
    }

    /**
     * 1 項が要求する辺（0〜2 本）を追加します。
     *
     * @param adjacency 上三角の隣接行列です
     * @param term 項です
     */
    static void addEdgesForTerm(boolean[][] adjacency, FermionicTerm term) {
        TermAnalysis analysis = TermClassifier.analyze(term, false);
        List<Factor> factors = analysis.getFactors();
        switch (analysis.getType()) {
            case EXCITATION:
            case NUMBER_EXCITATION: {
                List<Integer> modes = factors.stream()
                        .filter(f -> f.isCreation() || f.isAnnihilation()).map(Factor::getMode)
                        .collect(Collectors.toList());
                if (modes.size() != 2) {
                    throw new IllegalArgumentException(
                            "生成・消滅演算子の個数が不正です: " + term.label());
                }
                addOneEdge(adjacency, modes.get(0), modes.get(1));
                break;
            }
            case DOUBLE_EXCITATION: {
                List<Integer> raise = factors.stream().filter(Factor::isCreation)
                        .map(Factor::getMode).collect(Collectors.toList());
                List<Integer> lower = factors.stream().filter(Factor::isAnnihilation)
                        .map(Factor::getMode).collect(Collectors.toList());
                addOneEdge(adjacency, raise.get(0), raise.get(1));
                addOneEdge(adjacency, lower.get(0), lower.get(1));
                break;
            }
            default:
                // 数演算子・クーロン交換は辺を作りません
                break;
        }
    }

    /**
     * 小さいモード番号から大きいモード番号への辺を追加します（上三角を維持します）。
     *
     * @param adjacency 上三角の隣接行列です
     * @param i モード番号です
     * @param j モード番号です
     * @throws IllegalStateException i == j の場合に発生します
     */
    static void addOneEdge(boolean[][] adjacency, int i, int j) {
        if (i == j) {
            throw new IllegalStateException("同一モード間の辺は追加できません: " + i);
        }
        adjacency[Math.min(i, j)][Math.max(i, j)] = true;
    }
}
