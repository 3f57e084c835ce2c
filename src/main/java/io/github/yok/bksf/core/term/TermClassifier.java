package io.github.yok.bksf.core.term;

import io.github.yok.bksf.core.fermion.FermionicTerm;
import io.github.yok.bksf.core.fermion.ModeOperator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * フェルミオン項を因子列に分解し、相互作用種別を判定するクラスです。
 *
 * <p>
 * 演算子列をモード番号の昇順に走査し、恒等演算子以外を因子として記録します。 数演算子の展開を指定した場合、{@code N} は
 * {@code (mode,+)}, {@code (mode,-)} の隣接する 2 因子として記録します。
 * </p>
 */
public final class TermClassifier {

    private TermClassifier() {
    }

    /**
     * 数演算子を展開して項を解析します（写像の各公式はこの形を前提とします）。
     *
     * @param term 項です
     * @return 解析結果です
     * @throws IllegalArgumentException 1 体・2 体の電子ハミルトニアン項でない場合に発生します
     */
    public static TermAnalysis analyze(FermionicTerm term) {
        return analyze(term, true);
    }

    /**
     * 項を解析します。
     *
     * @param term 項です（null 不可）
     * @param expandNumberOperator 数演算子を (mode,+), (mode,-) に展開する場合は true です
     * @return 解析結果です
     * @throws IllegalArgumentException 1 体・2 体の電子ハミルトニアン項でない場合に発生します
     */
    public static TermAnalysis analyze(FermionicTerm term, boolean expandNumberOperator) {
        if (term == null) {
            throw new IllegalArgumentException("term は null 不可です");
        }
        int numberCount = 0;
        int raiseCount = 0;
        int lowerCount = 0;
        List<Factor> factors = new ArrayList<>();

        for (int mode = 0; mode < term.modeCount(); mode++) {
            ModeOperator op = term.operatorAt(mode);
            switch (op) {
                case IDENTITY:
                    break;
                case CREATION:
                    raiseCount++;
                    factors.add(new Factor(mode, ModeOperator.CREATION));
                    break;
                case ANNIHILATION:
                    lowerCount++;
                    factors.add(new Factor(mode, ModeOperator.ANNIHILATION));
                    break;
                case NUMBER:
                    numberCount++;
                    if (expandNumberOperator) {
                        factors.add(new Factor(mode, ModeOperator.CREATION));
                        factors.add(new Factor(mode, ModeOperator.ANNIHILATION));
                    } else {
                        factors.add(new Factor(mode, ModeOperator.NUMBER));
                    }
                    break;
                default:
                    throw new IllegalArgumentException("想定外の演算子です: " + op);
            }
        }

        InteractionType type;
        try {
            type = InteractionType.of(numberCount, raiseCount, lowerCount);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(e.getMessage() + ": " + term.label(), e);
        }
        return new TermAnalysis(type, Collections.unmodifiableList(factors));
    }
}
