package io.github.yok.bksf.core.fermion;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import io.github.yok.bksf.core.pauli.Coefficients;
import java.util.ArrayList;
import java.util.List;
import org.ejml.data.Complex_F64;

/**
 * フェルミオン演算子（{@link FermionicTerm} の和）を表す不変クラスです。
 *
 * <p>
 * 項の順序は入力順のまま保持し、常に同じ順序で反復します。全ての項のモード数は一致します。
 * </p>
 */
public final class FermionicOperator implements SecondQuantizedOperator {

    /**
     * 項の一覧です（入力順）。
     */
    private final ImmutableList<FermionicTerm> terms;

    /**
     * モード数 L です。
     */
    private final int registerLength;

    /**
     * フェルミオン演算子を生成します。
     *
     * @param terms 項の一覧です（1 項以上、全項のモード数が一致すること）
     * @throws IllegalArgumentException 項が空、またはモード数が一致しない場合に発生します
     * @throws NullPointerException terms が null の場合に発生します
     */
    public FermionicOperator(List<FermionicTerm> terms) {
        this.terms = ImmutableList.copyOf(terms);
        checkArgument(!this.terms.isEmpty(), "フェルミオン演算子には 1 項以上が必要です");
        this.registerLength = this.terms.get(0).modeCount();
        for (FermionicTerm t : this.terms) {
            checkArgument(t.modeCount() == registerLength,
                    "項のモード数が一致しません: %s（期待値 %s）: %s", t.modeCount(), registerLength, t.label());
        }
    }

    /**
     * ビルダーを返します。
     *
     * @return ビルダーです
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public int registerLength() {
        return registerLength;
    }

    /**
     * 項の一覧を入力順で返します。
     *
     * @return 項の一覧です（変更不可）
     */
    public List<FermionicTerm> terms() {
        return terms;
    }

    /**
     * 項数を返します。
     *
     * @return 項数です
     */
    public int size() {
        return terms.size();
    }

    @Override
    public String toString() {
        return "FermionicOperator" + terms;
    }

    /**
     * 文字列表記の項を順に積み上げるビルダーです。
     */
    public static final class Builder {

        private final List<FermionicTerm> terms = new ArrayList<>();

        private Builder() {
        }

        /**
         * 実係数の項を追加します。
         *
         * @param label 演算子文字列です
         * @param coefficient 実係数です
         * @return このビルダーです
         */
        public Builder add(String label, double coefficient) {
            return add(label, Coefficients.real(coefficient));
        }

        /**
         * 複素係数の項を追加します。
         *
         * @param label 演算子文字列です
         * @param coefficient 複素係数です
         * @return このビルダーです
         */
        public Builder add(String label, Complex_F64 coefficient) {
            terms.add(FermionicTerm.parse(label, coefficient));
            return this;
        }

        /**
         * フェルミオン演算子を生成します。
         *
         * @return フェルミオン演算子です
         */
        public FermionicOperator build() {
            return new FermionicOperator(terms);
        }
    }
}
