package io.github.yok.bksf.core.pauli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Value;
import org.ejml.data.Complex_F64;

/**
 * 複素係数付き Pauli 文字列の和（疎表現）を表す不変クラスです。
 *
 * <p>
 * 項の並びは加算・積の結果をそのまま保持し、同じ Pauli 文字列が複数回現れることがあります。 {@link #simplify(double)}
 * で同類項をまとめ、{@link #sort()} で決定的な順序に並べ替えます。
 * </p>
 */
public final class PauliSumOperator {

    /**
     * 量子ビット数です。
     */
    private final int numQubits;

    /**
     * 項の一覧です（変更不可）。
     */
    private final List<Term> terms;

    private PauliSumOperator(int numQubits, List<Term> terms) {
        this.numQubits = numQubits;
        this.terms = Collections.unmodifiableList(terms);
    }

    /**
     * 項を持たないゼロ演算子（加法の単位元）を返します。
     *
     * @param numQubits 量子ビット数です（0 以上）
     * @return ゼロ演算子です
     * @throws IllegalArgumentException numQubits が負の場合に発生します
     */
    public static PauliSumOperator zero(int numQubits) {
        if (numQubits < 0) {
            throw new IllegalArgumentException("numQubits は 0 以上が必要です: " + numQubits);
        }
        return new PauliSumOperator(numQubits, new ArrayList<>());
    }

    /**
     * 係数 1 の恒等演算子を返します。
     *
     * @param numQubits 量子ビット数です（0 以上）
     * @return 恒等演算子です
     */
    public static PauliSumOperator identity(int numQubits) {
        return of(PauliString.identity(numQubits));
    }

    /**
     * 係数 1 の単一項演算子を返します。
     *
     * @param pauli Pauli 文字列です
     * @return 単一項演算子です
     */
    public static PauliSumOperator of(PauliString pauli) {
        return of(pauli, Coefficients.real(1.0));
    }

    /**
     * 単一項演算子を返します。
     *
     * @param pauli Pauli 文字列です（null 不可）
     * @param coefficient 係数です（null 不可）
     * @return 単一項演算子です
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public static PauliSumOperator of(PauliString pauli, Complex_F64 coefficient) {
        if (pauli == null || coefficient == null) {
            throw new IllegalArgumentException("pauli/coefficient は null 不可です");
        }
        List<Term> list = new ArrayList<>(1);
        list.add(new Term(pauli, Coefficients.copy(coefficient)));
        return new PauliSumOperator(pauli.numQubits(), list);
    }

    /**
     * ラベルと係数の組から演算子を生成します（挿入順を保持します）。
     *
     * @param numQubits 量子ビット数です
     * @param labelsToCoefficients ラベル（右端が量子ビット 0）と係数の組です
     * @return 演算子です
     * @throws IllegalArgumentException ラベル長が量子ビット数と一致しない場合に発生します
     */
    public static PauliSumOperator fromLabels(int numQubits,
            Map<String, Complex_F64> labelsToCoefficients) {
        PauliSumOperator op = zero(numQubits);
        for (Map.Entry<String, Complex_F64> e : labelsToCoefficients.entrySet()) {
            op = op.add(of(PauliString.fromLabel(e.getKey()), e.getValue()));
        }
        return op;
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int getNumQubits() {
        return numQubits;
    }

    /**
     * 項の一覧を返します（変更不可）。
     *
     * @return 項の一覧です
     */
    public List<Term> getTerms() {
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

    /**
     * 和 this + other を返します（項を連結するのみで、同類項はまとめません）。
     *
     * @param other 加える演算子です
     * @return 和です
     * @throws IllegalArgumentException 量子ビット数が一致しない場合に発生します
     */
    public PauliSumOperator add(PauliSumOperator other) {
        requireSameWidth(other);
        List<Term> list = new ArrayList<>(terms.size() + other.terms.size());
        list.addAll(terms);
        list.addAll(other.terms);
        return new PauliSumOperator(numQubits, list);
    }

    /**
     * 差 this - other を返します。
     *
     * @param other 引く演算子です
     * @return 差です
     */
    public PauliSumOperator subtract(PauliSumOperator other) {
        return add(other.negate());
    }

    /**
     * 複素スカラー倍を返します。
     *
     * @param scalar 倍率です
     * @return スカラー倍した演算子です
     */
    public PauliSumOperator multiply(Complex_F64 scalar) {
        List<Term> list = new ArrayList<>(terms.size());
        for (Term t : terms) {
            list.add(new Term(t.getPauli(), Coefficients.multiply(t.getCoefficient(), scalar)));
        }
        return new PauliSumOperator(numQubits, list);
    }

    /**
     * 実スカラー倍を返します。
     *
     * @param scalar 倍率です
     * @return スカラー倍した演算子です
     */
    public PauliSumOperator multiply(double scalar) {
        return multiply(Coefficients.real(scalar));
    }

    /**
     * 符号を反転した演算子を返します。
     *
     * @return -this です
     */
    public PauliSumOperator negate() {
        return multiply(-1.0);
    }

    /**
     * 演算子積 this·other（this が左側）を返します。
     *
     * <p>
     * 全ての項の組について Pauli 文字列の積を取り、積で生じる位相を係数に掛けます。
     * </p>
     *
     * @param other 右側の演算子です
     * @return 演算子積です
     * @throws IllegalArgumentException 量子ビット数が一致しない場合に発生します
     */
    public PauliSumOperator dot(PauliSumOperator other) {
        requireSameWidth(other);
        List<Term> list = new ArrayList<>(terms.size() * other.terms.size());
        for (Term left : terms) {
            for (Term right : other.terms) {
                PauliString.Product product = left.getPauli().multiply(right.getPauli());
                Complex_F64 c = Coefficients.multiply(left.getCoefficient(), right.getCoefficient());
                list.add(new Term(product.getPauli(),
                        Coefficients.multiply(c, Coefficients.iPower(product.getPhaseExponent()))));
            }
        }
        return new PauliSumOperator(numQubits, list);
    }

    /**
     * 同じ Pauli 文字列の項をまとめ、絶対値が許容誤差以下の項を取り除きます。
     *
     * <p>
     * 項は最初に現れた順序を保ちます。全ての項が消えた場合は、量子ビット数を保つために 係数 0 の恒等演算子 1 項を返します。
     * </p>
     *
     * @param atol 係数をゼロとみなす絶対許容誤差です（0 以上）
     * @return 簡約した演算子です
     * @throws IllegalArgumentException atol が負または非有限の場合に発生します
     */
    public PauliSumOperator simplify(double atol) {
        if (!(atol >= 0.0) || Double.isInfinite(atol)) {
            throw new IllegalArgumentException("atol は 0 以上の有限値が必要です: " + atol);
        }
        Map<PauliString, Complex_F64> merged = new LinkedHashMap<>();
        for (Term t : terms) {
            merged.merge(t.getPauli(), t.getCoefficient(), Coefficients::plus);
        }
        List<Term> list = new ArrayList<>(merged.size());
        for (Map.Entry<PauliString, Complex_F64> e : merged.entrySet()) {
            if (!Coefficients.isNegligible(e.getValue(), atol)) {
                list.add(new Term(e.getKey(), e.getValue()));
            }
        }
        if (list.isEmpty()) {
            list.add(new Term(PauliString.identity(numQubits), Coefficients.real(0.0)));
        }
        return new PauliSumOperator(numQubits, list);
    }

    /**
     * 項を Pauli 文字列の全順序（I &lt; X &lt; Y &lt; Z、最上位量子ビットから）で安定ソートします。
     *
     * @return 並べ替えた演算子です
     */
    public PauliSumOperator sort() {
        List<Term> list = new ArrayList<>(terms);
        list.sort(Comparator.comparing(Term::getPauli));
        return new PauliSumOperator(numQubits, list);
    }

    /**
     * 正準形（{@link #simplify(double)} の後に {@link #sort()}）を返します。
     *
     * @param atol 係数をゼロとみなす絶対許容誤差です
     * @return 正準形の演算子です
     */
    public PauliSumOperator canonicalize(double atol) {
        return simplify(atol).sort();
    }

    /**
     * 指定ラベルの係数の合計を返します。
     *
     * @param label Pauli ラベルです
     * @return 該当項がある場合は係数の合計、ない場合は空です
     */
    public Optional<Complex_F64> coefficientOf(String label) {
        PauliString target = PauliString.fromLabel(label);
        Complex_F64 sum = null;
        for (Term t : terms) {
            if (t.getPauli().equals(target)) {
                sum = sum == null ? Coefficients.copy(t.getCoefficient())
                        : Coefficients.plus(sum, t.getCoefficient());
            }
        }
        return Optional.ofNullable(sum);
    }

    /**
     * 項の並び・Pauli 文字列・係数が許容誤差内で一致するかを返します。
     *
     * @param other 比較対象です
     * @param atol 係数の絶対許容誤差です
     * @return 一致する場合は true です
     */
    public boolean isClose(PauliSumOperator other, double atol) {
        if (other == null || other.numQubits != numQubits || other.size() != size()) {
            return false;
        }
        for (int k = 0; k < terms.size(); k++) {
            Term a = terms.get(k);
            Term b = other.terms.get(k);
            if (!a.getPauli().equals(b.getPauli())
                    || !Coefficients.isClose(a.getCoefficient(), b.getCoefficient(), atol)) {
                return false;
            }
        }
        return true;
    }

    private void requireSameWidth(PauliSumOperator other) {
        if (other == null) {
            throw new IllegalArgumentException("other は null 不可です");
        }
        if (other.numQubits != numQubits) {
            throw new IllegalArgumentException(
                    "量子ビット数が一致しません: " + numQubits + " != " + other.numQubits);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PauliSumOperator[").append(numQubits).append("]{");
        for (int k = 0; k < terms.size(); k++) {
            if (k > 0) {
                sb.append(", ");
            }
            Term t = terms.get(k);
            sb.append(t.getPauli().label()).append(": ")
                    .append(Coefficients.format(t.getCoefficient()));
        }
        return sb.append('}').toString();
    }

    /**
     * 係数付きの 1 項です。
     */
    @Value
    public static class Term {

        /**
         * Pauli 文字列です。
         */
        PauliString pauli;

        /**
         * 複素係数です。
         */
        Complex_F64 coefficient;

        /**
         * 項を生成します。係数はコピーして保持します。
         *
         * @param pauli Pauli 文字列です
         * @param coefficient 複素係数です
         */
        public Term(PauliString pauli, Complex_F64 coefficient) {
            this.pauli = pauli;
            this.coefficient = Coefficients.copy(coefficient);
        }

        /**
         * 複素係数のコピーを返します。
         *
         * @return 複素係数です
         */
        public Complex_F64 getCoefficient() {
            return Coefficients.copy(coefficient);
        }
    }
}
