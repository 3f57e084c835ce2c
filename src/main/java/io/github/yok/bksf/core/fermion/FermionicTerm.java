package io.github.yok.bksf.core.fermion;

import io.github.yok.bksf.core.pauli.Coefficients;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.ejml.data.Complex_F64;

/**
 * フェルミオン演算子の 1 項（モードごとの演算子の積と複素係数）を表す不変クラスです。
 *
 * <p>
 * 演算子列はモード番号順に並び、長さはモード数 L と一致します。
 * </p>
 */
public final class FermionicTerm {

    /**
     * モード順の演算子列です（変更不可）。
     */
    private final List<ModeOperator> operators;

    /**
     * 複素係数です。
     */
    private final Complex_F64 coefficient;

    /**
     * 項を生成します。
     *
     * @param operators モード順の演算子列です（null 不可）
     * @param coefficient 複素係数です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public FermionicTerm(List<ModeOperator> operators, Complex_F64 coefficient) {
        if (operators == null || operators.contains(null)) {
            throw new IllegalArgumentException("operators は null 不可です");
        }
        if (coefficient == null) {
            throw new IllegalArgumentException("coefficient は null 不可です");
        }
        this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
        this.coefficient = Coefficients.copy(coefficient);
    }

    /**
     * モード順の演算子列を返します。
     *
     * @return 変更不可の演算子列です
     */
    public List<ModeOperator> getOperators() {
        return operators;
    }

    /**
     * 複素係数のコピーを返します。
     *
     * @return 複素係数です
     */
    public Complex_F64 getCoefficient() {
        return Coefficients.copy(coefficient);
    }

    /**
     * 文字列表記（例: {@code "+-+-"}, {@code "IINN"}）から項を生成します。
     *
     * @param label I/N/+/- からなる演算子文字列です
     * @param coefficient 複素係数です
     * @return 項です
     * @throws IllegalArgumentException 想定外の記号が含まれる場合に発生します
     */
    public static FermionicTerm parse(String label, Complex_F64 coefficient) {
        if (label == null) {
            throw new IllegalArgumentException("label は null 不可です");
        }
        List<ModeOperator> ops = new ArrayList<>(label.length());
        for (int mode = 0; mode < label.length(); mode++) {
            ops.add(ModeOperator.fromSymbol(label.charAt(mode), mode));
        }
        return new FermionicTerm(ops, coefficient);
    }

    /**
     * モード数 L を返します。
     *
     * @return モード数です
     */
    public int modeCount() {
        return operators.size();
    }

    /**
     * 指定モードの演算子を返します。
     *
     * @param mode モード番号です（0 以上 L 未満）
     * @return 演算子です
     */
    public ModeOperator operatorAt(int mode) {
        return operators.get(mode);
    }

    /**
     * 文字列表記を返します。
     *
     * @return I/N/+/- からなる演算子文字列です
     */
    public String label() {
        StringBuilder sb = new StringBuilder(operators.size());
        for (ModeOperator op : operators) {
            sb.append(op.symbol());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return label() + " " + Coefficients.format(coefficient);
    }
}
