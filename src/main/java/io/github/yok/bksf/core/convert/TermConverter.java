package io.github.yok.bksf.core.convert;

import io.github.yok.bksf.core.edge.EdgeOperators;
import io.github.yok.bksf.core.pauli.Coefficients;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import org.ejml.data.Complex_F64;

/**
 * 分類済みの 1 項を、BKSF の 5 つの公式で Pauli 演算子へ変換するクラスです。
 *
 * <p>
 * 式番号は Setia, Whitfield (2018), arXiv:1712.00446 に対応します。 I は E 量子ビットの恒等演算子、h は項の係数です。
 * </p>
 */
public final class TermConverter {

    /**
     * 辺演算子 B, A の計算器です。
     */
    private final EdgeOperators ops;

    /**
     * 2 体励起の最終項の符号です。
     */
    private final DoubleExcitationSign doubleExcitationSign;

    /**
     * 変換器を生成します。
     *
     * @param ops 辺演算子の計算器です（null 不可）
     * @param doubleExcitationSign 2 体励起の最終項の符号です（null 不可）
     * @throws IllegalArgumentException 引数が null の場合に発生します
     */
    public TermConverter(EdgeOperators ops, DoubleExcitationSign doubleExcitationSign) {
        if (ops == null) {
            throw new IllegalArgumentException("ops は null 不可です");
        }
        if (doubleExcitationSign == null) {
            throw new IllegalArgumentException("doubleExcitationSign は null 不可です");
        }
        this.ops = ops;
        this.doubleExcitationSign = doubleExcitationSign;
    }

    /**
     * 数演算子 a†_p a_p を変換します（式 33）。
     *
     * <pre>
     *   (h/2) (I - B(p))
     * </pre>
     *
     * @param p モード番号です
     * @param h 係数です
     * @return Pauli 演算子です
     */
    public PauliSumOperator number(int p, Complex_F64 h) {
        PauliSumOperator op = ops.identity().subtract(ops.b(p));
        return op.multiply(Coefficients.scale(h, 0.5));
    }

    /**
     * クーロン・交換項を変換します（式 34）。
     *
     * <pre>
     *   ±(h/4) (I - B(p)) (I - B(q))    p == s なら +、それ以外は -
     * </pre>
     *
     * @param p 物理学者順の 1 番目のモードです
     * @param q 物理学者順の 2 番目のモードです
     * @param s 物理学者順の 4 番目（2 番目の消滅演算子）のモードです
     * @param h 係数（並べ替えの位相を反映済み）です
     * @return Pauli 演算子です
     */
    public PauliSumOperator coulombExchange(int p, int q, int s, Complex_F64 h) {
        PauliSumOperator id = ops.identity();
        PauliSumOperator op = id.subtract(ops.b(p)).dot(id.subtract(ops.b(q)));
        // p == s は交換 2 回、それ以外は 1 回
        double coeff = p == s ? 0.25 : -0.25;
        return op.multiply(Coefficients.scale(h, coeff));
    }

    /**
     * 1 体励起 a†_p a_q とそのエルミート共役の組を変換します（式 35）。
     *
     * <pre>
     *   (-i h/2) (A(p,q) B(q) + B(p) A(p,q))
     * </pre>
     *
     * @param p 生成演算子のモードです（p &lt; q）
     * @param q 消滅演算子のモードです
     * @param h 係数です
     * @return Pauli 演算子です
     * @throws IllegalArgumentException p &gt;= q の場合に発生します
     */
    public PauliSumOperator excitation(int p, int q, Complex_F64 h) {
        if (p >= q) {
            throw new IllegalArgumentException("p < q が必要です: p=" + p + ", q=" + q);
        }
        PauliSumOperator apq = ops.a(p, q);
        PauliSumOperator op = apq.dot(ops.b(q)).add(ops.b(p).dot(apq));
        return op.multiply(Coefficients.multiply(h, Coefficients.imaginary(-0.5)));
    }

    /**
     * 2 体励起 a†_p a†_q a_r a_s を変換します（式 37）。
     *
     * <pre>
     *   (h/8) A(p,q) A(r,s) (-I - BpBq + BpBr + BpBs + BqBr + BqBs - BrBs ∓ BpBqBrBs)
     * </pre>
     *
     * <p>
     * A(p,q), A(r,s) は引数が降順の場合に符号を反転します。最終項の符号は {@link DoubleExcitationSign} に従います。
     * </p>
     *
     * @param p 1 番目の生成演算子のモードです
     * @param q 2 番目の生成演算子のモードです
     * @param r 1 番目の消滅演算子のモードです
     * @param s 2 番目の消滅演算子のモードです
     * @param h 係数（並べ替えの位相を反映済み）です
     * @return Pauli 演算子です
     */
    public PauliSumOperator doubleExcitation(int p, int q, int r, int s, Complex_F64 h) {
        PauliSumOperator bp = ops.b(p);
        PauliSumOperator bq = ops.b(q);
        PauliSumOperator br = ops.b(r);
        PauliSumOperator bs = ops.b(s);
        PauliSumOperator apq = ops.orientedA(p, q);
        PauliSumOperator ars = ops.orientedA(r, s);

        PauliSumOperator poly = ops.identity().negate()
                .subtract(bp.dot(bq))
                .add(bp.dot(br))
                .add(bp.dot(bs))
                .add(bq.dot(br))
                .add(bq.dot(bs))
                .subtract(br.dot(bs))
                .add(bp.dot(bq).dot(br).dot(bs).multiply(doubleExcitationSign.factor()));

        PauliSumOperator op = apq.dot(ars).dot(poly);
        return op.multiply(Coefficients.scale(h, 0.125));
    }

    /**
     * 数演算子付き励起を変換します。
     *
     * <p>
     * p==r, p==s, q==r, q==s のいずれか 1 つだけが成り立つ前提で、共有モードを除いた 2 モード間の A と 残りのモードの B
     * を組み合わせます。
     * </p>
     *
     * <pre>
     *   p==r: (+i h/4) (A(q,s) B(s) + B(q) A(q,s)) (I - B(p))
     *   p==s: (-i h/4) (A(q,r) B(r) + B(q) A(q,r)) (I - B(p))
     *   q==r: (-i h/4) (A(p,s) B(s) + B(p) A(p,s)) (I - B(q))
     *   q==s: (+i h/4) (A(p,r) B(r) + B(p) A(p,r)) (I - B(q))
     * </pre>
     *
     * @param p 1 番目の生成演算子のモードです
     * @param q 2 番目の生成演算子のモードです
     * @param r 1 番目の消滅演算子のモードです
     * @param s 2 番目の消滅演算子のモードです
     * @param h 係数（並べ替えの位相を反映済み）です
     * @return Pauli 演算子です
     * @throws IllegalArgumentException 添字の一致パターンが想定外の場合に発生します
     */
    public PauliSumOperator numberExcitation(int p, int q, int r, int s, Complex_F64 h) {
        SharedMode shared = SharedMode.of(p, q, r, s);
        int sharedMode;
        int other;
        int third;
        switch (shared) {
            case P_EQUALS_R:
                sharedMode = p;
                other = q;
                third = s;
                break;
            case P_EQUALS_S:
                sharedMode = p;
                other = q;
                third = r;
                break;
            case Q_EQUALS_R:
                sharedMode = q;
                other = p;
                third = s;
                break;
            case Q_EQUALS_S:
                sharedMode = q;
                other = p;
                third = r;
                break;
            default:
                throw new IllegalArgumentException("想定外の添字の並びです: " + shared);
        }
        PauliSumOperator a = ops.orientedA(other, third);
        PauliSumOperator op = a.dot(ops.b(third)).add(ops.b(other).dot(a))
                .dot(ops.identity().subtract(ops.b(sharedMode)));
        Complex_F64 coeff = Coefficients.imaginary(0.25 * shared.sign);
        return op.multiply(Coefficients.multiply(coeff, h));
    }

    /**
     * 数演算子付き励起で共有されるモードの位置と、その場合の係数の符号です。
     */
    enum SharedMode {

        P_EQUALS_R(1),

        P_EQUALS_S(-1),

        Q_EQUALS_R(-1),

        Q_EQUALS_S(1);

        private final int sign;

        SharedMode(int sign) {
            this.sign = sign;
        }

        /**
         * 添字の一致パターンを判定します。
         *
         * @throws IllegalArgumentException 4 パターンのいずれにも該当しない場合に発生します
         */
        static SharedMode of(int p, int q, int r, int s) {
            if (p == r) {
                return P_EQUALS_R;
            }
            if (p == s) {
                return P_EQUALS_S;
            }
            if (q == r) {
                return Q_EQUALS_R;
            }
            if (q == s) {
                return Q_EQUALS_S;
            }
            throw new IllegalArgumentException("想定外の添字の並びです: p=" + p + ", q=" + q + ", r=" + r
                    + ", s=" + s);
        }
    }
}
