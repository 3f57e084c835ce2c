package io.github.yok.bksf.core.edge;

import io.github.yok.bksf.core.graph.EdgeList;
import io.github.yok.bksf.core.pauli.PauliString;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import java.util.OptionalInt;

/**
 * 辺リスト上で BKSF の辺演算子 B(i) と A(i,j) を計算するクラスです。
 *
 * <p>
 * 定義は arXiv:quant-ph/0003137 に従います。どちらも係数 1 の単一項で、量子ビット数は常に辺の数 E です。
 * </p>
 */
public final class EdgeOperators {

    /**
     * 量子ビット番号の割り当てを与える辺リストです。
     */
    private final EdgeList edges;

    /**
     * 辺演算子の計算器を生成します。
     *
     * @param edges 辺リストです（null 不可）
     * @throws IllegalArgumentException edges が null の場合に発生します
     */
    public EdgeOperators(EdgeList edges) {
        if (edges == null) {
            throw new IllegalArgumentException("edges は null 不可です");
        }
        this.edges = edges;
    }

    /**
     * E 量子ビットの恒等演算子を返します。
     *
     * @return 恒等演算子です
     */
    public PauliSumOperator identity() {
        return PauliSumOperator.identity(edges.size());
    }

    /**
     * 辺演算子 B(i) を返します。
     *
     * <p>
     * モード i に接続する全ての辺の量子ビットに Z を置き、それ以外は I です。
     * </p>
     *
     * @param mode モード番号 i です
     * @return B(i) です
     */
    public PauliSumOperator b(int mode) {
        int e = edges.size();
        boolean[] z = new boolean[e];
        for (int k = 0; k < e; k++) {
            z[k] = edges.touches(k, mode);
        }
        return PauliSumOperator.of(PauliString.of(z, new boolean[e]));
    }

    /**
     * 辺演算子 A(i,j) を返します。
     *
     * <p>
     * 辺 (i,j) の量子ビットに X を置き、i に接続する他の辺のうち反対側の端点が j 未満のもの、 および j
     * に接続する他の辺のうち反対側の端点が i 未満のものに Z を置きます。 この Pauli 文字列は i, j について対称で、反対称性
     * A(j,i) = -A(i,j) は {@link #orientedA(int, int)} が符号で与えます。
     * </p>
     *
     * @param i モード番号です
     * @param j モード番号です
     * @return A(i,j) です
     * @throws IllegalStateException (i,j) が辺でない場合に発生します
     */
    public PauliSumOperator a(int i, int j) {
        OptionalInt position = edges.indexOf(i, j);
        if (position.isEmpty()) {
            throw new IllegalStateException("相互作用グラフに辺 (" + i + "," + j + ") がありません");
        }
        int ij = position.getAsInt();
        int e = edges.size();
        boolean[] z = new boolean[e];
        boolean[] x = new boolean[e];
        x[ij] = true;
        for (int k = 0; k < e; k++) {
            if (k == ij) {
                continue;
            }
            if (edges.touches(k, i) && edges.otherEnd(k, i) < j) {
                z[k] = true;
            }
            if (edges.touches(k, j) && edges.otherEnd(k, j) < i) {
                z[k] = true;
            }
        }
        return PauliSumOperator.of(PauliString.of(z, x));
    }

    /**
     * 引数順を考慮した A(i,j) を返します（i &gt; j の場合は -A(j,i) として符号を反転します）。
     *
     * @param i モード番号です
     * @param j モード番号です
     * @return 符号付きの A(i,j) です
     * @throws IllegalStateException (i,j) が辺でない場合に発生します
     */
    public PauliSumOperator orientedA(int i, int j) {
        PauliSumOperator aij = a(i, j);
        return j < i ? aij.negate() : aij;
    }
}
