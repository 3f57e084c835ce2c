package io.github.yok.bksf.core.graph;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * 相互作用グラフの辺を決まった順序で並べた不変の辺リストです。
 *
 * <p>
 * 辺の位置 k がそのまま量子ビット番号 k です。各辺は (from, to) で from &lt; to を満たし、 順序は
 * {@link InteractionGraph#toEdgeList()} の行優先順に固定されます。
 * </p>
 */
public final class EdgeList {

    /**
     * モード数 L です。
     */
    private final int modeCount;

    /**
     * 各辺の小さい側のモード番号です。
     */
    private final int[] from;

    /**
     * 各辺の大きい側のモード番号です。
     */
    private final int[] to;

    /**
     * (min, max) から辺の位置を引く表です（辺がなければ -1）。
     */
    private final int[][] positions;

    EdgeList(int modeCount, int[] from, int[] to) {
        this.modeCount = modeCount;
        this.from = from.clone();
        this.to = to.clone();
        this.positions = new int[modeCount][modeCount];
        for (int[] row : positions) {
            Arrays.fill(row, -1);
        }
        for (int k = 0; k < from.length; k++) {
            positions[from[k]][to[k]] = k;
        }
    }

    /**
     * 辺の数（= 量子ビット数 E）を返します。
     *
     * @return 辺の数です
     */
    public int size() {
        return from.length;
    }

    /**
     * 位置 k の辺の小さい側のモード番号を返します。
     *
     * @param k 辺の位置です
     * @return モード番号です
     */
    public int from(int k) {
        return from[k];
    }

    /**
     * 位置 k の辺の大きい側のモード番号を返します。
     *
     * @param k 辺の位置です
     * @return モード番号です
     */
    public int to(int k) {
        return to[k];
    }

    /**
     * 位置 k の辺が指定モードに接続しているかを返します。
     *
     * @param k 辺の位置です
     * @param mode モード番号です
     * @return 接続している場合は true です
     */
    public boolean touches(int k, int mode) {
        return from[k] == mode || to[k] == mode;
    }

    /**
     * 位置 k の辺の、指定モードではない側の端点を返します。
     *
     * @param k 辺の位置です
     * @param mode 辺に接続しているモード番号です
     * @return 反対側のモード番号です
     * @throws IllegalArgumentException 辺が指定モードに接続していない場合に発生します
     */
    public int otherEnd(int k, int mode) {
        if (from[k] == mode) {
            return to[k];
        }
        if (to[k] == mode) {
            return from[k];
        }
        throw new IllegalArgumentException("辺 " + k + " はモード " + mode + " に接続していません");
    }

    /**
     * 無向辺 {i, j} の位置を返します。
     *
     * @param i モード番号です
     * @param j モード番号です
     * @return 辺の位置です（辺がない場合は空）
     */
    public OptionalInt indexOf(int i, int j) {
        if (i == j || i < 0 || j < 0 || i >= modeCount || j >= modeCount) {
            return OptionalInt.empty();
        }
        int k = positions[Math.min(i, j)][Math.max(i, j)];
        return k < 0 ? OptionalInt.empty() : OptionalInt.of(k);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int k = 0; k < from.length; k++) {
            if (k > 0) {
                sb.append(", ");
            }
            sb.append('(').append(from[k]).append(',').append(to[k]).append(')');
        }
        return sb.append(']').toString();
    }
}
