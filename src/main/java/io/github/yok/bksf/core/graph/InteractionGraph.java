package io.github.yok.bksf.core.graph;

/**
 * BKSF の相互作用グラフ（モードを頂点とする単純無向グラフ）を表す不変クラスです。
 *
 * <p>
 * 辺 (i, j) は常に i &lt; j の上三角で保持し、自己ループは持ちません。 生成は {@link InteractionGraphBuilder} が行います。
 * </p>
 */
public final class InteractionGraph {

    /**
     * モード数 L です。
     */
    private final int modeCount;

    /**
     * 上三角の隣接行列です（adjacency[i][j] は i &lt; j の場合のみ true になり得ます）。
     */
    private final boolean[][] adjacency;

    /**
     * 辺の数です。
     */
    private final int edgeCount;

    /**
     * 相互作用グラフを生成します。
     *
     * @param adjacency L×L の上三角隣接行列です（コピーして保持します）
     * @throws IllegalArgumentException 正方でない、または対角・下三角に辺がある場合に発生します
     */
    InteractionGraph(boolean[][] adjacency) {
        int n = adjacency.length;
        boolean[][] copy = new boolean[n][];
        int count = 0;
        for (int i = 0; i < n; i++) {
            if (adjacency[i].length != n) {
                throw new IllegalArgumentException("隣接行列が正方ではありません: row=" + i);
            }
            copy[i] = adjacency[i].clone();
            for (int j = 0; j < n; j++) {
                if (!copy[i][j]) {
                    continue;
                }
                if (j <= i) {
                    throw new IllegalArgumentException("隣接行列は上三角である必要があります: (" + i + "," + j + ")");
                }
                count++;
            }
        }
        this.modeCount = n;
        this.adjacency = copy;
        this.edgeCount = count;
    }

    /**
     * 辺を行優先（行 → 列の昇順）で線形化した辺リストを返します。
     *
     * <p>
     * この順序が量子ビット番号の割り当てそのものです。
     * </p>
     *
     * @return 辺リストです
     */
    public EdgeList toEdgeList() {
        int[] from = new int[edgeCount];
        int[] to = new int[edgeCount];
        int k = 0;
        for (int i = 0; i < modeCount; i++) {
            for (int j = i + 1; j < modeCount; j++) {
                if (adjacency[i][j]) {
                    from[k] = i;
                    to[k] = j;
                    k++;
                }
            }
        }
        return new EdgeList(modeCount, from, to);
    }
}
