package io.github.yok.bksf.core.integrals;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * 各軸の次元が n の 4 階実テンソル（行優先の 1 次元配列で保持）を表す不変クラスです。
 */
public final class TwoBodyTensor {

    /**
     * 各軸の次元です。
     */
    private final int dimension;

    /**
     * 要素です（添字 [i][j][k][l] の位置は ((i*n+j)*n+k)*n+l）。
     */
    private final double[] values;

    /**
     * テンソルを生成します。
     *
     * @param dimension 各軸の次元です（1 以上）
     * @param values 行優先の要素です（長さ n^4、コピーして保持します）
     * @throws IllegalArgumentException 次元または要素数が不正な場合に発生します
     */
    public TwoBodyTensor(int dimension, double[] values) {
        checkArgument(dimension >= 1, "dimension は 1 以上が必要です: %s", dimension);
        checkArgument(values != null, "values は null 不可です");
        long expected = (long) dimension * dimension * dimension * dimension;
        checkArgument(values.length == expected, "要素数が n^4 と一致しません: n=%s, length=%s",
                dimension, values.length);
        this.dimension = dimension;
        this.values = values.clone();
    }

    /**
     * 全要素が 0 のテンソルを返します。
     *
     * @param dimension 各軸の次元です
     * @return ゼロテンソルです
     */
    public static TwoBodyTensor zeros(int dimension) {
        checkArgument(dimension >= 1, "dimension は 1 以上が必要です: %s", dimension);
        return new TwoBodyTensor(dimension, new double[dimension * dimension * dimension * dimension]);
    }

    /**
     * 各軸の次元を返します。
     *
     * @return 次元です
     */
    public int dimension() {
        return dimension;
    }

    /**
     * 要素 t[i][j][k][l] を返します。
     *
     * @param i 添字です
     * @param j 添字です
     * @param k 添字です
     * @param l 添字です
     * @return 要素です
     */
    public double get(int i, int j, int k, int l) {
        return values[offset(i, j, k, l)];
    }

    /**
     * 1 要素だけ置き換えたテンソルを返します。
     *
     * @param i 添字です
     * @param j 添字です
     * @param k 添字です
     * @param l 添字です
     * @param value 値です
     * @return 新しいテンソルです
     */
    public TwoBodyTensor with(int i, int j, int k, int l, double value) {
        double[] copy = values.clone();
        copy[offset(i, j, k, l)] = value;
        return new TwoBodyTensor(dimension, copy);
    }

    /**
     * einsum 形式の添字置換 {@code "abcd->wxyz"} を適用したテンソルを返します。
     *
     * <p>
     * 結果 r は r[w][x][y][z] = t[a][b][c][d] を満たします（例: {@code "ijkl->iljk"} なら r[i][l][j][k] =
     * t[i][j][k][l]）。
     * </p>
     *
     * @param subscripts 置換の指定です
     * @return 置換後のテンソルです
     * @throws IllegalArgumentException 指定の形式が不正な場合に発生します
     */
    public TwoBodyTensor permute(String subscripts) {
        int[] axes = parsePermutation(subscripts);
        int n = dimension;
        double[] out = new double[values.length];
        int[] idx = new int[4];
        for (idx[0] = 0; idx[0] < n; idx[0]++) {
            for (idx[1] = 0; idx[1] < n; idx[1]++) {
                for (idx[2] = 0; idx[2] < n; idx[2]++) {
                    for (idx[3] = 0; idx[3] < n; idx[3]++) {
                        out[offset(idx[axes[0]], idx[axes[1]], idx[axes[2]], idx[axes[3]])] =
                                values[offset(idx[0], idx[1], idx[2], idx[3])];
                    }
                }
            }
        }
        return new TwoBodyTensor(n, out);
    }

    /**
     * 全要素が許容誤差内で一致するかを返します（|a-b| &lt;= atol + rtol*|b|、b は other 側）。
     *
     * @param other 比較対象です
     * @param rtol 相対許容誤差です
     * @param atol 絶対許容誤差です
     * @return 一致する場合は true です
     */
    public boolean isClose(TwoBodyTensor other, double rtol, double atol) {
        if (other == null || other.dimension != dimension) {
            return false;
        }
        for (int k = 0; k < values.length; k++) {
            double b = other.values[k];
            if (!(Math.abs(values[k] - b) <= atol + rtol * Math.abs(b))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 出力側の各軸が入力側のどの軸に対応するかを返します。
     */
    private static int[] parsePermutation(String subscripts) {
        checkArgument(subscripts != null, "subscripts は null 不可です");
        String[] sides = subscripts.split("->", -1);
        checkArgument(sides.length == 2 && sides[0].length() == 4 && sides[1].length() == 4,
                "添字置換の形式が不正です: %s", subscripts);
        String in = sides[0];
        String out = sides[1];
        int[] axes = new int[4];
        for (int k = 0; k < 4; k++) {
            int pos = in.indexOf(out.charAt(k));
            checkArgument(pos >= 0 && in.indexOf(in.charAt(k), k + 1) < 0,
                    "添字置換の形式が不正です: %s", subscripts);
            axes[k] = pos;
        }
        return axes;
    }

    private int offset(int i, int j, int k, int l) {
        return ((i * dimension + j) * dimension + k) * dimension + l;
    }
}
