package io.github.yok.bksf.core.pauli;

import java.util.Arrays;
import lombok.Value;

/**
 * 係数を持たない Pauli 文字列（I/X/Y/Z のテンソル積）を表す不変クラスです。
 *
 * <p>
 * 各量子ビットを (z, x) の 2 ビットで表します（00=I, 10=Z, 01=X, 11=Y）。 ラベル表記では量子ビット 0 を右端に置きます（例:
 * {@code "IIIZZZ"} は量子ビット 0,1,2 が Z）。
 * </p>
 *
 * <p>
 * 全順序は、最上位の量子ビットから順に I &lt; X &lt; Y &lt; Z で比較する辞書式順序です。 すなわちラベル文字列の辞書式順序と一致します。
 * </p>
 */
public final class PauliString implements Comparable<PauliString> {

    /**
     * 量子ビットごとの Z 成分です。
     */
    private final boolean[] z;

    /**
     * 量子ビットごとの X 成分です。
     */
    private final boolean[] x;

    private PauliString(boolean[] z, boolean[] x) {
        this.z = z;
        this.x = x;
    }

    /**
     * 恒等演算子（全量子ビット I）を返します。
     *
     * @param numQubits 量子ビット数です（0 以上）
     * @return 恒等演算子です
     * @throws IllegalArgumentException numQubits が負の場合に発生します
     */
    public static PauliString identity(int numQubits) {
        if (numQubits < 0) {
            throw new IllegalArgumentException("numQubits は 0 以上が必要です: " + numQubits);
        }
        return new PauliString(new boolean[numQubits], new boolean[numQubits]);
    }

    /**
     * (z, x) ベクトルから Pauli 文字列を生成します。
     *
     * @param z Z 成分です（コピーして保持します）
     * @param x X 成分です（コピーして保持します）
     * @return Pauli 文字列です
     * @throws IllegalArgumentException 引数が null、または長さが一致しない場合に発生します
     */
    public static PauliString of(boolean[] z, boolean[] x) {
        if (z == null || x == null) {
            throw new IllegalArgumentException("z/x は null 不可です");
        }
        if (z.length != x.length) {
            throw new IllegalArgumentException(
                    "z と x の長さが一致しません: z=" + z.length + ", x=" + x.length);
        }
        return new PauliString(z.clone(), x.clone());
    }

    /**
     * ラベル表記（右端が量子ビット 0）から Pauli 文字列を生成します。
     *
     * @param label I/X/Y/Z からなるラベルです
     * @return Pauli 文字列です
     * @throws IllegalArgumentException ラベルに I/X/Y/Z 以外の文字が含まれる場合に発生します
     */
    public static PauliString fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("label は null 不可です");
        }
        int n = label.length();
        boolean[] z = new boolean[n];
        boolean[] x = new boolean[n];
        for (int pos = 0; pos < n; pos++) {
            int qubit = n - 1 - pos;
            switch (label.charAt(pos)) {
                case 'I':
                    break;
                case 'X':
                    x[qubit] = true;
                    break;
                case 'Y':
                    x[qubit] = true;
                    z[qubit] = true;
                    break;
                case 'Z':
                    z[qubit] = true;
                    break;
                default:
                    throw new IllegalArgumentException(
                            "Pauli ラベルに想定外の文字が含まれています: '" + label.charAt(pos) + "' in " + label);
            }
        }
        return new PauliString(z, x);
    }

    /**
     * 量子ビット数を返します。
     *
     * @return 量子ビット数です
     */
    public int numQubits() {
        return z.length;
    }

    /**
     * 指定量子ビットの Pauli 記号（I/X/Y/Z）を返します。
     *
     * @param qubit 量子ビット番号です（0 以上 numQubits 未満）
     * @return Pauli 記号です
     */
    public char symbolAt(int qubit) {
        if (z[qubit]) {
            return x[qubit] ? 'Y' : 'Z';
        }
        return x[qubit] ? 'X' : 'I';
    }

    /**
     * 指定量子ビットの Z 成分を返します。
     *
     * @param qubit 量子ビット番号です
     * @return Z 成分です
     */
    public boolean z(int qubit) {
        return z[qubit];
    }

    /**
     * 指定量子ビットの X 成分を返します。
     *
     * @param qubit 量子ビット番号です
     * @return X 成分です
     */
    public boolean x(int qubit) {
        return x[qubit];
    }

    /**
     * 恒等演算子かどうかを返します。
     *
     * @return 全量子ビットが I の場合は true です
     */
    public boolean isIdentity() {
        for (int q = 0; q < z.length; q++) {
            if (z[q] || x[q]) {
                return false;
            }
        }
        return true;
    }

    /**
     * ラベル表記（右端が量子ビット 0）を返します。
     *
     * @return ラベルです
     */
    public String label() {
        StringBuilder sb = new StringBuilder(z.length);
        for (int q = z.length - 1; q >= 0; q--) {
            sb.append(symbolAt(q));
        }
        return sb.toString();
    }

    /**
     * 演算子積 this·other を計算します。
     *
     * <p>
     * 1 量子ビットごとに XY=iZ, YZ=iX, ZX=iY（逆順は -i）の規則で位相を積算します。
     * </p>
     *
     * @param other 右側の Pauli 文字列です
     * @return 位相（i の指数）と積の Pauli 文字列です
     * @throws IllegalArgumentException 量子ビット数が一致しない場合に発生します
     */
    public Product multiply(PauliString other) {
        if (other.numQubits() != numQubits()) {
            throw new IllegalArgumentException("量子ビット数が一致しません: " + numQubits() + " != "
                    + other.numQubits());
        }
        int n = numQubits();
        boolean[] rz = new boolean[n];
        boolean[] rx = new boolean[n];
        int phase = 0;
        for (int q = 0; q < n; q++) {
            int a = rank(z[q], x[q]);
            int b = rank(other.z[q], other.x[q]);
            if (a != 0 && b != 0 && a != b) {
                // X=1, Y=2, Z=3 の巡回順なら +i、逆順なら -i
                phase += Math.floorMod(b - a, 3) == 1 ? 1 : 3;
            }
            rz[q] = z[q] ^ other.z[q];
            rx[q] = x[q] ^ other.x[q];
        }
        return new Product(phase & 3, new PauliString(rz, rx));
    }

    /**
     * 順序付け用の記号ランク（I=0, X=1, Y=2, Z=3）を返します。
     */
    private static int rank(boolean zBit, boolean xBit) {
        if (zBit) {
            return xBit ? 2 : 3;
        }
        return xBit ? 1 : 0;
    }

    @Override
    public int compareTo(PauliString other) {
        int c = Integer.compare(numQubits(), other.numQubits());
        if (c != 0) {
            return c;
        }
        for (int q = numQubits() - 1; q >= 0; q--) {
            c = Integer.compare(rank(z[q], x[q]), rank(other.z[q], other.x[q]));
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PauliString)) {
            return false;
        }
        PauliString other = (PauliString) o;
        return Arrays.equals(z, other.z) && Arrays.equals(x, other.x);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(z) + Arrays.hashCode(x);
    }

    @Override
    public String toString() {
        return label();
    }

    /**
     * Pauli 文字列同士の積（i^phase × pauli）を表すクラスです。
     */
    @Value
    public static class Product {

        /**
         * 位相を表す i の指数（0〜3）です。
         */
        int phaseExponent;

        /**
         * 積の Pauli 文字列です。
         */
        PauliString pauli;
    }
}
