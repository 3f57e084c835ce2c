package io.github.yok.bksf.core.pauli;

import java.util.Locale;
import org.ejml.data.Complex_F64;
import org.ejml.ops.ComplexMath_F64;

/**
 * 複素係数（EJML の {@link Complex_F64}）の演算をまとめたユーティリティです。
 *
 * <p>
 * {@link Complex_F64} は可変オブジェクトのため、ここでは常に新しいインスタンスを返し、 引数は変更しません。
 * </p>
 */
public final class Coefficients {

    /**
     * i のべき乗（i^0, i^1, i^2, i^3）です。
     */
    private static final double[][] I_POWERS = {{1.0, 0.0}, {0.0, 1.0}, {-1.0, 0.0}, {0.0, -1.0}};

    private Coefficients() {
    }

    /**
     * 複素数 real + i*imaginary を生成します。
     *
     * @param real 実部です
     * @param imaginary 虚部です
     * @return 複素数です
     */
    public static Complex_F64 of(double real, double imaginary) {
        return new Complex_F64(real, imaginary);
    }

    /**
     * 実数を複素数として返します。
     *
     * @param real 実数です
     * @return 虚部 0 の複素数です
     */
    public static Complex_F64 real(double real) {
        return new Complex_F64(real, 0.0);
    }

    /**
     * 純虚数 i*imaginary を返します。
     *
     * @param imaginary 虚部です
     * @return 実部 0 の複素数です
     */
    public static Complex_F64 imaginary(double imaginary) {
        return new Complex_F64(0.0, imaginary);
    }

    /**
     * i^k を返します（k は負でも構いません）。
     *
     * @param exponent 指数です
     * @return i^k です
     */
    public static Complex_F64 iPower(int exponent) {
        double[] v = I_POWERS[Math.floorMod(exponent, 4)];
        return new Complex_F64(v[0], v[1]);
    }

    /**
     * 複素数の複製を返します。
     *
     * @param c 複素数です
     * @return 複製です
     */
    public static Complex_F64 copy(Complex_F64 c) {
        return new Complex_F64(c.real, c.imaginary);
    }

    /**
     * 和 a + b を返します。
     *
     * @param a 複素数です
     * @param b 複素数です
     * @return 和です
     */
    public static Complex_F64 plus(Complex_F64 a, Complex_F64 b) {
        Complex_F64 result = new Complex_F64();
        ComplexMath_F64.plus(a, b, result);
        return result;
    }

    /**
     * 積 a * b を返します。
     *
     * @param a 複素数です
     * @param b 複素数です
     * @return 積です
     */
    public static Complex_F64 multiply(Complex_F64 a, Complex_F64 b) {
        Complex_F64 result = new Complex_F64();
        ComplexMath_F64.multiply(a, b, result);
        return result;
    }

    /**
     * 実数倍 a * s を返します。
     *
     * @param a 複素数です
     * @param s 実数の倍率です
     * @return 実数倍した複素数です
     */
    public static Complex_F64 scale(Complex_F64 a, double s) {
        return new Complex_F64(a.real * s, a.imaginary * s);
    }

    /**
     * 絶対値が許容誤差以下（実質ゼロ）かどうかを返します。
     *
     * @param c 複素数です
     * @param atol 絶対許容誤差です
     * @return |c| &lt;= atol の場合は true です
     */
    public static boolean isNegligible(Complex_F64 c, double atol) {
        return c.getMagnitude() <= atol;
    }

    /**
     * 2 つの複素数が許容誤差内で一致するかを返します。
     *
     * @param a 複素数です
     * @param b 複素数です
     * @param atol 絶対許容誤差です
     * @return |a-b| &lt;= atol の場合は true です
     */
    public static boolean isClose(Complex_F64 a, Complex_F64 b, double atol) {
        return Math.hypot(a.real - b.real, a.imaginary - b.imaginary) <= atol;
    }

    /**
     * ログ・表示用に {@code (re+imj)} 形式へ整形します。
     *
     * @param c 複素数です
     * @return 整形した文字列です
     */
    public static String format(Complex_F64 c) {
        return String.format(Locale.ROOT, "(%.12g%+.12gj)", c.real, c.imaginary);
    }
}
