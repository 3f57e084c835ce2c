package io.github.yok.bksf.core.convert;

/**
 * 2 体励起の公式の最終項 B(p)B(q)B(r)B(s) に付ける符号です。
 *
 * <p>
 * 既定は {@link #NEGATIVE} です。{@link #POSITIVE} は arXiv:1712.00446 の式の符号です。
 * </p>
 */
public enum DoubleExcitationSign {

    /**
     * -B(p)B(q)B(r)B(s) とします。
     */
    NEGATIVE(-1.0),

    /**
     * +B(p)B(q)B(r)B(s) とします。
     */
    POSITIVE(1.0);

    /**
     * 符号（±1）です。
     */
    private final double factor;

    DoubleExcitationSign(double factor) {
        this.factor = factor;
    }

    /**
     * 符号（±1）を返します。
     *
     * @return 符号です
     */
    public double factor() {
        return factor;
    }
}
