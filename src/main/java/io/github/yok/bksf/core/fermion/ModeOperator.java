package io.github.yok.bksf.core.fermion;

/**
 * 1 モードに作用する第二量子化演算子の種類です。
 *
 * <p>
 * 外部の文字列表記（{@code I}, {@code N}, {@code +}, {@code -}）は、入力境界で一度だけこの列挙型に変換します。
 * </p>
 */
public enum ModeOperator {

    /**
     * 恒等演算子です。
     */
    IDENTITY('I'),

    /**
     * 数演算子 a†a です。
     */
    NUMBER('N'),

    /**
     * 生成演算子 a† です。
     */
    CREATION('+'),

    /**
     * 消滅演算子 a です。
     */
    ANNIHILATION('-');

    /**
     * 文字列表記での記号です。
     */
    private final char symbol;

    ModeOperator(char symbol) {
        this.symbol = symbol;
    }

    /**
     * 文字列表記での記号を返します。
     *
     * @return 記号です
     */
    public char symbol() {
        return symbol;
    }

    /**
     * 記号から演算子種別を返します。
     *
     * @param symbol 記号（I/N/+/-）です
     * @param mode エラーメッセージ用のモード番号です
     * @return 演算子種別です
     * @throws IllegalArgumentException 記号が I/N/+/- 以外の場合に発生します
     */
    public static ModeOperator fromSymbol(char symbol, int mode) {
        switch (symbol) {
            case 'I':
                return IDENTITY;
            case 'N':
                return NUMBER;
            case '+':
                return CREATION;
            case '-':
                return ANNIHILATION;
            default:
                throw new IllegalArgumentException(
                        "項に想定外の演算子記号が含まれています: '" + symbol + "'（モード " + mode + "）");
        }
    }
}
