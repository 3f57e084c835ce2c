package io.github.yok.bksf.core.term;

/**
 * 1 体・2 体の電子ハミルトニアン項の相互作用種別です。
 *
 * <p>
 * 種別は項に含まれる数演算子（N）・生成演算子（+）・消滅演算子（-）の個数だけで決まります。
 * </p>
 *
 * <pre>
 *   #N #+ #-   種別
 *    1  0  0   NUMBER
 *    2  0  0   COULOMB_EXCHANGE
 *    0  1  1   EXCITATION
 *    1  1  1   NUMBER_EXCITATION
 *    0  2  2   DOUBLE_EXCITATION
 * </pre>
 */
public enum InteractionType {

    /**
     * 数演算子 a†_p a_p です。
     */
    NUMBER,

    /**
     * クーロン・交換項 a†_p a†_q a_q a_p 等です。
     */
    COULOMB_EXCHANGE,

    /**
     * 1 体励起 a†_p a_q です。
     */
    EXCITATION,

    /**
     * 数演算子付き励起 a†_p a†_q a_q a_r 等です。
     */
    NUMBER_EXCITATION,

    /**
     * 2 体励起 a†_p a†_q a_r a_s です。
     */
    DOUBLE_EXCITATION;

    /**
     * 演算子の個数から相互作用種別を決定します。
     *
     * @param numberCount 数演算子の個数です
     * @param raiseCount 生成演算子の個数です
     * @param lowerCount 消滅演算子の個数です
     * @return 相互作用種別です
     * @throws IllegalArgumentException 1 体・2 体の電子ハミルトニアン項に該当しない場合に発生します
     */
    public static InteractionType of(int numberCount, int raiseCount, int lowerCount) {
        if (raiseCount == 0 && lowerCount == 0) {
            if (numberCount == 1) {
                return NUMBER;
            }
            if (numberCount == 2) {
                return COULOMB_EXCHANGE;
            }
        } else if (raiseCount == 1 && lowerCount == 1) {
            if (numberCount == 0) {
                return EXCITATION;
            }
            if (numberCount == 1) {
                return NUMBER_EXCITATION;
            }
        } else if (raiseCount == 2 && lowerCount == 2 && numberCount == 0) {
            return DOUBLE_EXCITATION;
        }
        throw new IllegalArgumentException("1 体・2 体の電子ハミルトニアン項ではありません: N=" + numberCount
                + ", +=" + raiseCount + ", -=" + lowerCount);
    }
}
