package io.github.yok.bksf.core.integrals;

/**
 * 2 電子積分テンソルの添字の並び方です。
 */
public enum IndexOrder {

    /**
     * 化学者順 (pq|rs) です。
     */
    CHEMIST,

    /**
     * 物理学者順 &lt;pq|rs&gt; です。
     */
    PHYSICIST,

    /**
     * 物理学者順に {@link TwoBodyIndexOrders#physToChem} を 1 回適用した中間の並びです。
     */
    INTERMEDIATE,

    /**
     * いずれにも該当しません。
     */
    UNKNOWN
}
