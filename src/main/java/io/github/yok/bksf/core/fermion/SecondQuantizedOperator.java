package io.github.yok.bksf.core.fermion;

/**
 * 第二量子化された演算子（モード数 L のレジスタ上の演算子の和）を表すインタフェースです。
 *
 * <p>
 * 写像の入力型の境界です。BKSF 写像が受け付けるのは {@link FermionicOperator} のみです。
 * </p>
 */
public interface SecondQuantizedOperator {

    /**
     * レジスタ長（モード数 L）を返します。
     *
     * @return モード数です
     */
    int registerLength();
}
