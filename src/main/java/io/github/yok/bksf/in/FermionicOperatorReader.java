package io.github.yok.bksf.in;

import io.github.yok.bksf.core.fermion.FermionicOperator;

/**
 * フェルミオン演算子を読み込む処理のインタフェースです。
 */
public interface FermionicOperatorReader {

    /**
     * フェルミオン演算子を読み込みます。
     *
     * @return フェルミオン演算子です
     */
    FermionicOperator read();

    /**
     * 出力ファイル名などに用いる、入力の識別名を返します。
     *
     * @return 識別名です
     */
    String name();
}
