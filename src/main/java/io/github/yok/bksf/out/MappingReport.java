package io.github.yok.bksf.out;

import io.github.yok.bksf.core.convert.DoubleExcitationSign;
import io.github.yok.bksf.core.graph.EdgeList;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import lombok.Value;

/**
 * 1 回の写像の結果と、その補助情報をまとめたクラスです。
 */
@Value
public class MappingReport {

    /**
     * 入力の識別名（出力ファイル名に用います）です。
     */
    String name;

    /**
     * フェルミオンのモード数です。
     */
    int modeCount;

    /**
     * 入力の項数です。
     */
    int inputTermCount;

    /**
     * 量子ビットに割り当てた辺リストです。
     */
    EdgeList edges;

    /**
     * 2 体励起の最終項の符号です。
     */
    DoubleExcitationSign doubleExcitationSign;

    /**
     * 写像結果（正準形）です。
     */
    PauliSumOperator result;
}
