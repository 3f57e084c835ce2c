package io.github.yok.bksf.core.mapper;

import io.github.yok.bksf.core.fermion.SecondQuantizedOperator;
import io.github.yok.bksf.core.pauli.PauliSumOperator;

/**
 * 第二量子化演算子を量子ビット上の Pauli 演算子へ写像するインタフェースです。
 */
public interface QubitMapper {

    /**
     * 演算子を写像します。
     *
     * @param operator 第二量子化演算子です
     * @return 正準形（同類項をまとめ、決定的な順序に並べた形）の Pauli 演算子です
     * @throws IllegalArgumentException 写像が扱えない演算子の種類、または項の形が不正な場合に発生します
     */
    PauliSumOperator map(SecondQuantizedOperator operator);
}
