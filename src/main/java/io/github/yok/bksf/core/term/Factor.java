package io.github.yok.bksf.core.term;

import io.github.yok.bksf.core.fermion.ModeOperator;
import lombok.Value;

/**
 * 項を構成する非恒等の因子（モード番号と演算子種別の組）です。
 *
 * <p>
 * 種別は {@link ModeOperator#CREATION}, {@link ModeOperator#ANNIHILATION}, {@link ModeOperator#NUMBER}
 * のいずれかです（数演算子を展開した場合は生成・消滅の 2 因子になります）。
 * </p>
 */
@Value
public class Factor {

    /**
     * モード番号です。
     */
    int mode;

    /**
     * 演算子種別です。
     */
    ModeOperator kind;

    /**
     * 生成演算子かどうかを返します。
     *
     * @return 生成演算子の場合は true です
     */
    public boolean isCreation() {
        return kind == ModeOperator.CREATION;
    }

    /**
     * 消滅演算子かどうかを返します。
     *
     * @return 消滅演算子の場合は true です
     */
    public boolean isAnnihilation() {
        return kind == ModeOperator.ANNIHILATION;
    }

    @Override
    public String toString() {
        return "(" + mode + "," + kind.symbol() + ")";
    }
}
