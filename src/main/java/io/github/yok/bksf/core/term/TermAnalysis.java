package io.github.yok.bksf.core.term;

import java.util.List;
import lombok.Value;

/**
 * 1 項の解析結果（相互作用種別と因子列）を保持するクラスです。
 */
@Value
public class TermAnalysis {

    /**
     * 相互作用種別です。
     */
    InteractionType type;

    /**
     * モード番号昇順の因子列です（変更不可）。
     */
    List<Factor> factors;
}
