package io.github.yok.bksf.core.integrals;

import java.util.List;

/**
 * 2 電子積分テンソルの添字順（化学者順・物理学者順）を変換・判定するユーティリティです。
 */
public final class TwoBodyIndexOrders {

    /**
     * 化学者順の積分が満たす置換対称性です。
     */
    private static final List<String> CHEMIST_SYMMETRIES = List.of("pqrs->qprs", "pqrs->pqsr",
            "pqrs->qpsr", "pqrs->rspq", "pqrs->rsqp", "pqrs->srpq", "pqrs->srqp");

    private static final double RTOL = 1e-5;

    private static final double ATOL = 1e-8;

    private TwoBodyIndexOrders() {
    }

    /**
     * 物理学者順を化学者順へ変換します（{@code "ijkl->iljk"}）。
     *
     * @param tensor 物理学者順のテンソルです
     * @return 化学者順のテンソルです
     */
    public static TwoBodyTensor physToChem(TwoBodyTensor tensor) {
        return tensor.permute("ijkl->iljk");
    }

    /**
     * 化学者順を物理学者順へ変換します（{@code "ijkl->iklj"}）。
     *
     * @param tensor 化学者順のテンソルです
     * @return 物理学者順のテンソルです
     */
    public static TwoBodyTensor chemToPhys(TwoBodyTensor tensor) {
        return tensor.permute("ijkl->iklj");
    }

    /**
     * 化学者順の 8 重対称性（恒等置換以外の 7 通り）を全て満たすかを返します。
     *
     * @param tensor テンソルです
     * @return 満たす場合は true です
     */
    public static boolean hasChemistSymmetries(TwoBodyTensor tensor) {
        for (String symmetry : CHEMIST_SYMMETRIES) {
            if (!tensor.isClose(tensor.permute(symmetry), RTOL, ATOL)) {
                return false;
            }
        }
        return true;
    }

    /**
     * テンソルの添字順を判定します。化学者順、物理学者順、中間の順に調べ、最初に該当したものを返します。
     *
     * @param tensor テンソルです
     * @return 添字順です
     */
    public static IndexOrder findIndexOrder(TwoBodyTensor tensor) {
        if (hasChemistSymmetries(tensor)) {
            return IndexOrder.CHEMIST;
        }
        TwoBodyTensor once = physToChem(tensor);
        if (hasChemistSymmetries(once)) {
            return IndexOrder.PHYSICIST;
        }
        if (hasChemistSymmetries(physToChem(once))) {
            return IndexOrder.INTERMEDIATE;
        }
        return IndexOrder.UNKNOWN;
    }
}
