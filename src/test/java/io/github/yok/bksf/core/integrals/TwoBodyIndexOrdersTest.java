package io.github.yok.bksf.core.integrals;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class TwoBodyIndexOrdersTest {

    private static final int N = 3;

    /**
     * (pq|rs) の 8 重対称性を持つ化学者順のテンソルを作ります。
     */
    private static TwoBodyTensor chemist() {
        double[] v = new double[N * N * N * N];
        int k = 0;
        for (int p = 0; p < N; p++) {
            for (int q = 0; q < N; q++) {
                for (int r = 0; r < N; r++) {
                    for (int s = 0; s < N; s++) {
                        int a = pair(p, q);
                        int b = pair(r, s);
                        v[k++] = 1.0 + a * b + 0.5 * (a + b) + 0.01 * (a * a + b * b);
                    }
                }
            }
        }
        return new TwoBodyTensor(N, v);
    }

    private static int pair(int p, int q) {
        int hi = Math.max(p, q);
        return hi * (hi + 1) / 2 + Math.min(p, q);
    }

    @Test
    void permuteFollowsEinsumSemantics() {
        TwoBodyTensor t = chemist();

        TwoBodyTensor phys = TwoBodyIndexOrders.chemToPhys(t);

        // r[i][k][l][j] = t[i][j][k][l]
        assertEquals(t.get(0, 1, 2, 2), phys.get(0, 2, 2, 1), 0.0);
        assertEquals(9.26, t.get(0, 1, 2, 2), 1e-12);
    }

    @Test
    void conversionsAreMutualInverses() {
        TwoBodyTensor t = chemist().with(0, 1, 2, 0, 42.0);

        assertTrue(TwoBodyIndexOrders.physToChem(TwoBodyIndexOrders.chemToPhys(t))
                .isClose(t, 0.0, 0.0));
        assertTrue(TwoBodyIndexOrders.chemToPhys(TwoBodyIndexOrders.physToChem(t))
                .isClose(t, 0.0, 0.0));
    }

    @Test
    void detectsEachIndexOrder() {
        TwoBodyTensor chem = chemist();
        TwoBodyTensor phys = TwoBodyIndexOrders.chemToPhys(chem);
        TwoBodyTensor intermediate = TwoBodyIndexOrders.chemToPhys(phys);

        assertEquals(IndexOrder.CHEMIST, TwoBodyIndexOrders.findIndexOrder(chem));
        assertEquals(IndexOrder.PHYSICIST, TwoBodyIndexOrders.findIndexOrder(phys));
        assertEquals(IndexOrder.INTERMEDIATE, TwoBodyIndexOrders.findIndexOrder(intermediate));
    }

    @Test
    void brokenSymmetryIsUnknown() {
        TwoBodyTensor broken = chemist().with(0, 1, 2, 2, 10.26);

        assertEquals(IndexOrder.UNKNOWN, TwoBodyIndexOrders.findIndexOrder(broken));
    }

    @Test
    void zeroTensorIsChemist() {
        assertEquals(IndexOrder.CHEMIST,
                TwoBodyIndexOrders.findIndexOrder(TwoBodyTensor.zeros(2)));
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> new TwoBodyTensor(2, new double[15]));
        assertThrows(IllegalArgumentException.class, () -> chemist().permute("ijk->ikj"));
        assertThrows(IllegalArgumentException.class, () -> chemist().permute("iijk->ijki"));
    }
}
