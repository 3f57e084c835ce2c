package io.github.yok.bksf.core.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.bksf.core.edge.EdgeOperators;
import io.github.yok.bksf.core.fermion.FermionicOperator;
import io.github.yok.bksf.core.graph.InteractionGraphBuilder;
import io.github.yok.bksf.core.pauli.Coefficients;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import java.util.Map;
import org.ejml.data.Complex_F64;
import org.junit.jupiter.api.Test;

final class TermConverterTest {

    private static final double EPS = 1e-12;

    private static final Complex_F64 ONE = Coefficients.real(1.0);

    /** 辺 (0,1), (1,2) の 3 モード鎖です。 */
    private static TermConverter path() {
        return converter("+-I", "I+-");
    }

    /** 辺 (0,1), (0,2), (1,2) の 3 モード完全グラフです。 */
    private static TermConverter triangle() {
        return converter("+-I", "+I-", "I+-");
    }

    private static TermConverter converter(String... labels) {
        FermionicOperator.Builder b = FermionicOperator.builder();
        for (String label : labels) {
            b.add(label, 1.0);
        }
        EdgeOperators ops =
                new EdgeOperators(InteractionGraphBuilder.build(b.build()).toEdgeList());
        return new TermConverter(ops, DoubleExcitationSign.NEGATIVE);
    }

    private static void assertOperator(Map<String, Double> expected, PauliSumOperator actual) {
        PauliSumOperator canonical = actual.canonicalize(1e-8);
        assertEquals(expected.size(), canonical.size(), canonical.toString());
        for (Map.Entry<String, Double> e : expected.entrySet()) {
            Complex_F64 c = canonical.coefficientOf(e.getKey())
                    .orElseThrow(() -> new AssertionError("missing " + e.getKey()));
            assertEquals(e.getValue(), c.real, EPS, e.getKey());
            assertEquals(0.0, c.imaginary, EPS, e.getKey());
        }
    }

    @Test
    void numberIsHalfOfIdentityMinusB() {
        assertOperator(Map.of("II", 0.5, "ZZ", -0.5), path().number(1, ONE));
    }

    @Test
    void coulombSignDependsOnWhetherPEqualsS() {
        // a†_0 a†_1 a_0 a_1 に位相 -1 を掛けた形（n_0 n_1）
        PauliSumOperator op = path().coulombExchange(0, 1, 1, Coefficients.real(-1.0));

        assertOperator(Map.of("II", 0.25, "IZ", -0.25, "ZI", 0.25, "ZZ", -0.25), op);

        PauliSumOperator same = path().coulombExchange(0, 1, 0, ONE);
        assertOperator(Map.of("II", 0.25, "IZ", -0.25, "ZI", 0.25, "ZZ", -0.25), same);
    }

    @Test
    void excitationCombinesBAndAIntoRealHermitianTerms() {
        assertOperator(Map.of("IY", 0.5, "ZY", -0.5), path().excitation(0, 1, ONE));
        assertOperator(Map.of("YI", 0.5, "YZ", -0.5), path().excitation(1, 2, ONE));
    }

    @Test
    void numberTimesCommutingHopMatchesNumberExcitation() {
        TermConverter c = path();
        // n_0 (a†_1 a_2 + h.c.) = -(a†_0 a†_1 a_0 a_2 + h.c.)
        PauliSumOperator product = c.number(0, ONE).dot(c.excitation(1, 2, ONE));
        PauliSumOperator direct = c.numberExcitation(0, 1, 0, 2, Coefficients.real(-1.0));

        assertOperator(Map.of("YI", 0.5, "YZ", -0.5), product);
        assertTrue(product.canonicalize(1e-8).isClose(direct.canonicalize(1e-8), EPS));
    }

    @Test
    void numberTimesNumberMatchesCoulombExchange() {
        TermConverter c = path();
        // n_0 n_1 = -a†_0 a†_1 a_0 a_1
        PauliSumOperator product = c.number(0, ONE).dot(c.number(1, ONE));
        PauliSumOperator direct = c.coulombExchange(0, 1, 1, Coefficients.real(-1.0));

        assertTrue(product.canonicalize(1e-8).isClose(direct.canonicalize(1e-8), EPS));
    }

    @Test
    void excitationRequiresAscendingModes() {
        assertThrows(IllegalArgumentException.class, () -> path().excitation(1, 0, ONE));
        assertThrows(IllegalArgumentException.class, () -> path().excitation(1, 1, ONE));
    }

    @Test
    void numberExcitationCasesUseSharedModeInIdentityMinusB() {
        // p == r: a†_0 a†_1 a_0 a_2
        assertOperator(Map.of("YIZ", 0.5, "YZI", -0.5),
                triangle().numberExcitation(0, 1, 0, 2, ONE));
        // q == s: a†_0 a†_2 a_1 a_2
        assertOperator(Map.of("IZY", -0.5, "ZIY", 0.5),
                triangle().numberExcitation(0, 2, 1, 2, ONE));
    }

    @Test
    void numberExcitationRejectsPatternsWithoutSharedMode() {
        assertThrows(IllegalArgumentException.class,
                () -> triangle().numberExcitation(0, 1, 2, 2, ONE));
    }

    @Test
    void doubleExcitationSignSelectsLastPolynomialTerm() {
        FermionicOperator op = FermionicOperator.builder().add("++--", 1.0).build();
        EdgeOperators ops = new EdgeOperators(InteractionGraphBuilder.build(op).toEdgeList());

        PauliSumOperator negative = new TermConverter(ops, DoubleExcitationSign.NEGATIVE)
                .doubleExcitation(0, 1, 2, 3, ONE);
        PauliSumOperator positive = new TermConverter(ops, DoubleExcitationSign.POSITIVE)
                .doubleExcitation(0, 1, 2, 3, ONE);

        assertOperator(Map.of("XX", -0.5, "YY", -0.5), negative);
        assertOperator(Map.of("XX", -0.25, "YY", -0.5), positive);
    }

    @Test
    void rejectsNullCollaborators() {
        assertThrows(IllegalArgumentException.class,
                () -> new TermConverter(null, DoubleExcitationSign.NEGATIVE));
    }
}
