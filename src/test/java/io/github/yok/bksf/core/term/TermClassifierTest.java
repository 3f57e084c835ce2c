package io.github.yok.bksf.core.term;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.bksf.core.fermion.FermionicTerm;
import io.github.yok.bksf.core.fermion.ModeOperator;
import io.github.yok.bksf.core.pauli.Coefficients;
import java.util.List;
import org.junit.jupiter.api.Test;

final class TermClassifierTest {

    private static FermionicTerm term(String label) {
        return FermionicTerm.parse(label, Coefficients.real(1.0));
    }

    @Test
    void classifiesByOperatorCounts() {
        assertEquals(InteractionType.NUMBER, TermClassifier.analyze(term("IINI")).getType());
        assertEquals(InteractionType.COULOMB_EXCHANGE,
                TermClassifier.analyze(term("NIIN")).getType());
        assertEquals(InteractionType.EXCITATION, TermClassifier.analyze(term("+II-")).getType());
        assertEquals(InteractionType.NUMBER_EXCITATION,
                TermClassifier.analyze(term("+N-I")).getType());
        assertEquals(InteractionType.DOUBLE_EXCITATION,
                TermClassifier.analyze(term("+-+-")).getType());
    }

    @Test
    void expandsNumberOperatorIntoAdjacentPair() {
        TermAnalysis a = TermClassifier.analyze(term("IN+-"));

        assertEquals(List.of(new Factor(1, ModeOperator.CREATION),
                new Factor(1, ModeOperator.ANNIHILATION), new Factor(2, ModeOperator.CREATION),
                new Factor(3, ModeOperator.ANNIHILATION)), a.getFactors());
    }

    @Test
    void keepsNumberOperatorWhenNotExpanded() {
        TermAnalysis a = TermClassifier.analyze(term("IN+-"), false);

        assertEquals(3, a.getFactors().size());
        assertEquals(ModeOperator.NUMBER, a.getFactors().get(0).getKind());
    }

    @Test
    void rejectsShapesOutsideOneAndTwoBodyHamiltonians() {
        assertThrows(IllegalArgumentException.class, () -> TermClassifier.analyze(term("IIII")));
        assertThrows(IllegalArgumentException.class, () -> TermClassifier.analyze(term("NNN")));
        assertThrows(IllegalArgumentException.class, () -> TermClassifier.analyze(term("++-I")));
        assertThrows(IllegalArgumentException.class, () -> TermClassifier.analyze(term("N+-+-")));
    }
}
