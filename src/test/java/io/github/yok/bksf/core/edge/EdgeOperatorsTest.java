package io.github.yok.bksf.core.edge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.bksf.core.fermion.FermionicOperator;
import io.github.yok.bksf.core.graph.InteractionGraphBuilder;
import io.github.yok.bksf.core.pauli.PauliSumOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class EdgeOperatorsTest {

    private EdgeOperators ops;

    @BeforeEach
    void completeGraphOnFourModes() {
        FermionicOperator op = FermionicOperator.builder().add("+-II", 1.0).add("+I-I", 1.0)
                .add("+II-", 1.0).add("I+-I", 1.0).add("I+I-", 1.0).add("II+-", 1.0).build();
        ops = new EdgeOperators(InteractionGraphBuilder.build(op).toEdgeList());
    }

    private static String label(PauliSumOperator op) {
        assertEquals(1, op.size());
        return op.getTerms().get(0).getPauli().label();
    }

    @Test
    void bPlacesZOnIncidentEdges() {
        assertEquals(6, ops.identity().getNumQubits());
        assertEquals("IIIZZZ", label(ops.b(0)));
        assertEquals("IZZIIZ", label(ops.b(1)));
        assertEquals("ZIZIZI", label(ops.b(2)));
        assertEquals("ZZIZII", label(ops.b(3)));
    }

    @Test
    void aPlacesXOnEdgeAndZOnLowerNeighborEdges() {
        assertEquals("IIIIIX", label(ops.a(0, 1)));
        assertEquals("IIIIXZ", label(ops.a(0, 2)));
        assertEquals("IIIXZZ", label(ops.a(0, 3)));
        assertEquals("IIXIZZ", label(ops.a(1, 2)));
        assertEquals("IXZZIZ", label(ops.a(1, 3)));
        assertEquals("XZZZZI", label(ops.a(2, 3)));
    }

    @Test
    void everyOperatorHasWidthE() {
        for (int i = 0; i < 4; i++) {
            assertEquals(6, ops.b(i).getNumQubits());
        }
        assertEquals(6, ops.a(1, 3).getNumQubits());
        assertEquals(6, ops.identity().getNumQubits());
    }

    @Test
    void orientedAIsAntisymmetric() {
        PauliSumOperator sum = ops.orientedA(1, 3).add(ops.orientedA(3, 1)).simplify(1e-12);

        assertTrue(sum.getTerms().get(0).getPauli().isIdentity());
        assertEquals(0.0, sum.getTerms().get(0).getCoefficient().getMagnitude(), 0.0);
        assertEquals(-1.0, ops.orientedA(3, 1).getTerms().get(0).getCoefficient().real, 0.0);
    }

    @Test
    void aAnticommutesWithBOfItsEndpoints() {
        PauliSumOperator a = ops.a(0, 2);
        PauliSumOperator b = ops.b(0);

        PauliSumOperator anti = a.dot(b).add(b.dot(a)).simplify(1e-12);

        assertEquals(0.0, anti.getTerms().get(0).getCoefficient().getMagnitude(), 0.0);
    }

    @Test
    void missingEdgeIsIllegalState() {
        FermionicOperator op = FermionicOperator.builder().add("+-+-", 1.0).build();
        EdgeOperators sparse = new EdgeOperators(InteractionGraphBuilder.build(op).toEdgeList());

        assertThrows(IllegalStateException.class, () -> sparse.a(0, 1));
    }
}
