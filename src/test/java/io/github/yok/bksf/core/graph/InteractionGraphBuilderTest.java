package io.github.yok.bksf.core.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.bksf.core.fermion.FermionicOperator;
import org.junit.jupiter.api.Test;

final class InteractionGraphBuilderTest {

    private static EdgeList edgesOf(String... labels) {
        FermionicOperator.Builder b = FermionicOperator.builder();
        for (String label : labels) {
            b.add(label, 1.0);
        }
        return InteractionGraphBuilder.build(b.build()).toEdgeList();
    }

    @Test
    void doubleExcitationConnectsCreationPairAndAnnihilationPair() {
        assertEquals("[(0,2), (1,3)]", edgesOf("+-+-").toString());
        assertEquals("[(0,3), (1,2)]", edgesOf("+--+").toString());
        assertEquals("[(0,1), (2,3)]", edgesOf("++--").toString());
    }

    @Test
    void excitationAndNumberExcitationAddOneEdge() {
        assertEquals("[(0,3)]", edgesOf("+II-").toString());
        assertEquals("[(0,2)]", edgesOf("-N+I").toString());
    }

    @Test
    void numberAndCoulombTermsAddNoEdges() {
        EdgeList edges = edgesOf("NII", "INN", "NIN");

        assertEquals(0, edges.size());
        assertFalse(edges.indexOf(0, 1).isPresent());
    }

    @Test
    void edgeListIsRowMajorUpperTriangleAndIgnoresDuplicates() {
        EdgeList edges = edgesOf("II+-", "+-II", "-+II", "+I-I", "I+I-", "+II-", "I+-I");

        assertEquals("[(0,1), (0,2), (0,3), (1,2), (1,3), (2,3)]", edges.toString());
        assertEquals(2, edges.from(5));
        assertEquals(3, edges.to(5));
        assertEquals(4, edges.indexOf(3,1).getAsInt());
    }

    @Test
    void edgeLookupIgnoresOrientationAndReportsOtherEnd() {
        EdgeList edges = edgesOf("+-+-");

        assertEquals(0, edges.indexOf(2, 0).getAsInt());
        assertFalse(edges.indexOf(0, 1).isPresent());
        assertFalse(edges.indexOf(0, 7).isPresent());
        assertTrue(edges.touches(1, 3));
        assertEquals(1, edges.otherEnd(1, 3));
        assertThrows(IllegalArgumentException.class, () -> edges.otherEnd(0, 1));
    }

    @Test
    void rejectsDegenerateEdge() {
        assertThrows(IllegalStateException.class,
                () -> InteractionGraphBuilder.addOneEdge(new boolean[2][2], 1, 1));
    }
}
