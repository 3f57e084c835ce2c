package io.github.yok.bksf.core.fermion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.ejml.data.Complex_F64;
import org.junit.jupiter.api.Test;

final class FermionicOperatorTest {

    @Test
    void builderParsesLabelsByMode() {
        FermionicOperator op = FermionicOperator.builder().add("+N-I", 0.5).add("IIII", 1.0).build();

        assertEquals(4, op.registerLength());
        assertEquals(2, op.size());
        FermionicTerm t = op.terms().get(0);
        assertEquals(ModeOperator.CREATION, t.operatorAt(0));
        assertEquals(ModeOperator.NUMBER, t.operatorAt(1));
        assertEquals(ModeOperator.ANNIHILATION, t.operatorAt(2));
        assertEquals(ModeOperator.IDENTITY, t.operatorAt(3));
        assertEquals("+N-I", t.label());
        assertEquals(0.5, t.getCoefficient().real, 0.0);
    }

    @Test
    void coefficientCannotBeChangedThroughGetterOrConstructorArgument() {
        Complex_F64 given = new Complex_F64(0.25, -1.0);
        FermionicTerm t = FermionicTerm.parse("+-", given);

        given.real = 7.0;
        Complex_F64 returned = t.getCoefficient();
        returned.real = 99.0;
        returned.imaginary = 99.0;

        assertEquals(0.25, t.getCoefficient().real, 0.0);
        assertEquals(-1.0, t.getCoefficient().imaginary, 0.0);
        assertThrows(UnsupportedOperationException.class,
                () -> t.getOperators().set(0, ModeOperator.IDENTITY));
    }

    @Test
    void rejectsUnknownSymbol() {
        assertThrows(IllegalArgumentException.class,
                () -> FermionicOperator.builder().add("+x-", 1.0));
    }

    @Test
    void rejectsEmptyAndRaggedOperators() {
        assertThrows(IllegalArgumentException.class, () -> FermionicOperator.builder().build());
        assertThrows(IllegalArgumentException.class,
                () -> FermionicOperator.builder().add("NI", 1.0).add("NII", 1.0).build());
    }
}
