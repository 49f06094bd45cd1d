package com.vidnyan.misra.adapter.out.evaluator.essentialtypes;

import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.model.NodeArena;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.model.VariableFlag;
import com.vidnyan.misra.domain.rule.CollectingSink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EssentialTypeRulesTest {

    private static final ValueType SIGNED_INT = ValueType.of("int", "signed");
    private static final ValueType UNSIGNED_INT = ValueType.of("int", "unsigned");
    private static final EnumSet<VariableFlag> LOCAL = EnumSet.of(VariableFlag.LOCAL);

    @Test
    void shiftOperandType_ShouldRequireUnsignedOperands() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "s << 2 ;")
                .line(2, "u << 2 ;")
                .line(3, "u << n ;")
                .line(4, "u >> v ;")
                .line(5, "x << y ;");
        b.ast(1, 0, 2).valueType(0, SIGNED_INT).valueType(2, SIGNED_INT);
        b.ast(5, 4, 6).valueType(4, UNSIGNED_INT).valueType(6, SIGNED_INT);
        b.ast(9, 8, 10).valueType(8, UNSIGNED_INT).valueType(10, SIGNED_INT);
        b.ast(13, 12, 14).valueType(12, UNSIGNED_INT).valueType(14, UNSIGNED_INT);
        b.ast(17, 16, 18);

        assertEquals(List.of("1:10.1", "3:10.1"), CollectingSink.run(new ShiftOperandTypeRule(), b.unit()).reports());
    }

    @Test
    void operandCategoryMismatch_ShouldReportMixedCategories() {
        // Arrange
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "a + b ;")
                .line(2, "a - c ;")
                .line(3, "E0 + a ;")
                .line(4, "K0 * a ;");
        int anonymous = b.scope(ScopeType.ENUM, "Anonymous0", -1, -1, -1);
        int color = b.scope(ScopeType.ENUM, "Color", -1, -1, -1);
        b.ast(1, 0, 2).valueType(0, SIGNED_INT).valueType(2, UNSIGNED_INT);
        b.ast(5, 4, 6).valueType(4, SIGNED_INT).valueType(6, SIGNED_INT);
        b.ast(9, 8, 10).valueType(8, SIGNED_INT.withTypeScope(anonymous)).valueType(10, UNSIGNED_INT);
        b.ast(13, 12, 14).valueType(12, SIGNED_INT.withTypeScope(color)).valueType(14, SIGNED_INT);

        // Act
        List<String> reports = CollectingSink.run(new OperandCategoryMismatchRule(), b.unit()).reports();

        // Assert
        assertEquals(List.of("1:10.4", "4:10.4"), reports);
    }

    @Test
    void operandCategoryMismatch_ShouldAbstainWithoutOperandTypes() {
        ModelBuilder b = ModelBuilder.file("test.c").line(1, "a + b ;");
        b.ast(1, 0, 2).valueType(0, SIGNED_INT);

        assertTrue(CollectingSink.run(new OperandCategoryMismatchRule(), b.unit()).reports().isEmpty());
    }

    @Test
    void compositeAssignmentWidening_ShouldReportWiderTarget() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "int a ;")
                .line(2, "int b ;")
                .line(3, "long l ;")
                .line(4, "l = a + b ;")
                .line(5, "int i ;")
                .line(6, "i = a + b ;")
                .line(7, "l = a ;");
        b.variable(1, 0, 0, NodeArena.NONE, LOCAL, 11, 20, 26);
        b.variable(4, 3, 3, NodeArena.NONE, LOCAL, 13, 22);
        b.variable(7, 6, 6, NodeArena.NONE, LOCAL, 9, 24);
        b.variable(16, 15, 15, NodeArena.NONE, LOCAL, 18);
        b.ast(12, 11, 13).ast(10, 9, 12)
                .valueType(9, ValueType.of("long", "signed"))
                .valueType(12, SIGNED_INT);
        b.ast(21, 20, 22).ast(19, 18, 21)
                .valueType(18, SIGNED_INT)
                .valueType(21, SIGNED_INT);
        b.ast(25, 24, 26)
                .valueType(24, ValueType.of("long", "signed"))
                .valueType(26, SIGNED_INT);

        assertEquals(List.of("4:10.6"), CollectingSink.run(new CompositeAssignmentWideningRule(), b.unit()).reports());
    }

    @Test
    void compositeCast_ShouldReportWiderOrDifferentCategory() {
        // Arrange
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "int a ;")
                .line(2, "int b ;")
                .line(3, "( long ) ( a + b ) ;")
                .line(4, "( int ) ( a + b ) ;")
                .line(5, "( unsigned ) ( a + b ) ;");
        b.valueType(0, SIGNED_INT).valueType(3, SIGNED_INT);
        b.variable(1, 0, 0, NodeArena.NONE, LOCAL, 10, 19, 28);
        b.variable(4, 3, 3, NodeArena.NONE, LOCAL, 12, 21, 30);
        b.ast(11, 10, 12).ast(6, 11, -1)
                .valueType(11, SIGNED_INT)
                .valueType(6, ValueType.of("long", "signed"));
        b.ast(20, 19, 21).ast(15, 20, -1)
                .valueType(20, SIGNED_INT)
                .valueType(15, SIGNED_INT);
        b.ast(29, 28, 30).ast(24, 29, -1)
                .valueType(29, SIGNED_INT)
                .valueType(24, UNSIGNED_INT);

        // Act
        List<String> reports = CollectingSink.run(new CompositeCastRule(), b.unit()).reports();

        // Assert
        assertEquals(List.of("3:10.8", "5:10.8"), reports);
    }

    @Test
    void compositeCast_ShouldIgnoreCastOfSimpleOperand() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "int a ;")
                .line(2, "( long ) a ;");
        b.valueType(0, SIGNED_INT);
        b.variable(1, 0, 0, NodeArena.NONE, LOCAL, 6);
        b.ast(3, 6, -1).valueType(3, ValueType.of("long", "signed")).valueType(6, SIGNED_INT);

        assertTrue(CollectingSink.run(new CompositeCastRule(), b.unit()).reports().isEmpty());
    }
}
