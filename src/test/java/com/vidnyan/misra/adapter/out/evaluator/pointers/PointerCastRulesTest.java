package com.vidnyan.misra.adapter.out.evaluator.pointers;

import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.model.NodeArena;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.model.VariableFlag;
import com.vidnyan.misra.domain.rule.CollectingSink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PointerCastRulesTest {

    private static final ValueType INT_PTR = ValueType.pointerTo("int", 1);
    private static final ValueType VOID_PTR = ValueType.pointerTo("void", 1);
    private static final ValueType CONST_INT_PTR = INT_PTR.withConstness(1);
    private static final ValueType LONG = ValueType.of("long", "signed");

    @Test
    void incompatibleObjectPointerCast_ShouldReportDifferentObjectTypes() {
        ModelBuilder b = casts(
                ValueType.pointerTo("float", 1), INT_PTR,
                ValueType.pointerTo("char", 1), INT_PTR,
                VOID_PTR, INT_PTR,
                record(0), record(1),
                record(0), record(0));

        assertEquals(List.of("1:11.3", "4:11.3"),
                CollectingSink.run(new IncompatibleObjectPointerCastRule(), b.unit()).reports());
    }

    @Test
    void pointerIntegerCast_ShouldReportBothDirections() {
        ModelBuilder b = casts(
                LONG, INT_PTR,
                INT_PTR, LONG,
                VOID_PTR, LONG,
                ValueType.of("float", null), INT_PTR,
                LONG, VOID_PTR);

        assertEquals(List.of("1:11.4", "2:11.4"), CollectingSink.run(new PointerIntegerCastRule(), b.unit()).reports());
    }

    @Test
    void voidPointerConversion_ShouldReportCastsAndAssignmentsFromVoidPointer() {
        // Arrange
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "( T ) x ;")
                .line(2, "p = q ;")
                .line(3, "( T ) malloc ( n ) ;")
                .line(4, "q = p ;");
        b.ast(0, 3, -1).valueType(0, INT_PTR).valueType(3, VOID_PTR);
        b.ast(6, 5, 7).valueType(5, INT_PTR).valueType(7, VOID_PTR);
        b.ast(13, 12, 14).ast(9, 13, -1).valueType(9, INT_PTR).valueType(13, VOID_PTR);
        b.ast(18, 17, 19).valueType(17, VOID_PTR).valueType(19, INT_PTR);

        // Act
        List<String> reports = CollectingSink.run(new VoidPointerConversionRule(), b.unit()).reports();

        // Assert
        assertEquals(List.of("1:11.5", "2:11.5"), reports);
    }

    @Test
    void voidPointerArithmeticCast_ShouldAllowLiteralZero() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "( T ) x ;")
                .line(2, "( T ) 0 ;")
                .line(3, "( T ) x ;")
                .line(4, "( T ) x ;");
        b.ast(0, 3, -1).valueType(0, VOID_PTR).valueType(3, LONG);
        b.ast(5, 8, -1).valueType(5, VOID_PTR).valueType(8, ValueType.of("int", "signed"));
        b.ast(10, 13, -1).valueType(10, LONG).valueType(13, VOID_PTR);
        b.ast(15, 18, -1).valueType(15, INT_PTR).valueType(18, LONG);

        assertEquals(List.of("1:11.6", "3:11.6"),
                CollectingSink.run(new VoidPointerArithmeticCastRule(), b.unit()).reports());
    }

    @Test
    void pointerNonIntegerCast_ShouldReportFloatingConversions() {
        ModelBuilder b = casts(
                ValueType.of("float", null), INT_PTR,
                INT_PTR, ValueType.of("double", null),
                LONG, INT_PTR,
                ValueType.of("void", null), INT_PTR);

        assertEquals(List.of("1:11.7", "2:11.7"), CollectingSink.run(new PointerNonIntegerCastRule(), b.unit()).reports());
    }

    @Test
    void constQualifierRemoval_ShouldReportCastsAndCallArguments() {
        // Arrange
        ModelBuilder b = casts(
                INT_PTR, CONST_INT_PTR,
                CONST_INT_PTR, CONST_INT_PTR,
                CONST_INT_PTR, INT_PTR)
                .line(4, "void f ( int * q ) ;")
                .line(5, "f ( p ) ;")
                .line(6, "f ( r ) ;");
        int parameter = b.variable(20, 18, 19, NodeArena.NONE, EnumSet.of(VariableFlag.ARGUMENT, VariableFlag.POINTER));
        int f = b.function("f", 16, false, Map.of(1, parameter));
        b.function(23, f).ast(24, 23, 25).valueType(25, CONST_INT_PTR);
        b.function(28, f).ast(29, 28, 30).valueType(30, INT_PTR);

        // Act
        List<String> reports = CollectingSink.run(new ConstQualifierRemovalRule(), b.unit()).reports();

        // Assert
        assertEquals(List.of("1:11.8", "5:11.8"), reports);
    }

    @Test
    void nullPointerConstant_ShouldReportLiteralZeroButNotNull() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "p = 0 ;")
                .line(2, "p == NULL ;")
                .line(3, "p != q ;")
                .line(4, "p = 1 ;");
        ValueType intType = ValueType.of("int", "signed");
        b.ast(1, 0, 2).valueType(0, INT_PTR).valueType(2, intType).values(2, 0);
        b.ast(5, 4, 6).valueType(4, INT_PTR).valueType(6, intType).values(6, 0);
        b.ast(9, 8, 10).valueType(8, INT_PTR).valueType(10, INT_PTR).values(10, 0);
        b.ast(13, 12, 14).valueType(12, INT_PTR).valueType(14, intType).values(14, 1);

        assertEquals(List.of("1:11.9"), CollectingSink.run(new NullPointerConstantRule(), b.unit()).reports());
    }

    private static ValueType record(int scope) {
        return new ValueType("record", null, 0, 1, 0, scope, null);
    }

    /**
     * One {@code ( T ) x ;} line per target/source pair.
     */
    private static ModelBuilder casts(ValueType... targetSourcePairs) {
        ModelBuilder b = ModelBuilder.file("test.c");
        for (int i = 0; i < targetSourcePairs.length / 2; i++) {
            int cast = i * 5;
            b.line(i + 1, "( T ) x ;");
            b.ast(cast, cast + 3, -1)
                    .valueType(cast, targetSourcePairs[2 * i])
                    .valueType(cast + 3, targetSourcePairs[2 * i + 1]);
        }
        return b;
    }
}
