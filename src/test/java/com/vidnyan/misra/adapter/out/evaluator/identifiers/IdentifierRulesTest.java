package com.vidnyan.misra.adapter.out.evaluator.identifiers;

import com.vidnyan.misra.domain.model.LanguageStandard;
import com.vidnyan.misra.domain.model.ModelBuilder;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.VariableFlag;
import com.vidnyan.misra.domain.rule.CollectingSink;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierRulesTest {

    /** 31 characters. */
    private static final String PREFIX = "abcdefghijklmnopqrstuvwxyz_abcd";

    private static final EnumSet<VariableFlag> GLOBAL = EnumSet.of(VariableFlag.GLOBAL);
    private static final EnumSet<VariableFlag> LOCAL = EnumSet.of(VariableFlag.LOCAL);

    @Test
    void externalDistinct_ShouldReportLaterDeclarationSharingPrefix() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "int " + PREFIX + "1 ;")
                .line(2, "int " + PREFIX + "2 ;");
        b.variable(1, 0, 0, -1, GLOBAL);
        b.variable(4, 3, 3, -1, GLOBAL);

        assertEquals(List.of("2:5.1"), CollectingSink.run(new ExternalIdentifierDistinctRule(), b.unit()).reports());
    }

    @Test
    void externalDistinct_ShouldIgnoreInternalLinkageAndShortNames() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "static int " + PREFIX + "1 ;")
                .line(2, "int " + PREFIX + "2 ;")
                .line(3, "int counter ;")
                .line(4, "int counter ;");
        b.variable(2, 1, 1, -1, EnumSet.of(VariableFlag.GLOBAL, VariableFlag.STATIC));
        b.variable(5, 4, 4, -1, GLOBAL);
        b.variable(8, 7, 7, -1, GLOBAL);
        b.variable(11, 10, 10, -1, GLOBAL);

        assertTrue(CollectingSink.run(new ExternalIdentifierDistinctRule(), b.unit()).reports().isEmpty());
    }

    @Test
    void sameScopeDistinct_ShouldReportLaterLocalInSameScope() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "void f ( ) {")
                .line(2, "int " + PREFIX + "1 ;")
                .line(3, "int " + PREFIX + "2 ;")
                .line(4, "}");
        int fn = b.scope(ScopeType.FUNCTION, "f", 4, 11, -1);
        b.tokenScope(6, fn).tokenScope(9, fn);
        b.variable(6, 5, 5, fn, LOCAL);
        b.variable(9, 8, 8, fn, LOCAL);

        assertEquals(List.of("3:5.2"), CollectingSink.run(new SameScopeIdentifierDistinctRule(), b.unit()).reports());
    }

    @Test
    void sameScopeDistinct_ShouldIgnoreDeclarationsInDifferentScopes() {
        ModelBuilder b = nestedDeclarations(PREFIX + "_outer", PREFIX + "_inner");

        assertTrue(CollectingSink.run(new SameScopeIdentifierDistinctRule(), b.unit()).reports().isEmpty());
    }

    @Test
    void hiding_ShouldReportInnerDeclaration() {
        ModelBuilder b = nestedDeclarations("x", "x");

        assertEquals(List.of("4:5.3"), CollectingSink.run(new IdentifierHidingRule(), b.unit()).reports());
    }

    @Test
    void hiding_ShouldCompareSignificantCharactersOfStandard() {
        ModelBuilder c89 = nestedDeclarations(PREFIX + "_outer", PREFIX + "_inner").standard(LanguageStandard.C89);
        ModelBuilder c99 = nestedDeclarations(PREFIX + "_outer", PREFIX + "_inner").standard(LanguageStandard.C99);

        assertEquals(List.of("4:5.3"), CollectingSink.run(new IdentifierHidingRule(), c89.unit()).reports());
        assertTrue(CollectingSink.run(new IdentifierHidingRule(), c99.unit()).reports().isEmpty());
    }

    @Test
    void hiding_ShouldIgnoreDistinctNames() {
        ModelBuilder b = nestedDeclarations("x", "y");

        assertTrue(CollectingSink.run(new IdentifierHidingRule(), b.unit()).reports().isEmpty());
    }

    @Test
    void hiding_ShouldTerminateOnScopeNestingCycle() {
        // Arrange
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "void f ( ) {")
                .line(2, "int x ;")
                .line(3, "{")
                .line(4, "int x ;")
                .line(5, "}")
                .line(6, "}");
        int fn = b.scope(ScopeType.FUNCTION, "f", 4, 13, 1);
        int block = b.scope(ScopeType.UNCONDITIONAL, null, 8, 12, fn);
        b.tokenScope(6, fn).tokenScope(10, block);
        b.variable(6, 5, 5, fn, LOCAL);
        b.variable(10, 9, 9, block, LOCAL);

        // Act
        List<String> reports = CollectingSink.run(new IdentifierHidingRule(), b.unit()).reports();

        // Assert
        assertEquals(List.of("4:5.3", "4:5.3"), reports);
    }

    @Test
    void macroCollision_ShouldReportVariableAndTagNamedLikeMacro() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .directive(1, "#define LIMIT 10")
                .line(2, "int LIMIT ;")
                .line(3, "struct LIMIT { int n ; } ;");
        b.variable(1, 0, 0, -1, GLOBAL);
        b.scope(ScopeType.STRUCT, "LIMIT", 5, 9, -1);

        assertEquals(List.of("2:5.5", "3:5.5"), CollectingSink.run(new MacroNameCollisionRule(), b.unit()).reports());
    }

    @Test
    void macroCollision_ShouldIgnoreDistinctNames() {
        ModelBuilder b = ModelBuilder.file("test.c")
                .directive(1, "#define LIMIT 10")
                .line(2, "int limit ;");
        b.variable(1, 0, 0, -1, GLOBAL);

        assertTrue(CollectingSink.run(new MacroNameCollisionRule(), b.unit()).reports().isEmpty());
    }

    /**
     * {@code outer} declared in a function body, {@code inner} in a nested block on line 4.
     */
    private static ModelBuilder nestedDeclarations(String outer, String inner) {
        ModelBuilder b = ModelBuilder.file("test.c")
                .line(1, "void f ( ) {")
                .line(2, "int " + outer + " ;")
                .line(3, "{")
                .line(4, "int " + inner + " ;")
                .line(5, "}")
                .line(6, "}");
        int fn = b.scope(ScopeType.FUNCTION, "f", 4, 13, -1);
        int block = b.scope(ScopeType.UNCONDITIONAL, null, 8, 12, fn);
        b.tokenScope(6, fn).tokenScope(10, block);
        b.variable(6, 5, 5, fn, LOCAL);
        b.variable(10, 9, 9, block, LOCAL);
        return b;
    }
}
