package com.vidnyan.misra.adapter.out.model;

import com.vidnyan.misra.application.port.out.ProgramModelException;
import com.vidnyan.misra.config.MisraConfiguration;
import com.vidnyan.misra.domain.model.Configuration;
import com.vidnyan.misra.domain.model.LanguageStandard;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.TranslationUnit;
import com.vidnyan.misra.domain.model.Variable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonProgramModelSourceTest {

    private static final String MODEL = """
            {
              "file": "main.c",
              "standard": "c99",
              "platform": {"charBit": 8, "shortBit": 16, "intBit": 32, "longBit": 64, "longLongBit": 64, "pointerBit": 64},
              "rawTokens": [
                {"str": "x", "type": "name", "file": "main.c", "line": 3, "column": 1},
                {"str": "=", "type": "op", "file": "main.c", "line": 3, "column": 3},
                {"str": "1", "type": "number", "file": "main.c", "line": 3, "column": 5},
                {"str": "// 15.1", "file": "main.c", "line": 3, "column": 8}
              ],
              "suppressions": [
                {"errorId": "misra-c2012-15.1", "fileName": "main.c", "lineNumber": 3}
              ],
              "configurations": [
                {
                  "name": "",
                  "tokens": [
                    {"id": "t1", "str": "x", "type": "name", "file": "main.c", "line": 3, "column": 1,
                     "astParent": "t2", "variable": "v1", "scope": "s1", "varId": 1},
                    {"id": "t2", "str": "=", "type": "op", "file": "main.c", "line": 3, "column": 3,
                     "astOperand1": "t1", "astOperand2": "t3", "scope": "s1"},
                    {"id": "t3", "str": "1", "type": "number", "file": "main.c", "line": 3, "column": 5,
                     "astParent": "t2", "link": "missing", "values": [{"intValue": 1}],
                     "valueType": {"type": "int", "sign": "signed", "bits": 0, "pointer": 0}}
                  ],
                  "scopes": [
                    {"id": "s1", "type": "Global", "nestedIn": "nowhere"}
                  ],
                  "variables": [
                    {"id": "v1", "nameToken": "t1", "typeStartToken": "t1", "typeEndToken": "t1",
                     "scope": "s1", "isGlobal": true, "isStatic": true}
                  ],
                  "functions": [],
                  "directives": [
                    {"str": "#include <stdio.h>", "file": "main.c", "line": 1}
                  ],
                  "futureField": 42
                }
              ]
            }
            """;

    @TempDir
    Path tempDir;

    private final JsonProgramModelSource source = new JsonProgramModelSource(new MisraConfiguration().objectMapper());

    @Test
    void load_ShouldResolveIdsToNodes() throws IOException {
        // Arrange
        Path dump = tempDir.resolve("main.c.dump");
        Files.writeString(dump, MODEL);

        // Act
        TranslationUnit unit = source.load(dump);

        // Assert
        assertEquals("main.c", unit.sourceFile());
        assertEquals(LanguageStandard.C99, unit.standard());
        assertEquals(32, unit.platform().intBit());
        assertEquals(4, unit.rawTokens().size());
        assertEquals(1, unit.suppressions().size());

        Configuration cfg = unit.configurations().get(0);
        Token assign = cfg.tokens().get(1);
        assertSame(cfg.tokens().get(0), assign.astOperand1());
        assertSame(cfg.tokens().get(2), assign.astOperand2());
        assertSame(assign, assign.astOperand1().astParent());

        Variable x = cfg.tokens().get(0).variable();
        assertNotNull(x);
        assertTrue(x.isGlobal());
        assertTrue(x.isStatic());
        assertSame(cfg.tokens().get(0), x.nameToken());
        assertTrue(cfg.scopes().get(0).is(ScopeType.GLOBAL));
        assertEquals("int", cfg.tokens().get(2).valueType().type());
        assertEquals(1L, cfg.tokens().get(2).values().get(0).intValue());
        assertEquals("#include <stdio.h>", cfg.directives().get(0).str());
    }

    @Test
    void load_ShouldTreatDanglingIdsAsAbsent() throws IOException {
        Path dump = tempDir.resolve("main.c.dump");
        Files.writeString(dump, MODEL);

        Configuration cfg = source.load(dump).configurations().get(0);

        assertNull(cfg.tokens().get(2).link());
        assertNull(cfg.scopes().get(0).nestedIn());
        assertNull(cfg.tokens().get(1).variable());
    }

    @Test
    void load_ShouldDefaultFileNameAndPlatform() throws IOException {
        Path dump = tempDir.resolve("other.c.dump");
        Files.writeString(dump, "{\"configurations\": []}");

        TranslationUnit unit = source.load(dump);

        assertEquals("other.c.dump", unit.sourceFile());
        assertTrue(unit.configurations().isEmpty());
        assertEquals(0, unit.rawTokens().size());
        assertEquals(LanguageStandard.C89, unit.standard());
    }

    @Test
    void load_ShouldRejectMissingOrMalformedModels() throws IOException {
        assertThrows(ProgramModelException.class, () -> source.load(tempDir.resolve("absent.dump")));

        Path broken = tempDir.resolve("broken.dump");
        Files.writeString(broken, "{\"configurations\": [");
        assertThrows(ProgramModelException.class, () -> source.load(broken));
    }

    @Test
    void load_ShouldRejectNullEntries() throws IOException {
        Path dump = tempDir.resolve("nulls.dump");
        Files.writeString(dump, "{\"configurations\":[{\"tokens\":[null]}]}");

        ProgramModelException e = assertThrows(ProgramModelException.class, () -> source.load(dump));

        assertTrue(e.getMessage().startsWith("Malformed program model"));
        assertInstanceOf(NullPointerException.class, e.getCause());
    }

    @Test
    void load_ShouldRejectNullConfigurationsAndVariables() throws IOException {
        Path nullConfiguration = tempDir.resolve("config.dump");
        Files.writeString(nullConfiguration, "{\"configurations\":[null]}");
        Path nullVariable = tempDir.resolve("variable.dump");
        Files.writeString(nullVariable, "{\"configurations\":[{\"variables\":[null]}]}");

        assertThrows(ProgramModelException.class, () -> source.load(nullConfiguration));
        assertThrows(ProgramModelException.class, () -> source.load(nullVariable));
    }

    @Test
    void load_ShouldRejectSelfReferencingOperand() throws IOException {
        // Arrange
        Path dump = tempDir.resolve("cycle.dump");
        Files.writeString(dump, """
                {"configurations": [{"tokens": [
                  {"id": "p", "str": "+", "astOperand1": "p", "astOperand2": "p", "astParent": "p"}
                ]}]}
                """);

        // Act
        ProgramModelException e = assertThrows(ProgramModelException.class, () -> source.load(dump));

        // Assert
        assertTrue(e.getMessage().contains("operand cycle through token p"));
    }

    @Test
    void load_ShouldRejectParentAndScopeCycles() throws IOException {
        Path parents = tempDir.resolve("parents.dump");
        Files.writeString(parents, """
                {"configurations": [{"tokens": [
                  {"id": "a", "str": "a", "astParent": "b"},
                  {"id": "b", "str": "b", "astParent": "a"}
                ]}]}
                """);
        Path scopes = tempDir.resolve("scopes.dump");
        Files.writeString(scopes, """
                {"configurations": [{"scopes": [
                  {"id": "s1", "type": "Function", "nestedIn": "s2"},
                  {"id": "s2", "type": "If", "nestedIn": "s1"}
                ]}]}
                """);

        assertTrue(assertThrows(ProgramModelException.class, () -> source.load(parents))
                .getMessage().contains("parent cycle"));
        assertTrue(assertThrows(ProgramModelException.class, () -> source.load(scopes))
                .getMessage().contains("Scope nesting cycle"));
    }

    @Test
    void load_ShouldAcceptSharedOperandsWithoutCycle() throws IOException {
        Path dump = tempDir.resolve("shared.dump");
        Files.writeString(dump, """
                {"configurations": [{"tokens": [
                  {"id": "x", "str": "x"},
                  {"id": "m", "str": "*", "astOperand1": "x", "astOperand2": "x"}
                ]}]}
                """);

        Configuration cfg = source.load(dump).configurations().get(0);

        assertSame(cfg.token(0), cfg.token(1).astOperand1());
        assertSame(cfg.token(0), cfg.token(1).astOperand2());
    }
}
