package com.vidnyan.misra.adapter.out.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.misra.application.port.out.ProgramModelException;
import com.vidnyan.misra.application.port.out.ProgramModelSource;
import com.vidnyan.misra.domain.model.Configuration;
import com.vidnyan.misra.domain.model.Directive;
import com.vidnyan.misra.domain.model.FunctionData;
import com.vidnyan.misra.domain.model.LanguageStandard;
import com.vidnyan.misra.domain.model.NodeArena;
import com.vidnyan.misra.domain.model.Platform;
import com.vidnyan.misra.domain.model.RawTokenStream;
import com.vidnyan.misra.domain.model.ScopeData;
import com.vidnyan.misra.domain.model.ScopeType;
import com.vidnyan.misra.domain.model.SuppressionDirective;
import com.vidnyan.misra.domain.model.TokenData;
import com.vidnyan.misra.domain.model.TokenType;
import com.vidnyan.misra.domain.model.TranslationUnit;
import com.vidnyan.misra.domain.model.Value;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.model.VariableData;
import com.vidnyan.misra.domain.model.VariableFlag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the analyzer's program model from a JSON document.
 * <p>
 * Nodes reference each other through string ids, which are mapped to arena
 * indices per configuration. An id that names no node of the right kind
 * resolves to "absent".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonProgramModelSource implements ProgramModelSource {

    private final ObjectMapper objectMapper;

    @Override
    public TranslationUnit load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ProgramModelException("Program model not found: " + path);
        }
        UnitDto dto;
        try {
            dto = objectMapper.readValue(path.toFile(), UnitDto.class);
        } catch (IOException e) {
            throw new ProgramModelException("Cannot read program model " + path + ": " + e.getMessage(), e);
        }
        if (dto == null) {
            throw new ProgramModelException("Empty program model: " + path);
        }

        String sourceFile = dto.file != null ? dto.file : path.getFileName().toString();
        TranslationUnit unit;
        try {
            unit = mapUnit(sourceFile, dto);
        } catch (RuntimeException e) {
            throw new ProgramModelException("Malformed program model " + path + ": " + e.getMessage(), e);
        }

        log.debug("Loaded {}: {} raw tokens, {} configuration(s)",
                sourceFile, unit.rawTokens().size(), unit.configurations().size());
        return unit;
    }

    private TranslationUnit mapUnit(String sourceFile, UnitDto dto) {
        List<Configuration> configurations = new ArrayList<>();
        for (ConfigurationDto cfg : nonNull(dto.configurations)) {
            configurations.add(mapConfiguration(cfg));
        }
        return new TranslationUnit(
                sourceFile,
                mapRawTokens(nonNull(dto.rawTokens)),
                configurations,
                nonNull(dto.suppressions).stream().map(this::mapSuppression).toList(),
                mapPlatform(dto.platform),
                LanguageStandard.fromCode(dto.standard));
    }

    private RawTokenStream mapRawTokens(List<TokenDto> tokens) {
        List<TokenData> data = new ArrayList<>(tokens.size());
        for (TokenDto t : tokens) {
            data.add(TokenData.builder(t.str == null ? "" : t.str)
                    .type(TokenType.fromCode(t.type))
                    .file(t.file)
                    .line(t.line)
                    .column(t.column)
                    .build());
        }
        return new RawTokenStream(data);
    }

    private Configuration mapConfiguration(ConfigurationDto cfg) {
        Ids ids = new Ids(cfg);

        List<TokenData> tokens = new ArrayList<>();
        for (TokenDto t : nonNull(cfg.tokens)) {
            tokens.add(TokenData.builder(t.str == null ? "" : t.str)
                    .type(TokenType.fromCode(t.type))
                    .file(t.file)
                    .line(t.line)
                    .column(t.column)
                    .link(ids.token(t.link))
                    .astParent(ids.token(t.astParent))
                    .astOperand1(ids.token(t.astOperand1))
                    .astOperand2(ids.token(t.astOperand2))
                    .scope(ids.scope(t.scope))
                    .variable(ids.variable(t.variable))
                    .function(ids.function(t.function))
                    .varId(t.varId)
                    .typeScope(ids.scope(t.typeScope))
                    .valueType(mapValueType(t.valueType, ids))
                    .values(nonNull(t.values).stream().map(v -> new Value(v.intValue)).toList())
                    .build());
        }

        List<ScopeData> scopes = new ArrayList<>();
        for (ScopeDto s : nonNull(cfg.scopes)) {
            scopes.add(new ScopeData(
                    ScopeType.fromCode(s.type),
                    s.className,
                    ids.token(s.bodyStart),
                    ids.token(s.bodyEnd),
                    ids.scope(s.nestedIn),
                    ids.function(s.function)));
        }

        List<VariableData> variables = new ArrayList<>();
        for (VariableDto v : nonNull(cfg.variables)) {
            variables.add(new VariableData(
                    ids.token(v.nameToken),
                    ids.token(v.typeStartToken),
                    ids.token(v.typeEndToken),
                    ids.scope(v.scope),
                    flags(v),
                    v.constness));
        }

        List<FunctionData> functions = new ArrayList<>();
        for (FunctionDto f : nonNull(cfg.functions)) {
            Map<Integer, Integer> arguments = new LinkedHashMap<>();
            if (f.arguments != null) {
                f.arguments.forEach((position, variable) -> {
                    int index = ids.variable(variable);
                    if (index != NodeArena.NONE) {
                        arguments.put(position, index);
                    }
                });
            }
            functions.add(new FunctionData(f.name, ids.token(f.tokenDef), f.isStatic, arguments));
        }

        List<Directive> directives = nonNull(cfg.directives).stream()
                .map(d -> new Directive(d.str == null ? "" : d.str, d.file, d.line))
                .toList();

        requireAcyclic(cfg, tokens, scopes);
        return new Configuration(cfg.name, tokens, scopes, variables, functions, directives);
    }

    // Rules walk operands, parents and enclosing scopes without cycle checks.
    private static void requireAcyclic(ConfigurationDto cfg, List<TokenData> tokens, List<ScopeData> scopes) {
        int operandCycle = GraphCycles.nodeOnCycle(tokens.size(),
                i -> new int[] {tokens.get(i).astOperand1(), tokens.get(i).astOperand2()});
        if (operandCycle != GraphCycles.NONE) {
            throw new IllegalArgumentException("AST operand cycle through token " + cfg.tokens.get(operandCycle).id);
        }
        int parentCycle = GraphCycles.nodeOnCycle(tokens.size(), i -> new int[] {tokens.get(i).astParent()});
        if (parentCycle != GraphCycles.NONE) {
            throw new IllegalArgumentException("AST parent cycle through token " + cfg.tokens.get(parentCycle).id);
        }
        int scopeCycle = GraphCycles.nodeOnCycle(scopes.size(), i -> new int[] {scopes.get(i).nestedIn()});
        if (scopeCycle != GraphCycles.NONE) {
            throw new IllegalArgumentException("Scope nesting cycle through scope " + cfg.scopes.get(scopeCycle).id);
        }
    }

    private ValueType mapValueType(ValueTypeDto dto, Ids ids) {
        if (dto == null || dto.type == null) {
            return null;
        }
        return new ValueType(dto.type, dto.sign, dto.bits, dto.pointer, dto.constness,
                ids.scope(dto.typeScope), dto.originalTypeName);
    }

    private SuppressionDirective mapSuppression(SuppressionDto dto) {
        return new SuppressionDirective(dto.errorId, dto.fileName, dto.lineNumber, dto.symbolName);
    }

    private Platform mapPlatform(PlatformDto dto) {
        if (dto == null) {
            log.warn("No platform in program model, bit widths unknown");
            return Platform.unknown();
        }
        return new Platform(dto.charBit, dto.shortBit, dto.intBit, dto.longBit, dto.longLongBit, dto.pointerBit);
    }

    private static Set<VariableFlag> flags(VariableDto v) {
        Set<VariableFlag> flags = EnumSet.noneOf(VariableFlag.class);
        if (v.isArgument) flags.add(VariableFlag.ARGUMENT);
        if (v.isArray) flags.add(VariableFlag.ARRAY);
        if (v.isClass) flags.add(VariableFlag.CLASS);
        if (v.isConst) flags.add(VariableFlag.CONST);
        if (v.isExtern) flags.add(VariableFlag.EXTERN);
        if (v.isGlobal) flags.add(VariableFlag.GLOBAL);
        if (v.isLocal) flags.add(VariableFlag.LOCAL);
        if (v.isPointer) flags.add(VariableFlag.POINTER);
        if (v.isStatic) flags.add(VariableFlag.STATIC);
        return flags;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }

    /**
     * Document id to arena index, one table per node kind.
     */
    private static final class Ids {
        private final Map<String, Integer> tokens = new HashMap<>();
        private final Map<String, Integer> scopes = new HashMap<>();
        private final Map<String, Integer> variables = new HashMap<>();
        private final Map<String, Integer> functions = new HashMap<>();

        Ids(ConfigurationDto cfg) {
            List<TokenDto> t = nonNull(cfg.tokens);
            for (int i = 0; i < t.size(); i++) {
                register(tokens, t.get(i).id, i);
            }
            List<ScopeDto> s = nonNull(cfg.scopes);
            for (int i = 0; i < s.size(); i++) {
                register(scopes, s.get(i).id, i);
            }
            List<VariableDto> v = nonNull(cfg.variables);
            for (int i = 0; i < v.size(); i++) {
                register(variables, v.get(i).id, i);
            }
            List<FunctionDto> f = nonNull(cfg.functions);
            for (int i = 0; i < f.size(); i++) {
                register(functions, f.get(i).id, i);
            }
        }

        private static void register(Map<String, Integer> table, String id, int index) {
            if (id != null) {
                table.putIfAbsent(id, index);
            }
        }

        int token(String id) {
            return lookup(tokens, id);
        }

        int scope(String id) {
            return lookup(scopes, id);
        }

        int variable(String id) {
            return lookup(variables, id);
        }

        int function(String id) {
            return lookup(functions, id);
        }

        private static int lookup(Map<String, Integer> table, String id) {
            if (id == null) {
                return NodeArena.NONE;
            }
            return table.getOrDefault(id, NodeArena.NONE);
        }
    }

    // DTO classes for JSON deserialization
    static class UnitDto {
        public String file;
        public String standard;
        public PlatformDto platform;
        public List<TokenDto> rawTokens;
        public List<SuppressionDto> suppressions;
        public List<ConfigurationDto> configurations;
    }

    static class PlatformDto {
        public int charBit;
        public int shortBit;
        public int intBit;
        public int longBit;
        public int longLongBit;
        public int pointerBit;
    }

    static class SuppressionDto {
        public String errorId;
        public String fileName;
        public Integer lineNumber;
        public String symbolName;
    }

    static class ConfigurationDto {
        public String name;
        public List<TokenDto> tokens;
        public List<ScopeDto> scopes;
        public List<VariableDto> variables;
        public List<FunctionDto> functions;
        public List<DirectiveDto> directives;
    }

    static class TokenDto {
        public String id;
        public String str;
        public String type;
        public String file;
        public int line;
        public int column;
        public String link;
        public String astParent;
        public String astOperand1;
        public String astOperand2;
        public String scope;
        public String variable;
        public String function;
        public int varId;
        public String typeScope;
        public ValueTypeDto valueType;
        public List<ValueDto> values;
    }

    static class ValueTypeDto {
        public String type;
        public String sign;
        public int bits;
        public int pointer;
        public int constness;
        public String typeScope;
        public String originalTypeName;
    }

    static class ValueDto {
        public Long intValue;
    }

    static class ScopeDto {
        public String id;
        public String type;
        public String className;
        public String bodyStart;
        public String bodyEnd;
        public String nestedIn;
        public String function;
    }

    static class VariableDto {
        public String id;
        public String nameToken;
        public String typeStartToken;
        public String typeEndToken;
        public String scope;
        public boolean isArgument;
        public boolean isArray;
        public boolean isClass;
        public boolean isConst;
        public boolean isExtern;
        public boolean isGlobal;
        public boolean isLocal;
        public boolean isPointer;
        public boolean isStatic;
        public int constness;
    }

    static class FunctionDto {
        public String id;
        public String name;
        public String tokenDef;
        public boolean isStatic;
        public Map<Integer, String> arguments;
    }

    static class DirectiveDto {
        public String str;
        public String file;
        public int line;
    }
}
