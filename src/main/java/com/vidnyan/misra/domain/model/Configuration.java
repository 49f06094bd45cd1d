package com.vidnyan.misra.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One preprocessor-resolved variant of a translation unit.
 * Owns the decorated token list and the symbol tables; immutable once built.
 */
public final class Configuration implements NodeArena {

    private final String name;
    private final List<Token> tokens;
    private final List<Scope> scopes;
    private final List<Variable> variables;
    private final List<Function> functions;
    private final List<Directive> directives;

    public Configuration(
            String name,
            List<TokenData> tokens,
            List<ScopeData> scopes,
            List<VariableData> variables,
            List<FunctionData> functions,
            List<Directive> directives
    ) {
        this.name = name == null ? "" : name;
        List<Token> tokenNodes = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            tokenNodes.add(new Token(this, i, tokens.get(i)));
        }
        List<Scope> scopeNodes = new ArrayList<>(scopes.size());
        for (int i = 0; i < scopes.size(); i++) {
            scopeNodes.add(new Scope(this, i, scopes.get(i)));
        }
        List<Variable> variableNodes = new ArrayList<>(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            variableNodes.add(new Variable(this, i, variables.get(i)));
        }
        List<Function> functionNodes = new ArrayList<>(functions.size());
        for (int i = 0; i < functions.size(); i++) {
            functionNodes.add(new Function(this, i, functions.get(i)));
        }
        this.tokens = Collections.unmodifiableList(tokenNodes);
        this.scopes = Collections.unmodifiableList(scopeNodes);
        this.variables = Collections.unmodifiableList(variableNodes);
        this.functions = Collections.unmodifiableList(functionNodes);
        this.directives = List.copyOf(directives);
    }

    public String name() {
        return name;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public List<Scope> scopes() {
        return scopes;
    }

    public List<Variable> variables() {
        return variables;
    }

    public List<Function> functions() {
        return functions;
    }

    public List<Directive> directives() {
        return directives;
    }

    @Override
    public Token token(int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    @Override
    public Scope scope(int index) {
        return index >= 0 && index < scopes.size() ? scopes.get(index) : null;
    }

    @Override
    public Variable variable(int index) {
        return index >= 0 && index < variables.size() ? variables.get(index) : null;
    }

    @Override
    public Function function(int index) {
        return index >= 0 && index < functions.size() ? functions.get(index) : null;
    }
}
