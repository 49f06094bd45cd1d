package com.vidnyan.misra.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The undecorated lexical stream of a file, including comments and
 * directive tokens in their original spelling. Carries no symbol data.
 */
public final class RawTokenStream implements NodeArena {

    private final List<Token> tokens;

    public RawTokenStream(List<TokenData> tokens) {
        List<Token> nodes = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            nodes.add(new Token(this, i, tokens.get(i)));
        }
        this.tokens = Collections.unmodifiableList(nodes);
    }

    public static RawTokenStream empty() {
        return new RawTokenStream(List.of());
    }

    public List<Token> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    @Override
    public Token token(int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    @Override
    public Scope scope(int index) {
        return null;
    }

    @Override
    public Variable variable(int index) {
        return null;
    }

    @Override
    public Function function(int index) {
        return null;
    }
}
