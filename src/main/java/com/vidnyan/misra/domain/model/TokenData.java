package com.vidnyan.misra.domain.model;

import java.util.List;

/**
 * Raw, index-based description of a token as supplied by the analyzer.
 * All relation fields are arena indices; {@link NodeArena#NONE} when absent.
 */
public record TokenData(
    String str,
    TokenType type,
    String file,
    int line,
    int column,
    int link,
    int astParent,
    int astOperand1,
    int astOperand2,
    int scope,
    int variable,
    int function,
    int varId,
    int typeScope,
    ValueType valueType,
    List<Value> values
) {

    public static Builder builder(String str) {
        return new Builder(str);
    }

    public static class Builder {
        private final String str;
        private TokenType type = TokenType.OTHER;
        private String file = "";
        private int line;
        private int column;
        private int link = NodeArena.NONE;
        private int astParent = NodeArena.NONE;
        private int astOperand1 = NodeArena.NONE;
        private int astOperand2 = NodeArena.NONE;
        private int scope = NodeArena.NONE;
        private int variable = NodeArena.NONE;
        private int function = NodeArena.NONE;
        private int varId;
        private int typeScope = NodeArena.NONE;
        private ValueType valueType;
        private List<Value> values = List.of();

        private Builder(String str) {
            this.str = str;
        }

        public Builder type(TokenType type) { this.type = type; return this; }
        public Builder file(String file) { this.file = file; return this; }
        public Builder line(int line) { this.line = line; return this; }
        public Builder column(int column) { this.column = column; return this; }
        public Builder link(int link) { this.link = link; return this; }
        public Builder astParent(int index) { this.astParent = index; return this; }
        public Builder astOperand1(int index) { this.astOperand1 = index; return this; }
        public Builder astOperand2(int index) { this.astOperand2 = index; return this; }
        public Builder scope(int scope) { this.scope = scope; return this; }
        public Builder variable(int variable) { this.variable = variable; return this; }
        public Builder function(int function) { this.function = function; return this; }
        public Builder varId(int varId) { this.varId = varId; return this; }
        public Builder typeScope(int typeScope) { this.typeScope = typeScope; return this; }
        public Builder valueType(ValueType valueType) { this.valueType = valueType; return this; }
        public Builder values(List<Value> values) { this.values = values; return this; }

        public TokenData build() {
            return new TokenData(str, type, file, line, column, link, astParent, astOperand1, astOperand2,
                    scope, variable, function, varId, typeScope, valueType, List.copyOf(values));
        }
    }
}
