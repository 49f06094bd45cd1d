package com.vidnyan.misra.adapter.out.evaluator.lexical;

import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.rule.RawTokenRule;

import java.util.List;

/**
 * Rule 4.1: octal and hexadecimal escape sequences shall be terminated.
 *
 * <p>Only literals containing at least one numeric escape are inspected.
 * The literal body is split at each backslash and every piece must then be a
 * complete hex, octal or simple escape.
 */
public class UnterminatedEscapeSequenceRule extends RawTokenRule {

    private static final String HEX_DIGITS = "0123456789abcdefABCDEF";
    private static final String OCT_DIGITS = "01234567";
    private static final String SIMPLE_ESCAPES = "'\"?\\abfnrtv";

    public UnterminatedEscapeSequenceRule() {
        super(4, 1);
    }

    @Override
    protected void evaluate(List<Token> rawTokens, DiagnosticsSink sink) {
        for (Token token : rawTokens) {
            if (hasUnterminatedEscape(token.str())) {
                report(sink, token);
            }
        }
    }

    static boolean hasUnterminatedEscape(String literal) {
        if (literal.length() < 3) {
            return false;
        }
        char delimiter = literal.charAt(0);
        if (delimiter != '"' && delimiter != '\'') {
            return false;
        }
        if (literal.charAt(literal.length() - 1) != delimiter) {
            return false;
        }
        String symbols = literal.substring(1, literal.length() - 1);
        if (symbols.length() < 2 || !hasNumericEscapeSequence(symbols)) {
            return false;
        }
        String[] parts = symbols.split("\\\\", -1);
        for (int i = 1; i < parts.length; i++) {
            String sequence = "\\" + parts[i];
            if (!isHexEscape(sequence) && !isOctalEscape(sequence) && !isSimpleEscape(sequence)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Scans character pairs, so an escape starting at an odd offset is missed.
     */
    static boolean hasNumericEscapeSequence(String symbols) {
        if (symbols.indexOf('\\') < 0) {
            return false;
        }
        for (int i = 0; i + 1 < symbols.length(); i += 2) {
            char next = symbols.charAt(i + 1);
            if (symbols.charAt(i) == '\\' && (next == 'x' || OCT_DIGITS.indexOf(next) >= 0)) {
                return true;
            }
        }
        return false;
    }

    static boolean isHexEscape(String sequence) {
        if (sequence.length() < 3 || !sequence.startsWith("\\x")) {
            return false;
        }
        return allIn(sequence.substring(2), HEX_DIGITS);
    }

    static boolean isOctalEscape(String sequence) {
        if (sequence.length() < 2 || sequence.length() > 4 || sequence.charAt(0) != '\\') {
            return false;
        }
        return allIn(sequence.substring(1), OCT_DIGITS);
    }

    static boolean isSimpleEscape(String sequence) {
        return sequence.length() == 2 && sequence.charAt(0) == '\\'
                && SIMPLE_ESCAPES.indexOf(sequence.charAt(1)) >= 0;
    }

    private static boolean allIn(String text, String alphabet) {
        for (int i = 0; i < text.length(); i++) {
            if (alphabet.indexOf(text.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
