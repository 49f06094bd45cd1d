package com.vidnyan.misra.adapter.out.evaluator.essentialtypes;

import com.vidnyan.misra.domain.essential.EssentialRank;
import com.vidnyan.misra.domain.essential.EssentialTypes;
import com.vidnyan.misra.domain.model.Token;
import com.vidnyan.misra.domain.model.ValueType;
import com.vidnyan.misra.domain.pattern.Expressions;

import java.util.Optional;

/**
 * Integer ranks ({@code char} to {@code long long}) of assignment and cast operands.
 */
final class IntegerRanks {

    private IntegerRanks() {
    }

    static Optional<EssentialRank> of(ValueType valueType) {
        if (valueType == null || valueType.isPointer()) {
            return Optional.empty();
        }
        return EssentialRank.integerTypeRank(valueType.type());
    }

    /**
     * Rank of an expression as the source of a conversion. A cast contributes
     * its target type, anything else its essential rank.
     */
    static Optional<EssentialRank> ofSource(Token expr, EssentialTypes essentialTypes) {
        Optional<EssentialRank> rank = Expressions.isCast(expr)
                ? EssentialRank.fromTypeName(expr.valueType() == null ? null : expr.valueType().type())
                : essentialTypes.rank(expr);
        return rank.filter(r -> r.isInteger() && r != EssentialRank.BOOL);
    }
}
