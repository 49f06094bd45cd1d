package com.vidnyan.misra.domain.rule;

import com.vidnyan.misra.domain.essential.EssentialTypes;
import com.vidnyan.misra.domain.model.Configuration;
import com.vidnyan.misra.domain.model.LanguageStandard;
import com.vidnyan.misra.domain.model.Platform;
import com.vidnyan.misra.domain.model.RawTokenStream;
import com.vidnyan.misra.domain.model.TranslationUnit;

/**
 * Read-only context provided to rule evaluators.
 */
public record EvaluationContext(
    TranslationUnit unit,
    Configuration configuration,
    EssentialTypes essentialTypes
) {

    /**
     * Create context.
     */
    public static EvaluationContext of(TranslationUnit unit, Configuration configuration) {
        return new EvaluationContext(unit, configuration, new EssentialTypes(unit.platform()));
    }

    public RawTokenStream rawTokens() {
        return unit.rawTokens();
    }

    public Platform platform() {
        return unit.platform();
    }

    public LanguageStandard standard() {
        return unit.standard();
    }
}
