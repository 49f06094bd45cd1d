package com.vidnyan.misra.application.service;

import com.vidnyan.misra.domain.model.TranslationUnit;
import com.vidnyan.misra.domain.rule.DiagnosticsSink;
import com.vidnyan.misra.domain.suppression.SuppressionRegistry;

/**
 * Creates the sink a unit's rules report into.
 * Chosen once at startup: reporting or verify mode.
 */
@FunctionalInterface
public interface DiagnosticsSinkFactory {

    DiagnosticsSink create(TranslationUnit unit, SuppressionRegistry registry);
}
