package com.vidnyan.misra.domain.rule;

import com.vidnyan.misra.domain.model.Locatable;

/**
 * Receives rule hits. Implementations decide about suppression,
 * message text and what a unit's report looks like.
 */
public interface DiagnosticsSink {

    void report(Locatable location, RuleId rule);

    /**
     * Close the unit and return what was collected.
     */
    UnitReport finish();
}
