package com.vidnyan.misra.application.port.out;

import com.vidnyan.misra.domain.rule.UnitReport;

/**
 * Port for emitting the findings of a unit as soon as it is checked.
 */
public interface ViolationReporter {

    void report(UnitReport report);
}
