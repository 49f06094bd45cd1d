package com.vidnyan.misra.application.port.out;

import com.vidnyan.misra.domain.model.TranslationUnit;

import java.nio.file.Path;

/**
 * Port for acquiring the program model of a translation unit.
 * Implemented by adapters that read analyzer output.
 */
public interface ProgramModelSource {

    /**
     * Load one translation unit.
     *
     * @throws ProgramModelException if the document is missing or malformed
     */
    TranslationUnit load(Path path);
}
