package com.vidnyan.misra.adapter.out.evaluator.stdlib;

import com.vidnyan.misra.domain.model.Configuration;
import com.vidnyan.misra.domain.model.Directive;

import java.util.Optional;

final class Includes {

    private Includes() {
    }

    /**
     * First {@code #include} of the given header, written exactly as {@code #include <header>}.
     */
    static Optional<Directive> find(Configuration configuration, String header) {
        String expected = "#include " + header;
        return configuration.directives().stream()
                .filter(d -> d.str().equals(expected))
                .findFirst();
    }
}
