package com.vidnyan.misra.domain.model;

import java.util.List;

/**
 * Everything the analyzer produced for one source file.
 */
public record TranslationUnit(
    String sourceFile,
    RawTokenStream rawTokens,
    List<Configuration> configurations,
    List<SuppressionDirective> suppressions,
    Platform platform,
    LanguageStandard standard
) {

    public TranslationUnit {
        rawTokens = rawTokens == null ? RawTokenStream.empty() : rawTokens;
        configurations = configurations == null ? List.of() : List.copyOf(configurations);
        suppressions = suppressions == null ? List.of() : List.copyOf(suppressions);
        platform = platform == null ? Platform.unknown() : platform;
        standard = standard == null ? LanguageStandard.C89 : standard;
    }
}
