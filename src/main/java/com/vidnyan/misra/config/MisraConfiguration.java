package com.vidnyan.misra.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.misra.application.port.out.RuleCatalog;
import com.vidnyan.misra.application.port.out.RuleTextRepository;
import com.vidnyan.misra.application.service.DiagnosticsSinkFactory;
import com.vidnyan.misra.application.service.ReportingSink;
import com.vidnyan.misra.application.service.VerifySink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the rule engine.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class MisraConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Reporting sink, or the verify sink when {@code misra.verify} is set.
     */
    @Bean
    public DiagnosticsSinkFactory diagnosticsSinkFactory(MisraProperties properties, RuleTextRepository ruleTexts) {
        if (properties.isVerify()) {
            log.info("Verify mode: comparing reports against source comments");
            return (unit, registry) -> new VerifySink(unit);
        }
        return (unit, registry) -> new ReportingSink(unit.sourceFile(), registry, ruleTexts);
    }

    /**
     * Log available evaluators on startup.
     */
    @Bean
    public String logEvaluators(RuleCatalog ruleCatalog) {
        log.info("Registered {} rule evaluators for {} rules:",
                ruleCatalog.evaluators().size(), ruleCatalog.engineRules().size());
        ruleCatalog.evaluators().forEach(e -> log.debug("  - {}", e));
        return "evaluators-logged";
    }
}
