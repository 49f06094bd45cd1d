package com.vidnyan.misra.adapter.out.ruletext;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.misra.application.port.out.RuleTextRepository;
import com.vidnyan.misra.config.MisraProperties;
import com.vidnyan.misra.domain.rule.DomainSeverity;
import com.vidnyan.misra.domain.rule.RuleId;
import com.vidnyan.misra.domain.rule.RuleText;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rule text repository backed by a JSON array of
 * {@code {"rule": "15.1", "text": "...", "severity": "Required"}} entries.
 * Without a configured location the repository stays empty.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemRuleTextRepository implements RuleTextRepository {

    private final ObjectMapper objectMapper;
    private final MisraProperties properties;

    private final Map<RuleId, RuleText> ruleTexts = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadRuleTexts() {
        String location = properties.getRuleTexts();
        if (location == null || location.isBlank()) {
            log.info("No rule texts configured, using the generic violation message");
            return;
        }

        Resource resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) {
            log.warn("Rule texts not found: {}", location);
            return;
        }

        try (InputStream in = resource.getInputStream()) {
            List<RuleTextDto> dtos = objectMapper.readValue(in, new TypeReference<List<RuleTextDto>>() {});
            for (RuleTextDto dto : dtos) {
                try {
                    RuleId rule = RuleId.parse(dto.rule);
                    ruleTexts.put(rule, new RuleText(rule, dto.text, DomainSeverity.fromText(dto.severity)));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping rule text with bad rule id '{}'", dto.rule);
                }
            }
            log.info("Loaded {} rule texts from {}", ruleTexts.size(), location);
        } catch (IOException e) {
            log.error("Failed to load rule texts from {}", location, e);
        }
    }

    @Override
    public Optional<RuleText> findByRule(RuleId rule) {
        return Optional.ofNullable(ruleTexts.get(rule));
    }

    @Override
    public int size() {
        return ruleTexts.size();
    }

    // DTO class for JSON deserialization
    static class RuleTextDto {
        public String rule;
        public String text;
        public String severity;
    }
}
