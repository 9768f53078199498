package com.example.abac.subject;

import com.example.abac.config.properties.AbacProperties;
import com.example.abac.model.SubjectAttributes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Subjects declared under {@code abac.subjects}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.subject-source", havingValue = "config", matchIfMissing = true)
public class ConfiguredSubjectDirectory implements SubjectDirectory {

    private final Map<String, SubjectAttributes> subjects;

    public ConfiguredSubjectDirectory(AbacProperties properties) {
        this.subjects = properties.subjects().stream()
                .collect(Collectors.toUnmodifiableMap(SubjectAttributes::id, Function.identity(),
                        (first, duplicate) -> first));
        log.info("Configured subject directory initialized with {} subjects", subjects.size());
    }

    @Override
    public Mono<SubjectAttributes> findSubject(String subjectId) {
        return Mono.justOrEmpty(subjects.get(subjectId));
    }
}
