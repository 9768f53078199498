package com.example.abac.subject;

import com.example.abac.config.properties.AbacProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static com.example.abac.util.SubjectAttributesTestBuilder.aSubject;
import static com.example.abac.util.SubjectAttributesTestBuilder.anAdmin;

@DisplayName("ConfiguredSubjectDirectory")
class ConfiguredSubjectDirectoryTest {

    @Test
    @DisplayName("should find configured subjects by id and nothing else")
    void shouldFindConfiguredSubjects() {
        AbacProperties properties = new AbacProperties(null, null, null, null, null,
                List.of(anAdmin(), aSubject().withId("5").build()), null);
        ConfiguredSubjectDirectory directory = new ConfiguredSubjectDirectory(properties);

        StepVerifier.create(directory.findSubject("1"))
                .expectNext(anAdmin())
                .verifyComplete();
        StepVerifier.create(directory.findSubject("9"))
                .verifyComplete();
    }
}
