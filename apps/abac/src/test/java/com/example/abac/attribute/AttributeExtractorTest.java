package com.example.abac.attribute;

import com.example.abac.model.AttributeValue.Scalar;
import com.example.abac.model.ResourceDescriptor;
import com.example.abac.model.SubjectAttributes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static com.example.abac.util.SubjectAttributesTestBuilder.aSubject;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AttributeExtractor")
class AttributeExtractorTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:15:00Z");

    private AttributeExtractor extractor;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
        extractor = new AttributeExtractor(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should expose subject, resource, action and environment sections")
    void shouldExposeAllSections() {
        SubjectAttributes subject = aSubject().withId("5").withRoles("admin", "auditor").withSecurityLevel(3).build();
        ResourceDescriptor resource = new ResourceDescriptor("file", "f-1", Map.of("user_id", 5));

        AttributeNamespace namespace = extractor.namespace(subject, resource, "read");

        assertThat(namespace.resolve("user.id")).isEqualTo(new Scalar("5"));
        assertThat(namespace.resolve("user.security_level")).isEqualTo(new Scalar(3));
        assertThat(namespace.resolve("user.is_active")).isEqualTo(new Scalar(true));
        assertThat(namespace.resolve("user.roles").elements())
                .containsExactly(new Scalar("admin"), new Scalar("auditor"));
        assertThat(namespace.resolve("resource.type")).isEqualTo(new Scalar("file"));
        assertThat(namespace.resolve("resource.id")).isEqualTo(new Scalar("f-1"));
        assertThat(namespace.resolve("resource.user_id")).isEqualTo(new Scalar(5));
        assertThat(namespace.resolve("action.type")).isEqualTo(new Scalar("read"));
        assertThat(namespace.resolve("environment.current_time"))
                .isEqualTo(new Scalar(LocalDateTime.of(2024, 3, 4, 10, 15)));
    }

    @Test
    @DisplayName("should leave unset optional subject fields absent")
    void shouldLeaveUnsetFieldsAbsent() {
        SubjectAttributes subject = new SubjectAttributes("9", null, null, null, null, null, null, null);

        AttributeNamespace namespace = extractor.namespace(subject, ResourceDescriptor.of("user", null), "read");

        assertThat(namespace.resolve("user.department").isAbsent()).isTrue();
        assertThat(namespace.resolve("resource.id").isAbsent()).isTrue();
        assertThat(namespace.resolve("user.roles").elements()).isEmpty();
    }

    @Test
    @DisplayName("should describe a domain object using its class name as type")
    void shouldDescribeDomainObject() {
        ResourceDescriptor descriptor = extractor.describe(new Report(42, 7, "Q1"), null);

        assertThat(descriptor.type()).isEqualTo("report");
        assertThat(descriptor.id()).isEqualTo("42");
        assertThat(descriptor.attributes()).containsEntry("ownerId", 7).containsEntry("title", "Q1");
    }

    @Test
    @DisplayName("should use the given type when describing a domain object")
    void shouldUseGivenType() {
        ResourceDescriptor descriptor = extractor.describe(new Report(1, 2, "x"), "rag_data");

        assertThat(descriptor.type()).isEqualTo("rag_data");
    }

    public record Report(int id, int ownerId, String title) {
    }
}
