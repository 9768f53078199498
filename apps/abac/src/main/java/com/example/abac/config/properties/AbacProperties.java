package com.example.abac.config.properties;

import com.example.abac.model.SubjectAttributes;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Engine configuration bound from {@code abac.*}.
 *
 * @param policyStore   {@code config} reads the seed file, {@code mongo} the policy collection
 * @param policySeed    location of the policy seed used by the {@code config} store
 * @param subjectSource {@code config} uses {@code subjects}, {@code user-service} calls the user service
 * @param subjectHeader request header carrying the authenticated subject id
 * @param userService   user service connection, used when {@code subjectSource=user-service}
 * @param subjects      subjects known to the {@code config} subject source
 * @param vocabulary    actions and resource types offered to policy authors
 */
@ConfigurationProperties(prefix = "abac")
public record AbacProperties(
        String policyStore,
        String policySeed,
        String subjectSource,
        String subjectHeader,
        UserService userService,
        List<SubjectAttributes> subjects,
        Vocabulary vocabulary
) {
    public static final String DEFAULT_POLICY_SEED = "classpath:abac/policies.json";
    public static final String DEFAULT_SUBJECT_HEADER = "X-User-Id";

    public AbacProperties {
        if (policyStore == null || policyStore.isBlank()) {
            policyStore = "config";
        }
        if (policySeed == null || policySeed.isBlank()) {
            policySeed = DEFAULT_POLICY_SEED;
        }
        if (subjectSource == null || subjectSource.isBlank()) {
            subjectSource = "config";
        }
        if (subjectHeader == null || subjectHeader.isBlank()) {
            subjectHeader = DEFAULT_SUBJECT_HEADER;
        }
        if (userService == null) {
            userService = UserService.defaults();
        }
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
        if (vocabulary == null) {
            vocabulary = Vocabulary.defaults();
        }
    }

    public record UserService(String baseUrl, Duration timeout) {
        public UserService {
            if (baseUrl == null || baseUrl.isBlank()) {
                baseUrl = "http://localhost:8081";
            }
            if (timeout == null) {
                timeout = Duration.ofSeconds(5);
            }
        }

        public static UserService defaults() {
            return new UserService(null, null);
        }
    }

    public record Vocabulary(List<String> actions, List<String> resourceTypes) {
        public Vocabulary {
            if (actions == null || actions.isEmpty()) {
                actions = List.of("create", "read", "update", "delete", "manage", "execute", "view", "all");
            }
            if (resourceTypes == null || resourceTypes.isEmpty()) {
                resourceTypes = List.of("ui.page", "api.endpoint", "rag_data", "rag_file", "user", "role", "policy");
            }
        }

        public static Vocabulary defaults() {
            return new Vocabulary(null, null);
        }
    }

    public static AbacProperties defaults() {
        return new AbacProperties(null, null, null, null, null, null, null);
    }
}
