package com.example.abac.subject;

import com.example.abac.config.properties.AbacProperties;
import com.example.abac.exception.ApiException;
import com.example.abac.model.SubjectAttributes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Fetches subjects from the user service: {@code GET /users/{id}}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.subject-source", havingValue = "user-service")
public class UserServiceSubjectDirectory implements SubjectDirectory {

    private static final String SERVICE_NAME = "UserService";

    private final WebClient webClient;
    private final Duration timeout;

    public UserServiceSubjectDirectory(WebClient.Builder webClientBuilder, AbacProperties properties) {
        this.webClient = webClientBuilder
                .baseUrl(properties.userService().baseUrl())
                .build();
        this.timeout = properties.userService().timeout();
        log.info("User service subject directory initialized (base-url={})", properties.userService().baseUrl());
    }

    @Override
    public Mono<SubjectAttributes> findSubject(String subjectId) {
        log.debug("Fetching subject attributes for {}", subjectId);

        return webClient.get()
                .uri("/users/{id}", subjectId)
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(SubjectAttributes.class);
                    }
                    if (response.statusCode().value() == HttpStatus.NOT_FOUND.value()) {
                        log.debug("Subject {} not found in user service", subjectId);
                        return response.releaseBody().then(Mono.empty());
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(body -> Mono.error(new ApiException(
                                    SERVICE_NAME,
                                    response.statusCode(),
                                    "User service error",
                                    body)));
                })
                .timeout(timeout)
                .onErrorMap(TimeoutException.class,
                        e -> new ApiException(SERVICE_NAME, "User service timed out", e))
                .doOnError(e -> {
                    if (!(e instanceof ApiException)) {
                        log.error("Failed to fetch subject {}", subjectId, e);
                    }
                });
    }
}
