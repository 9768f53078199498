package com.example.abac.subject;

import com.example.abac.config.properties.AbacProperties;
import com.example.abac.exception.ApiException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UserServiceSubjectDirectory")
class UserServiceSubjectDirectoryTest {

    private static AbacProperties properties(Duration timeout) {
        return new AbacProperties("config", null, "user-service", null,
                new AbacProperties.UserService("http://users.test", timeout), null, null);
    }

    private static UserServiceSubjectDirectory directory(ExchangeFunction exchange, Duration timeout) {
        return new UserServiceSubjectDirectory(WebClient.builder().exchangeFunction(exchange), properties(timeout));
    }

    private static Mono<ClientResponse> respond(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .body(body)
                .build());
    }

    @Test
    @DisplayName("should map the user service response to subject attributes")
    void shouldMapSubject() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        UserServiceSubjectDirectory directory = directory(request -> {
            captured.set(request);
            return respond(HttpStatus.OK, """
                    {"id":"5","username":"alice","department":"finance","securityLevel":2,"roles":["standard_user"]}
                    """);
        }, Duration.ofSeconds(5));

        StepVerifier.create(directory.findSubject("5"))
                .assertNext(subject -> {
                    assertThat(subject.id()).isEqualTo("5");
                    assertThat(subject.department()).isEqualTo("finance");
                    assertThat(subject.securityLevel()).isEqualTo(2);
                    assertThat(subject.active()).isTrue();
                    assertThat(subject.hasRole("standard_user")).isTrue();
                })
                .verifyComplete();

        assertThat(captured.get().url().toString()).isEqualTo("http://users.test/users/5");
    }

    @Test
    @DisplayName("should complete empty for an unknown subject")
    void shouldCompleteEmptyOnNotFound() {
        UserServiceSubjectDirectory directory = directory(request -> respond(HttpStatus.NOT_FOUND, ""),
                Duration.ofSeconds(5));

        StepVerifier.create(directory.findSubject("404")).verifyComplete();
    }

    @Test
    @DisplayName("should raise ApiException for a server error")
    void shouldRaiseApiExceptionOnServerError() {
        UserServiceSubjectDirectory directory = directory(
                request -> respond(HttpStatus.SERVICE_UNAVAILABLE, "{\"error\":\"down\"}"), Duration.ofSeconds(5));

        StepVerifier.create(directory.findSubject("5"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(ApiException.class);
                    assertThat(((ApiException) error).getStatusCode().value()).isEqualTo(503);
                })
                .verify();
    }

    @Test
    @DisplayName("should raise ApiException when the user service is too slow")
    void shouldRaiseApiExceptionOnTimeout() {
        UserServiceSubjectDirectory directory = directory(request -> Mono.never(), Duration.ofMillis(50));

        StepVerifier.create(directory.findSubject("5"))
                .expectError(ApiException.class)
                .verify(Duration.ofSeconds(5));
    }
}
