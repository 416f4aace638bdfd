package fr.lapetina.orchestrator.infrastructure.retry;

import fr.lapetina.orchestrator.domain.exception.ProviderException;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultRetryClassifierTest {

    private final DefaultRetryClassifier classifier = DefaultRetryClassifier.INSTANCE;

    @ParameterizedTest
    @ValueSource(ints = {408, 429, 500, 502, 503, 504})
    @DisplayName("should retry rate limiting, request timeout and server errors")
    void shouldRetryRetryableStatus(int status) {
        assertThat(classifier.isRetryable(ProviderException.fromStatus("p", status, "HTTP " + status))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 403, 404, 422})
    @DisplayName("should not retry client errors")
    void shouldNotRetryClientStatus(int status) {
        assertThat(classifier.isRetryable(ProviderException.fromStatus("p", status, "HTTP " + status))).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Failed to fetch",
            "NetworkError when attempting to fetch resource",
            "Request timed out",
            "socket hang up",
            "read ECONNRESET",
            "Rate limit exceeded",
            "Upstream returned HTTP 503",
            "Gateway error, status: 502",
            "Request failed with status code 429"
    })
    @DisplayName("should retry by message when no typed information is available")
    void shouldRetryByMessage(String message) {
        assertThat(classifier.isRetryable(new RuntimeException(message))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "max_tokens must be <= 512",
            "Prompt exceeds 4096 tokens, got 500 extra",
            "Model gpt-4-0429 not found"
    })
    @DisplayName("should not treat numbers outside a status context as status codes")
    void shouldIgnoreBareNumbers(String message) {
        assertThat(classifier.isRetryable(new IllegalArgumentException(message))).isFalse();
    }

    @Test
    @DisplayName("should not retry unknown errors")
    void shouldNotRetryUnknownErrors() {
        assertThat(classifier.isRetryable(new IllegalArgumentException("Invalid prompt"))).isFalse();
        assertThat(classifier.isRetryable(null)).isFalse();
    }

    @Test
    @DisplayName("should never retry configuration or circuit errors")
    void shouldNotRetryConfigurationErrors() {
        assertThat(classifier.isRetryable(ProviderException.configuration("Missing API key: network"))).isFalse();
        assertThat(classifier.isRetryable(new ProviderException(ErrorType.CIRCUIT_OPEN, "Circuit open"))).isFalse();
    }

    @Test
    @DisplayName("should retry IO and timeout exceptions through wrapping layers")
    void shouldRetryWrappedIoExceptions() {
        assertThat(classifier.isRetryable(new CompletionException(new ConnectException()))).isTrue();
        assertThat(classifier.isRetryable(new RuntimeException("boom", new IOException()))).isTrue();
        assertThat(classifier.isRetryable(new TimeoutException())).isTrue();
    }

    @Test
    @DisplayName("should trust the status code over the message")
    void shouldPreferStatusOverMessage() {
        ProviderException badRequest = ProviderException.fromStatus("p", 400, "connection parameter invalid");

        assertThat(classifier.isRetryable(badRequest)).isFalse();
    }
}
