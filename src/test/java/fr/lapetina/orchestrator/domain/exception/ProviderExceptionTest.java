package fr.lapetina.orchestrator.domain.exception;

import fr.lapetina.orchestrator.domain.model.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderExceptionTest {

    @ParameterizedTest
    @CsvSource({
            "429, TRANSIENT",
            "408, TRANSIENT",
            "500, TRANSIENT",
            "503, TRANSIENT",
            "400, FATAL",
            "401, FATAL",
            "404, FATAL"
    })
    @DisplayName("should classify HTTP statuses")
    void shouldClassifyStatus(int status, ErrorType expected) {
        ProviderException error = ProviderException.fromStatus("openai", status, "HTTP " + status);

        assertThat(error.getErrorType()).isEqualTo(expected);
        assertThat(error.getStatusCode()).hasValue(status);
        assertThat(error.getProviderId()).isEqualTo("openai");
    }

    @Test
    @DisplayName("should strip completion and execution layers")
    void shouldUnwrap() {
        IOException root = new IOException("connection reset");
        Throwable wrapped = new CompletionException(new ExecutionException(root));

        assertThat(ProviderException.unwrap(wrapped)).isSameAs(root);
    }

    @Test
    @DisplayName("should keep provider exceptions and classify others when wrapping")
    void shouldWrap() {
        ProviderException original = ProviderException.configuration("missing key");

        assertThat(ProviderException.wrap(new CompletionException(original), "openai")).isSameAs(original);
        assertThat(ProviderException.wrap(new IOException("reset"), "openai").getErrorType())
                .isEqualTo(ErrorType.TRANSIENT);

        ProviderException fatal = ProviderException.wrap(new IllegalStateException(), "openai");
        assertThat(fatal.getErrorType()).isEqualTo(ErrorType.FATAL);
        assertThat(fatal.getMessage()).isEqualTo("IllegalStateException");
        assertThat(fatal.getStatusCode()).isEmpty();
    }

    @Test
    @DisplayName("should expose the last error of an aggregated dispatch failure")
    void shouldAggregate() {
        ProviderException last = ProviderException.fromStatus("b", 500, "HTTP 500");

        AggregatedDispatchException aggregated = new AggregatedDispatchException("summarize", List.of("a", "b"), last);

        assertThat(aggregated.getErrorType()).isEqualTo(ErrorType.EXHAUSTED);
        assertThat(aggregated.getLastError()).isSameAs(last);
        assertThat(aggregated.getCause()).isSameAs(last);
        assertThat(aggregated.getAttemptedProviders()).containsExactly("a", "b");
    }
}
