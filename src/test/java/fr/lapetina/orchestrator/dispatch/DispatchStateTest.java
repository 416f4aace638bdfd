package fr.lapetina.orchestrator.dispatch;

import fr.lapetina.orchestrator.domain.model.ErrorType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchStateTest {

    @Test
    @DisplayName("should succeed regardless of what remains")
    void shouldSucceed() {
        assertThat(DispatchState.afterAttempt(true, null, false, false)).isEqualTo(DispatchState.SUCCESS);
        assertThat(DispatchState.afterAttempt(true, null, true, true)).isEqualTo(DispatchState.SUCCESS);
    }

    @ParameterizedTest
    @EnumSource(value = ErrorType.class, names = {"TRANSIENT", "FATAL", "TIMEOUT", "CIRCUIT_OPEN"})
    @DisplayName("should fall back on provider errors when allowed and a provider remains")
    void shouldFallBack(ErrorType errorType) {
        assertThat(DispatchState.afterAttempt(false, errorType, true, true)).isEqualTo(DispatchState.FALLBACK);
    }

    @Test
    @DisplayName("should be exhausted when fallback is disabled or no provider remains")
    void shouldExhaust() {
        assertThat(DispatchState.afterAttempt(false, ErrorType.TRANSIENT, false, true)).isEqualTo(DispatchState.EXHAUSTED);
        assertThat(DispatchState.afterAttempt(false, ErrorType.FATAL, true, false)).isEqualTo(DispatchState.EXHAUSTED);
    }

    @Test
    @DisplayName("should reject on configuration errors even when providers remain")
    void shouldRejectOnConfigurationError() {
        assertThat(DispatchState.afterAttempt(false, ErrorType.CONFIGURATION, true, true)).isEqualTo(DispatchState.REJECTED);
    }

    @Test
    @DisplayName("should only treat settled outcomes as terminal")
    void shouldFlagTerminalStates() {
        assertThat(DispatchState.SUCCESS.isTerminal()).isTrue();
        assertThat(DispatchState.EXHAUSTED.isTerminal()).isTrue();
        assertThat(DispatchState.REJECTED.isTerminal()).isTrue();
        assertThat(DispatchState.ATTEMPTING.isTerminal()).isFalse();
        assertThat(DispatchState.FALLBACK.isTerminal()).isFalse();
    }
}
