package fr.lapetina.orchestrator.infrastructure.retry;

import fr.lapetina.orchestrator.domain.exception.ProviderException;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Retry classification used when a policy carries no explicit predicate.
 *
 * Retryable: timeouts, network failures, rate limiting (429), request
 * timeout (408) and server failures (5xx). Everything else is fatal.
 * Typed information (error type, status code) wins over message matching;
 * message matching is kept for errors raised by code that does not
 * produce {@link ProviderException}s.
 */
public final class DefaultRetryClassifier implements RetryPredicate {

    public static final DefaultRetryClassifier INSTANCE = new DefaultRetryClassifier();

    private static final List<String> RETRYABLE_FRAGMENTS = List.of(
            "timeout",
            "timed out",
            "network",
            "fetch",
            "connection",
            "econnreset",
            "socket",
            "rate limit",
            "too many requests",
            "5xx"
    );

    // Only numbers that follow "http", "status" or "code" count as a status
    private static final Pattern STATUS_IN_MESSAGE =
            Pattern.compile("\\b(?:http|status|code)\\s*[:=]?\\s*(408|429|5\\d\\d)\\b");

    private DefaultRetryClassifier() {
    }

    @Override
    public boolean isRetryable(Throwable error) {
        if (error == null) {
            return false;
        }
        Throwable cause = ProviderException.unwrap(error);

        if (cause instanceof ProviderException pe) {
            switch (pe.getErrorType()) {
                case CONFIGURATION, CIRCUIT_OPEN, EXHAUSTED -> {
                    return false;
                }
                case TRANSIENT, TIMEOUT -> {
                    return true;
                }
                default -> {
                    // FATAL: fall through to status and message inspection
                }
            }
            OptionalInt status = pe.getStatusCode();
            if (status.isPresent()) {
                return isRetryableStatus(status.getAsInt());
            }
        }

        if (matchesMessage(cause.getMessage())) {
            return true;
        }

        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof TimeoutException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    static boolean isRetryableStatus(int status) {
        return status == 408 || status == 429 || (status >= 500 && status < 600);
    }

    private static boolean matchesMessage(String message) {
        if (message == null || message.isBlank()) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String fragment : RETRYABLE_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        Matcher matcher = STATUS_IN_MESSAGE.matcher(lower);
        return matcher.find();
    }
}
