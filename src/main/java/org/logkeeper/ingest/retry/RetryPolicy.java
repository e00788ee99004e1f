package org.logkeeper.ingest.retry;

import org.logkeeper.ingest.PipelineSettings.RetrySettings;
import org.logkeeper.ingest.api.errors.FatalStorageException;
import org.logkeeper.ingest.api.errors.HistoryFetchException;
import org.logkeeper.ingest.api.errors.TransientStorageException;
import org.logkeeper.ingest.api.errors.ValidationException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;

/**
 * Classifies failures as retryable or fatal and computes exponential backoff delays.
 * <p>
 * <strong>Classification</strong> walks the cause chain and stops at the first conclusive link:
 * <ul>
 *   <li>Storage and history exceptions carry their own verdict.</li>
 *   <li>SQL errors are classified by SQLState class: {@code 08} (connection), {@code 40}
 *       (rollback, serialization), {@code 57} (operator intervention, busy) and H2's lock timeout
 *       {@code HYT00} are retryable; {@code 22}, {@code 23}, {@code 28} and {@code 42} are fatal.</li>
 *   <li>Network timeouts and I/O failures are retryable.</li>
 *   <li>Otherwise the message is searched for network, timeout, rate-limit and 5xx keywords.</li>
 * </ul>
 * Anything else is fatal.
 * <p>
 * <strong>Delay</strong> for attempt {@code n} (the attempt that just failed, starting at 1) is
 * {@code min(maxDelay, initialDelay * multiplier^(n-1))}, spread by {@code ±jitterFactor} and
 * clamped to {@code [0, maxDelay]}.
 */
public class RetryPolicy {

    private static final List<String> RETRYABLE_KEYWORDS = List.of(
        "connection", "timeout", "timed out", "network", "rate limit", "too many requests",
        "503", "502", "500");

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final Duration maxElapsed;
    private final Random random;

    /**
     * Creates a policy with thread-local randomness for jitter.
     *
     * @param settings The retry settings.
     */
    public RetryPolicy(RetrySettings settings) {
        this(settings, null);
    }

    /**
     * Creates a policy with a given random source, for reproducible jitter in tests.
     *
     * @param settings The retry settings.
     * @param random   The random source, or {@code null} for {@link ThreadLocalRandom}.
     */
    public RetryPolicy(RetrySettings settings, Random random) {
        this.maxAttempts = settings.maxAttempts();
        this.initialDelay = settings.initialDelay();
        this.multiplier = settings.multiplier();
        this.maxDelay = settings.maxDelay();
        this.jitterFactor = settings.jitterFactor();
        this.maxElapsed = settings.maxElapsed();
        this.random = random;
    }

    /**
     * Classifies a failure.
     *
     * @param error The failure, possibly wrapped.
     * @return {@link ErrorClass#RETRYABLE} or {@link ErrorClass#FATAL}.
     */
    public ErrorClass classify(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            ErrorClass verdict = classifySingle(current);
            if (verdict != null) {
                return verdict;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return matchesRetryableKeyword(error) ? ErrorClass.RETRYABLE : ErrorClass.FATAL;
    }

    /**
     * Computes the delay after a failed attempt.
     *
     * @param attempt The number of the attempt that failed, starting at 1.
     * @return The delay before the next attempt.
     */
    public Duration nextDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        double base = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        double capped = Math.min(base, (double) maxDelay.toMillis());
        double spread = jitterFactor == 0.0 ? 0.0 : capped * jitterFactor * (2.0 * nextRandom() - 1.0);
        long millis = Math.round(Math.max(0.0, Math.min(capped + spread, (double) maxDelay.toMillis())));
        return Duration.ofMillis(millis);
    }

    /**
     * Decides whether another attempt is allowed.
     *
     * @param attemptsMade The number of attempts made so far.
     * @param elapsed      Time since the first attempt.
     * @return {@code false} once either the attempt or the time budget is used up.
     */
    public boolean shouldRetry(int attemptsMade, Duration elapsed) {
        return attemptsMade < maxAttempts && elapsed.compareTo(maxElapsed) < 0;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getMaxElapsed() {
        return maxElapsed;
    }

    private double nextRandom() {
        return random != null ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
    }

    private ErrorClass classifySingle(Throwable error) {
        if (error instanceof TransientStorageException) {
            return ErrorClass.RETRYABLE;
        }
        if (error instanceof FatalStorageException || error instanceof ValidationException) {
            return ErrorClass.FATAL;
        }
        if (error instanceof HistoryFetchException) {
            return ((HistoryFetchException) error).isRetryable() ? ErrorClass.RETRYABLE : ErrorClass.FATAL;
        }
        if (error instanceof SQLTransientException || error instanceof SQLRecoverableException) {
            return ErrorClass.RETRYABLE;
        }
        if (error instanceof SQLException) {
            return classifySqlState(((SQLException) error).getSQLState());
        }
        if (error instanceof SocketTimeoutException || error instanceof ConnectException
            || error instanceof TimeoutException || error instanceof IOException) {
            return ErrorClass.RETRYABLE;
        }
        return null;
    }

    /**
     * Classifies a SQLState, or returns {@code null} if the state is unknown.
     *
     * @param sqlState The five-character SQLState.
     * @return The verdict, or {@code null}.
     */
    public static ErrorClass classifySqlState(String sqlState) {
        if (sqlState == null || sqlState.length() < 2) {
            return null;
        }
        if ("HYT00".equals(sqlState)) {
            return ErrorClass.RETRYABLE;
        }
        switch (sqlState.substring(0, 2)) {
            case "08":
            case "40":
            case "57":
                return ErrorClass.RETRYABLE;
            case "22":
            case "23":
            case "28":
            case "42":
                return ErrorClass.FATAL;
            default:
                return null;
        }
    }

    private static boolean matchesRetryableKeyword(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String keyword : RETRYABLE_KEYWORDS) {
                    if (lower.contains(keyword)) {
                        return true;
                    }
                }
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
