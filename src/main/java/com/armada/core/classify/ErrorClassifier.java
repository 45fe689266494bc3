package com.armada.core.classify;

import com.armada.core.model.ErrorKind;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps the raw output and exit code of a unit of work to an {@link ErrorKind}.
 *
 * <p>Patterns are tested in a fixed priority order and the first match wins, so text that
 * carries several markers (a billing message quoting "error 403", say) classifies the same
 * way every time. Stateless and thread-safe.
 */
public class ErrorClassifier {

    /** Exit code conventionally reported by {@code timeout(1)} and used for per-item timeouts. */
    public static final int TIMEOUT_EXIT_CODE = 124;

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    private static final List<Map.Entry<ErrorKind, Pattern>> RULES = List.of(
            Map.entry(ErrorKind.RATE_LIMIT,
                    Pattern.compile("429|rate.?limit|too many requests|throttl", FLAGS)),
            Map.entry(ErrorKind.AUTH,
                    Pattern.compile("401|403|unauthorized|forbidden|invalid.?api.?key", FLAGS)),
            Map.entry(ErrorKind.QUOTA,
                    Pattern.compile("quota|billing|exceeded|insufficient|payment.?required|402", FLAGS)),
            Map.entry(ErrorKind.TIMEOUT,
                    Pattern.compile("timeout|timed?.?out", FLAGS)),
            Map.entry(ErrorKind.NETWORK,
                    Pattern.compile("network|connection|refused|ECONNREFUSED|ETIMEDOUT", FLAGS)),
            Map.entry(ErrorKind.API_ERROR,
                    Pattern.compile("500|502|503|504|internal.?server|bad.?gateway", FLAGS))
    );

    /**
     * Classifies a failure. A {@link #TIMEOUT_EXIT_CODE} exit counts as a timeout marker at the
     * timeout rule's position in the priority order.
     *
     * @param rawOutput captured output, may be null
     * @param exitCode  process exit code, or 0 when unknown
     */
    public ErrorKind classify(String rawOutput, int exitCode) {
        String text = rawOutput == null ? "" : rawOutput;
        for (Map.Entry<ErrorKind, Pattern> rule : RULES) {
            if (rule.getKey() == ErrorKind.TIMEOUT && exitCode == TIMEOUT_EXIT_CODE) {
                return ErrorKind.TIMEOUT;
            }
            if (rule.getValue().matcher(text).find()) {
                return rule.getKey();
            }
        }
        return ErrorKind.NONE;
    }

    public ErrorKind classify(String rawOutput) {
        return classify(rawOutput, 0);
    }

    public boolean isFatal(ErrorKind kind) {
        return kind.isFatal();
    }

    public boolean isRetryable(ErrorKind kind) {
        return kind.isRetryable();
    }
}
