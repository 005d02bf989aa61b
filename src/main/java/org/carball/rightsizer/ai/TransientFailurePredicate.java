package org.carball.rightsizer.ai;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Recognizes failures worth retrying: rate limiting, overload, timeouts and 429/5xx statuses.
 * The whole cause chain is inspected.
 */
public class TransientFailurePredicate implements Predicate<Throwable> {

    private static final List<String> TRANSIENT_MARKERS = List.of(
            "rate limit", "rate_limit", "ratelimit", "too many requests",
            "overload", "timeout", "timed out");

    // a whole status code, so "max_tokens must be <= 5000" is not a server error
    private static final Pattern TRANSIENT_STATUS = Pattern.compile("\\b(?:429|5\\d\\d)\\b");

    @Override
    public boolean test(Throwable failure) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SocketTimeoutException || current instanceof TimeoutException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : TRANSIENT_MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
                if (TRANSIENT_STATUS.matcher(lower).find()) {
                    return true;
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
