package io.github.vishalmysore.cloudslash.swarm;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Default classifier. Recognizes {@link ThrottledException} anywhere in the
 * cause chain, the rate-limit error codes cloud providers put in their
 * exception messages, and an HTTP 429 status.
 */
public class RateLimitThrottleClassifier implements ThrottleClassifier {

    // Lower-case markers matched against every message in the cause chain
    private static final List<String> MARKERS = List.of(
            "throttling",
            "toomanyrequests",
            "too many requests",
            "requestlimitexceeded",
            "rate exceeded",
            "slowdown");

    // 429 counts only as an HTTP status, never as digits inside an id
    private static final Pattern STATUS_429 = Pattern.compile("\\b(?:status(?:\\s*code)?|http|code)\\W{0,3}429\\b");

    @Override
    public boolean isThrottled(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof ThrottledException) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                for (String marker : MARKERS) {
                    if (lower.contains(marker)) {
                        return true;
                    }
                }
                if (STATUS_429.matcher(lower).find()) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }
}
