package io.github.vishalmysore.cloudslash.policy;

import io.github.vishalmysore.cloudslash.domain.PropertyValue;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default suppression policy driven by the {@code cloudslash:ignore} resource tag.
 *
 * Recognized values, evaluated in order (first match wins):
 * <ul>
 * <li>{@code true} - always suppressed</li>
 * <li>{@code cost<N} - suppressed while the node's monthly cost is below N</li>
 * <li>{@code justified:<text>} - flagged, but marked justified with the given text</li>
 * <li>{@code YYYY-MM-DD} - suppressed until that date (UTC)</li>
 * <li>{@code <N>d} / {@code <N>h} - grace period measured from the node's creation time</li>
 * </ul>
 * Anything else is treated as if the tag were absent.
 */
public class IgnoreTagPolicy implements SuppressionPolicy {
    private static final Logger log = Logger.getLogger(IgnoreTagPolicy.class.getName());

    public static final String IGNORE_TAG = "cloudslash:ignore";

    // Properties consulted for the creation timestamp, in priority order
    public static final List<String> CREATION_KEYS = List.of("LaunchTime", "CreateTime", "StartTime", "Created");

    private static final String COST_PREFIX = "cost<";
    private static final String JUSTIFIED_PREFIX = "justified:";
    private static final Pattern DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern GRACE_PERIOD = Pattern.compile("(\\d+)([dh])");

    @Override
    public SuppressionDecision evaluate(ResourceNode node, Instant now) {
        String raw = node.getTags().get(IGNORE_TAG);
        if (raw == null) {
            return SuppressionDecision.flag();
        }
        String trimmed = raw.trim();
        String value = trimmed.toLowerCase(Locale.ROOT);

        if (value.equals("true")) {
            return SuppressionDecision.suppress();
        }
        if (value.startsWith(COST_PREFIX)) {
            return evaluateCostThreshold(node, value.substring(COST_PREFIX.length()));
        }
        if (value.startsWith(JUSTIFIED_PREFIX)) {
            return SuppressionDecision.justify(trimmed.substring(JUSTIFIED_PREFIX.length()).trim());
        }
        if (DATE.matcher(value).matches()) {
            return evaluateIgnoreUntil(node, value, now);
        }
        Matcher grace = GRACE_PERIOD.matcher(value);
        if (grace.matches()) {
            return evaluateGracePeriod(node, grace, now);
        }

        log.fine("Unrecognized " + IGNORE_TAG + " value '" + raw + "' on " + node.getId());
        return SuppressionDecision.flag();
    }

    private SuppressionDecision evaluateCostThreshold(ResourceNode node, String limit) {
        try {
            double threshold = Double.parseDouble(limit.trim());
            return node.getCost() < threshold ? SuppressionDecision.suppress() : SuppressionDecision.flag();
        } catch (NumberFormatException e) {
            log.fine("Invalid cost threshold '" + limit + "' on " + node.getId());
            return SuppressionDecision.flag();
        }
    }

    private SuppressionDecision evaluateIgnoreUntil(ResourceNode node, String date, Instant now) {
        try {
            Instant until = LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toInstant();
            return now.isBefore(until) ? SuppressionDecision.suppress() : SuppressionDecision.flag();
        } catch (DateTimeParseException e) {
            log.fine("Invalid ignore date '" + date + "' on " + node.getId());
            return SuppressionDecision.flag();
        }
    }

    private SuppressionDecision evaluateGracePeriod(ResourceNode node, Matcher grace, Instant now) {
        long amount;
        try {
            amount = Long.parseLong(grace.group(1));
        } catch (NumberFormatException e) {
            return SuppressionDecision.flag();
        }
        Duration period;
        try {
            period = grace.group(2).equals("d") ? Duration.ofDays(amount) : Duration.ofHours(amount);
        } catch (ArithmeticException e) {
            log.fine("Grace period out of range '" + grace.group() + "' on " + node.getId());
            return SuppressionDecision.flag();
        }

        Optional<Instant> created = findCreationTime(node);
        if (created.isEmpty()) {
            return SuppressionDecision.flag();
        }
        Duration age = Duration.between(created.get(), now);
        return age.compareTo(period) < 0 ? SuppressionDecision.suppress() : SuppressionDecision.flag();
    }

    /**
     * First present creation timestamp. String values are accepted when they
     * hold an ISO-8601 instant.
     */
    static Optional<Instant> findCreationTime(ResourceNode node) {
        for (String key : CREATION_KEYS) {
            Optional<PropertyValue> value = node.getProperty(key);
            if (value.isEmpty()) {
                continue;
            }
            Optional<Instant> timestamp = value.get().asTimestamp();
            if (timestamp.isPresent()) {
                return timestamp;
            }
            Optional<String> text = value.get().asString();
            if (text.isPresent()) {
                try {
                    return Optional.of(Instant.parse(text.get()));
                } catch (DateTimeParseException e) {
                    log.fine("Unparseable " + key + " '" + text.get() + "' on " + node.getId());
                }
            }
        }
        return Optional.empty();
    }

    @Override
    public String getName() {
        return "Tag (" + IGNORE_TAG + ")";
    }
}
