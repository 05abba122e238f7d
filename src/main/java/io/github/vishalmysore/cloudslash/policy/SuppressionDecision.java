package io.github.vishalmysore.cloudslash.policy;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Outcome of a {@link SuppressionPolicy} evaluation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SuppressionDecision {

    public enum Verdict {
        FLAG, // Record as waste
        SUPPRESS, // Do not record; the node is marked ignored
        JUSTIFY // Record as waste but exclude from actionable totals
    }

    private static final SuppressionDecision FLAG = new SuppressionDecision(Verdict.FLAG, null);
    private static final SuppressionDecision SUPPRESS = new SuppressionDecision(Verdict.SUPPRESS, null);

    Verdict verdict;
    String justification;

    public static SuppressionDecision flag() {
        return FLAG;
    }

    public static SuppressionDecision suppress() {
        return SUPPRESS;
    }

    public static SuppressionDecision justify(String justification) {
        return new SuppressionDecision(Verdict.JUSTIFY, justification);
    }
}
