package io.github.vishalmysore.cloudslash.analysis;

import lombok.Builder;
import lombok.Data;

/**
 * Counts produced by one reachability pass.
 */
@Data
@Builder
public class ReachabilitySummary {
    private int ingressCount;
    private int reachableCount;
    private int darkMatterCount;
}
