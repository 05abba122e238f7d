package io.github.vishalmysore.cloudslash.domain;

import lombok.Value;

/**
 * A scan failure for one discovery scope (profile, region and scanner name).
 * Recorded on the graph so reports can flag a partial result.
 */
@Value
public class ScopeError {
    String scope;
    String message;
}
