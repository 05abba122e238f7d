package io.github.vishalmysore.cloudslash.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A discovered cloud resource. Nodes are created by the graph's upsert API and
 * are never removed during a run; all mutation goes through
 * {@link io.github.vishalmysore.cloudslash.graph.ResourceGraph} so that it
 * happens under the graph lock.
 */
@Data
@Builder
public class ResourceNode {

    /** Property key holding the provider tag map. */
    public static final String TAGS = "Tags";

    private String id;
    private String type;

    // Open bag filled by scanners and heuristics
    @Builder.Default
    private Map<String, PropertyValue> properties = new HashMap<>();

    private boolean waste;
    private String wasteReason;
    private boolean justified;
    private String justification;
    private boolean ignored;
    private int riskScore;
    private double cost;
    private String sourceLocation;

    @Builder.Default
    private ReachabilityState reachability = ReachabilityState.UNKNOWN;

    public Optional<PropertyValue> getProperty(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public Optional<String> getStringProperty(String key) {
        return getProperty(key).flatMap(PropertyValue::asString);
    }

    @JsonIgnore
    public Map<String, String> getTags() {
        return getProperty(TAGS)
                .flatMap(PropertyValue::asStringMap)
                .orElse(Collections.emptyMap());
    }

    /**
     * Waste that should appear in actionable totals and remediation output.
     */
    @JsonIgnore
    public boolean isActionableWaste() {
        return waste && !justified;
    }
}
