package io.github.vishalmysore.cloudslash.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * One row of the waste report.
 */
@Data
@Builder
public class WasteItem {
    @JsonProperty("resource_id")
    private String resourceId;
    private String type;
    private String region;
    @JsonProperty("monthly_cost")
    private double monthlyCost;
    @JsonProperty("risk_score")
    private int riskScore;
    private String reason;
    private boolean justified;
    private String justification;
    private String reachability;
    @JsonProperty("source_location")
    private String sourceLocation;
}
