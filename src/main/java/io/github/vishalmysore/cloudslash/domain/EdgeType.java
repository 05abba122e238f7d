package io.github.vishalmysore.cloudslash.domain;

/**
 * Represents the relationship carried by an edge in the resource graph.
 * The forward direction always points from the dependent resource to the
 * resource it depends on (instance to subnet, subnet to VPC).
 */
public enum EdgeType {
    ATTACHED_TO, // Instance attached to a subnet, volume attached to an instance
    SECURED_BY, // Resource guarded by a security group
    CONTAINS, // Structural containment reported by the provider
    FLOWS_TO, // Traffic path discovered from routing data
    UNKNOWN // Relationship reported without a classification
}
