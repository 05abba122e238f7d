package io.github.vishalmysore.cloudslash.domain;

import java.util.Set;

/**
 * Well-known resource type tags. Types are open strings supplied by the
 * scanners; only the ones the core reasons about are listed here.
 */
public final class ResourceTypes {

    /** Placeholder type for endpoints created before their own scan arrived. */
    public static final String UNKNOWN = "Unknown";

    public static final String INTERNET_GATEWAY = "AWS::EC2::InternetGateway";
    public static final String VPN_GATEWAY = "AWS::EC2::VPNGateway";
    public static final String VPC = "AWS::EC2::VPC";
    public static final String SUBNET = "AWS::EC2::Subnet";
    public static final String INSTANCE = "AWS::EC2::Instance";
    public static final String VOLUME = "AWS::EC2::Volume";
    public static final String SNAPSHOT = "AWS::EC2::Snapshot";
    public static final String NAT_GATEWAY = "AWS::EC2::NatGateway";
    public static final String ELASTIC_IP = "AWS::EC2::EIP";
    public static final String SECURITY_GROUP = "AWS::EC2::SecurityGroup";
    public static final String DB_INSTANCE = "AWS::RDS::DBInstance";
    public static final String EKS_CLUSTER = "AWS::EKS::Cluster";
    public static final String S3_BUCKET = "AWS::S3::Bucket";

    /** Types that act as network ingress points for reachability analysis. */
    public static final Set<String> INGRESS_TYPES = Set.of(INTERNET_GATEWAY, VPN_GATEWAY);

    private ResourceTypes() {
    }

    public static boolean isIngress(String type) {
        return type != null && INGRESS_TYPES.contains(type);
    }

    public static boolean isUnknown(String type) {
        return type == null || UNKNOWN.equals(type);
    }
}
