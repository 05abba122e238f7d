package io.github.vishalmysore.cloudslash.remediation;

import io.github.vishalmysore.cloudslash.analysis.CycleDetectedException;
import io.github.vishalmysore.cloudslash.analysis.DependencyOrderer;
import io.github.vishalmysore.cloudslash.analysis.ImpactAnalyzer;
import io.github.vishalmysore.cloudslash.analysis.ImpactReport;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.domain.ResourceTypes;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Writes shell scripts that act on the waste findings of a graph, and a
 * Terraform restoration plan that backs them up.
 *
 * The safe-delete script processes resources in the order returned by
 * {@link DependencyOrderer#topologicalSort}, dependents first, so a resource
 * is never deleted while something still attached to it remains. Each step
 * carries a blast-radius warning when {@link ImpactAnalyzer} finds affected
 * resources that are still in use.
 *
 * Only ids and types made of letters, digits and {@code . _ / : -} are ever
 * written out; anything else is replaced or skipped, so a crafted resource id
 * cannot inject shell commands.
 */
public class RemediationScriptGenerator {
    private static final Logger log = Logger.getLogger(RemediationScriptGenerator.class.getName());

    // Every id and type written to a script, comments included, must match
    private static final Pattern SAFE_TOKEN = Pattern.compile("^[a-zA-Z0-9._/:-]+$");
    private static final String REDACTED = "<unsafe value omitted>";

    private static final Map<String, String> TERRAFORM_TYPES = Map.of(
            ResourceTypes.INSTANCE, "aws_instance",
            ResourceTypes.VOLUME, "aws_ebs_volume",
            ResourceTypes.DB_INSTANCE, "aws_db_instance",
            ResourceTypes.NAT_GATEWAY, "aws_nat_gateway",
            ResourceTypes.ELASTIC_IP, "aws_eip",
            ResourceTypes.SECURITY_GROUP, "aws_security_group",
            ResourceTypes.EKS_CLUSTER, "aws_eks_cluster");

    private final ResourceGraph graph;
    private final DependencyOrderer orderer;
    private final ImpactAnalyzer impactAnalyzer;
    private final Clock clock;

    public RemediationScriptGenerator(ResourceGraph graph) {
        this(graph, Clock.systemUTC());
    }

    public RemediationScriptGenerator(ResourceGraph graph, Clock clock) {
        this.graph = graph;
        this.orderer = new DependencyOrderer(graph);
        this.impactAnalyzer = new ImpactAnalyzer(graph);
        this.clock = clock;
    }

    /**
     * Writes the safe-delete script for all actionable (non-justified) waste.
     * Nothing is written when the waste set cannot be ordered.
     *
     * @throws CycleDetectedException if the waste set contains a dependency cycle
     */
    public void generateSafeDeleteScript(Writer out) throws CycleDetectedException, IOException {
        List<ResourceNode> candidates = graph.getWasteNodes().stream()
                .filter(ResourceNode::isActionableWaste)
                .collect(Collectors.toList());
        List<ResourceNode> ordered = orderer.topologicalSort(candidates);

        StringBuilder sb = new StringBuilder();
        header(sb, "CloudSlash Safe Remediation Script");
        sb.append("set -e\n\n");

        int processed = 0;
        for (ResourceNode node : ordered) {
            String resourceId = extractResourceId(node.getId());
            if (!isSafe(node.getId()) || !isSafe(resourceId)) {
                sb.append("# Skipping resource with unsafe id\n\n");
                log.warning("Unsafe resource id left out of safe-delete script");
                continue;
            }
            appendImpactWarning(sb, node);
            if (appendDeleteCommand(sb, node.getType(), resourceId)) {
                processed++;
            }
        }

        if (processed == 0) {
            sb.append("echo \"No waste found to remediate.\"\n");
        } else {
            sb.append("echo \"Safe Remediation Complete. ").append(processed).append(" resources processed.\"\n");
        }
        out.write(sb.toString());
        out.flush();
        log.info("Safe-delete script generated for " + processed + " of " + ordered.size() + " waste resources");
    }

    /**
     * Writes a script that tags every actionable waste resource with
     * {@code cloudslash:ignore=true}, sorted by id. Only ARNs can be tagged;
     * other ids are listed as skipped.
     */
    public void generateIgnoreScript(Writer out) throws IOException {
        List<ResourceNode> candidates = graph.getWasteNodes().stream()
                .filter(ResourceNode::isActionableWaste)
                .sorted(Comparator.comparing(ResourceNode::getId))
                .collect(Collectors.toList());

        StringBuilder sb = new StringBuilder();
        header(sb, "CloudSlash Ignore Tagging Script");
        sb.append("# Run this script to suppress reporting for these resources in future scans.\n");
        sb.append("set -e\n\n");

        int count = 0;
        for (ResourceNode node : candidates) {
            if (!isSafe(node.getId())) {
                sb.append("# Skipping resource with unsafe id\n");
                continue;
            }
            if (!node.getId().startsWith("arn:")) {
                sb.append("# Skipping non-ARN resource: ").append(node.getId()).append("\n");
                continue;
            }
            sb.append("echo \"Ignoring: ").append(extractResourceId(node.getId())).append("\"\n");
            sb.append("aws resourcegroupstaggingapi tag-resources --resource-arn-list ")
                    .append(node.getId())
                    .append(" --tags cloudslash:ignore=true\n");
            count++;
        }

        if (count == 0) {
            sb.append("echo \"No waste found to ignore.\"\n");
        } else {
            sb.append("echo \"Ignore Tagging Complete. ").append(count).append(" resources tagged.\"\n");
        }
        out.write(sb.toString());
        out.flush();
    }

    /**
     * Writes a Terraform file of {@code import} blocks for the actionable waste
     * of supported types. Running {@code terraform plan -generate-config-out}
     * against it captures the resources' configuration before deletion so
     * they can be recreated later.
     */
    public void generateRestorationPlan(Writer out) throws IOException {
        List<ResourceNode> candidates = graph.getWasteNodes().stream()
                .filter(ResourceNode::isActionableWaste)
                .collect(Collectors.toList());

        StringBuilder sb = new StringBuilder();
        sb.append("# CloudSlash Restoration Plan\n");
        sb.append("# Generated: ").append(DateTimeFormatter.ISO_INSTANT.format(clock.instant())).append("\n");
        sb.append("# 1. Run 'terraform init'\n");
        sb.append("# 2. Run 'terraform plan -generate-config-out=restoration_backup.tf'\n");
        sb.append("# 3. Keep restoration_backup.tf; it recreates any resource deleted by mistake\n\n");
        sb.append("terraform {\n  required_version = \">= 1.5.0\"\n  required_providers {\n")
                .append("    aws = {\n      source  = \"hashicorp/aws\"\n      version = \"~> 5.0\"\n    }\n  }\n}\n\n");
        sb.append("provider \"aws\" {\n  region = \"us-east-1\" # override with AWS_REGION if needed\n}\n\n");

        int count = 0;
        for (ResourceNode node : candidates) {
            String tfType = TERRAFORM_TYPES.get(node.getType());
            String resourceId = extractResourceId(node.getId());
            if (tfType == null || !isSafe(resourceId)) {
                continue;
            }
            sb.append("import {\n");
            sb.append("  to = ").append(tfType).append(".restore_")
                    .append(resourceId.replaceAll("[^a-zA-Z0-9_]", "_")).append("\n");
            sb.append("  id = \"").append(resourceId).append("\"\n");
            sb.append("}\n\n");
            count++;
        }
        if (count == 0) {
            sb.append("# No supported resources found for restoration.\n");
        }
        out.write(sb.toString());
        out.flush();
        log.info("Restoration plan generated for " + count + " resources");
    }

    private static boolean isSafe(String value) {
        return value != null && SAFE_TOKEN.matcher(value).matches();
    }

    private static String display(String value) {
        return isSafe(value) ? value : REDACTED;
    }

    private void header(StringBuilder sb, String title) {
        sb.append("#!/bin/bash\n");
        sb.append("# ").append(title).append("\n");
        sb.append("# Generated: ").append(DateTimeFormatter.ISO_INSTANT.format(clock.instant())).append("\n");
        if (graph.isPartial()) {
            sb.append("# WARNING: scan was partial (")
                    .append(graph.getScopeErrors().size())
                    .append(" failed scopes); dependencies may be missing\n");
        }
        sb.append("\n");
    }

    private void appendImpactWarning(StringBuilder sb, ResourceNode node) {
        ImpactReport impact = impactAnalyzer.analyzeImpact(node.getId());
        if (impact == null) {
            return;
        }
        List<ResourceNode> active = impact.getActiveAffected();
        if (active.isEmpty()) {
            return;
        }
        sb.append("# WARNING: ").append(display(node.getId())).append(" affects ")
                .append(active.size()).append(" active resource(s): ")
                .append(active.stream().map(n -> display(n.getId())).collect(Collectors.joining(", ")))
                .append("\n");
    }

    /**
     * Appends the commands for one resource. Returns false for types without
     * an automated action.
     */
    private boolean appendDeleteCommand(StringBuilder sb, String type, String resourceId) {
        switch (type) {
            case ResourceTypes.INSTANCE:
                // Stop rather than terminate: compute billing ends, storage is kept
                sb.append("echo \"Stopping EC2 Instance: ").append(resourceId).append("\"\n");
                sb.append("aws ec2 stop-instances --instance-ids ").append(resourceId).append("\n\n");
                return true;
            case ResourceTypes.VOLUME:
                sb.append("echo \"Processing Volume: ").append(resourceId).append("\"\n");
                sb.append("aws ec2 create-snapshot --volume-id ").append(resourceId)
                        .append(" --description \"CloudSlash-Archive-").append(resourceId)
                        .append("\" --tag-specifications 'ResourceType=snapshot,Tags=[{Key=CloudSlash,Value=Archive}]'\n");
                sb.append("aws ec2 delete-volume --volume-id ").append(resourceId).append("\n\n");
                return true;
            case ResourceTypes.DB_INSTANCE:
                sb.append("echo \"Stopping RDS: ").append(resourceId).append("\"\n");
                sb.append("aws rds stop-db-instance --db-instance-identifier ").append(resourceId).append("\n\n");
                return true;
            case ResourceTypes.NAT_GATEWAY:
                sb.append("echo \"Processing NAT Gateway: ").append(resourceId).append("\"\n");
                sb.append("aws ec2 delete-nat-gateway --nat-gateway-id ").append(resourceId).append("\n\n");
                return true;
            case ResourceTypes.ELASTIC_IP:
                sb.append("echo \"Processing EIP: ").append(resourceId).append("\"\n");
                sb.append("aws ec2 release-address --allocation-id ").append(resourceId).append("\n\n");
                return true;
            case ResourceTypes.SUBNET:
                sb.append("echo \"Deleting Subnet: ").append(resourceId).append("\"\n");
                sb.append("aws ec2 delete-subnet --subnet-id ").append(resourceId).append("\n\n");
                return true;
            case ResourceTypes.VPC:
                sb.append("echo \"Deleting VPC: ").append(resourceId).append("\"\n");
                sb.append("aws ec2 delete-vpc --vpc-id ").append(resourceId).append("\n\n");
                return true;
            default:
                sb.append("# Manual review required for ").append(display(type)).append(": ").append(resourceId).append("\n\n");
                return false;
        }
    }

    /**
     * Last segment of an ARN's resource part ({@code instance/i-123} gives
     * {@code i-123}); non-ARN ids are returned unchanged.
     */
    public static String extractResourceId(String id) {
        if (id == null || !id.startsWith("arn:")) {
            return id;
        }
        String[] parts = id.split(":", 6);
        if (parts.length < 6 || parts[5].isEmpty()) {
            return id;
        }
        String resource = parts[5];
        String[] segments = resource.split("[/:]");
        for (int i = segments.length - 1; i >= 0; i--) {
            if (!segments[i].isEmpty()) {
                return segments[i];
            }
        }
        return resource;
    }
}
