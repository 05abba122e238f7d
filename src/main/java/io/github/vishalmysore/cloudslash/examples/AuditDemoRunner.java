package io.github.vishalmysore.cloudslash.examples;

import io.github.vishalmysore.cloudslash.analysis.CycleDetectedException;
import io.github.vishalmysore.cloudslash.analysis.DependencyOrderer;
import io.github.vishalmysore.cloudslash.analysis.ImpactAnalyzer;
import io.github.vishalmysore.cloudslash.analysis.ImpactReport;
import io.github.vishalmysore.cloudslash.analysis.ReachabilityAnalyzer;
import io.github.vishalmysore.cloudslash.analysis.ReachabilitySummary;
import io.github.vishalmysore.cloudslash.config.AuditConfig;
import io.github.vishalmysore.cloudslash.domain.EdgeType;
import io.github.vishalmysore.cloudslash.domain.PropertyValue;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.domain.ResourceTypes;
import io.github.vishalmysore.cloudslash.export.WasteReportExporter;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;
import io.github.vishalmysore.cloudslash.remediation.RemediationScriptGenerator;
import io.github.vishalmysore.cloudslash.swarm.AdaptiveScheduler;
import io.github.vishalmysore.cloudslash.swarm.ScanContext;
import io.github.vishalmysore.cloudslash.swarm.SwarmTask;
import io.github.vishalmysore.cloudslash.swarm.ThrottledException;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * End-to-end demonstration of an audit run against a simulated account:
 * 1. Concurrent ingestion through the adaptive scheduler
 * 2. Waste marking with tag-driven suppression
 * 3. Reachability, deletion ordering and blast radius
 * 4. Remediation scripts and JSON report export
 */
public class AuditDemoRunner {

        private static final String REGION = "us-east-1";

        public static void main(String[] args) throws Exception {
                System.out.println("╔════════════════════════════════════════════════════════════╗");
                System.out.println("║     CloudSlash: Concurrent Waste Audit Demo               ║");
                System.out.println("╚════════════════════════════════════════════════════════════╝\n");

                AuditConfig config = AuditConfig.load();
                System.out.println("Swarm bounds: start " + config.getStartWorkers() + ", min "
                                + config.getMinWorkers() + ", max " + config.getMaxWorkers()
                                + ", queue " + config.getQueueCapacity() + "\n");

                // === Phase 1: Concurrent Ingestion ===
                System.out.println("═══ PHASE 1: CONCURRENT INGESTION ═══\n");

                ResourceGraph graph = new ResourceGraph();
                AdaptiveScheduler scheduler = new AdaptiveScheduler(config);
                ScanContext context = new ScanContext();
                scheduler.start(context);

                List<CompletableFuture<Void>> scans = new ArrayList<>();
                scans.add(scan(scheduler, graph, "ec2:network:" + REGION, ctx -> scanNetwork(graph)));
                scans.add(scan(scheduler, graph, "ec2:instances:" + REGION, ctx -> scanCompute(graph)));
                scans.add(scan(scheduler, graph, "ec2:volumes:" + REGION, ctx -> scanStorage(graph)));
                scans.add(scan(scheduler, graph, "rds:" + REGION, ctx -> {
                        throw new ThrottledException("RequestLimitExceeded: DescribeDBInstances");
                }));

                CompletableFuture.allOf(scans.toArray(new CompletableFuture[0])).join();
                scheduler.stop();

                System.out.println("Scheduler: " + scheduler.getStats());
                System.out.println("Graph: " + graph.dumpStats() + "\n");

                // === Phase 2: Waste Marking ===
                System.out.println("═══ PHASE 2: WASTE MARKING ═══\n");

                markWaste(graph);
                for (ResourceNode node : graph.getNodes()) {
                        if (node.isWaste() || node.isIgnored()) {
                                printFinding(node);
                        }
                }

                // === Phase 3: Analysis ===
                System.out.println("\n═══ PHASE 3: REACHABILITY, ORDERING, BLAST RADIUS ═══\n");

                ReachabilitySummary reachability = new ReachabilityAnalyzer(graph).analyzeReachability();
                System.out.println("Reachability: " + reachability);

                DependencyOrderer orderer = new DependencyOrderer(graph);
                try {
                        List<ResourceNode> order = orderer.topologicalSort(graph.getWasteNodes());
                        System.out.print("Deletion order:");
                        order.forEach(node -> System.out.print(" " + node.getId()));
                        System.out.println();
                } catch (CycleDetectedException e) {
                        System.out.println("Cannot order deletions: " + e.getMessage());
                }

                ImpactReport impact = new ImpactAnalyzer(graph).analyzeImpact("subnet-0a1");
                System.out.println("Blast radius of subnet-0a1: " + impact.getAffectedCount()
                                + " resources, risk " + impact.getTotalRiskScore());

                // === Phase 4: Remediation and Export ===
                System.out.println("\n═══ PHASE 4: REMEDIATION AND EXPORT ═══\n");

                RemediationScriptGenerator generator = new RemediationScriptGenerator(graph);
                printScript("safe_cleanup.sh", out -> generator.generateSafeDeleteScript(out));
                printScript("ignore_resources.sh", out -> generator.generateIgnoreScript(out));

                String report = new WasteReportExporter().exportWasteReport(graph);
                System.out.println("Waste report (JSON):");
                System.out.println(report);

                System.out.println("\n╔════════════════════════════════════════════════════════════╗");
                System.out.println("║                    DEMO COMPLETE                          ║");
                System.out.println("╚════════════════════════════════════════════════════════════╝");
        }

        /**
         * Submits a scan; a failure is recorded against its scope and the run
         * continues with a partial graph.
         */
        private static CompletableFuture<Void> scan(AdaptiveScheduler scheduler, ResourceGraph graph,
                        String scope, SwarmTask task) throws InterruptedException {
                return scheduler.submit(task).exceptionally(error -> {
                        graph.addError(scope, error);
                        return null;
                });
        }

        /**
         * VPC, subnets and the internet gateway. The gateway is the ingress
         * point; the private subnet is not directly reachable from it.
         */
        private static void scanNetwork(ResourceGraph graph) {
                graph.addNode("igw-01", ResourceTypes.INTERNET_GATEWAY, Map.of("Region", PropertyValue.of(REGION)));
                graph.addNode("vpc-01", ResourceTypes.VPC, Map.of("Region", PropertyValue.of(REGION)));
                graph.addNode("subnet-0a1", ResourceTypes.SUBNET, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "NetworkType", PropertyValue.of("Public")));
                graph.addNode("subnet-0b2", ResourceTypes.SUBNET, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "NetworkType", PropertyValue.of("Private")));

                graph.addTypedEdge("igw-01", "subnet-0a1", EdgeType.FLOWS_TO, 1);
                graph.addTypedEdge("igw-01", "subnet-0b2", EdgeType.FLOWS_TO, 1);
                graph.addTypedEdge("subnet-0a1", "vpc-01", EdgeType.CONTAINS, 1);
                graph.addTypedEdge("subnet-0b2", "vpc-01", EdgeType.CONTAINS, 1);
        }

        private static void scanCompute(ResourceGraph graph) {
                Instant now = Instant.now();
                graph.addNode("i-0web", ResourceTypes.INSTANCE, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "State", PropertyValue.of("running"),
                                "LaunchTime", PropertyValue.of(now.minus(90, ChronoUnit.DAYS))));
                graph.addNode("i-0batch", ResourceTypes.INSTANCE, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "State", PropertyValue.of("stopped"),
                                "LaunchTime", PropertyValue.of(now.minus(200, ChronoUnit.DAYS))));
                graph.addNode("i-0canary", ResourceTypes.INSTANCE, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "State", PropertyValue.of("stopped"),
                                "LaunchTime", PropertyValue.of(now.minus(2, ChronoUnit.DAYS)),
                                ResourceNode.TAGS, PropertyValue.of(Map.of("cloudslash:ignore", "7d"))));

                graph.addTypedEdge("i-0web", "subnet-0a1", EdgeType.ATTACHED_TO, 1);
                graph.addTypedEdge("i-0batch", "subnet-0b2", EdgeType.ATTACHED_TO, 1);
                graph.addTypedEdge("i-0canary", "subnet-0b2", EdgeType.ATTACHED_TO, 1);
        }

        private static void scanStorage(ResourceGraph graph) {
                graph.addNode("vol-0orphan", ResourceTypes.VOLUME, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "State", PropertyValue.of("available"),
                                "Size", PropertyValue.of(500)));
                graph.addNode("vol-0legal", ResourceTypes.VOLUME, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "State", PropertyValue.of("available"),
                                ResourceNode.TAGS, PropertyValue.of(Map.of(
                                                "cloudslash:ignore", "justified:Legal hold until audit closes"))));
                graph.addNode("vol-0data", ResourceTypes.VOLUME, Map.of(
                                "Region", PropertyValue.of(REGION),
                                "State", PropertyValue.of("in-use")));
                graph.addTypedEdge("vol-0data", "i-0web", EdgeType.ATTACHED_TO, 1);
        }

        /**
         * Stand-in for the external heuristics: stopped instances and
         * unattached volumes are waste.
         */
        private static void markWaste(ResourceGraph graph) {
                for (ResourceNode node : graph.getNodes()) {
                        String state = node.getStringProperty("State").orElse("");
                        if (ResourceTypes.INSTANCE.equals(node.getType()) && state.equals("stopped")) {
                                graph.updateNode(node.getId(), n -> n.setCost(30.0));
                                graph.markWaste(node.getId(), 60, "Instance stopped");
                        } else if (ResourceTypes.VOLUME.equals(node.getType()) && state.equals("available")) {
                                graph.updateNode(node.getId(), n -> n.setCost(40.0));
                                graph.markWaste(node.getId(), 80, "Volume unattached");
                        }
                }
        }

        private static void printFinding(ResourceNode node) {
                String status;
                if (node.isIgnored()) {
                        status = "SUPPRESSED";
                } else if (node.isJustified()) {
                        status = "JUSTIFIED (" + node.getJustification() + ")";
                } else {
                        status = "WASTE risk=" + node.getRiskScore();
                }
                System.out.println("  " + node.getId() + " [" + node.getType() + "] " + status);
        }

        private static void printScript(String name, ScriptWriter writer) {
                StringWriter out = new StringWriter();
                try {
                        writer.write(out);
                        System.out.println("--- " + name + " ---");
                        System.out.println(out);
                } catch (CycleDetectedException | IOException e) {
                        System.out.println("Could not generate " + name + ": " + e.getMessage());
                }
        }

        @FunctionalInterface
        private interface ScriptWriter {
                void write(StringWriter out) throws CycleDetectedException, IOException;
        }
}
