package io.github.vishalmysore.cloudslash.analysis;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertNull;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.Before;
import org.junit.Test;

import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;

/**
 * Tests for {@link ImpactAnalyzer}.
 */
public class ImpactAnalyzerTest {

    private ResourceGraph graph;
    private ImpactAnalyzer analyzer;

    @Before
    public void setup() {
        graph = new ResourceGraph();
        analyzer = new ImpactAnalyzer(graph);
        // a -> b -> d, a -> c -> d, d -> a closes a loop back to the target
        graph.addEdge("a", "b");
        graph.addEdge("a", "c");
        graph.addEdge("b", "d");
        graph.addEdge("c", "d");
        graph.addEdge("d", "e");
        graph.addEdge("d", "a");
    }

    private static List<String> ids(List<ResourceNode> nodes) {
        return nodes.stream().map(ResourceNode::getId).collect(Collectors.toList());
    }

    @Test
    public void testUnknownNode() {
        assertNull(analyzer.analyzeImpact("missing"));
    }

    /**
     * Each affected node appears once, and the target never appears.
     */
    @Test
    public void testDirectAndCascading() {
        ImpactReport report = analyzer.analyzeImpact("a");

        assertThat(report.getTargetNode().getId(), is("a"));
        assertThat(ids(report.getDirectImpact()), containsInAnyOrder("b", "c"));
        assertThat(ids(report.getCascadingImpact()), contains("d", "e"));
        assertThat(report.getAffectedCount(), is(4));
    }

    @Test
    public void testRiskSum() {
        graph.markWaste("b", 30);
        graph.markWaste("e", 50);
        graph.markWaste("a", 90);

        ImpactReport report = analyzer.analyzeImpact("a");

        assertThat(report.getTotalRiskScore(), is(80));
        assertThat(ids(report.getActiveAffected()), containsInAnyOrder("c", "d"));
    }

    @Test
    public void testLeaf() {
        ImpactReport report = analyzer.analyzeImpact("e");
        assertThat(report.getDirectImpact(), is(empty()));
        assertThat(report.getCascadingImpact(), is(empty()));
        assertThat(report.getTotalRiskScore(), is(0));
    }
}
