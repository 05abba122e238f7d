package io.github.vishalmysore.cloudslash.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.vishalmysore.cloudslash.domain.ResourceEdge;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Clock;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Exports the resource graph and its waste findings as JSON documents.
 * Justified waste is listed but excluded from the actionable totals.
 */
public class WasteReportExporter {
    private static final Logger log = Logger.getLogger(WasteReportExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Clock clock;

    public WasteReportExporter() {
        this(Clock.systemUTC());
    }

    public WasteReportExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Export the full graph (nodes, edges, statistics, scan errors) as a JSON string.
     */
    public String exportGraph(ResourceGraph graph) {
        return graph.readLocked(() -> write(buildGraphDocument(graph)));
    }

    /**
     * Export the waste findings, most expensive first, as a JSON string.
     */
    public String exportWasteReport(ResourceGraph graph) {
        return write(buildWasteReport(graph));
    }

    public void writeWasteReport(ResourceGraph graph, Writer out) throws IOException {
        mapper.writeValue(out, buildWasteReport(graph));
    }

    private Map<String, Object> buildGraphDocument(ResourceGraph graph) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("generatedAt", clock.instant().toString());
        doc.put("partial", graph.isPartial());

        List<ResourceNode> nodes = graph.getNodes();
        doc.put("nodes", nodes);

        List<ResourceEdge> edges = new ArrayList<>();
        for (ResourceNode node : nodes) {
            edges.addAll(graph.getEdges(node.getId()));
        }
        doc.put("edges", edges);

        doc.put("statistics", Map.of(
                "nodeCount", nodes.size(),
                "edgeCount", edges.size(),
                "wasteCount", nodes.stream().filter(ResourceNode::isWaste).count()));
        doc.put("scopeErrors", graph.getScopeErrors());
        return doc;
    }

    private Map<String, Object> buildWasteReport(ResourceGraph graph) {
        List<WasteItem> items = graph.readLocked(() -> graph.getWasteNodes().stream()
                .map(WasteReportExporter::toItem)
                .sorted(Comparator.comparingDouble(WasteItem::getMonthlyCost).reversed())
                .collect(Collectors.toList()));

        List<WasteItem> actionable = items.stream()
                .filter(item -> !item.isJustified())
                .collect(Collectors.toList());
        double monthlyWaste = actionable.stream().mapToDouble(WasteItem::getMonthlyCost).sum();

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("generatedAt", clock.instant().toString());
        doc.put("partial", graph.isPartial());
        doc.put("totalResources", graph.getNodeCount());
        doc.put("totalWaste", actionable.size());
        doc.put("justifiedWaste", items.size() - actionable.size());
        doc.put("monthlyWasteCost", monthlyWaste);
        doc.put("projectedAnnualSavings", monthlyWaste * 12);
        doc.put("items", items);
        return doc;
    }

    private static WasteItem toItem(ResourceNode node) {
        return WasteItem.builder()
                .resourceId(node.getId())
                .type(node.getType())
                .region(node.getStringProperty("Region").orElse(""))
                .monthlyCost(node.getCost())
                .riskScore(node.getRiskScore())
                .reason(node.getWasteReason() != null
                        ? node.getWasteReason()
                        : node.getStringProperty(ResourceGraph.REASON).orElse(""))
                .justified(node.isJustified())
                .justification(node.getJustification())
                .reachability(node.getReachability().name())
                .sourceLocation(node.getSourceLocation())
                .build();
    }

    private String write(Object doc) {
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            log.severe("Failed to export JSON: " + e.getMessage());
            throw new UncheckedIOException(e);
        }
    }
}
