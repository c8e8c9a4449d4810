package com.architecture.memory.vuegraph.service.render;

import com.architecture.memory.vuegraph.model.Directionality;
import com.architecture.memory.vuegraph.model.GraphEntity;
import com.architecture.memory.vuegraph.model.MapGraph;
import com.architecture.memory.vuegraph.model.MapLink;
import com.architecture.memory.vuegraph.model.MapNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Plain-text tables summarising an extracted graph, one row per node or link in id order.
 */
@Component
public class GraphTableRenderer {

    private static final String COLUMN_GAP = "  ";
    private static final String ELLIPSIS = "...";

    private static final Map<String, Function<MapNode, Object>> NODE_COLUMNS = Map.of(
            "label", MapNode::getLabel,
            "layer", MapNode::getLayer,
            "parent", MapNode::getParent,
            "type", MapNode::getType
    );

    public String renderNodes(MapGraph graph, String column) {
        Function<MapNode, Object> accessor = NODE_COLUMNS.get(column);
        if (accessor == null) {
            throw new IllegalArgumentException("Unknown node column '" + column + "', expected one of " + NODE_COLUMNS.keySet());
        }

        List<String[]> rows = new ArrayList<>();
        for (MapNode node : graph.getNodes().values()) {
            Object value = accessor.apply(node);
            rows.add(new String[]{String.valueOf(node.getId()), value == null ? "" : value.toString()});
        }
        return table(new String[]{"ID", column.toUpperCase(Locale.ROOT)}, rows);
    }

    public String renderLinks(MapGraph graph, int maxLength) {
        List<String[]> rows = new ArrayList<>();
        for (MapLink link : graph.getLinks().values()) {
            GraphEntity start = graph.start(link);
            GraphEntity end = graph.end(link);
            rows.add(new String[]{
                    String.valueOf(link.getId()),
                    truncate(start.getLabel(), maxLength),
                    arrow(link),
                    truncate(end.getLabel(), maxLength)
            });
        }
        return table(new String[]{"Link ID", "Node 1", "Relationship", "Node 2"}, rows);
    }

    /**
     * ASCII form of a link, e.g. {@code " <--[label]--> "} for a bidirectional labelled link.
     */
    static String arrow(MapLink link) {
        String tag = link.getLabel() == null || link.getLabel().isEmpty() ? "" : "[" + link.getLabel() + "]";
        String left = link.getDirected() == Directionality.BIDIRECTIONAL ? " <" : "";
        String right = link.getDirected() != Directionality.UNDIRECTED ? "> " : "";
        return String.join("--", left, tag, right);
    }

    static String truncate(String text, int maxLength) {
        if (text == null) return "";
        return text.length() > maxLength ? text.substring(0, maxLength) + ELLIPSIS : text;
    }

    private static String table(String[] headers, List<String[]> rows) {
        int[] widths = new int[headers.length];
        for (int i = 0; i < headers.length; i++) {
            widths[i] = headers[i].length();
        }
        for (String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, headers, widths);
        String[] rule = new String[headers.length];
        for (int i = 0; i < headers.length; i++) {
            rule[i] = "-".repeat(widths[i]);
        }
        appendRow(sb, rule, widths);
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, String[] cells, int[] widths) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) line.append(COLUMN_GAP);
            line.append(String.format("%-" + widths[i] + "s", cells[i]));
        }
        sb.append(line.toString().stripTrailing()).append('\n');
    }
}
