package org.refactor.flowchart;

import org.refactor.flowchart.graph.Edge;
import org.refactor.flowchart.graph.FlowNode;
import org.refactor.flowchart.graph.GraphStore;
import org.refactor.flowchart.graph.NodeRole;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 测试里按文字、标签查图的小工具
 */
public final class Graphs {

    private Graphs() {
    }

    /** 文字完全相同的唯一节点，没有或不唯一都直接失败 */
    public static FlowNode node(GraphStore store, String text) {
        List<FlowNode> found = store.nodes().stream()
                .filter(n -> n.text().equals(text))
                .collect(Collectors.toList());
        if (found.size() != 1) {
            throw new AssertionError("Expected one node '" + text + "' but found " + found + " in " + store.nodes());
        }
        return found.get(0);
    }

    public static List<FlowNode> nodesStartingWith(GraphStore store, String prefix) {
        return store.nodes().stream()
                .filter(n -> n.text().startsWith(prefix))
                .collect(Collectors.toList());
    }

    public static List<FlowNode> nodesWithRole(GraphStore store, NodeRole role) {
        return store.nodes().stream()
                .filter(n -> n.role() == role)
                .collect(Collectors.toList());
    }

    public static List<Edge> labelled(GraphStore store, String label) {
        return store.edges().stream()
                .filter(e -> Objects.equals(e.label(), label))
                .collect(Collectors.toList());
    }

    public static List<Edge> outgoing(GraphStore store, String from) {
        return store.edges().stream()
                .filter(e -> e.from().equals(from))
                .collect(Collectors.toList());
    }

    public static List<Edge> between(GraphStore store, String from, String to) {
        return store.edges().stream()
                .filter(e -> e.from().equals(from) && e.to().equals(to))
                .collect(Collectors.toList());
    }
}
