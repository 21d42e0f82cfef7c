package org.refactor.flowchart.post;

import org.refactor.flowchart.graph.Edge;
import org.refactor.flowchart.graph.FlowNode;
import org.refactor.flowchart.graph.GraphStore;
import org.refactor.flowchart.graph.NodeRole;
import org.refactor.flowchart.graph.NodeShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 构建之后的图优化：消除旁路节点（跳转穿透），删除没有边引用的节点。
 */
public final class GraphOptimizer {

    private static final Logger log = LoggerFactory.getLogger(GraphOptimizer.class);

    private GraphOptimizer() {
    }

    /**
     * 消除所有无文字的合并节点。
     * <p>
     * 每个旁路节点转发到它的第一个后继，转发链传递解析，遇到环就停。
     * 指向旁路节点的边改指最终目标，没有标签时沿用链上第一个标签；
     * 从旁路节点出发的边丢弃。链成环时边丢弃；链落在没有后继的旁路节点上时
     * （方法体末尾的循环出口、if 汇合点），保留这个节点并改成一个 End 标记。
     * 重复执行结果不变。
     */
    public static void eliminateBypassNodes(GraphStore store) {
        Set<String> bypass = new LinkedHashSet<>();
        for (FlowNode node : store.nodes()) {
            if (node.isBypass()) {
                bypass.add(node.id());
            }
        }
        if (bypass.isEmpty()) {
            return;
        }

        Map<String, Edge> forward = new HashMap<>();
        for (Edge edge : store.edges()) {
            if (bypass.contains(edge.from()) && !forward.containsKey(edge.from())) {
                forward.put(edge.from(), edge);
            }
        }

        List<Edge> rewritten = new ArrayList<>();
        Set<String> deadEnds = new LinkedHashSet<>();
        for (Edge edge : store.edges()) {
            if (bypass.contains(edge.from())) {
                continue;
            }
            if (!bypass.contains(edge.to())) {
                rewritten.add(edge);
                continue;
            }
            String target = edge.to();
            String label = edge.label();
            boolean deadEnd = false;
            Set<String> visited = new HashSet<>();
            while (bypass.contains(target) && visited.add(target)) {
                Edge next = forward.get(target);
                if (next == null) {
                    deadEnd = true;
                    break;
                }
                if (label == null) {
                    label = next.label();
                }
                target = next.to();
            }
            if (deadEnd) {
                deadEnds.add(target);
            } else if (bypass.contains(target)) {
                log.debug("Dropping edge {} -> {}: bypass chain is a cycle", edge.from(), edge.to());
                continue;
            }
            rewritten.add(new Edge(edge.from(), target, label, edge.kind()));
        }

        store.replaceEdges(dedupe(rewritten));
        bypass.removeAll(deadEnds);
        store.removeNodes(bypass);
        for (String id : deadEnds) {
            FlowNode merge = store.node(id);
            store.removeNode(id);
            store.addNode(new FlowNode(id, "End", NodeShape.END, NodeRole.TERMINAL, merge.scope(), 0));
        }
        log.debug("Eliminated {} bypass nodes, kept {} as end markers", bypass.size(), deadEnds.size());
    }

    /**
     * 删除不是任何边端点的节点，End 节点始终保留
     */
    public static void pruneUnreferenced(GraphStore store) {
        Set<String> referenced = new HashSet<>();
        for (Edge edge : store.edges()) {
            referenced.add(edge.from());
            referenced.add(edge.to());
        }
        List<String> unused = new ArrayList<>();
        for (FlowNode node : store.nodes()) {
            if (!referenced.contains(node.id()) && !node.id().equals(store.endId())) {
                unused.add(node.id());
            }
        }
        store.removeNodes(unused);
        if (!unused.isEmpty()) {
            log.debug("Pruned {} unreferenced nodes", unused.size());
        }
    }

    /** 按 (from, to, label) 去重，保持第一次出现的顺序 */
    static List<Edge> dedupe(List<Edge> edges) {
        Map<String, Edge> unique = new LinkedHashMap<>();
        for (Edge edge : edges) {
            unique.putIfAbsent(edge.key(), edge);
        }
        return new ArrayList<>(unique.values());
    }
}
