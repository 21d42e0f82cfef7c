package org.refactor.flowchart.post;

import org.refactor.flowchart.config.ViewMode;
import org.refactor.flowchart.graph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 按视图模式隐藏节点。
 * <p>
 * 隐藏的节点被收缩掉：保留节点指向隐藏节点的边，替换成指向经由隐藏节点能到达的每个保留节点的边，
 * 标签取路径上第一个有标签的边。Start、End、折叠占位节点总是保留。
 */
public final class ViewModeFilter {

    private static final Logger log = LoggerFactory.getLogger(ViewModeFilter.class);

    private ViewModeFilter() {
    }

    public static void apply(GraphStore store, ViewMode mode) {
        if (mode == null || mode == ViewMode.DETAILED) {
            return;
        }
        Set<String> hidden = new HashSet<>();
        for (FlowNode node : store.nodes()) {
            if (!visible(node, mode, store)) {
                hidden.add(node.id());
            }
        }
        if (hidden.isEmpty()) {
            return;
        }

        Map<String, List<Edge>> outgoing = new HashMap<>();
        for (Edge edge : store.edges()) {
            outgoing.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }

        List<Edge> result = new ArrayList<>();
        for (Edge edge : store.edges()) {
            if (hidden.contains(edge.from())) {
                continue;
            }
            if (!hidden.contains(edge.to())) {
                result.add(edge);
                continue;
            }
            contract(edge, hidden, outgoing, result);
        }
        store.replaceEdges(GraphOptimizer.dedupe(result));
        store.removeNodes(hidden);
        log.info("View mode {} hid {} nodes", mode.name().toLowerCase(Locale.ROOT), hidden.size());
    }

    /** 从 edge 的终点出发，只经过隐藏节点，找到所有可达的保留节点 */
    private static void contract(Edge edge, Set<String> hidden, Map<String, List<Edge>> outgoing, List<Edge> result) {
        Deque<Step> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(new Step(edge.to(), edge.label()));
        visited.add(edge.to());
        while (!queue.isEmpty()) {
            Step step = queue.poll();
            for (Edge next : outgoing.getOrDefault(step.node(), List.of())) {
                String label = step.label() != null ? step.label() : next.label();
                if (!hidden.contains(next.to())) {
                    if (!next.to().equals(edge.from())) {
                        result.add(new Edge(edge.from(), next.to(), label, edge.kind()));
                    }
                } else if (visited.add(next.to())) {
                    queue.add(new Step(next.to(), label));
                }
            }
        }
    }

    private record Step(String node, String label) {
    }

    private static boolean visible(FlowNode node, ViewMode mode, GraphStore store) {
        if (node.id().equals(store.startId()) || node.id().equals(store.endId())) {
            return true;
        }
        NodeRole role = node.role();
        if (role == NodeRole.PLACEHOLDER || role == NodeRole.TERMINAL) {
            return true;
        }
        if (mode == ViewMode.TERSE) {
            return role.keptInTerseView();
        }
        if (node.scope() instanceof Scope.Method method && "__init__".equals(method.methodName())) {
            return false;
        }
        return !role.noise();
    }
}
