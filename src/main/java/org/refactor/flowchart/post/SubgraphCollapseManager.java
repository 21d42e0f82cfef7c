package org.refactor.flowchart.post;

import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.entry.EntryPoint;
import org.refactor.flowchart.graph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 决定每个作用域展开还是折叠，并把折叠的作用域替换成一个占位节点。
 * <p>
 * 判定顺序：
 * <ol>
 *     <li>作用域 id 在强制折叠列表中：折叠</li>
 *     <li>作用域 id 在白名单中：展开</li>
 *     <li>作用域就是入口：展开</li>
 *     <li>所属类名（或函数名）在强制折叠列表中：折叠</li>
 *     <li>所属类名（或函数名）在白名单中：展开</li>
 *     <li>否则直属节点数超过 max_subgraph_nodes 时折叠</li>
 * </ol>
 * 主流程永不折叠。折叠一个作用域会连同它的所有后代作用域一起吸收。
 */
public class SubgraphCollapseManager {

    private static final Logger log = LoggerFactory.getLogger(SubgraphCollapseManager.class);

    private final FlowchartConfig config;
    private final EntryPoint entry;

    public SubgraphCollapseManager(FlowchartConfig config, EntryPoint entry) {
        this.config = Objects.requireNonNull(config, "config");
        this.entry = entry;
    }

    public boolean shouldCollapse(Scope scope, GraphStore store) {
        if (scope instanceof Scope.Main) {
            return false;
        }
        Set<String> force = config.getForceCollapseList();
        Set<String> whitelist = config.getSubgraphWhitelist();
        if (force.contains(scope.id())) {
            return true;
        }
        if (whitelist.contains(scope.id())) {
            return false;
        }
        if (entry != null && scope.equals(entry.scope())) {
            return false;
        }
        String base = scope.baseName();
        if (base != null && force.contains(base)) {
            return true;
        }
        if (base != null && whitelist.contains(base)) {
            return false;
        }
        return store.nodeCount(scope) > config.getMaxSubgraphNodes();
    }

    /**
     * 折叠所有需要折叠的作用域，重写跨边界的边。
     *
     * @return 折叠的作用域 -> 折叠信息，按处理顺序
     */
    public Map<Scope, CollapsedSubgraph> collapse(GraphStore store) {
        Map<Scope, Integer> depths = depths(store);
        List<Scope> ordered = new ArrayList<>(store.scopes());
        ordered.sort(Comparator.comparingInt((Scope s) -> depths.getOrDefault(s, 0)).thenComparing(Scope.BY_ID));

        Map<Scope, CollapsedSubgraph> collapsed = new LinkedHashMap<>();
        Set<Scope> absorbed = new HashSet<>();
        Map<String, String> redirect = new HashMap<>();

        for (Scope scope : ordered) {
            if (absorbed.contains(scope) || !shouldCollapse(scope, store)) {
                continue;
            }
            List<Scope> nested = descendants(store, scope);
            List<String> nodeIds = new ArrayList<>(store.nodesInScope(scope));
            nested.forEach(s -> nodeIds.addAll(store.nodesInScope(s)));
            if (nodeIds.isEmpty()) {
                continue;
            }
            absorbed.addAll(nested);
            Collections.sort(nodeIds);

            String placeholderId = "collapsed_" + scope.id() + "_" + nodeIds.size();
            CollapsedSubgraph subgraph = new CollapsedSubgraph(scope, nodeIds.size(),
                    scope.displayName(nodeIds.size()), placeholderId, nodeIds, nested);
            collapsed.put(scope, subgraph);
            nodeIds.forEach(id -> redirect.put(id, placeholderId));

            store.removeNodes(nodeIds);
            store.addNode(new FlowNode(placeholderId, "Collapsed nodes (" + nodeIds.size() + ")",
                    NodeShape.STATEMENT, NodeRole.PLACEHOLDER, scope, 0));
            log.info("Collapsed {} into {}", subgraph.displayName(), placeholderId);
        }

        if (!redirect.isEmpty()) {
            store.replaceEdges(rewrite(store.edges(), redirect));
        }
        return collapsed;
    }

    /** 边端点改到占位节点上，折叠区域内部的边丢弃 */
    private static List<Edge> rewrite(List<Edge> edges, Map<String, String> redirect) {
        List<Edge> result = new ArrayList<>();
        for (Edge edge : edges) {
            String from = redirect.getOrDefault(edge.from(), edge.from());
            String to = redirect.getOrDefault(edge.to(), edge.to());
            boolean touched = redirect.containsKey(edge.from()) || redirect.containsKey(edge.to());
            if (touched && from.equals(to)) {
                continue;
            }
            result.add(edge.withEndpoints(from, to));
        }
        return GraphOptimizer.dedupe(result);
    }

    /** 所有后代作用域，先序 */
    static List<Scope> descendants(GraphStore store, Scope scope) {
        List<Scope> result = new ArrayList<>();
        Set<Scope> visited = new HashSet<>();
        visited.add(scope);
        Deque<Scope> stack = new ArrayDeque<>(store.childScopes(scope));
        while (!stack.isEmpty()) {
            Scope next = stack.pop();
            if (!visited.add(next)) {
                continue;
            }
            result.add(next);
            List<Scope> children = store.childScopes(next);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /** 作用域在层级中的深度，根为 0 */
    private static Map<Scope, Integer> depths(GraphStore store) {
        Map<Scope, Integer> depths = new HashMap<>();
        Deque<Scope> queue = new ArrayDeque<>();
        for (Scope root : store.rootScopes()) {
            depths.put(root, 0);
            queue.add(root);
        }
        while (!queue.isEmpty()) {
            Scope scope = queue.poll();
            for (Scope child : store.childScopes(scope)) {
                if (!depths.containsKey(child)) {
                    depths.put(child, depths.get(scope) + 1);
                    queue.add(child);
                }
            }
        }
        return depths;
    }
}
