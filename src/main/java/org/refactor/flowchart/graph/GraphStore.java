package org.refactor.flowchart.graph;

import java.util.*;

/**
 * 存放一次生成的所有节点、边和作用域层级。
 * <p>
 * 构建阶段由 GraphBuilder 独占写入，之后按流水线顺序依次交给优化、折叠、渲染，
 * 同一时刻只有一个阶段在改它。
 */
public class GraphStore {

    // 节点按创建顺序保存
    private final Map<String, FlowNode> nodes = new LinkedHashMap<>();

    // 边按创建顺序保存，优化/折叠时整体替换
    private List<Edge> edges = new ArrayList<>();

    // 作用域层级：父作用域 -> 在其中被调用展开的子作用域
    private final Map<Scope, Set<Scope>> scopeChildren = new LinkedHashMap<>();

    private int idCounter = 0;
    private String startId;
    private String endId;

    /** 生成唯一 id：前缀 + 全局递增计数 */
    public String nextId(String prefix) {
        idCounter++;
        return prefix + idCounter;
    }

    public FlowNode addNode(FlowNode node) {
        if (nodes.containsKey(node.id())) {
            throw new IllegalStateException("Duplicate node id: " + node.id());
        }
        nodes.put(node.id(), node);
        return node;
    }

    public FlowNode node(String id) {
        return nodes.get(id);
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public Collection<FlowNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public void removeNode(String id) {
        nodes.remove(id);
    }

    public void removeNodes(Collection<String> ids) {
        ids.forEach(nodes::remove);
    }

    public void addEdge(Edge edge) {
        edges.add(edge);
    }

    public List<Edge> edges() {
        return Collections.unmodifiableList(edges);
    }

    public void replaceEdges(List<Edge> newEdges) {
        this.edges = new ArrayList<>(newEdges);
    }

    public void addChildScope(Scope parent, Scope child) {
        if (!parent.equals(child)) {
            scopeChildren.computeIfAbsent(parent, k -> new LinkedHashSet<>()).add(child);
        }
    }

    /**
     * 直接子作用域：调用展开出来的作用域，类作用域还包括它的所有方法作用域。按 id 排序。
     */
    public List<Scope> childScopes(Scope scope) {
        Set<Scope> children = new TreeSet<>(Scope.BY_ID);
        children.addAll(scopeChildren.getOrDefault(scope, Set.of()));
        if (scope instanceof Scope.ClassScope classScope) {
            for (Scope s : scopes()) {
                if (s instanceof Scope.Method method && method.className().equals(classScope.name())) {
                    children.add(s);
                }
            }
        }
        return new ArrayList<>(children);
    }

    /** 所有出现过的作用域：节点所属作用域、它们的类作用域、调用层级中出现的作用域 */
    public Set<Scope> scopes() {
        Set<Scope> result = new TreeSet<>(Scope.BY_ID);
        for (FlowNode node : nodes.values()) {
            result.add(node.scope());
            if (node.scope() instanceof Scope.Method method) {
                result.add(method.classScope());
            }
        }
        scopeChildren.forEach((parent, children) -> {
            result.add(parent);
            result.addAll(children);
        });
        return result;
    }

    /** 没有父作用域的作用域（主流程、类、未被任何作用域调用展开的函数） */
    public List<Scope> rootScopes() {
        Set<Scope> nested = new HashSet<>();
        scopeChildren.values().forEach(nested::addAll);
        List<Scope> roots = new ArrayList<>();
        for (Scope scope : scopes()) {
            if (scope instanceof Scope.Method) {
                continue;
            }
            if (!nested.contains(scope)) {
                roots.add(scope);
            }
        }
        return roots;
    }

    /** 直接属于该作用域的节点 id，按创建顺序 */
    public List<String> nodesInScope(Scope scope) {
        List<String> ids = new ArrayList<>();
        for (FlowNode node : nodes.values()) {
            if (node.scope().equals(scope)) {
                ids.add(node.id());
            }
        }
        return ids;
    }

    public int nodeCount(Scope scope) {
        return nodesInScope(scope).size();
    }

    /** 子图标题里的节点数：类作用域本身没有节点，按它所有方法的节点合计 */
    public int subgraphNodeCount(Scope scope) {
        if (scope instanceof Scope.ClassScope) {
            int count = 0;
            for (Scope child : childScopes(scope)) {
                count += nodeCount(child);
            }
            return count;
        }
        return nodeCount(scope);
    }

    public String startId() {
        return startId;
    }

    public void setStartId(String startId) {
        this.startId = startId;
    }

    public String endId() {
        return endId;
    }

    public void setEndId(String endId) {
        this.endId = endId;
    }
}
