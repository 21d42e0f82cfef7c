package org.refactor.flowchart.build;

import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.entry.EntryPoint;
import org.refactor.flowchart.graph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 一次构建的全部可变状态：节点仓库、循环栈、调用栈、嵌套深度、方法子图缓存、类型表。
 * 每次构建新建一个，不做静态共享。
 */
final class BuilderContext {

    private static final Logger log = LoggerFactory.getLogger(BuilderContext.class);

    final GraphStore store;
    final FlowchartConfig config;
    final DefinitionIndex index;
    final TypeResolver resolver;
    final EntryPoint entry;

    private final Deque<LoopFrame> loopStack = new ArrayDeque<>();
    // 普通函数调用的返回目标（end_call 节点）
    private final Deque<String> callStack = new ArrayDeque<>();
    private int depth = 0;

    // 函数作用域 -> 第一次进入该函数时的调用节点，递归边指向它
    private final Map<Scope, String> functionStarts = new HashMap<>();
    private final Map<String, Integer> callCounts = new HashMap<>();

    // 方法子图缓存：入口节点和最后一个节点
    private final Map<MethodKey, String> methodEntries = new HashMap<>();
    private final Map<MethodKey, String> methodLastNodes = new HashMap<>();
    // 方法作用域 -> 第一次调用它的节点，方法内 return 连回这里
    private final Map<Scope.Method, String> callingNodes = new HashMap<>();
    // 顺序流模式下方法内的 return 节点
    private final Map<Scope.Method, List<String>> methodExits = new HashMap<>();

    private String pendingLabel;
    private String firstImportId;
    private boolean exhausted;
    private boolean limitReported;

    BuilderContext(GraphStore store, FlowchartConfig config, DefinitionIndex index, TypeResolver resolver,
                   EntryPoint entry) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.index = Objects.requireNonNull(index, "index");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.entry = entry;
    }

    /**
     * 创建节点。节点数到达上限时返回 null 并标记耗尽，调用方据此停止构建。
     */
    String addNode(String prefix, String text, NodeShape shape, NodeRole role, Scope scope, int line) {
        if (store.size() >= config.getMaxNodes()) {
            if (!exhausted) {
                log.warn("Node limit {} reached, truncating flowchart", config.getMaxNodes());
            }
            exhausted = true;
            return null;
        }
        String id = store.nextId(prefix);
        String label = NodeText.truncate(text, NodeText.MAX_TEXT);
        if (line > 0 && config.getHighlightLines().contains(line)) {
            label = NodeText.HIGHLIGHT + label;
        }
        store.addNode(new FlowNode(id, label, shape, role, scope, line));
        return id;
    }

    /** 无文字的合并节点 */
    String addMerge(Scope scope) {
        return addNode("merge", "", NodeShape.MERGE, NodeRole.CONTROL, scope, 0);
    }

    void connect(String from, String to, String label) {
        connect(from, to, label, Edge.Kind.ONE_WAY);
    }

    /**
     * 连边。label 为空时使用待定标签（分支入口的 True / False / Try），用过即清空。
     */
    void connect(String from, String to, String label, Edge.Kind kind) {
        if (from == null || to == null) {
            return;
        }
        if (label == null && pendingLabel != null) {
            label = pendingLabel;
            pendingLabel = null;
        }
        if (config.isSequentialFlow()) {
            kind = Edge.Kind.ONE_WAY;
        }
        store.addEdge(new Edge(from, to, label, kind));
    }

    void setPendingLabel(String label) {
        this.pendingLabel = label;
    }

    boolean exhausted() {
        return exhausted;
    }

    /** 第一次到达节点上限时返回 true，之后都返回 false */
    boolean reportLimit() {
        if (!exhausted || limitReported) {
            return false;
        }
        limitReported = true;
        return true;
    }

    String endId() {
        return store.endId();
    }

    // ---- 循环 ----

    void pushLoop(LoopFrame frame) {
        loopStack.push(frame);
    }

    void popLoop() {
        loopStack.pop();
    }

    LoopFrame currentLoop() {
        return loopStack.peek();
    }

    // ---- 调用 ----

    void pushCall(String returnTarget) {
        callStack.push(returnTarget);
    }

    void popCall() {
        callStack.pop();
    }

    String currentReturnTarget() {
        return callStack.peek();
    }

    int depth() {
        return depth;
    }

    boolean depthExceeded() {
        return depth >= config.getMaxNestingDepth();
    }

    void enter() {
        depth++;
    }

    void leave() {
        depth--;
    }

    /** 第一次调用 f 用 Function(f)，第 k 次用 CallInstance(f, k) */
    Scope nextCallScope(String function) {
        int count = callCounts.merge(function, 1, Integer::sum);
        return count == 1 ? new Scope.Function(function) : new Scope.CallInstance(function, count);
    }

    void recordFunctionStart(Scope scope, String nodeId) {
        functionStarts.putIfAbsent(scope, nodeId);
    }

    String functionStart(Scope scope) {
        return functionStarts.get(scope);
    }

    // ---- 方法子图 ----

    String methodEntry(MethodKey key) {
        return methodEntries.get(key);
    }

    void cacheMethodEntry(MethodKey key, String entryId) {
        methodEntries.put(key, entryId);
    }

    String methodLastNode(MethodKey key) {
        return methodLastNodes.get(key);
    }

    void cacheMethodLastNode(MethodKey key, String lastId) {
        if (lastId != null) {
            methodLastNodes.put(key, lastId);
        }
    }

    void recordCallingNode(Scope.Method scope, String callId) {
        callingNodes.putIfAbsent(scope, callId);
    }

    String callingNode(Scope.Method scope) {
        return callingNodes.get(scope);
    }

    void recordMethodExit(Scope.Method scope, String nodeId) {
        methodExits.computeIfAbsent(scope, k -> new ArrayList<>()).add(nodeId);
    }

    /** 顺序流模式下方法的最后一个 return 节点，没有时返回 null */
    String lastMethodExit(Scope.Method scope) {
        List<String> exits = methodExits.get(scope);
        return exits == null || exits.isEmpty() ? null : exits.get(exits.size() - 1);
    }

    String firstImportId() {
        return firstImportId;
    }

    void setFirstImportId(String firstImportId) {
        this.firstImportId = firstImportId;
    }
}
