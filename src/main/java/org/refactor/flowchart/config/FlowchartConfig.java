package org.refactor.flowchart.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Type;
import java.util.*;

/**
 * 流程图生成选项。setter 可以链式调用。
 * <p>
 * 从外部读取时（{@link #fromOptions(Map)} / {@link #fromJson(String)}），
 * 不认识的键和格式不对的值只记 WARN 日志，保留默认值，不会失败。
 */
public class FlowchartConfig {

    private static final Logger log = LoggerFactory.getLogger(FlowchartConfig.class);

    public static final int DEFAULT_MAX_NODES = 100;
    public static final int DEFAULT_MAX_NESTING_DEPTH = 6;
    public static final int DEFAULT_MAX_SUBGRAPH_NODES = 25;

    private static final Type OPTIONS_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    // 按语句类型的显示开关
    private boolean showPrints = true;
    private boolean showFunctions = true;
    private boolean showForLoops = true;
    private boolean showWhileLoops = true;
    private boolean showVariables = true;
    private boolean showIfs = true;
    private boolean showImports = true;
    private boolean showExceptions = true;
    private boolean showReturns = true;
    private boolean showClasses = true;

    private boolean mergeCommonNodes = true;
    // true: 方法调用画单向 "Call" 边，调用后从方法出口继续
    private boolean sequentialFlow = false;

    private int maxNodes = DEFAULT_MAX_NODES;
    private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
    private int maxSubgraphNodes = DEFAULT_MAX_SUBGRAPH_NODES;

    private Set<String> subgraphWhitelist = new TreeSet<>();
    private Set<String> forceCollapseList = new TreeSet<>();

    private ViewMode viewMode = ViewMode.DETAILED;
    private boolean pruneUnusedNodes = true;
    private Set<Integer> highlightLines = new TreeSet<>();

    public static FlowchartConfig defaults() {
        return new FlowchartConfig();
    }

    /**
     * 从 JSON 对象读取选项。JSON 本身损坏时记 WARN 并返回默认配置。
     */
    public static FlowchartConfig fromJson(String json) {
        if (json == null || json.isBlank()) {
            return defaults();
        }
        Map<String, Object> options;
        try {
            options = new Gson().fromJson(json, OPTIONS_TYPE);
        } catch (JsonParseException e) {
            log.warn("Ignoring malformed configuration JSON: {}", e.getMessage());
            return defaults();
        }
        return fromOptions(options == null ? Map.of() : options);
    }

    /** 按 snake_case 键读取选项 */
    public static FlowchartConfig fromOptions(Map<String, ?> options) {
        FlowchartConfig config = new FlowchartConfig();
        options.forEach(config::apply);
        return config;
    }

    private void apply(String key, Object value) {
        switch (key) {
            case "show_prints":
                bool(key, value).ifPresent(this::setShowPrints);
                break;
            case "show_functions":
                bool(key, value).ifPresent(this::setShowFunctions);
                break;
            case "show_for_loops":
                bool(key, value).ifPresent(this::setShowForLoops);
                break;
            case "show_while_loops":
                bool(key, value).ifPresent(this::setShowWhileLoops);
                break;
            case "show_loops":
                bool(key, value).ifPresent(v -> setShowForLoops(v).setShowWhileLoops(v));
                break;
            case "show_variables":
                bool(key, value).ifPresent(this::setShowVariables);
                break;
            case "show_ifs":
            case "show_conditionals":
                bool(key, value).ifPresent(this::setShowIfs);
                break;
            case "show_imports":
                bool(key, value).ifPresent(this::setShowImports);
                break;
            case "show_exceptions":
                bool(key, value).ifPresent(this::setShowExceptions);
                break;
            case "show_returns":
                bool(key, value).ifPresent(this::setShowReturns);
                break;
            case "show_classes":
                bool(key, value).ifPresent(this::setShowClasses);
                break;
            case "merge_common_nodes":
                bool(key, value).ifPresent(this::setMergeCommonNodes);
                break;
            case "sequential_flow":
                bool(key, value).ifPresent(this::setSequentialFlow);
                break;
            case "max_nodes":
                integer(key, value, 2).ifPresent(this::setMaxNodes);
                break;
            case "max_nesting_depth":
                integer(key, value, 0).ifPresent(this::setMaxNestingDepth);
                break;
            case "max_subgraph_nodes":
                integer(key, value, 0).ifPresent(this::setMaxSubgraphNodes);
                break;
            case "subgraph_whitelist":
                names(key, value).ifPresent(this::setSubgraphWhitelist);
                break;
            case "force_collapse_list":
                names(key, value).ifPresent(this::setForceCollapseList);
                break;
            case "view_mode":
                ViewMode mode = value == null ? null : ViewMode.parse(String.valueOf(value));
                if (mode == null) {
                    log.warn("Unknown view_mode '{}', using {}", value, ViewMode.DETAILED);
                    mode = ViewMode.DETAILED;
                }
                setViewMode(mode);
                break;
            case "prune_unused_nodes":
                bool(key, value).ifPresent(this::setPruneUnusedNodes);
                break;
            case "highlight_lines":
                lines(key, value).ifPresent(this::setHighlightLines);
                break;
            default:
                log.warn("Ignoring unrecognized configuration option '{}'", key);
        }
    }

    // ===== 取值转换 =====

    private static Optional<Boolean> bool(String key, Object value) {
        if (value instanceof Boolean b) {
            return Optional.of(b);
        }
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue() != 0);
        }
        if (value instanceof String s) {
            switch (s.trim().toLowerCase(Locale.ROOT)) {
                case "1":
                case "true":
                case "yes":
                case "on":
                    return Optional.of(true);
                case "0":
                case "false":
                case "no":
                case "off":
                    return Optional.of(false);
                default:
                    break;
            }
        }
        log.warn("Ignoring malformed boolean for '{}': {}", key, value);
        return Optional.empty();
    }

    private static Optional<Integer> integer(String key, Object value, int min) {
        Integer parsed = null;
        if (value instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            parsed = n.intValue();
        } else if (value instanceof String s) {
            try {
                parsed = Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                parsed = null;
            }
        }
        if (parsed == null || parsed < min) {
            log.warn("Ignoring malformed value for '{}': {} (expected an integer >= {})", key, value, min);
            return Optional.empty();
        }
        return Optional.of(parsed);
    }

    private static Optional<Set<String>> names(String key, Object value) {
        Set<String> names = new TreeSet<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !String.valueOf(item).isBlank()) {
                    names.add(String.valueOf(item).trim());
                }
            }
            return Optional.of(names);
        }
        if (value instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    names.add(part.trim());
                }
            }
            return Optional.of(names);
        }
        log.warn("Ignoring malformed name list for '{}': {}", key, value);
        return Optional.empty();
    }

    private static Optional<Set<Integer>> lines(String key, Object value) {
        Collection<?> items;
        if (value instanceof Collection<?> collection) {
            items = collection;
        } else if (value instanceof String s) {
            items = Arrays.asList(s.split(","));
        } else {
            log.warn("Ignoring malformed line list for '{}': {}", key, value);
            return Optional.empty();
        }
        Set<Integer> lines = new TreeSet<>();
        for (Object item : items) {
            if (item instanceof String s && s.isBlank()) {
                continue;
            }
            integer(key, item, 1).ifPresent(lines::add);
        }
        return Optional.of(lines);
    }

    // ===== getter / 链式 setter =====

    public boolean isShowPrints() {
        return showPrints;
    }

    public FlowchartConfig setShowPrints(boolean showPrints) {
        this.showPrints = showPrints;
        return this;
    }

    public boolean isShowFunctions() {
        return showFunctions;
    }

    public FlowchartConfig setShowFunctions(boolean showFunctions) {
        this.showFunctions = showFunctions;
        return this;
    }

    public boolean isShowForLoops() {
        return showForLoops;
    }

    public FlowchartConfig setShowForLoops(boolean showForLoops) {
        this.showForLoops = showForLoops;
        return this;
    }

    public boolean isShowWhileLoops() {
        return showWhileLoops;
    }

    public FlowchartConfig setShowWhileLoops(boolean showWhileLoops) {
        this.showWhileLoops = showWhileLoops;
        return this;
    }

    public boolean isShowVariables() {
        return showVariables;
    }

    public FlowchartConfig setShowVariables(boolean showVariables) {
        this.showVariables = showVariables;
        return this;
    }

    public boolean isShowIfs() {
        return showIfs;
    }

    public FlowchartConfig setShowIfs(boolean showIfs) {
        this.showIfs = showIfs;
        return this;
    }

    public boolean isShowImports() {
        return showImports;
    }

    public FlowchartConfig setShowImports(boolean showImports) {
        this.showImports = showImports;
        return this;
    }

    public boolean isShowExceptions() {
        return showExceptions;
    }

    public FlowchartConfig setShowExceptions(boolean showExceptions) {
        this.showExceptions = showExceptions;
        return this;
    }

    public boolean isShowReturns() {
        return showReturns;
    }

    public FlowchartConfig setShowReturns(boolean showReturns) {
        this.showReturns = showReturns;
        return this;
    }

    public boolean isShowClasses() {
        return showClasses;
    }

    public FlowchartConfig setShowClasses(boolean showClasses) {
        this.showClasses = showClasses;
        return this;
    }

    public boolean isMergeCommonNodes() {
        return mergeCommonNodes;
    }

    public FlowchartConfig setMergeCommonNodes(boolean mergeCommonNodes) {
        this.mergeCommonNodes = mergeCommonNodes;
        return this;
    }

    public boolean isSequentialFlow() {
        return sequentialFlow;
    }

    public FlowchartConfig setSequentialFlow(boolean sequentialFlow) {
        this.sequentialFlow = sequentialFlow;
        return this;
    }

    public int getMaxNodes() {
        return maxNodes;
    }

    public FlowchartConfig setMaxNodes(int maxNodes) {
        this.maxNodes = maxNodes;
        return this;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public FlowchartConfig setMaxNestingDepth(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
        return this;
    }

    public int getMaxSubgraphNodes() {
        return maxSubgraphNodes;
    }

    public FlowchartConfig setMaxSubgraphNodes(int maxSubgraphNodes) {
        this.maxSubgraphNodes = maxSubgraphNodes;
        return this;
    }

    public Set<String> getSubgraphWhitelist() {
        return Collections.unmodifiableSet(subgraphWhitelist);
    }

    public FlowchartConfig setSubgraphWhitelist(Collection<String> subgraphWhitelist) {
        this.subgraphWhitelist = new TreeSet<>(subgraphWhitelist);
        return this;
    }

    public Set<String> getForceCollapseList() {
        return Collections.unmodifiableSet(forceCollapseList);
    }

    public FlowchartConfig setForceCollapseList(Collection<String> forceCollapseList) {
        this.forceCollapseList = new TreeSet<>(forceCollapseList);
        return this;
    }

    public ViewMode getViewMode() {
        return viewMode;
    }

    public FlowchartConfig setViewMode(ViewMode viewMode) {
        this.viewMode = Objects.requireNonNull(viewMode, "viewMode");
        return this;
    }

    public boolean isPruneUnusedNodes() {
        return pruneUnusedNodes;
    }

    public FlowchartConfig setPruneUnusedNodes(boolean pruneUnusedNodes) {
        this.pruneUnusedNodes = pruneUnusedNodes;
        return this;
    }

    public Set<Integer> getHighlightLines() {
        return Collections.unmodifiableSet(highlightLines);
    }

    public FlowchartConfig setHighlightLines(Collection<Integer> highlightLines) {
        this.highlightLines = new TreeSet<>(highlightLines);
        return this;
    }
}
