package org.refactor.flowchart.render;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.entry.EntryKind;
import org.refactor.flowchart.entry.EntryPoint;
import org.refactor.flowchart.graph.GraphStore;
import org.refactor.flowchart.graph.Scope;
import org.refactor.flowchart.post.CollapsedSubgraph;

import java.util.*;

/**
 * 和流程图一起输出的元数据：每个作用域的展开 / 折叠状态、入口描述、名字到行号的映射。
 * 字段按下划线命名序列化成 JSON。
 */
public class DiagramMetadata {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .disableHtmlEscaping()
            .create();

    public static final String EXPANDED = "expanded";
    public static final String COLLAPSED = "collapsed";

    public Map<String, SubgraphInfo> collapsedSubgraphs = new TreeMap<>();
    public Map<String, SubgraphInfo> expandedSubgraphs = new TreeMap<>();
    // 作用域 id -> expanded / collapsed
    public Map<String, String> subgraphStatusMap = new TreeMap<>();
    public List<SubgraphInfo> allSubgraphs = new ArrayList<>();
    public String filePath;
    public Map<String, Integer> nameToLineMap = new LinkedHashMap<>();
    public List<String> subgraphWhitelist = new ArrayList<>();
    public List<String> forceCollapseList = new ArrayList<>();
    public EntrySelection entrySelection;

    public static class SubgraphInfo {
        public String scope;
        public int nodeCount;
        public String displayName;
        public String status;
        public List<String> scopeNodes = new ArrayList<>();
        // 只有折叠的作用域有
        public String placeholderId;
        public List<String> absorbedScopes;
    }

    public static class EntrySelection {
        public String type;
        public String name;
        public String className;
        public Integer lineOffset;
    }

    /** 生成失败时使用的空元数据 */
    public static DiagramMetadata empty() {
        return new DiagramMetadata();
    }

    /**
     * 根据处理完的图生成元数据
     */
    public static DiagramMetadata describe(GraphStore store, Map<Scope, CollapsedSubgraph> collapsed,
                                           FlowchartConfig config, EntryPoint entry,
                                           Map<String, Integer> nameToLine) {
        DiagramMetadata metadata = new DiagramMetadata();
        Set<Scope> absorbed = new HashSet<>();
        for (CollapsedSubgraph subgraph : collapsed.values()) {
            SubgraphInfo info = new SubgraphInfo();
            info.scope = subgraph.scope().id();
            info.nodeCount = subgraph.nodeCount();
            info.displayName = subgraph.displayName();
            info.status = COLLAPSED;
            info.scopeNodes = new ArrayList<>(subgraph.absorbedNodeIds());
            info.placeholderId = subgraph.placeholderId();
            info.absorbedScopes = new ArrayList<>();
            for (Scope scope : subgraph.absorbedScopes()) {
                info.absorbedScopes.add(scope.id());
                absorbed.add(scope);
                metadata.subgraphStatusMap.put(scope.id(), COLLAPSED);
            }
            metadata.collapsedSubgraphs.put(info.scope, info);
            metadata.subgraphStatusMap.put(info.scope, COLLAPSED);
        }
        for (Scope scope : store.scopes()) {
            if (scope instanceof Scope.Main || collapsed.containsKey(scope) || absorbed.contains(scope)) {
                continue;
            }
            SubgraphInfo info = new SubgraphInfo();
            info.scope = scope.id();
            info.scopeNodes = store.nodesInScope(scope);
            info.nodeCount = store.subgraphNodeCount(scope);
            info.displayName = scope.displayName(info.nodeCount);
            info.status = EXPANDED;
            metadata.expandedSubgraphs.put(info.scope, info);
            metadata.subgraphStatusMap.put(info.scope, EXPANDED);
        }
        metadata.allSubgraphs.addAll(metadata.collapsedSubgraphs.values());
        metadata.allSubgraphs.addAll(metadata.expandedSubgraphs.values());
        metadata.allSubgraphs.sort(Comparator.comparing(info -> info.scope));

        metadata.subgraphWhitelist = new ArrayList<>(new TreeSet<>(config.getSubgraphWhitelist()));
        metadata.forceCollapseList = new ArrayList<>(new TreeSet<>(config.getForceCollapseList()));
        if (nameToLine != null) {
            metadata.nameToLineMap = new LinkedHashMap<>(nameToLine);
        }
        if (entry != null) {
            metadata.filePath = entry.filePath();
            EntrySelection selection = new EntrySelection();
            selection.type = entry.kind().label();
            selection.name = entry.kind() == EntryKind.CLASS ? entry.className() : entry.name();
            selection.className = entry.kind() == EntryKind.METHOD ? entry.className() : null;
            String key = entry.mappingKey();
            selection.lineOffset = key == null ? null : metadata.nameToLineMap.get(key);
            metadata.entrySelection = selection;
        }
        return metadata;
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
