package org.refactor.flowchart;

import org.refactor.flowchart.ast.Module;
import org.refactor.flowchart.ast.SyntaxTreeException;
import org.refactor.flowchart.ast.SyntaxTreeReader;
import org.refactor.flowchart.build.DefinitionIndex;
import org.refactor.flowchart.build.GraphBuilder;
import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.entry.DefinitionSlicer;
import org.refactor.flowchart.entry.EntryPoint;
import org.refactor.flowchart.entry.EntrySelector;
import org.refactor.flowchart.graph.GraphStore;
import org.refactor.flowchart.graph.Scope;
import org.refactor.flowchart.post.CollapsedSubgraph;
import org.refactor.flowchart.post.GraphOptimizer;
import org.refactor.flowchart.post.SubgraphCollapseManager;
import org.refactor.flowchart.post.ViewModeFilter;
import org.refactor.flowchart.render.DiagramMetadata;
import org.refactor.flowchart.render.DiagramRenderer;
import org.refactor.flowchart.render.MermaidRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * 流程图生成流水线：
 * 入口裁剪 → 构建 → 消除旁路节点 → 子图折叠 → 视图过滤 → 清理孤立节点 → 渲染。
 * <p>
 * 任何阶段出错都不会抛到外面，返回一个只含错误节点的流程图。
 */
public class FlowchartGenerator {

    private static final Logger log = LoggerFactory.getLogger(FlowchartGenerator.class);

    private final FlowchartConfig config;
    private final EntrySelector selector;
    private final DiagramRenderer renderer;

    public FlowchartGenerator(FlowchartConfig config) {
        this(config, new DefinitionSlicer(), new MermaidRenderer());
    }

    public FlowchartGenerator(FlowchartConfig config, EntrySelector selector, DiagramRenderer renderer) {
        this.config = Objects.requireNonNull(config, "config");
        this.selector = Objects.requireNonNull(selector, "selector");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * 从 JSON 语法树生成整个文件的流程图
     */
    public FlowchartResult generate(String syntaxTreeJson) {
        return generate(syntaxTreeJson, EntryPoint.file(null));
    }

    public FlowchartResult generate(String syntaxTreeJson, EntryPoint entry) {
        try {
            Module module = new SyntaxTreeReader().read(syntaxTreeJson);
            return generate(module, entry);
        } catch (SyntaxTreeException e) {
            log.error("Failed to read syntax tree: {}", e.getMessage());
            return failure("Error: " + e.getMessage());
        }
    }

    public FlowchartResult generate(Module module, EntryPoint entry) {
        try {
            return run(module, entry);
        } catch (RuntimeException e) {
            log.error("Flowchart generation failed", e);
            return failure("Error generating flowchart: " + e.getMessage());
        }
    }

    private FlowchartResult run(Module module, EntryPoint entry) {
        Map<String, Integer> nameToLine = DefinitionSlicer.lineMapping(module);
        Module selected = selector.select(module, entry);

        DefinitionIndex index = DefinitionIndex.of(selected);
        GraphStore store = new GraphBuilder(config, index, entry).build(selected);

        GraphOptimizer.eliminateBypassNodes(store);
        SubgraphCollapseManager collapseManager = new SubgraphCollapseManager(config, entry);
        Map<Scope, CollapsedSubgraph> collapsed = collapseManager.collapse(store);
        ViewModeFilter.apply(store, config.getViewMode());
        if (config.isPruneUnusedNodes()) {
            GraphOptimizer.pruneUnreferenced(store);
        }

        String diagram = renderer.render(store, collapsed);
        DiagramMetadata metadata = DiagramMetadata.describe(store, collapsed, config, entry, nameToLine);
        log.info("Rendered {} nodes, {} edges, {} collapsed subgraphs", store.size(), store.edges().size(),
                collapsed.size());
        return new FlowchartResult(diagram, metadata);
    }

    private static FlowchartResult failure(String message) {
        String text = MermaidRenderer.escape(message);
        return new FlowchartResult("graph TD\n    error[\"" + text + "\"]\n", DiagramMetadata.empty());
    }
}
