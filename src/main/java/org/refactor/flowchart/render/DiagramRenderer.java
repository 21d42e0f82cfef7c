package org.refactor.flowchart.render;

import org.refactor.flowchart.graph.GraphStore;
import org.refactor.flowchart.graph.Scope;
import org.refactor.flowchart.post.CollapsedSubgraph;

import java.util.Map;

/**
 * 把处理完的图输出成图表文本
 */
public interface DiagramRenderer {

    String id();

    /**
     * @param collapsed 折叠的作用域，没有时传空 Map
     */
    String render(GraphStore store, Map<Scope, CollapsedSubgraph> collapsed);
}
