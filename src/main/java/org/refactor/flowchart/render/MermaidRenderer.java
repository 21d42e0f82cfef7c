package org.refactor.flowchart.render;

import org.refactor.flowchart.graph.*;
import org.refactor.flowchart.post.CollapsedSubgraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 输出 Mermaid 流程图：
 * 先是全部节点声明，再按作用域层级输出嵌套的 subgraph，最后按创建顺序输出边。
 * 同样的图总是得到同样的文本。
 */
public class MermaidRenderer implements DiagramRenderer {

    private static final Logger log = LoggerFactory.getLogger(MermaidRenderer.class);

    private static final String INDENT = "    ";

    @Override
    public String id() {
        return "mermaid";
    }

    @Override
    public String render(GraphStore store, Map<Scope, CollapsedSubgraph> collapsed) {
        StringBuilder out = new StringBuilder("graph TD\n");
        for (FlowNode node : store.nodes()) {
            out.append(INDENT).append(declaration(node)).append('\n');
        }

        Set<Scope> absorbed = new HashSet<>();
        collapsed.values().forEach(c -> absorbed.addAll(c.absorbedScopes()));
        SubgraphWriter writer = new SubgraphWriter(store, collapsed, absorbed);
        // 主流程的子作用域放在最外层，然后是类（方法嵌在类里），最后是其余函数
        for (Scope child : store.childScopes(Scope.MAIN)) {
            writer.write(child, 1, out);
        }
        List<Scope> roots = store.rootScopes();
        for (Scope root : roots) {
            if (root instanceof Scope.ClassScope) {
                writer.write(root, 1, out);
            }
        }
        for (Scope root : roots) {
            if (!(root instanceof Scope.Main)) {
                writer.write(root, 1, out);
            }
        }

        for (Edge edge : store.edges()) {
            if (!store.contains(edge.from()) || !store.contains(edge.to())) {
                log.warn("Skipping edge {} -> {}: endpoint not declared", edge.from(), edge.to());
                continue;
            }
            out.append(INDENT).append(edgeLine(edge)).append('\n');
        }
        return out.toString();
    }

    static String declaration(FlowNode node) {
        NodeShape shape = node.shape();
        return node.id() + shape.open() + escape(node.text()) + shape.close();
    }

    static String edgeLine(Edge edge) {
        String arrow = edge.kind() == Edge.Kind.BIDIRECTIONAL ? "<-->" : "-->";
        if (edge.hasLabel()) {
            return edge.from() + " " + arrow + "|" + escape(edge.label()) + "| " + edge.to();
        }
        return edge.from() + " " + arrow + " " + edge.to();
    }

    /** 双引号换成单引号，尖括号转义，换行转成 {@code <br/>} */
    public static String escape(String text) {
        return text.replace("\"", "'")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\n", "<br/>");
    }

    /**
     * 深度优先输出子图，每个作用域只输出一次，空作用域不输出
     */
    private static final class SubgraphWriter {
        private final GraphStore store;
        private final Map<Scope, CollapsedSubgraph> collapsed;
        private final Set<Scope> absorbed;
        private final Set<Scope> visited = new HashSet<>();

        SubgraphWriter(GraphStore store, Map<Scope, CollapsedSubgraph> collapsed, Set<Scope> absorbed) {
            this.store = store;
            this.collapsed = collapsed;
            this.absorbed = absorbed;
        }

        void write(Scope scope, int depth, StringBuilder out) {
            if (scope instanceof Scope.Main || absorbed.contains(scope) || !visited.add(scope)) {
                return;
            }
            String indent = INDENT.repeat(depth);
            CollapsedSubgraph subgraph = collapsed.get(scope);
            if (subgraph != null) {
                if (!store.contains(subgraph.placeholderId())) {
                    return;
                }
                out.append(indent).append(header(scope, subgraph.displayName())).append('\n');
                out.append(indent).append(INDENT).append(subgraph.placeholderId()).append('\n');
                out.append(indent).append("end\n");
                return;
            }

            List<String> own = store.nodesInScope(scope);
            StringBuilder nested = new StringBuilder();
            for (Scope child : store.childScopes(scope)) {
                write(child, depth + 1, nested);
            }
            if (own.isEmpty() && nested.length() == 0) {
                return;
            }
            out.append(indent).append(header(scope, scope.displayName(store.subgraphNodeCount(scope)))).append('\n');
            for (String id : own) {
                out.append(indent).append(INDENT).append(id).append('\n');
            }
            out.append(nested);
            out.append(indent).append("end\n");
        }

        private static String header(Scope scope, String title) {
            return "subgraph sg_" + scope.id() + "[\"" + escape(title) + "\"]";
        }
    }
}
