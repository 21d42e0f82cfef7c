package org.refactor.flowchart.render;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.refactor.flowchart.graph.*;
import org.refactor.flowchart.post.CollapsedSubgraph;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MermaidRendererTest {

    private static final Scope.Function HELPER = new Scope.Function("helper");
    private static final Scope.Method RUN = new Scope.Method("Tool", "run");

    private final MermaidRenderer renderer = new MermaidRenderer();
    private GraphStore store;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        store.setStartId("start");
        store.setEndId("finish");
        add("start", "Start", NodeShape.START, Scope.MAIN);
        add("finish", "End", NodeShape.END, Scope.MAIN);
        add("call1", "Call: helper()", NodeShape.CALL, Scope.MAIN);
        add("h1", "x = \"a\"", NodeShape.STATEMENT, HELPER);
        add("m1", "Method: run()", NodeShape.CALL, RUN);
        store.addChildScope(Scope.MAIN, HELPER);
        store.addEdge(new Edge("start", "call1", null));
        store.addEdge(new Edge("call1", "h1", null));
        store.addEdge(new Edge("h1", "finish", null));
        store.addEdge(new Edge("call1", "m1", "Call and Return", Edge.Kind.BIDIRECTIONAL));
    }

    private void add(String id, String text, NodeShape shape, Scope scope) {
        store.addNode(new FlowNode(id, text, shape, NodeRole.STATEMENT, scope, 0));
    }

    @Test
    void rendersNodesSubgraphsAndEdges() {
        String diagram = renderer.render(store, Map.of());

        assertThat(diagram).isEqualTo(String.join("\n",
                "graph TD",
                "    start[Start]",
                "    finish[End]",
                "    call1[[\"Call: helper()\"]]",
                "    h1[\"x = 'a'\"]",
                "    m1[[\"Method: run()\"]]",
                "    subgraph sg_helper[\"Function: helper() (1 nodes)\"]",
                "        h1",
                "    end",
                "    subgraph sg_class_Tool[\"Class: Tool (1 nodes)\"]",
                "        subgraph sg_class_Tool_run[\"Method: run (1 nodes)\"]",
                "            m1",
                "        end",
                "    end",
                "    start --> call1",
                "    call1 --> h1",
                "    h1 --> finish",
                "    call1 <-->|Call and Return| m1",
                ""));
    }

    @Test
    void edgesWithMissingEndpointsAreSkipped() {
        store.addEdge(new Edge("h1", "ghost", "True"));

        String diagram = renderer.render(store, Map.of());

        assertThat(diagram).doesNotContain("ghost");
    }

    @Test
    void collapsedScopeShowsOnlyPlaceholder() {
        store.removeNode("h1");
        store.addNode(new FlowNode("collapsed_helper_4", "Collapsed nodes (4)", NodeShape.STATEMENT,
                NodeRole.PLACEHOLDER, HELPER, 0));
        CollapsedSubgraph subgraph = new CollapsedSubgraph(HELPER, 4, HELPER.displayName(4), "collapsed_helper_4",
                List.of("h1", "h2", "h3", "h4"), List.of());

        String diagram = renderer.render(store, Map.of(HELPER, subgraph));

        assertThat(diagram).contains(
                "    subgraph sg_helper[\"Function: helper() (4 nodes)\"]\n"
                        + "        collapsed_helper_4\n"
                        + "    end\n");
        assertThat(diagram).contains("    collapsed_helper_4[\"Collapsed nodes (4)\"]\n");
    }

    @Test
    void subgraphBlocksAreBalanced() {
        String diagram = renderer.render(store, Map.of());

        long opened = diagram.lines().filter(l -> l.trim().startsWith("subgraph ")).count();
        long closed = diagram.lines().filter(l -> l.trim().equals("end")).count();
        assertThat(opened).isEqualTo(closed).isEqualTo(3);
    }

    @Test
    void escapeReplacesQuotesBracketsAndNewlines() {
        assertThat(MermaidRenderer.escape("say \"hi\" <b>\nbye")).isEqualTo("say 'hi' &lt;b&gt;<br/>bye");
    }

    @Test
    void rendererIdIsMermaid() {
        assertThat(renderer.id()).isEqualTo("mermaid");
    }
}
