package org.refactor.flowchart.post;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.entry.EntryPoint;
import org.refactor.flowchart.graph.*;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class SubgraphCollapseManagerTest {

    private static final Scope HELPER = new Scope.Function("helper");
    private static final Scope.Method QUERY = new Scope.Method("Db", "query");

    private GraphStore store;

    @BeforeEach
    void setUp() {
        store = new GraphStore();
        store.setStartId("start");
        store.setEndId("finish");
        store.addNode(new FlowNode("start", "Start", NodeShape.START, NodeRole.TERMINAL, Scope.MAIN, 0));
        store.addNode(new FlowNode("finish", "End", NodeShape.END, NodeRole.TERMINAL, Scope.MAIN, 0));
    }

    /** 在 scope 里加一串首尾相连的节点，从 from 连进来，最后连到 to */
    private void chain(Scope scope, String prefix, int count, String from, String to) {
        String previous = from;
        for (int i = 1; i <= count; i++) {
            String id = prefix + i;
            store.addNode(new FlowNode(id, "step " + i, NodeShape.STATEMENT, NodeRole.STATEMENT, scope, i));
            store.addEdge(new Edge(previous, id, null));
            previous = id;
        }
        store.addEdge(new Edge(previous, to, null));
    }

    private static SubgraphCollapseManager manager(FlowchartConfig config) {
        return new SubgraphCollapseManager(config, EntryPoint.file(null));
    }

    @Test
    void largeScopeCollapsesIntoPlaceholder() {
        store.addChildScope(Scope.MAIN, HELPER);
        chain(HELPER, "h", 6, "start", "finish");

        Map<Scope, CollapsedSubgraph> collapsed = manager(FlowchartConfig.defaults().setMaxSubgraphNodes(5))
                .collapse(store);

        CollapsedSubgraph subgraph = collapsed.get(HELPER);
        assertThat(subgraph.placeholderId()).isEqualTo("collapsed_helper_6");
        assertThat(subgraph.nodeCount()).isEqualTo(6);
        assertThat(subgraph.displayName()).isEqualTo("Function: helper() (6 nodes)");
        assertThat(store.node("collapsed_helper_6").text()).isEqualTo("Collapsed nodes (6)");
        assertThat(store.node("collapsed_helper_6").role()).isEqualTo(NodeRole.PLACEHOLDER);
        assertThat(store.nodesInScope(HELPER)).containsExactly("collapsed_helper_6");
        assertThat(store.edges()).containsExactly(
                new Edge("start", "collapsed_helper_6", null),
                new Edge("collapsed_helper_6", "finish", null));
    }

    @Test
    void smallScopeStaysExpanded() {
        store.addChildScope(Scope.MAIN, HELPER);
        chain(HELPER, "h", 5, "start", "finish");

        Map<Scope, CollapsedSubgraph> collapsed = manager(FlowchartConfig.defaults().setMaxSubgraphNodes(5))
                .collapse(store);

        assertThat(collapsed).isEmpty();
        assertThat(store.nodesInScope(HELPER)).hasSize(5);
    }

    @Test
    void mainFlowNeverCollapses() {
        chain(Scope.MAIN, "m", 10, "start", "finish");
        FlowchartConfig config = FlowchartConfig.defaults().setMaxSubgraphNodes(1)
                .setForceCollapseList(List.of("main"));

        assertThat(manager(config).shouldCollapse(Scope.MAIN, store)).isFalse();
        assertThat(manager(config).collapse(store)).isEmpty();
    }

    @Test
    void exactForceBeatsExactWhitelist() {
        FlowchartConfig config = FlowchartConfig.defaults()
                .setForceCollapseList(List.of("helper"))
                .setSubgraphWhitelist(List.of("helper"));

        assertThat(manager(config).shouldCollapse(HELPER, store)).isTrue();
    }

    @Test
    void exactWhitelistBeatsForcePattern() {
        FlowchartConfig config = FlowchartConfig.defaults()
                .setSubgraphWhitelist(List.of("class_Db_query"))
                .setForceCollapseList(List.of("Db"));

        assertThat(manager(config).shouldCollapse(QUERY, store)).isFalse();
    }

    @Test
    void forcePatternMatchesOwningClass() {
        FlowchartConfig config = FlowchartConfig.defaults().setForceCollapseList(List.of("Db"));

        assertThat(manager(config).shouldCollapse(QUERY, store)).isTrue();
        assertThat(manager(config).shouldCollapse(new Scope.ClassScope("Db"), store)).isTrue();
    }

    @Test
    void forcePatternBeatsWhitelistPattern() {
        FlowchartConfig config = FlowchartConfig.defaults()
                .setForceCollapseList(List.of("Db"))
                .setSubgraphWhitelist(List.of("Db"));

        assertThat(manager(config).shouldCollapse(QUERY, store)).isTrue();
    }

    @Test
    void whitelistPatternProtectsLargeScope() {
        chain(QUERY, "q", 10, "start", "finish");
        FlowchartConfig config = FlowchartConfig.defaults().setMaxSubgraphNodes(2)
                .setSubgraphWhitelist(List.of("Db"));

        assertThat(manager(config).shouldCollapse(QUERY, store)).isFalse();
    }

    @Test
    void callInstancesMatchPatternByFunctionName() {
        FlowchartConfig config = FlowchartConfig.defaults().setForceCollapseList(List.of("helper"));

        assertThat(manager(config).shouldCollapse(new Scope.CallInstance("helper", 2), store)).isTrue();
    }

    @Test
    void entryScopeStaysExpanded() {
        store.addChildScope(Scope.MAIN, HELPER);
        chain(HELPER, "h", 6, "start", "finish");
        SubgraphCollapseManager manager = new SubgraphCollapseManager(
                FlowchartConfig.defaults().setMaxSubgraphNodes(5), EntryPoint.function("helper"));

        assertThat(manager.shouldCollapse(HELPER, store)).isFalse();
        assertThat(manager.collapse(store)).isEmpty();
    }

    @Test
    void collapsingAbsorbsNestedScopes() {
        Scope outer = new Scope.Function("outer");
        Scope inner = new Scope.Function("inner");
        store.addChildScope(Scope.MAIN, outer);
        store.addChildScope(outer, inner);
        chain(outer, "o", 2, "start", "i1");
        chain(inner, "i", 3, "o2", "finish");
        FlowchartConfig config = FlowchartConfig.defaults().setForceCollapseList(Set.of("outer"));

        Map<Scope, CollapsedSubgraph> collapsed = manager(config).collapse(store);

        assertThat(collapsed).containsOnlyKeys(outer);
        CollapsedSubgraph subgraph = collapsed.get(outer);
        assertThat(subgraph.nodeCount()).isEqualTo(5);
        assertThat(subgraph.absorbedScopes()).containsExactly(inner);
        assertThat(store.nodesInScope(inner)).isEmpty();
        assertThat(store.edges()).containsExactly(
                new Edge("start", "collapsed_outer_5", null),
                new Edge("collapsed_outer_5", "finish", null));
    }
}
