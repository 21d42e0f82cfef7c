package org.refactor.flowchart.post;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.refactor.flowchart.config.ViewMode;
import org.refactor.flowchart.graph.*;

import static org.assertj.core.api.Assertions.assertThat;

class ViewModeFilterTest {

    private GraphStore store;

    @BeforeEach
    void setUp() {
        // start -> if -True-> print -> call -> end, if -False-> end
        store = new GraphStore();
        store.setStartId("start");
        store.setEndId("finish");
        add("start", "Start", NodeShape.START, NodeRole.TERMINAL, Scope.MAIN);
        add("finish", "End", NodeShape.END, NodeRole.TERMINAL, Scope.MAIN);
        add("cond", "if ready", NodeShape.CONDITION, NodeRole.CONTROL, Scope.MAIN);
        add("log", "print(`go`)", NodeShape.STATEMENT, NodeRole.PRINT, Scope.MAIN);
        add("work", "Call: work()", NodeShape.CALL, NodeRole.CALL, Scope.MAIN);
        store.addEdge(new Edge("start", "cond", null));
        store.addEdge(new Edge("cond", "log", "True"));
        store.addEdge(new Edge("log", "work", null));
        store.addEdge(new Edge("work", "finish", null));
        store.addEdge(new Edge("cond", "finish", "False"));
    }

    private void add(String id, String text, NodeShape shape, NodeRole role, Scope scope) {
        store.addNode(new FlowNode(id, text, shape, role, scope, 0));
    }

    @Test
    void detailedKeepsEverything() {
        ViewModeFilter.apply(store, ViewMode.DETAILED);

        assertThat(store.size()).isEqualTo(5);
        assertThat(store.edges()).hasSize(5);
    }

    @Test
    void compactHidesPrintsAndKeepsBranchLabel() {
        ViewModeFilter.apply(store, ViewMode.COMPACT);

        assertThat(store.contains("log")).isFalse();
        assertThat(store.edges()).containsExactly(
                new Edge("start", "cond", null),
                new Edge("cond", "work", "True"),
                new Edge("work", "finish", null),
                new Edge("cond", "finish", "False"));
    }

    @Test
    void compactHidesConstructorBodies() {
        add("init", "Constructor: __init__()", NodeShape.CALL, NodeRole.CALL, new Scope.Method("Box", "__init__"));
        store.addEdge(new Edge("work", "init", null));
        store.addEdge(new Edge("init", "work", "Return"));

        ViewModeFilter.apply(store, ViewMode.COMPACT);

        assertThat(store.contains("init")).isFalse();
        // 收缩后的自环不保留
        assertThat(store.edges()).noneMatch(e -> e.from().equals(e.to()));
    }

    @Test
    void terseKeepsOnlyCallsAndTerminals() {
        ViewModeFilter.apply(store, ViewMode.TERSE);

        assertThat(store.nodes()).extracting(FlowNode::id).containsExactlyInAnyOrder("start", "finish", "work");
        assertThat(store.edges()).containsExactlyInAnyOrder(
                new Edge("start", "work", "True"),
                new Edge("start", "finish", "False"),
                new Edge("work", "finish", null));
    }

    @Test
    void placeholdersSurviveTerseView() {
        add("collapsed_helper_7", "Collapsed nodes (7)", NodeShape.STATEMENT, NodeRole.PLACEHOLDER,
                new Scope.Function("helper"));
        store.addEdge(new Edge("work", "collapsed_helper_7", null));

        ViewModeFilter.apply(store, ViewMode.TERSE);

        assertThat(store.contains("collapsed_helper_7")).isTrue();
    }
}
