package org.refactor.flowchart.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FlowchartConfigTest {

    @Test
    void defaultsShowEverything() {
        FlowchartConfig config = FlowchartConfig.defaults();

        assertThat(config.isShowPrints()).isTrue();
        assertThat(config.isShowClasses()).isTrue();
        assertThat(config.isMergeCommonNodes()).isTrue();
        assertThat(config.isSequentialFlow()).isFalse();
        assertThat(config.getMaxNodes()).isEqualTo(FlowchartConfig.DEFAULT_MAX_NODES);
        assertThat(config.getMaxNestingDepth()).isEqualTo(FlowchartConfig.DEFAULT_MAX_NESTING_DEPTH);
        assertThat(config.getMaxSubgraphNodes()).isEqualTo(FlowchartConfig.DEFAULT_MAX_SUBGRAPH_NODES);
        assertThat(config.getViewMode()).isEqualTo(ViewMode.DETAILED);
        assertThat(config.getSubgraphWhitelist()).isEmpty();
    }

    @Test
    void readsSnakeCaseOptions() {
        FlowchartConfig config = FlowchartConfig.fromJson("{"
                + "\"show_prints\": false,"
                + "\"max_nodes\": 40,"
                + "\"max_subgraph_nodes\": 8,"
                + "\"subgraph_whitelist\": [\"main\", \"Db\"],"
                + "\"force_collapse_list\": \"helper, class_Cache\","
                + "\"sequential_flow\": \"yes\","
                + "\"highlight_lines\": [3, 7]"
                + "}");

        assertThat(config.isShowPrints()).isFalse();
        assertThat(config.getMaxNodes()).isEqualTo(40);
        assertThat(config.getMaxSubgraphNodes()).isEqualTo(8);
        assertThat(config.getSubgraphWhitelist()).containsExactlyInAnyOrder("main", "Db");
        assertThat(config.getForceCollapseList()).containsExactlyInAnyOrder("helper", "class_Cache");
        assertThat(config.isSequentialFlow()).isTrue();
        assertThat(config.getHighlightLines()).containsExactly(3, 7);
    }

    @Test
    void showLoopsSetsBothLoopKinds() {
        FlowchartConfig config = FlowchartConfig.fromOptions(Map.of("show_loops", false));

        assertThat(config.isShowForLoops()).isFalse();
        assertThat(config.isShowWhileLoops()).isFalse();
    }

    @Test
    void viewModeAcceptsAliases() {
        assertThat(FlowchartConfig.fromOptions(Map.of("view_mode", "calls")).getViewMode()).isEqualTo(ViewMode.TERSE);
        assertThat(FlowchartConfig.fromOptions(Map.of("view_mode", "Simple")).getViewMode())
                .isEqualTo(ViewMode.COMPACT);
        assertThat(FlowchartConfig.fromOptions(Map.of("view_mode", "sideways")).getViewMode())
                .isEqualTo(ViewMode.DETAILED);
    }

    @Test
    void malformedValuesKeepDefaults() {
        FlowchartConfig config = FlowchartConfig.fromOptions(Map.of(
                "max_nodes", 1,
                "max_nesting_depth", "deep",
                "show_imports", "maybe",
                "not_an_option", true,
                "highlight_lines", List.of("4", "x", "")));

        assertThat(config.getMaxNodes()).isEqualTo(FlowchartConfig.DEFAULT_MAX_NODES);
        assertThat(config.getMaxNestingDepth()).isEqualTo(FlowchartConfig.DEFAULT_MAX_NESTING_DEPTH);
        assertThat(config.isShowImports()).isTrue();
        assertThat(config.getHighlightLines()).containsExactly(4);
    }

    @Test
    void malformedJsonFallsBackToDefaults() {
        FlowchartConfig config = FlowchartConfig.fromJson("{\"max_nodes\": ");

        assertThat(config.getMaxNodes()).isEqualTo(FlowchartConfig.DEFAULT_MAX_NODES);
        assertThat(FlowchartConfig.fromJson(null).isShowPrints()).isTrue();
    }

    @Test
    void gsonNumbersAreAcceptedAsIntegers() {
        // Gson 把所有数字读成 double
        FlowchartConfig config = FlowchartConfig.fromJson("{\"max_nesting_depth\": 3.0, \"max_nodes\": 2.5}");

        assertThat(config.getMaxNestingDepth()).isEqualTo(3);
        assertThat(config.getMaxNodes()).isEqualTo(FlowchartConfig.DEFAULT_MAX_NODES);
    }
}
