package org.refactor.flowchart;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.refactor.flowchart.ast.Module;
import org.refactor.flowchart.ast.Statement;
import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.config.ViewMode;
import org.refactor.flowchart.entry.EntryPoint;
import org.refactor.flowchart.render.DiagramMetadata;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.refactor.flowchart.SyntaxTrees.*;

class FlowchartGeneratorTest {

    private static final Pattern DECLARATION = Pattern.compile("^ {4}([A-Za-z_][\\w]*)[\\[{(].*");
    private static final Pattern EDGE = Pattern.compile("^ {4}(\\S+) (-->|<-->)(\\|[^|]*\\|)? (\\S+)$");

    private static String demo() throws IOException {
        try (InputStream in = FlowchartGeneratorTest.class.getResourceAsStream("/trees/demo.json")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static Set<String> declaredIds(String diagram) {
        Set<String> ids = new HashSet<>();
        for (String line : diagram.lines().collect(Collectors.toList())) {
            Matcher matcher = DECLARATION.matcher(line);
            if (matcher.matches() && !line.contains("-->")) {
                ids.add(matcher.group(1));
            }
        }
        return ids;
    }

    @Test
    void everyEdgeEndpointIsDeclared() throws IOException {
        String diagram = new FlowchartGenerator(FlowchartConfig.defaults()).generate(demo()).diagram();

        assertThat(diagram).startsWith("graph TD\n");
        Set<String> ids = declaredIds(diagram);
        List<String> edges = diagram.lines().filter(l -> l.contains("-->")).collect(Collectors.toList());
        assertThat(edges).isNotEmpty();
        for (String edge : edges) {
            Matcher matcher = EDGE.matcher(edge);
            assertThat(matcher.matches()).as(edge).isTrue();
            assertThat(ids).as(edge).contains(matcher.group(1), matcher.group(4));
        }
    }

    @Test
    void nestsFunctionAndClassSubgraphs() throws IOException {
        FlowchartResult result = new FlowchartGenerator(FlowchartConfig.defaults()).generate(demo());

        assertThat(result.diagram())
                .contains("subgraph sg_greet[\"Function: greet()")
                .contains("subgraph sg_class_Counter[\"Class: Counter")
                .contains("subgraph sg_class_Counter_increment[\"Method: increment")
                .contains("<-->|Call and Return|")
                .contains("Unsupported Node: Match");
        DiagramMetadata metadata = result.metadata();
        assertThat(metadata.expandedSubgraphs).containsKeys("greet", "class_Counter___init__",
                "class_Counter_increment");
        assertThat(metadata.collapsedSubgraphs).isEmpty();
        int methodNodes = metadata.expandedSubgraphs.get("class_Counter___init__").nodeCount
                + metadata.expandedSubgraphs.get("class_Counter_increment").nodeCount;
        assertThat(metadata.expandedSubgraphs.get("class_Counter").nodeCount).isEqualTo(methodNodes).isPositive();
        assertThat(result.diagram())
                .contains("subgraph sg_class_Counter[\"Class: Counter (" + methodNodes + " nodes)\"]");
        assertThat(metadata.nameToLineMap).containsEntry("greet", 3).containsEntry("Counter.increment", 11);
    }

    @Test
    void forcedCollapseShowsPlaceholder() throws IOException {
        FlowchartConfig config = FlowchartConfig.defaults().setForceCollapseList(List.of("greet"));

        FlowchartResult result = new FlowchartGenerator(config).generate(demo());

        assertThat(result.diagram()).contains("Collapsed nodes (");
        assertThat(result.diagram()).doesNotContain("print(`Hello`, name)");
        assertThat(result.metadata().collapsedSubgraphs).containsKey("greet");
        assertThat(result.metadata().subgraphStatusMap).containsEntry("greet", DiagramMetadata.COLLAPSED);
        assertThat(result.metadata().collapsedSubgraphs.get("greet").placeholderId).startsWith("collapsed_greet_");
    }

    @Test
    void functionEntryDescribesSelection() throws IOException {
        FlowchartResult result = new FlowchartGenerator(FlowchartConfig.defaults())
                .generate(demo(), EntryPoint.function("greet").withFilePath("demo.py"));

        DiagramMetadata.EntrySelection selection = result.metadata().entrySelection;
        assertThat(selection.type).isEqualTo("function");
        assertThat(selection.name).isEqualTo("greet");
        assertThat(selection.lineOffset).isEqualTo(3);
        assertThat(result.metadata().filePath).isEqualTo("demo.py");
        assertThat(result.diagram()).contains("Call: greet()").doesNotContain("Call: c.increment()");
    }

    @Test
    void terseViewKeepsCalls() throws IOException {
        FlowchartResult result = new FlowchartGenerator(FlowchartConfig.defaults().setViewMode(ViewMode.TERSE))
                .generate(demo());

        assertThat(result.diagram())
                .contains("Call: greet('world')")
                .doesNotContain("print(`Hello`, name)")
                .doesNotContain("import os");
    }

    @Test
    void functionNamedMainIsItsOwnSubgraph() {
        List<Statement> body = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            body.add(assign(2 + i, "v" + i, num(i)));
        }
        Module module = module(
                new Statement.FunctionDef(1, "main", List.of(), body),
                ifThen(10, compare(name("__name__"), "==", str("__main__")), expr(11, call("main"))));
        FlowchartConfig config = FlowchartConfig.defaults().setMaxSubgraphNodes(5).setMergeCommonNodes(false);

        FlowchartResult result = new FlowchartGenerator(config).generate(module, EntryPoint.file(null));

        assertThat(result.diagram()).contains("subgraph sg_main[\"Function: main() (7 nodes)\"]")
                .contains("collapsed_main_7")
                .doesNotContain("v0 = 0");
        assertThat(result.metadata().collapsedSubgraphs).containsOnlyKeys("main");
        assertThat(result.metadata().subgraphStatusMap).containsEntry("main", DiagramMetadata.COLLAPSED);
    }

    @Test
    void malformedTreeRendersErrorNode() {
        FlowchartResult result = new FlowchartGenerator(FlowchartConfig.defaults()).generate("{\"_type\": ");

        assertThat(result.diagram()).startsWith("graph TD\n    error[\"Error: Malformed syntax tree JSON");
        assertThat(result.diagram().lines().count()).isEqualTo(2);
        assertThat(result.metadata().allSubgraphs).isEmpty();
    }

    @Test
    void wrongRootRendersErrorNode() {
        FlowchartResult result = new FlowchartGenerator(FlowchartConfig.defaults())
                .generate("{\"_type\": \"Expression\"}");

        assertThat(result.diagram()).contains("error[\"Error: Syntax tree root must be a Module, got Expression\"]");
    }

    @Test
    void metadataJsonUsesSnakeCaseKeys() throws IOException {
        FlowchartResult result = new FlowchartGenerator(FlowchartConfig.defaults())
                .generate(demo(), EntryPoint.file("demo.py"));

        JsonObject json = JsonParser.parseString(result.metadataJson()).getAsJsonObject();
        assertThat(json.keySet()).contains("collapsed_subgraphs", "expanded_subgraphs", "subgraph_status_map",
                "all_subgraphs", "file_path", "name_to_line_map", "entry_selection");
        assertThat(json.getAsJsonObject("entry_selection").get("type").getAsString()).isEqualTo("file");
        assertThat(json.getAsJsonObject("subgraph_status_map").get("greet").getAsString())
                .isEqualTo(DiagramMetadata.EXPANDED);
        JsonObject greet = json.getAsJsonObject("expanded_subgraphs").getAsJsonObject("greet");
        assertThat(greet.get("display_name").getAsString()).startsWith("Function: greet() (");
        assertThat(greet.get("node_count").getAsInt()).isPositive();
    }
}
