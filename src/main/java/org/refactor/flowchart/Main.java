package org.refactor.flowchart;

import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.entry.EntryPoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 命令行入口：读取 JSON 语法树（和可选的 JSON 配置），
 * 依次输出 Mermaid 文本和元数据 JSON。
 * <p>
 * 用法：{@code Main <syntax-tree.json> [config.json] [source-path]}
 */
public class Main {

    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            System.err.println("Usage: Main <syntax-tree.json> [config.json] [source-path]");
            System.exit(2);
        }
        String tree = Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);
        FlowchartConfig config = args.length > 1
                ? FlowchartConfig.fromJson(Files.readString(Path.of(args[1]), StandardCharsets.UTF_8))
                : FlowchartConfig.defaults();
        EntryPoint entry = EntryPoint.file(args.length > 2 ? args[2] : args[0]);

        FlowchartResult result = new FlowchartGenerator(config).generate(tree, entry);
        System.out.println(result.diagram());
        System.out.println(result.metadataJson());
    }
}
