package org.refactor.flowchart;

import org.refactor.flowchart.render.DiagramMetadata;

import java.util.Objects;

/**
 * 一次生成的结果：Mermaid 文本和元数据
 */
public record FlowchartResult(String diagram, DiagramMetadata metadata) {

    public FlowchartResult {
        Objects.requireNonNull(diagram, "diagram");
        Objects.requireNonNull(metadata, "metadata");
    }

    public String metadataJson() {
        return metadata.toJson();
    }
}
