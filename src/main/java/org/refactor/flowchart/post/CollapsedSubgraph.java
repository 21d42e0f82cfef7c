package org.refactor.flowchart.post;

import org.refactor.flowchart.graph.Scope;

import java.util.List;
import java.util.Objects;

/**
 * 一个被折叠的作用域。
 *
 * @param scope           折叠的作用域
 * @param nodeCount       吸收的节点总数（含嵌套作用域）
 * @param displayName     子图标题，如 "Function: f() (6 nodes)"
 * @param placeholderId   占位节点 id
 * @param absorbedNodeIds 被删除的节点 id，已排序
 * @param absorbedScopes  一并吸收的嵌套作用域
 */
public record CollapsedSubgraph(Scope scope, int nodeCount, String displayName, String placeholderId,
                                List<String> absorbedNodeIds, List<Scope> absorbedScopes) {

    public CollapsedSubgraph {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(placeholderId, "placeholderId");
        absorbedNodeIds = List.copyOf(absorbedNodeIds);
        absorbedScopes = List.copyOf(absorbedScopes);
    }
}
