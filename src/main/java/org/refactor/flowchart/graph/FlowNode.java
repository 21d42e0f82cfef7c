package org.refactor.flowchart.graph;

import java.util.Objects;

/**
 * 流程图中的一个节点。
 * <p>
 * 创建后只有合并相邻简单语句时会追加文字，其余不变。
 */
public class FlowNode {
    private final String id;
    private String text;
    private final NodeShape shape;
    private NodeRole role;
    private final Scope scope;      // 所属作用域
    private final int line;         // 源码行号，没有时为 0

    public FlowNode(String id, String text, NodeShape shape, NodeRole role, Scope scope, int line) {
        this.id = Objects.requireNonNull(id, "id");
        this.text = text == null ? "" : text;
        this.shape = Objects.requireNonNull(shape, "shape");
        this.role = Objects.requireNonNull(role, "role");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.line = line;
    }

    public String id() {
        return id;
    }

    public String text() {
        return text;
    }

    public NodeShape shape() {
        return shape;
    }

    public NodeRole role() {
        return role;
    }

    public Scope scope() {
        return scope;
    }

    public int line() {
        return line;
    }

    /** 没有文字的合并节点，优化阶段会被消掉 */
    public boolean isBypass() {
        return shape == NodeShape.MERGE && text.isBlank();
    }

    /**
     * 把一条简单语句合并到本节点，文字另起一行。
     * 角色不同时（print 接赋值）统一记为赋值。
     */
    public void appendLine(String line, NodeRole lineRole) {
        this.text = this.text + "\n" + line;
        if (lineRole != role) {
            this.role = NodeRole.ASSIGNMENT;
        }
    }

    /** 在文字末尾追加一行 "..."，已经有了就不重复加 */
    public void markContinued() {
        if (!text.endsWith("...")) {
            this.text = this.text + "\n...";
        }
    }

    @Override
    public String toString() {
        return id + "(" + shape + ", " + scope.id() + "): " + text;
    }
}
