package org.refactor.flowchart.graph;

/**
 * 节点形状，对应 Mermaid 的节点定界符
 */
public enum NodeShape {
    START("[", "]"),
    END("[", "]"),
    CONDITION("{\"", "\"}"),
    LOOP("{{\"", "\"}}"),
    // 合并/旁路节点，没有文字
    MERGE("{{", "}}"),
    STATEMENT("[\"", "\"]"),
    CALL("[[\"", "\"]]"),
    IMPORT("[/\"", "\"\\]"),
    EXCEPTION("[[\"", "\"]]"),
    TRY("{\"", "\"}"),
    FINALLY("[/\"", "\"\\]"),
    EXIT("[/\"", "\"\\]");

    private final String open;
    private final String close;

    NodeShape(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }
}
