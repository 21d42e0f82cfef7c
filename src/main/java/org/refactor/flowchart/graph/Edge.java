package org.refactor.flowchart.graph;

import java.util.Objects;

/**
 * 有向边。label 可以为 null；BIDIRECTIONAL 表示 "调用并返回"。
 */
public record Edge(String from, String to, String label, Kind kind) {

    public enum Kind {
        ONE_WAY,
        BIDIRECTIONAL
    }

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(kind, "kind");
        if (label != null && label.isEmpty()) {
            label = null;
        }
    }

    public Edge(String from, String to, String label) {
        this(from, to, label, Kind.ONE_WAY);
    }

    public boolean hasLabel() {
        return label != null;
    }

    public Edge withEndpoints(String newFrom, String newTo) {
        return new Edge(newFrom, newTo, label, kind);
    }

    public Edge withLabel(String newLabel) {
        return new Edge(from, to, newLabel, kind);
    }

    /** 去重用的键：(from, to, label) */
    public String key() {
        return from + "\u0000" + to + "\u0000" + (label == null ? "" : label);
    }
}
