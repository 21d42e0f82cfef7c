package org.refactor.flowchart.graph;

/**
 * 节点在流程中的语义角色。形状决定怎么画，角色决定合并、视图过滤时怎么处理。
 */
public enum NodeRole {
    /** 条件、循环、合并 */
    CONTROL,
    STATEMENT,
    PRINT,
    /** 不含调用的简单赋值 */
    ASSIGNMENT,
    CALL,
    RETURN,
    IMPORT,
    /** try / except / raise / assert 等异常相关脚手架 */
    EXCEPTION,
    /** 错误、警告节点 */
    DIAGNOSTIC,
    NOOP,
    /** 折叠子图后的占位节点 */
    PLACEHOLDER,
    /** Start / End / Exit */
    TERMINAL;

    /** 可以合并进上一个节点文字里的角色 */
    public boolean consolidable() {
        return this == PRINT || this == ASSIGNMENT;
    }

    /** compact 视图下隐藏的角色 */
    public boolean noise() {
        return this == PRINT || this == IMPORT || this == EXCEPTION || this == DIAGNOSTIC || this == NOOP;
    }

    /** terse 视图下保留的角色 */
    public boolean keptInTerseView() {
        return this == TERMINAL || this == CALL || this == RETURN || this == PLACEHOLDER;
    }
}
