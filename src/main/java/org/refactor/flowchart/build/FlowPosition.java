package org.refactor.flowchart.build;

import org.refactor.flowchart.graph.Scope;

/**
 * 访问一条语句时的位置：前驱节点和当前作用域
 */
record FlowPosition(String current, Scope scope) {
}
