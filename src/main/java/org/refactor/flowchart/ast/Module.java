package org.refactor.flowchart.ast;

import java.util.List;

/**
 * 一个源码单元（文件）的语法树根
 */
public record Module(List<Statement> body) {
    public Module {
        body = List.copyOf(body);
    }
}
