package org.refactor.flowchart.ast;

/**
 * 输入的语法树无法读取（JSON 损坏、缺少 _type、根节点不是 Module）
 */
public class SyntaxTreeException extends Exception {

    public SyntaxTreeException(String message) {
        super(message);
    }

    public SyntaxTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
