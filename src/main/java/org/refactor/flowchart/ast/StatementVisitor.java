package org.refactor.flowchart.ast;

/**
 * 语句访问者。每种语句一个方法，新增语句类型时编译器会要求所有实现补齐。
 *
 * @param <R> 返回值类型
 * @param <A> 附加参数类型
 */
public interface StatementVisitor<R, A> {

    R visitIf(Statement.If stmt, A arg);

    R visitFor(Statement.For stmt, A arg);

    R visitWhile(Statement.While stmt, A arg);

    R visitFunctionDef(Statement.FunctionDef stmt, A arg);

    R visitClassDef(Statement.ClassDef stmt, A arg);

    R visitAssign(Statement.Assign stmt, A arg);

    R visitAugAssign(Statement.AugAssign stmt, A arg);

    R visitExpression(Statement.ExpressionStatement stmt, A arg);

    R visitReturn(Statement.Return stmt, A arg);

    R visitBreak(Statement.Break stmt, A arg);

    R visitContinue(Statement.Continue stmt, A arg);

    R visitTry(Statement.Try stmt, A arg);

    R visitRaise(Statement.Raise stmt, A arg);

    R visitWith(Statement.With stmt, A arg);

    R visitAssert(Statement.Assert stmt, A arg);

    R visitPass(Statement.Pass stmt, A arg);

    R visitImport(Statement.Import stmt, A arg);

    R visitImportFrom(Statement.ImportFrom stmt, A arg);

    R visitUnsupported(Statement.Unsupported stmt, A arg);
}
