package org.refactor.flowchart.ast;

import java.util.List;
import java.util.Objects;

/**
 * 语句节点。每条语句带源码行号，并通过 {@link StatementVisitor} 分发。
 */
public sealed interface Statement {

    int line();

    <R, A> R accept(StatementVisitor<R, A> visitor, A arg);

    record If(int line, Expression test, List<Statement> body, List<Statement> orElse) implements Statement {
        public If {
            Objects.requireNonNull(test, "test");
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitIf(this, arg);
        }
    }

    record For(int line, Expression target, Expression iter, List<Statement> body,
               List<Statement> orElse) implements Statement {
        public For {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitFor(this, arg);
        }
    }

    record While(int line, Expression test, List<Statement> body, List<Statement> orElse) implements Statement {
        public While {
            body = List.copyOf(body);
            orElse = List.copyOf(orElse);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitWhile(this, arg);
        }
    }

    record FunctionDef(int line, String name, List<String> params, List<Statement> body) implements Statement {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            params = List.copyOf(params);
            body = List.copyOf(body);
        }

        /** 第一个形参是否是 self（实例方法） */
        public boolean takesSelf() {
            return !params.isEmpty() && "self".equals(params.get(0));
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitFunctionDef(this, arg);
        }
    }

    record ClassDef(int line, String name, List<Expression> bases, List<Statement> body) implements Statement {
        public ClassDef {
            Objects.requireNonNull(name, "name");
            bases = List.copyOf(bases);
            body = List.copyOf(body);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitClassDef(this, arg);
        }
    }

    record Assign(int line, List<Expression> targets, Expression value) implements Statement {
        public Assign {
            targets = List.copyOf(targets);
            Objects.requireNonNull(value, "value");
        }

        /** 只有一个赋值目标时返回它，否则返回 null */
        public Expression singleTarget() {
            return targets.size() == 1 ? targets.get(0) : null;
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitAssign(this, arg);
        }
    }

    record AugAssign(int line, Expression target, String operator, Expression value) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitAugAssign(this, arg);
        }
    }

    record ExpressionStatement(int line, Expression value) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitExpression(this, arg);
        }
    }

    /** value 为 null 表示裸 return */
    record Return(int line, Expression value) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitReturn(this, arg);
        }
    }

    record Break(int line) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitBreak(this, arg);
        }
    }

    record Continue(int line) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitContinue(this, arg);
        }
    }

    record ExceptHandler(Expression type, String name, List<Statement> body) {
        public ExceptHandler {
            body = List.copyOf(body);
        }
    }

    record Try(int line, List<Statement> body, List<ExceptHandler> handlers, List<Statement> orElse,
               List<Statement> finalBody) implements Statement {
        public Try {
            body = List.copyOf(body);
            handlers = List.copyOf(handlers);
            orElse = List.copyOf(orElse);
            finalBody = List.copyOf(finalBody);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitTry(this, arg);
        }
    }

    /** exc 为 null 表示重新抛出 */
    record Raise(int line, Expression exc, Expression cause) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitRaise(this, arg);
        }
    }

    record WithItem(Expression contextExpr, Expression optionalVars) {
    }

    record With(int line, List<WithItem> items, List<Statement> body) implements Statement {
        public With {
            items = List.copyOf(items);
            body = List.copyOf(body);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitWith(this, arg);
        }
    }

    record Assert(int line, Expression test, Expression message) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitAssert(this, arg);
        }
    }

    record Pass(int line) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitPass(this, arg);
        }
    }

    record ImportAlias(String name, String asName) {
    }

    record Import(int line, List<ImportAlias> names) implements Statement {
        public Import {
            names = List.copyOf(names);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitImport(this, arg);
        }
    }

    /** module 为 null 表示相对导入 {@code from . import x} */
    record ImportFrom(int line, String module, List<ImportAlias> names) implements Statement {
        public ImportFrom {
            names = List.copyOf(names);
        }

        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitImportFrom(this, arg);
        }
    }

    /** 读取器不认识的语句类型 */
    record Unsupported(int line, String kind) implements Statement {
        @Override
        public <R, A> R accept(StatementVisitor<R, A> visitor, A arg) {
            return visitor.visitUnsupported(this, arg);
        }
    }
}
