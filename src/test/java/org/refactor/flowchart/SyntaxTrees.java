package org.refactor.flowchart;

import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Expression.*;
import org.refactor.flowchart.ast.Module;
import org.refactor.flowchart.ast.Statement;
import org.refactor.flowchart.ast.Statement.*;

import java.util.Arrays;
import java.util.List;

/**
 * 测试里手工拼语法树用的静态工厂
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    public static Module module(Statement... body) {
        return new Module(List.of(body));
    }

    public static List<Statement> body(Statement... statements) {
        return List.of(statements);
    }

    // ---- 表达式 ----

    public static Name name(String id) {
        return new Name(id);
    }

    public static Constant str(String value) {
        return new Constant(value);
    }

    public static Constant num(long value) {
        return new Constant(value);
    }

    public static Attribute attr(Expression value, String attr) {
        return new Attribute(value, attr);
    }

    public static Call call(String function, Expression... args) {
        return new Call(new Name(function), Arrays.asList(args), List.of());
    }

    public static Call callMethod(Expression receiver, String method, Expression... args) {
        return new Call(new Attribute(receiver, method), Arrays.asList(args), List.of());
    }

    public static Compare compare(Expression left, String operator, Expression right) {
        return new Compare(left, List.of(operator), List.of(right));
    }

    public static BinaryOp binary(Expression left, String operator, Expression right) {
        return new BinaryOp(left, operator, right);
    }

    // ---- 语句 ----

    public static ExpressionStatement expr(int line, Expression value) {
        return new ExpressionStatement(line, value);
    }

    public static ExpressionStatement print(int line, Expression... args) {
        return new ExpressionStatement(line, call("print", args));
    }

    public static Assign assign(int line, String target, Expression value) {
        return new Assign(line, List.of(new Name(target)), value);
    }

    public static Assign assign(int line, Expression target, Expression value) {
        return new Assign(line, List.of(target), value);
    }

    public static AugAssign augAssign(int line, String target, String operator, Expression value) {
        return new AugAssign(line, new Name(target), operator, value);
    }

    public static If ifThen(int line, Expression test, Statement... body) {
        return new If(line, test, List.of(body), List.of());
    }

    public static If ifElse(int line, Expression test, List<Statement> body, List<Statement> orElse) {
        return new If(line, test, body, orElse);
    }

    public static For forLoop(int line, String target, Expression iter, Statement... body) {
        return new For(line, new Name(target), iter, List.of(body), List.of());
    }

    public static While whileLoop(int line, Expression test, Statement... body) {
        return new While(line, test, List.of(body), List.of());
    }

    public static FunctionDef def(int line, String name, List<String> params, Statement... body) {
        return new FunctionDef(line, name, params, List.of(body));
    }

    public static ClassDef classDef(int line, String name, Statement... body) {
        return new ClassDef(line, name, List.of(), List.of(body));
    }

    public static Return ret(int line, Expression value) {
        return new Return(line, value);
    }

    public static Break brk(int line) {
        return new Break(line);
    }

    public static Continue cont(int line) {
        return new Continue(line);
    }

    public static Raise raise(int line, Expression exc) {
        return new Raise(line, exc, null);
    }

    public static Pass pass(int line) {
        return new Pass(line);
    }

    public static Import importModule(int line, String... names) {
        return new Import(line, Arrays.stream(names).map(n -> new ImportAlias(n, null)).toList());
    }
}
