package org.refactor.flowchart.ast;

import org.refactor.flowchart.ast.Expression.*;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * 表达式树的遍历工具
 */
public final class Expressions {

    private Expressions() {
    }

    /** 先序遍历 expr 的整棵子树（包括 expr 自己） */
    public static void walk(Expression expr, Consumer<Expression> action) {
        if (expr == null) {
            return;
        }
        action.accept(expr);
        for (Expression child : children(expr)) {
            walk(child, action);
        }
    }

    /** 子树中所有调用表达式，按先序顺序 */
    public static List<Call> calls(Expression expr) {
        List<Call> calls = new ArrayList<>();
        walk(expr, e -> {
            if (e instanceof Call call) {
                calls.add(call);
            }
        });
        return calls;
    }

    public static boolean containsCall(Expression expr) {
        return !calls(expr).isEmpty();
    }

    private static List<Expression> children(Expression expr) {
        List<Expression> children = new ArrayList<>();
        if (expr instanceof Attribute attribute) {
            children.add(attribute.value());
        } else if (expr instanceof Call call) {
            children.add(call.func());
            children.addAll(call.args());
            call.keywords().forEach(k -> children.add(k.value()));
        } else if (expr instanceof BinaryOp binaryOp) {
            children.add(binaryOp.left());
            children.add(binaryOp.right());
        } else if (expr instanceof BoolOp boolOp) {
            children.addAll(boolOp.values());
        } else if (expr instanceof UnaryOp unaryOp) {
            children.add(unaryOp.operand());
        } else if (expr instanceof Compare compare) {
            children.add(compare.left());
            children.addAll(compare.comparators());
        } else if (expr instanceof Subscript subscript) {
            children.add(subscript.value());
            children.add(subscript.slice());
        } else if (expr instanceof Collection collection) {
            children.addAll(collection.elements());
        } else if (expr instanceof DictLiteral dict) {
            dict.keys().forEach(children::add);
            children.addAll(dict.values());
        } else if (expr instanceof Lambda lambda) {
            children.add(lambda.body());
        } else if (expr instanceof Comprehension comprehension) {
            children.add(comprehension.key());
            children.add(comprehension.element());
            for (Generator generator : comprehension.generators()) {
                children.add(generator.target());
                children.add(generator.iter());
                children.addAll(generator.ifs());
            }
        } else if (expr instanceof FormattedString formatted) {
            children.addAll(formatted.parts());
        } else if (expr instanceof FormattedValue value) {
            children.add(value.value());
        } else if (expr instanceof Conditional conditional) {
            children.add(conditional.test());
            children.add(conditional.body());
            children.add(conditional.orElse());
        } else if (expr instanceof Starred starred) {
            children.add(starred.value());
        }
        children.removeIf(c -> c == null);
        return children;
    }
}
