package org.refactor.flowchart.build;

import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Expression.Call;
import org.refactor.flowchart.ast.Expression.Constant;
import org.refactor.flowchart.ast.ExpressionPrinter;
import org.refactor.flowchart.ast.Statement.FunctionDef;

import java.math.BigInteger;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 节点文字的拼装规则
 */
final class NodeText {

    static final int MAX_TEXT = 80;
    static final int MAX_CONDITION = 30;
    static final String HIGHLIGHT = "🔴 ";

    private static final Set<String> EXIT_CALLS = Set.of("sys.exit", "os._exit", "exit", "quit");

    private NodeText() {
    }

    static String truncate(String text, int max) {
        if (text.length() > max) {
            return text.substring(0, max - 3) + "...";
        }
        return text;
    }

    static String of(Expression expr) {
        return ExpressionPrinter.print(expr);
    }

    static String condition(Expression test) {
        return "if " + truncate(of(test), MAX_CONDITION);
    }

    /** print 语句：引号换成反引号，避免和图语法冲突 */
    static String print(Call call) {
        return of(call).replace('\'', '`').replace('"', '`');
    }

    static boolean isPrint(Expression expr) {
        return expr instanceof Call call && "print".equals(call.simpleName());
    }

    static boolean isExit(Call call) {
        String name = call.simpleName();
        if (name == null && call.func() instanceof Expression.Attribute attribute
                && attribute.value() instanceof Expression.Name module) {
            name = module.id() + "." + attribute.attr();
        }
        return name != null && EXIT_CALLS.contains(name);
    }

    static boolean isDocstring(Expression expr) {
        return expr instanceof Constant constant && constant.value() instanceof String;
    }

    /** 方法子图入口节点文字，形参不含 self */
    static String methodLabel(FunctionDef method) {
        List<String> params = method.takesSelf()
                ? method.params().subList(1, method.params().size())
                : method.params();
        String args = String.join(", ", params);
        if ("__init__".equals(method.name())) {
            return "Constructor: __init__(" + args + ")";
        }
        return "Method: " + method.name() + "(" + args + ")";
    }

    /**
     * 集合字面量赋值的摘要：x = List[int, str]，元素类型去重排序。
     * 不是集合字面量时返回 null。
     */
    static String collectionSummary(String target, Expression value) {
        List<Expression> elements;
        String typeName;
        if (value instanceof Expression.Collection collection) {
            elements = collection.elements();
            typeName = collection.kind().typeName();
        } else if (value instanceof Expression.DictLiteral dict) {
            elements = dict.values();
            typeName = Expression.CollectionKind.DICT.typeName();
        } else {
            return null;
        }
        Set<String> elementTypes = new TreeSet<>();
        for (Expression element : elements) {
            String name = typeName(element);
            if (name != null) {
                elementTypes.add(name);
            }
        }
        if (elementTypes.isEmpty()) {
            return target + " = " + typeName;
        }
        return target + " = " + typeName + "[" + String.join(", ", elementTypes) + "]";
    }

    private static String typeName(Expression expr) {
        if (expr instanceof Expression.Collection collection) {
            return collection.kind().typeName();
        }
        if (expr instanceof Expression.DictLiteral) {
            return Expression.CollectionKind.DICT.typeName();
        }
        if (expr instanceof Constant constant) {
            Object v = constant.value();
            if (v == null) {
                return "NoneType";
            }
            if (v instanceof Boolean) {
                return "bool";
            }
            if (v instanceof Long || v instanceof Integer || v instanceof BigInteger) {
                return "int";
            }
            if (v instanceof Number) {
                return "float";
            }
            return "str";
        }
        return null;
    }
}
