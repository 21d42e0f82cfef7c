package org.refactor.flowchart.ast;

import org.refactor.flowchart.ast.Expression.*;

import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * 把表达式还原成类 Python 源码文本，按运算符优先级补括号。
 */
public final class ExpressionPrinter {

    private static final int LAMBDA = 0;
    private static final int CONDITIONAL = 1;
    private static final int OR = 2;
    private static final int AND = 3;
    private static final int NOT = 4;
    private static final int COMPARE = 5;
    private static final int UNARY = 12;
    private static final int POWER = 13;
    private static final int ATOM = 15;

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("|", 6),
            Map.entry("^", 7),
            Map.entry("&", 8),
            Map.entry("<<", 9),
            Map.entry(">>", 9),
            Map.entry("+", 10),
            Map.entry("-", 10),
            Map.entry("*", 11),
            Map.entry("/", 11),
            Map.entry("//", 11),
            Map.entry("%", 11),
            Map.entry("@", 11),
            Map.entry("**", POWER)
    );

    private ExpressionPrinter() {
    }

    public static String print(Expression expr) {
        if (expr == null) {
            return "";
        }
        return print(expr, LAMBDA);
    }

    private static String print(Expression expr, int minPrecedence) {
        int precedence = precedenceOf(expr);
        String text = render(expr);
        return precedence < minPrecedence ? "(" + text + ")" : text;
    }

    private static int precedenceOf(Expression expr) {
        if (expr instanceof Lambda) {
            return LAMBDA;
        }
        if (expr instanceof Conditional) {
            return CONDITIONAL;
        }
        if (expr instanceof BoolOp boolOp) {
            return "or".equals(boolOp.operator()) ? OR : AND;
        }
        if (expr instanceof UnaryOp unaryOp) {
            return "not".equals(unaryOp.operator()) ? NOT : UNARY;
        }
        if (expr instanceof Compare) {
            return COMPARE;
        }
        if (expr instanceof BinaryOp binaryOp) {
            return BINARY_PRECEDENCE.getOrDefault(binaryOp.operator(), 10);
        }
        return ATOM;
    }

    private static String render(Expression expr) {
        if (expr instanceof Name name) {
            return name.id();
        }
        if (expr instanceof Constant constant) {
            return constant(constant.value());
        }
        if (expr instanceof Attribute attribute) {
            return print(attribute.value(), ATOM) + "." + attribute.attr();
        }
        if (expr instanceof Call call) {
            StringJoiner joiner = new StringJoiner(", ", print(call.func(), ATOM) + "(", ")");
            call.args().forEach(a -> joiner.add(print(a, LAMBDA)));
            for (Keyword keyword : call.keywords()) {
                String value = print(keyword.value(), LAMBDA);
                joiner.add(keyword.arg() == null ? "**" + value : keyword.arg() + "=" + value);
            }
            return joiner.toString();
        }
        if (expr instanceof BinaryOp binaryOp) {
            int p = precedenceOf(binaryOp);
            boolean rightAssociative = "**".equals(binaryOp.operator());
            String left = print(binaryOp.left(), rightAssociative ? p + 1 : p);
            String right = print(binaryOp.right(), rightAssociative ? p : p + 1);
            return left + " " + binaryOp.operator() + " " + right;
        }
        if (expr instanceof BoolOp boolOp) {
            int p = precedenceOf(boolOp);
            StringJoiner joiner = new StringJoiner(" " + boolOp.operator() + " ");
            boolOp.values().forEach(v -> joiner.add(print(v, p + 1)));
            return joiner.toString();
        }
        if (expr instanceof UnaryOp unaryOp) {
            if ("not".equals(unaryOp.operator())) {
                return "not " + print(unaryOp.operand(), NOT);
            }
            return unaryOp.operator() + print(unaryOp.operand(), UNARY);
        }
        if (expr instanceof Compare compare) {
            StringBuilder sb = new StringBuilder(print(compare.left(), COMPARE + 1));
            for (int i = 0; i < compare.operators().size() && i < compare.comparators().size(); i++) {
                sb.append(' ').append(compare.operators().get(i)).append(' ')
                        .append(print(compare.comparators().get(i), COMPARE + 1));
            }
            return sb.toString();
        }
        if (expr instanceof Subscript subscript) {
            return print(subscript.value(), ATOM) + "[" + print(subscript.slice(), LAMBDA) + "]";
        }
        if (expr instanceof Collection collection) {
            return collection(collection);
        }
        if (expr instanceof DictLiteral dict) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            for (int i = 0; i < dict.values().size(); i++) {
                Expression key = i < dict.keys().size() ? dict.keys().get(i) : null;
                String value = print(dict.values().get(i), LAMBDA);
                joiner.add(key == null ? "**" + value : print(key, LAMBDA) + ": " + value);
            }
            return joiner.toString();
        }
        if (expr instanceof Lambda lambda) {
            String params = String.join(", ", lambda.params());
            return (params.isEmpty() ? "lambda" : "lambda " + params) + ": " + print(lambda.body(), LAMBDA);
        }
        if (expr instanceof Comprehension comprehension) {
            return comprehension(comprehension);
        }
        if (expr instanceof FormattedString formatted) {
            return formattedString(formatted.parts());
        }
        if (expr instanceof FormattedValue formattedValue) {
            return "{" + print(formattedValue.value(), LAMBDA) + "}";
        }
        if (expr instanceof Conditional conditional) {
            return print(conditional.body(), OR) + " if " + print(conditional.test(), OR)
                    + " else " + print(conditional.orElse(), CONDITIONAL);
        }
        if (expr instanceof Starred starred) {
            return "*" + print(starred.value(), ATOM);
        }
        if (expr instanceof Raw raw) {
            return raw.text();
        }
        return "";
    }

    private static String collection(Collection collection) {
        StringJoiner joiner = new StringJoiner(", ");
        collection.elements().forEach(e -> joiner.add(print(e, LAMBDA)));
        String inner = joiner.toString();
        return switch (collection.kind()) {
            case LIST -> "[" + inner + "]";
            case TUPLE -> collection.elements().size() == 1 ? "(" + inner + ",)" : "(" + inner + ")";
            case SET -> collection.elements().isEmpty() ? "set()" : "{" + inner + "}";
            case DICT -> "{" + inner + "}";
        };
    }

    private static String comprehension(Comprehension comprehension) {
        StringBuilder sb = new StringBuilder();
        if (comprehension.kind() == ComprehensionKind.DICT && comprehension.key() != null) {
            sb.append(print(comprehension.key(), LAMBDA)).append(": ");
        }
        sb.append(print(comprehension.element(), LAMBDA));
        sb.append(generators(comprehension.generators()));
        return switch (comprehension.kind()) {
            case LIST -> "[" + sb + "]";
            case SET, DICT -> "{" + sb + "}";
            case GENERATOR -> "(" + sb + ")";
        };
    }

    /** 推导式的 {@code for t in it if c} 部分，带前导空格 */
    public static String generators(List<Generator> generators) {
        StringBuilder sb = new StringBuilder();
        for (Generator generator : generators) {
            sb.append(" for ").append(print(generator.target(), LAMBDA))
                    .append(" in ").append(print(generator.iter(), OR));
            for (Expression condition : generator.ifs()) {
                sb.append(" if ").append(print(condition, OR));
            }
        }
        return sb.toString();
    }

    private static String formattedString(List<Expression> parts) {
        StringBuilder sb = new StringBuilder("f'");
        for (Expression part : parts) {
            if (part instanceof Constant constant && constant.value() instanceof String s) {
                sb.append(s.replace("{", "{{").replace("}", "}}").replace("'", "\\'"));
            } else if (part instanceof FormattedValue value) {
                sb.append(render(value));
            } else {
                sb.append('{').append(print(part, LAMBDA)).append('}');
            }
        }
        return sb.append('\'').toString();
    }

    private static String constant(Object value) {
        if (value == null) {
            return "None";
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        return String.valueOf(value);
    }

    private static String quote(String s) {
        String escaped = s.replace("\\", "\\\\").replace("\n", "\\n").replace("\t", "\\t");
        if (escaped.contains("'") && !escaped.contains("\"")) {
            return "\"" + escaped + "\"";
        }
        return "'" + escaped.replace("'", "\\'") + "'";
    }
}
