package org.refactor.flowchart.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 表达式节点。只保留流程图需要的结构，其余表达式退化为 {@link Raw}。
 */
public sealed interface Expression {

    record Name(String id) implements Expression {
        public Name {
            Objects.requireNonNull(id, "id");
        }
    }

    record Attribute(Expression value, String attr) implements Expression {
        public Attribute {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(attr, "attr");
        }
    }

    record Call(Expression func, List<Expression> args, List<Keyword> keywords) implements Expression {
        public Call {
            Objects.requireNonNull(func, "func");
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }

        /** 被调用的简单名字（{@code f(...)}），属性调用返回 null */
        public String simpleName() {
            return func instanceof Name name ? name.id() : null;
        }

        /** 属性调用的方法名（{@code obj.m(...)}），否则返回 null */
        public String attributeName() {
            return func instanceof Attribute attribute ? attribute.attr() : null;
        }

        /** 属性调用的接收者（{@code obj}），否则返回 null */
        public Expression receiver() {
            return func instanceof Attribute attribute ? attribute.value() : null;
        }
    }

    /** {@code arg} 为 null 表示 {@code **kwargs} */
    record Keyword(String arg, Expression value) {
        public Keyword {
            Objects.requireNonNull(value, "value");
        }
    }

    /** value 可以是 String、Number、Boolean 或 null（None） */
    record Constant(Object value) implements Expression {
    }

    record BinaryOp(Expression left, String operator, Expression right) implements Expression {
    }

    record BoolOp(String operator, List<Expression> values) implements Expression {
        public BoolOp {
            values = List.copyOf(values);
        }
    }

    record UnaryOp(String operator, Expression operand) implements Expression {
    }

    record Compare(Expression left, List<String> operators, List<Expression> comparators) implements Expression {
        public Compare {
            operators = List.copyOf(operators);
            comparators = List.copyOf(comparators);
        }
    }

    record Subscript(Expression value, Expression slice) implements Expression {
    }

    enum CollectionKind {
        LIST("List"), TUPLE("Tuple"), SET("Set"), DICT("Dict");

        private final String typeName;

        CollectionKind(String typeName) {
            this.typeName = typeName;
        }

        public String typeName() {
            return typeName;
        }
    }

    /** List / Tuple / Set 字面量 */
    record Collection(CollectionKind kind, List<Expression> elements) implements Expression {
        public Collection {
            elements = List.copyOf(elements);
        }
    }

    /** Dict 字面量，key 为 null 表示 {@code **other} */
    record DictLiteral(List<Expression> keys, List<Expression> values) implements Expression {
        public DictLiteral {
            keys = Collections.unmodifiableList(new ArrayList<>(keys));
            values = List.copyOf(values);
        }
    }

    record Lambda(List<String> params, Expression body) implements Expression {
        public Lambda {
            params = List.copyOf(params);
        }
    }

    enum ComprehensionKind {
        LIST("List"), SET("Set"), DICT("Dict"), GENERATOR("Generator");

        private final String label;

        ComprehensionKind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    record Generator(Expression target, Expression iter, List<Expression> ifs) {
        public Generator {
            ifs = List.copyOf(ifs);
        }
    }

    /** key 只在 DICT 推导式中非 null，此时 element 是 value */
    record Comprehension(ComprehensionKind kind, Expression key, Expression element,
                         List<Generator> generators) implements Expression {
        public Comprehension {
            generators = List.copyOf(generators);
        }
    }

    /** f-string，parts 中的 {@link FormattedValue} 是插值 */
    record FormattedString(List<Expression> parts) implements Expression {
        public FormattedString {
            parts = List.copyOf(parts);
        }
    }

    record FormattedValue(Expression value) implements Expression {
    }

    record Conditional(Expression test, Expression body, Expression orElse) implements Expression {
    }

    record Starred(Expression value) implements Expression {
    }

    /** 未建模的表达式，保留原始文本 */
    record Raw(String text) implements Expression {
    }
}
