package org.refactor.flowchart.ast;

import org.junit.jupiter.api.Test;
import org.refactor.flowchart.ast.Expression.*;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.refactor.flowchart.SyntaxTrees.*;

class ExpressionPrinterTest {

    private static String print(Expression expr) {
        return ExpressionPrinter.print(expr);
    }

    @Test
    void parenthesizesByPrecedence() {
        assertThat(print(binary(binary(name("a"), "+", name("b")), "*", name("c")))).isEqualTo("(a + b) * c");
        assertThat(print(binary(name("a"), "-", binary(name("b"), "-", name("c"))))).isEqualTo("a - (b - c)");
        assertThat(print(binary(num(2), "**", binary(num(3), "**", num(2))))).isEqualTo("2 ** 3 ** 2");
        assertThat(print(new BoolOp("and", List.of(new BoolOp("or", List.of(name("a"), name("b"))), name("c")))))
                .isEqualTo("(a or b) and c");
        assertThat(print(new UnaryOp("not", compare(name("x"), "==", num(1))))).isEqualTo("not x == 1");
    }

    @Test
    void printsCallsWithKeywords() {
        Call call = new Call(attr(name("log"), "info"), List.of(str("msg")),
                List.of(new Keyword("level", num(2)), new Keyword(null, name("extra"))));

        assertThat(print(call)).isEqualTo("log.info('msg', level=2, **extra)");
    }

    @Test
    void quotesStrings() {
        assertThat(print(str("plain"))).isEqualTo("'plain'");
        assertThat(print(str("it's"))).isEqualTo("\"it's\"");
        assertThat(print(str("line\nbreak"))).isEqualTo("'line\\nbreak'");
        assertThat(print(new Constant(null))).isEqualTo("None");
        assertThat(print(new Constant(true))).isEqualTo("True");
    }

    @Test
    void printsCollections() {
        assertThat(print(new Collection(CollectionKind.TUPLE, List.of(num(1))))).isEqualTo("(1,)");
        assertThat(print(new Collection(CollectionKind.SET, List.of()))).isEqualTo("set()");
        assertThat(print(new Collection(CollectionKind.LIST, List.of(num(1), str("a"))))).isEqualTo("[1, 'a']");
        assertThat(print(new DictLiteral(Arrays.asList(str("k"), null), List.of(num(1), name("rest")))))
                .isEqualTo("{'k': 1, **rest}");
    }

    @Test
    void printsComprehensionsAndLambdas() {
        Generator generator = new Generator(name("x"), name("items"), List.of(compare(name("x"), ">", num(0))));
        Comprehension squares = new Comprehension(ComprehensionKind.LIST, null,
                binary(name("x"), "*", name("x")), List.of(generator));

        assertThat(print(squares)).isEqualTo("[x * x for x in items if x > 0]");
        assertThat(ExpressionPrinter.generators(List.of(generator))).isEqualTo(" for x in items if x > 0");
        assertThat(print(new Lambda(List.of("a", "b"), binary(name("a"), "+", name("b")))))
                .isEqualTo("lambda a, b: a + b");
    }

    @Test
    void printsFormattedStringsAndConditionals() {
        FormattedString greeting = new FormattedString(List.of(str("Hi "), new FormattedValue(name("name"))));

        assertThat(print(greeting)).isEqualTo("f'Hi {name}'");
        assertThat(print(new Conditional(name("ok"), str("yes"), str("no")))).isEqualTo("'yes' if ok else 'no'");
        assertThat(print(new Subscript(name("items"), num(0)))).isEqualTo("items[0]");
        assertThat(print(new Starred(name("args")))).isEqualTo("*args");
    }

    @Test
    void nullPrintsEmpty() {
        assertThat(ExpressionPrinter.print(null)).isEmpty();
    }
}
