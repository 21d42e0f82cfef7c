package org.refactor.flowchart.build;

import org.junit.jupiter.api.Test;
import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Module;
import org.refactor.flowchart.graph.Scope;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.refactor.flowchart.SyntaxTrees.*;

class TypeResolverTest {

    private final Module module = module(
            classDef(1, "Engine", def(2, "start", List.of("self"), pass(3))),
            classDef(4, "Car",
                    def(5, "__init__", List.of("self", "engine"),
                            assign(6, attr(name("self"), "engine"), name("engine"))),
                    def(7, "drive", List.of("self"), pass(8))),
            def(9, "service", List.of("vehicle"), pass(10)));

    private final TypeResolver resolver = new TypeResolver(DefinitionIndex.of(module));

    @Test
    void instantiationBindsVariable() {
        resolver.recordInstantiation("e", "Engine", call("Engine"), Scope.MAIN);

        assertThat(resolver.variableType("e")).isEqualTo("Engine");
        assertThat(resolver.resolveReceiver(name("e"), Scope.MAIN))
                .contains(new TypeResolver.Resolution("Engine", false));
    }

    @Test
    void selfResolvesToOwningClass() {
        assertThat(resolver.resolveReceiver(name("self"), new Scope.Method("Car", "drive")))
                .contains(new TypeResolver.Resolution("Car", false));
        assertThat(resolver.resolveReceiver(name("self"), Scope.MAIN)).isEmpty();
    }

    @Test
    void classNameIsStaticAccess() {
        assertThat(resolver.resolveReceiver(name("Car"), Scope.MAIN))
                .contains(new TypeResolver.Resolution("Car", true));
        assertThat(resolver.instanceType(name("Car"), Scope.MAIN)).isNull();
    }

    @Test
    void newInstanceReceiverResolves() {
        assertThat(resolver.instanceType(call("Engine"), Scope.MAIN)).isEqualTo("Engine");
        assertThat(resolver.resolveReceiver(call("unknown"), Scope.MAIN)).isEmpty();
    }

    @Test
    void constructorArgumentsFlowIntoSelfAttributes() {
        resolver.recordInstantiation("e", "Engine", call("Engine"), Scope.MAIN);
        resolver.recordInstantiation("car", "Car", call("Car", name("e")), Scope.MAIN);
        Scope.Method init = new Scope.Method("Car", "__init__");
        assertThat(resolver.parameterType(init, "engine")).isEqualTo("Engine");

        resolver.recordAttributeAssignment(attr(name("self"), "engine"), name("engine"), init);

        Expression receiver = attr(name("self"), "engine");
        assertThat(resolver.resolveReceiver(receiver, new Scope.Method("Car", "drive")))
                .contains(new TypeResolver.Resolution("Engine", false));
    }

    @Test
    void keywordArgumentsArePropagated() {
        resolver.recordInstantiation("c", "Car", call("Car"), Scope.MAIN);
        Expression.Call call = new Expression.Call(name("service"), List.of(),
                List.of(new Expression.Keyword("vehicle", name("c"))));

        resolver.propagateArguments(new Scope.Function("service"), DefinitionIndex.of(module).function("service"),
                call, Scope.MAIN);

        assertThat(resolver.parameterType(new Scope.Function("service"), "vehicle")).isEqualTo("Car");
        assertThat(resolver.resolveReceiver(name("vehicle"), new Scope.Function("service")))
                .contains(new TypeResolver.Resolution("Car", false));
    }

    @Test
    void attributeAssignmentOutsideMethodIsIgnored() {
        resolver.recordAttributeAssignment(attr(name("self"), "engine"), call("Engine"), Scope.MAIN);

        assertThat(resolver.resolveReceiver(attr(name("self"), "engine"), Scope.MAIN)).isEmpty();
    }
}
