package org.refactor.flowchart.build;

import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Expression.Call;
import org.refactor.flowchart.ast.Expression.Comprehension;
import org.refactor.flowchart.ast.Expression.Lambda;
import org.refactor.flowchart.ast.Expression.Name;
import org.refactor.flowchart.ast.ExpressionPrinter;
import org.refactor.flowchart.ast.Expressions;
import org.refactor.flowchart.ast.Statement.Assign;
import org.refactor.flowchart.ast.Statement.ExpressionStatement;
import org.refactor.flowchart.ast.Statement.FunctionDef;
import org.refactor.flowchart.graph.Edge;
import org.refactor.flowchart.graph.NodeRole;
import org.refactor.flowchart.graph.NodeShape;
import org.refactor.flowchart.graph.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 调用展开：把对已知函数、类方法的调用替换成被调函数体的内联子图。
 * <p>
 * 普通函数每个调用点展开一次（第 k 次调用用独立作用域），方法体只构建一次，之后的调用复用缓存。
 * 嵌套深度超过上限时画占位节点，直接递归画回到函数入口的边。
 */
class CallSplicer {

    private static final Logger log = LoggerFactory.getLogger(CallSplicer.class);

    private final GraphBuilder builder;
    private final BuilderContext ctx;

    CallSplicer(GraphBuilder builder, BuilderContext ctx) {
        this.builder = builder;
        this.ctx = ctx;
    }

    // ---- 语句入口 ----

    String expression(ExpressionStatement stmt, FlowPosition at) {
        Expression value = stmt.value();
        int line = stmt.line();
        if (value instanceof Call call) {
            return call(call, at, line);
        }
        if (value instanceof Lambda lambda) {
            String text = "Lambda: " + String.join(", ", lambda.params()) + " → " + NodeText.of(lambda.body());
            return builder.statement("lambda", text, NodeShape.STATEMENT, NodeRole.STATEMENT, at, line);
        }
        if (value instanceof Comprehension comprehension) {
            String element = NodeText.of(comprehension.element());
            if (comprehension.key() != null) {
                element = NodeText.of(comprehension.key()) + ": " + element;
            }
            String text = comprehension.kind().label() + ": " + element
                    + ExpressionPrinter.generators(comprehension.generators());
            return builder.statement("comp", text, NodeShape.STATEMENT, NodeRole.STATEMENT, at, line);
        }
        return withNestedCalls("expr", NodeText.of(value), NodeRole.STATEMENT, value, at, line);
    }

    String assign(Assign stmt, FlowPosition at) {
        Scope scope = at.scope();
        Expression value = stmt.value();
        int line = stmt.line();
        for (Expression target : stmt.targets()) {
            ctx.resolver.recordAttributeAssignment(target, value, scope);
        }
        String targets = stmt.targets().stream().map(NodeText::of).collect(Collectors.joining(" = "));
        String text = targets + " = " + NodeText.of(value);
        String variable = stmt.singleTarget() instanceof Name name ? name.id() : null;

        if (value instanceof Call call) {
            String name = call.simpleName();
            if (ctx.index.isClass(name)) {
                return instantiate(call, name, variable, text, at, line);
            }
            if ("__init__".equals(call.attributeName()) && call.receiver() instanceof Call inner
                    && ctx.index.isClass(inner.simpleName())) {
                String cls = inner.simpleName();
                String created = instantiate(inner, cls, variable, text, at, line);
                if (created == null) {
                    return null;
                }
                return diagnostic(created, "⚠️ Redundant __init__ call: " + cls + "() already calls constructor",
                        scope, line);
            }
            if (call.attributeName() != null) {
                return methodCall(call, at, line, text);
            }
            if (ctx.index.isFunction(name) && ctx.config.isShowFunctions()) {
                return callFunction(call, at, line, text);
            }
        }

        String summary = NodeText.collectionSummary(targets, value);
        if (summary != null) {
            text = summary;
        }
        if (Expressions.containsCall(value)) {
            return withNestedCalls("assign", text, NodeRole.STATEMENT, value, at, line);
        }
        return builder.simpleStatement("assign", text, NodeRole.ASSIGNMENT, at, line);
    }

    /**
     * return 的返回值：直接递归画回函数入口，已知函数和可解析的方法调用照常展开
     */
    String returnValue(Expression value, FlowPosition at, int line) {
        Scope scope = at.scope();
        String returnNode = at.current();
        String current = returnNode;
        for (Call call : Expressions.calls(value)) {
            String name = call.simpleName();
            if (name != null && name.equals(scope.functionName())) {
                ctx.connect(returnNode, ctx.functionStart(scope), "Recursion");
            } else if (ctx.index.isFunction(name) && ctx.config.isShowFunctions()) {
                current = callFunction(call, new FlowPosition(current, scope), line, null);
            } else if (call.attributeName() != null && ctx.config.isShowClasses()) {
                current = quietMethodSplice(call, new FlowPosition(current, scope));
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * 先画语句节点，再依次展开其中对已知函数的调用（如 print(f(x))、y = f(x) + 1）
     */
    String withNestedCalls(String prefix, String text, NodeRole role, Expression expr, FlowPosition at, int line) {
        String current = builder.statement(prefix, text, NodeShape.STATEMENT, role, at, line);
        if (current == null || !ctx.config.isShowFunctions()) {
            return current;
        }
        for (Call call : Expressions.calls(expr)) {
            if (ctx.index.isFunction(call.simpleName())) {
                current = callFunction(call, new FlowPosition(current, at.scope()), line, null);
                if (current == null) {
                    return null;
                }
            }
        }
        return current;
    }

    // ---- 调用 ----

    private String call(Call call, FlowPosition at, int line) {
        String name = call.simpleName();
        if (NodeText.isExit(call)) {
            builder.statement("exit", "Exit: " + NodeText.of(call), NodeShape.EXIT, NodeRole.TERMINAL, at, line);
            return null;
        }
        if (NodeText.isPrint(call)) {
            if (hasKnownCall(call)) {
                return withNestedCalls("print", NodeText.print(call), NodeRole.PRINT, argumentsOf(call), at, line);
            }
            return builder.simpleStatement("print", NodeText.print(call), NodeRole.PRINT, at, line);
        }
        if (ctx.index.isClass(name)) {
            return instantiate(call, name, null, "Create: " + NodeText.of(call), at, line);
        }
        if (ctx.index.isFunction(name)) {
            if (!ctx.config.isShowFunctions()) {
                return at.current();
            }
            return callFunction(call, at, line, null);
        }
        if (call.attributeName() != null) {
            return methodCall(call, at, line, "Call: " + NodeText.of(call));
        }
        return builder.statement("call", NodeText.of(call), NodeShape.CALL, NodeRole.CALL, at, line);
    }

    private boolean hasKnownCall(Call print) {
        return Expressions.calls(argumentsOf(print)).stream().anyMatch(c -> ctx.index.isFunction(c.simpleName()));
    }

    /** 只看实参，不包括 print 自己 */
    private static Expression argumentsOf(Call call) {
        List<Expression> args = new ArrayList<>(call.args());
        call.keywords().forEach(k -> args.add(k.value()));
        return new Expression.Collection(Expression.CollectionKind.TUPLE, args);
    }

    /**
     * 展开普通函数调用。
     *
     * @param text 调用节点文字，null 时用 "Call: f(...)"（赋值语句传入整条赋值）
     * @return 调用返回后的节点，分支结束时为 null
     */
    String callFunction(Call call, FlowPosition at, int line, String text) {
        String function = call.simpleName();
        Scope scope = at.scope();
        String callText = text != null ? text : "Call: " + NodeText.of(call);

        if (function.equals(scope.functionName())) {
            String id = builder.statement("recursive_call", "Recursive Call: " + NodeText.of(call), NodeShape.CALL,
                    NodeRole.CALL, at, line);
            ctx.connect(id, ctx.functionStart(scope), "Recursion");
            return id;
        }
        if (ctx.depthExceeded()) {
            log.warn("Max nesting depth {} reached at call to {}()", ctx.config.getMaxNestingDepth(), function);
            return builder.statement("nesting_limit",
                    callText + " (Max nesting depth " + ctx.config.getMaxNestingDepth() + " exceeded)",
                    NodeShape.CALL, NodeRole.DIAGNOSTIC, at, line);
        }

        Scope callee = ctx.nextCallScope(function);
        String callId = builder.statement("call", callText, NodeShape.CALL, NodeRole.CALL, at, line);
        String endCall = ctx.addMerge(scope);
        if (callId == null || endCall == null) {
            return null;
        }
        ctx.store.addChildScope(scope, callee);
        ctx.recordFunctionStart(callee, callId);
        FunctionDef def = ctx.index.function(function);
        ctx.resolver.propagateArguments(callee, def, call, scope);
        log.debug("Splicing {}() as {} at depth {}", function, callee.id(), ctx.depth());

        String bodyEnd;
        ctx.pushCall(endCall);
        ctx.enter();
        try {
            bodyEnd = builder.processList(def.body(), callId, callee, null);
        } finally {
            ctx.leave();
            ctx.popCall();
        }
        if (ctx.exhausted()) {
            return null;
        }
        ctx.connect(bodyEnd, endCall, null);
        return endCall;
    }

    /**
     * obj.m(...)：解析接收者的类，展开方法体；解析不了时画错误 / 警告节点，流程从该节点继续
     */
    private String methodCall(Call call, FlowPosition at, int line, String text) {
        Scope scope = at.scope();
        String methodName = call.attributeName();
        String callId = builder.statement("call", text, NodeShape.CALL, NodeRole.CALL, at, line);
        if (callId == null || !ctx.config.isShowClasses()) {
            return callId;
        }

        Optional<TypeResolver.Resolution> resolved = ctx.resolver.resolveReceiver(call.receiver(), scope);
        if (resolved.isEmpty()) {
            log.debug("Could not resolve receiver of {}", NodeText.of(call));
            return diagnostic(callId, "❌ Could not resolve class for method '" + methodName + "'", scope, line);
        }
        String cls = resolved.get().className();
        FunctionDef method = ctx.index.method(cls, methodName);
        if (method != null) {
            if (!accessible(resolved.get(), method)) {
                return diagnostic(callId,
                        "❌ Instance method '" + methodName + "' called on class '" + cls + "' without instantiation",
                        scope, line);
            }
            ctx.resolver.propagateArguments(new Scope.Method(cls, methodName), method, call, scope);
            return spliceMethod(cls, method, callId, scope);
        }
        if (ctx.index.hasProperty(cls, methodName)) {
            return diagnostic(callId, "⚠️ '" + methodName + "' is a property, not a method", scope, line);
        }
        log.warn("Method '{}' not found in class {}", methodName, cls);
        return diagnostic(callId, "❌ Method '" + methodName + "' not found in " + cls, scope, line);
    }

    /** return 里的方法调用：能解析就展开，解析不了不画错误节点 */
    private String quietMethodSplice(Call call, FlowPosition at) {
        Optional<TypeResolver.Resolution> resolved = ctx.resolver.resolveReceiver(call.receiver(), at.scope());
        if (resolved.isEmpty()) {
            return at.current();
        }
        String cls = resolved.get().className();
        FunctionDef method = ctx.index.method(cls, call.attributeName());
        if (method == null || !accessible(resolved.get(), method)) {
            return at.current();
        }
        ctx.resolver.propagateArguments(new Scope.Method(cls, method.name()), method, call, at.scope());
        return spliceMethod(cls, method, at.current(), at.scope());
    }

    /** C.m() 直接在类上调用实例方法，只有入口就是这个类时才允许 */
    private boolean accessible(TypeResolver.Resolution resolution, FunctionDef method) {
        if (!resolution.staticAccess() || !method.takesSelf()) {
            return true;
        }
        return ctx.entry != null && ctx.entry.allowsClassAccess(resolution.className());
    }

    /**
     * C(...)：画创建节点，记录变量类型，有 __init__ 时展开构造函数
     */
    private String instantiate(Call call, String cls, String variable, String text, FlowPosition at, int line) {
        String id = builder.statement("create", text, NodeShape.CALL, NodeRole.CALL, at, line);
        if (id == null) {
            return null;
        }
        ctx.resolver.recordInstantiation(variable, cls, call, at.scope());
        FunctionDef init = ctx.index.method(cls, "__init__");
        if (init == null || !ctx.config.isShowClasses()) {
            return id;
        }
        return spliceMethod(cls, init, id, at.scope());
    }

    /**
     * 把方法体接到调用节点上。同一个 (类, 方法) 只构建一次，之后的调用只补一条调用边。
     *
     * @return 调用之后流程继续的节点
     */
    private String spliceMethod(String cls, FunctionDef method, String callId, Scope callerScope) {
        MethodKey key = new MethodKey(cls, method.name());
        Scope.Method methodScope = new Scope.Method(cls, method.name());

        String cached = ctx.methodEntry(key);
        if (cached != null) {
            log.debug("Reusing method subgraph {}", key);
            callEdge(callId, cached);
            return continuation(key, methodScope, callId);
        }
        if (ctx.depthExceeded()) {
            log.warn("Max nesting depth {} reached at method {}", ctx.config.getMaxNestingDepth(), key);
            String id = ctx.addNode("nesting_limit",
                    NodeText.methodLabel(method) + " (Max nesting depth " + ctx.config.getMaxNestingDepth()
                            + " exceeded)", NodeShape.CALL, NodeRole.DIAGNOSTIC, callerScope, method.line());
            ctx.connect(callId, id, null);
            return id;
        }

        String entryId = ctx.addNode("method", NodeText.methodLabel(method), NodeShape.CALL, NodeRole.CALL,
                methodScope, method.line());
        if (entryId == null) {
            return null;
        }
        ctx.cacheMethodEntry(key, entryId);
        ctx.recordCallingNode(methodScope, callId);
        callEdge(callId, entryId);
        log.debug("Building method subgraph {} at depth {}", key, ctx.depth());

        String last;
        ctx.enter();
        try {
            last = builder.processList(method.body(), entryId, methodScope, null);
        } finally {
            ctx.leave();
        }
        if (ctx.exhausted()) {
            return null;
        }
        ctx.cacheMethodLastNode(key, last);
        return continuation(key, methodScope, callId);
    }

    private void callEdge(String callId, String entryId) {
        if (ctx.config.isSequentialFlow()) {
            ctx.connect(callId, entryId, "Call");
        } else {
            ctx.connect(callId, entryId, "Call and Return", Edge.Kind.BIDIRECTIONAL);
        }
    }

    /**
     * 默认模式下调用是双向边，流程从调用节点继续；
     * 顺序流模式下从方法最后一个 return（没有时是方法最后一个节点）继续
     */
    private String continuation(MethodKey key, Scope.Method methodScope, String callId) {
        if (!ctx.config.isSequentialFlow()) {
            return callId;
        }
        String exit = ctx.lastMethodExit(methodScope);
        if (exit != null) {
            return exit;
        }
        String last = ctx.methodLastNode(key);
        return last != null ? last : callId;
    }

    private String diagnostic(String from, String text, Scope scope, int line) {
        String id = ctx.addNode("error", text, NodeShape.STATEMENT, NodeRole.DIAGNOSTIC, scope, line);
        ctx.connect(from, id, null);
        return id;
    }
}
