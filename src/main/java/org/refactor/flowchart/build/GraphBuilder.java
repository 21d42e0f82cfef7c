package org.refactor.flowchart.build;

import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Expressions;
import org.refactor.flowchart.ast.Module;
import org.refactor.flowchart.ast.Statement;
import org.refactor.flowchart.ast.Statement.*;
import org.refactor.flowchart.ast.StatementVisitor;
import org.refactor.flowchart.config.FlowchartConfig;
import org.refactor.flowchart.entry.EntryPoint;
import org.refactor.flowchart.graph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.StringJoiner;
import java.util.stream.Collectors;

/**
 * 构建流程图：按语句类型分发，逐条语句连边。
 * <p>
 * 每个 visit 方法接收前驱节点，返回执行完本语句后的当前节点；
 * 返回 null 表示这条分支已经结束（return / raise / break / continue / exit），
 * 同一语句列表中后面的语句不再处理。
 * <p>
 * 一个实例只构建一次。
 */
public class GraphBuilder implements StatementVisitor<String, FlowPosition> {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final BuilderContext ctx;
    private final CallSplicer calls;

    public GraphBuilder(FlowchartConfig config, DefinitionIndex index, EntryPoint entry) {
        this.ctx = new BuilderContext(new GraphStore(), config, index, new TypeResolver(index), entry);
        this.calls = new CallSplicer(this, ctx);
    }

    /**
     * 从模块主流程开始构建。函数定义不进入主流程，只在被调用时展开。
     */
    public GraphStore build(Module module) {
        GraphStore store = ctx.store;
        // 计数后缀保证 id 不会是 Mermaid 关键字 end
        String startId = store.nextId("start");
        String endId = store.nextId("end");
        store.addNode(new FlowNode(startId, "Start", NodeShape.START, NodeRole.TERMINAL, Scope.MAIN, 0));
        store.addNode(new FlowNode(endId, "End", NodeShape.END, NodeRole.TERMINAL, Scope.MAIN, 0));
        store.setStartId(startId);
        store.setEndId(endId);

        List<Statement> mainFlow = module.body().stream()
                .filter(s -> !(s instanceof FunctionDef))
                .collect(Collectors.toList());
        String last = processList(mainFlow, startId, Scope.MAIN, null);
        if (last != null) {
            ctx.connect(last, endId, null);
        }
        log.info("Built flowchart with {} nodes and {} edges", store.size(), store.edges().size());
        return store;
    }

    /**
     * 依次处理一个语句列表。
     *
     * @param firstLabel 列表入口边的标签（True / False / Try），可以为 null
     * @return 列表执行完后的当前节点，分支已结束时为 null
     */
    String processList(List<Statement> statements, String prev, Scope scope, String firstLabel) {
        ctx.setPendingLabel(firstLabel);
        String current = prev;
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            if (i == 0 && statement instanceof ExpressionStatement expr && NodeText.isDocstring(expr.value())) {
                continue;
            }
            if (!enabled(statement)) {
                continue;
            }
            log.debug("Line {}: {} in {}", statement.line(), statement.getClass().getSimpleName(), scope.id());
            String next = statement.accept(this, new FlowPosition(current, scope));
            if (ctx.exhausted()) {
                if (ctx.reportLimit()) {
                    ctx.connect(current, ctx.endId(), "Max node limit " + ctx.config.getMaxNodes() + " exceeded");
                }
                current = null;
                break;
            }
            if (next == null) {
                current = null;
                break;
            }
            if (!next.equals(current)) {
                ctx.setPendingLabel(null);
            }
            current = next;
        }
        ctx.setPendingLabel(null);
        return current;
    }

    private boolean enabled(Statement statement) {
        FlowchartConfig config = ctx.config;
        if (statement instanceof For) {
            return config.isShowForLoops();
        }
        if (statement instanceof While) {
            return config.isShowWhileLoops();
        }
        if (statement instanceof Assign || statement instanceof AugAssign) {
            return config.isShowVariables();
        }
        if (statement instanceof If) {
            return config.isShowIfs();
        }
        if (statement instanceof Try || statement instanceof Raise || statement instanceof Assert) {
            return config.isShowExceptions();
        }
        if (statement instanceof Return) {
            return config.isShowReturns();
        }
        if (statement instanceof ClassDef) {
            return config.isShowClasses();
        }
        if (statement instanceof Import || statement instanceof ImportFrom) {
            return config.isShowImports();
        }
        if (statement instanceof ExpressionStatement expr && NodeText.isPrint(expr.value())) {
            return config.isShowPrints();
        }
        return true;
    }

    /**
     * 简单语句（print、不含调用的赋值）：开启合并时并入同作用域的上一个简单语句节点，否则新建节点
     */
    String simpleStatement(String prefix, String text, NodeRole role, FlowPosition at, int line) {
        if (ctx.config.isMergeCommonNodes() && at.current() != null) {
            FlowNode previous = ctx.store.node(at.current());
            if (previous != null && previous.scope().equals(at.scope()) && previous.role().consolidable()) {
                previous.appendLine(NodeText.truncate(text, NodeText.MAX_TEXT), role);
                return at.current();
            }
        }
        return statement(prefix, text, NodeShape.STATEMENT, role, at, line);
    }

    /** 新建一个节点并从前驱连过来 */
    String statement(String prefix, String text, NodeShape shape, NodeRole role, FlowPosition at, int line) {
        String id = ctx.addNode(prefix, text, shape, role, at.scope(), line);
        ctx.connect(at.current(), id, null);
        return id;
    }

    @Override
    public String visitIf(If stmt, FlowPosition at) {
        Scope scope = at.scope();
        String cond = statement("if", NodeText.condition(stmt.test()), NodeShape.CONDITION, NodeRole.CONTROL, at,
                stmt.line());
        if (cond == null) {
            return null;
        }
        String trueEnd = processList(stmt.body(), cond, scope, "True");
        if (ctx.exhausted()) {
            return null;
        }

        if (!stmt.orElse().isEmpty()) {
            String falseEnd = processList(stmt.orElse(), cond, scope, "False");
            if (ctx.exhausted()) {
                return null;
            }
            if (trueEnd == null && falseEnd == null) {
                return null;
            }
            String merge = ctx.addMerge(scope);
            ctx.connect(trueEnd, merge, cond.equals(trueEnd) ? "True" : null);
            ctx.connect(falseEnd, merge, cond.equals(falseEnd) ? "False" : null);
            return merge;
        }

        if (scope instanceof Scope.Main && isMainGuard(stmt.test())) {
            String guardEnd = ctx.addNode("end", "End", NodeShape.END, NodeRole.TERMINAL, scope, 0);
            ctx.connect(trueEnd, guardEnd, null);
            ctx.connect(cond, ctx.endId(), "False");
            return null;
        }

        String merge = ctx.addMerge(scope);
        if (trueEnd != null && !trueEnd.equals(cond)) {
            ctx.connect(trueEnd, merge, null);
        }
        ctx.connect(cond, merge, "False");
        return merge;
    }

    private static boolean isMainGuard(Expression test) {
        String text = NodeText.of(test);
        return text.contains("__name__ == '__main__'") || text.contains("__name__ == \"__main__\"");
    }

    @Override
    public String visitFor(For stmt, FlowPosition at) {
        String text = "for " + NodeText.of(stmt.target()) + " in " + NodeText.of(stmt.iter());
        String loop = statement("for", text, NodeShape.LOOP, NodeRole.CONTROL, at, stmt.line());
        return loop(loop, stmt.body(), stmt.orElse(), at.scope(), false);
    }

    @Override
    public String visitWhile(While stmt, FlowPosition at) {
        String text = "while " + NodeText.of(stmt.test());
        String loop = statement("while", text, NodeShape.CONDITION, NodeRole.CONTROL, at, stmt.line());
        return loop(loop, stmt.body(), stmt.orElse(), at.scope(), true);
    }

    private String loop(String loop, List<Statement> body, List<Statement> orElse, Scope scope, boolean isWhile) {
        if (loop == null) {
            return null;
        }
        String exit = ctx.addMerge(scope);
        if (exit == null) {
            return null;
        }
        ctx.pushLoop(new LoopFrame(loop, exit));
        String bodyEnd;
        try {
            bodyEnd = processList(body, loop, scope, null);
        } finally {
            ctx.popLoop();
        }
        if (ctx.exhausted()) {
            return null;
        }
        if (bodyEnd != null && (!bodyEnd.equals(loop) || isWhile)) {
            ctx.connect(bodyEnd, loop, "Next Iteration");
        }

        // else 子句只在正常结束（Done）时执行，break 直接跳到出口
        if (!orElse.isEmpty()) {
            String elseEnd = processList(orElse, loop, scope, "Done");
            if (ctx.exhausted()) {
                return null;
            }
            ctx.connect(elseEnd, exit, loop.equals(elseEnd) ? "Done" : null);
        } else {
            ctx.connect(loop, exit, "Done");
        }
        return exit;
    }

    @Override
    public String visitBreak(Break stmt, FlowPosition at) {
        LoopFrame frame = ctx.currentLoop();
        if (frame == null) {
            log.warn("Line {}: 'break' outside loop ignored", stmt.line());
            return at.current();
        }
        ctx.connect(at.current(), frame.exitId(), null);
        return null;
    }

    @Override
    public String visitContinue(Continue stmt, FlowPosition at) {
        LoopFrame frame = ctx.currentLoop();
        if (frame == null) {
            log.warn("Line {}: 'continue' outside loop ignored", stmt.line());
            return at.current();
        }
        ctx.connect(at.current(), frame.startId(), null);
        return null;
    }

    @Override
    public String visitReturn(Return stmt, FlowPosition at) {
        Scope scope = at.scope();
        Expression value = stmt.value();
        String text = value == null ? "return" : "return " + NodeText.of(value);
        String id = statement("return", text, NodeShape.STATEMENT, NodeRole.RETURN, at, stmt.line());
        if (id == null) {
            return null;
        }
        String from = id;
        if (value != null) {
            from = calls.returnValue(value, new FlowPosition(id, scope), stmt.line());
            if (from == null) {
                return null;
            }
        }

        if (scope instanceof Scope.Method method) {
            if (ctx.config.isSequentialFlow()) {
                ctx.recordMethodExit(method, from);
            } else {
                ctx.connect(from, ctx.callingNode(method), "Return");
            }
        } else if (ctx.currentReturnTarget() != null) {
            ctx.connect(from, ctx.currentReturnTarget(), null);
        } else {
            ctx.connect(from, ctx.endId(), null);
        }
        return null;
    }

    @Override
    public String visitTry(Try stmt, FlowPosition at) {
        Scope scope = at.scope();
        String tryId = statement("try", "Try", NodeShape.TRY, NodeRole.EXCEPTION, at, stmt.line());
        String merge = ctx.addMerge(scope);
        if (tryId == null || merge == null) {
            return null;
        }
        boolean reached = false;

        String bodyEnd = processList(stmt.body(), tryId, scope, "Try");
        if (bodyEnd != null) {
            ctx.connect(bodyEnd, merge, tryId.equals(bodyEnd) ? "Try" : null);
            reached = true;
        }
        for (ExceptHandler handler : stmt.handlers()) {
            if (ctx.exhausted()) {
                return null;
            }
            String handlerId = ctx.addNode("except", exceptText(handler), NodeShape.EXCEPTION, NodeRole.EXCEPTION,
                    scope, stmt.line());
            ctx.connect(tryId, handlerId, "Exception");
            String handlerEnd = processList(handler.body(), handlerId, scope, null);
            if (handlerEnd != null) {
                ctx.connect(handlerEnd, merge, null);
                reached = true;
            }
        }
        if (!stmt.orElse().isEmpty() && !ctx.exhausted()) {
            String elseId = ctx.addNode("else", "Else", NodeShape.CONDITION, NodeRole.EXCEPTION, scope, stmt.line());
            ctx.connect(tryId, elseId, "No Exception");
            String elseEnd = processList(stmt.orElse(), elseId, scope, null);
            if (elseEnd != null) {
                ctx.connect(elseEnd, merge, null);
                reached = true;
            }
        }
        if (ctx.exhausted()) {
            return null;
        }
        if (!stmt.finalBody().isEmpty()) {
            // finally 总会执行
            String finallyId = ctx.addNode("finally", "Finally", NodeShape.FINALLY, NodeRole.EXCEPTION, scope,
                    stmt.line());
            // 所有分支都终止时汇合点没有入边，finally 直接挂在 Try 下面
            ctx.connect(reached ? merge : tryId, finallyId, null);
            String finallyEnd = processList(stmt.finalBody(), finallyId, scope, null);
            return reached ? finallyEnd : null;
        }
        return reached ? merge : null;
    }

    private static String exceptText(ExceptHandler handler) {
        if (handler.type() == null) {
            return handler.name() == null ? "Except" : "Except as " + handler.name();
        }
        String type = NodeText.of(handler.type());
        return handler.name() == null ? "Except " + type : "Except " + type + " as " + handler.name();
    }

    @Override
    public String visitRaise(Raise stmt, FlowPosition at) {
        String text;
        if (stmt.exc() == null) {
            text = "Re-raise Exception";
        } else if (stmt.cause() != null) {
            text = "Raise " + NodeText.of(stmt.exc()) + " from " + NodeText.of(stmt.cause());
        } else {
            text = "Raise " + NodeText.of(stmt.exc());
        }
        statement("raise", text, NodeShape.EXCEPTION, NodeRole.EXCEPTION, at, stmt.line());
        return null;
    }

    @Override
    public String visitWith(With stmt, FlowPosition at) {
        StringJoiner contexts = new StringJoiner(", ");
        for (WithItem item : stmt.items()) {
            String context = NodeText.of(item.contextExpr());
            contexts.add(item.optionalVars() == null ? context : context + " as " + NodeText.of(item.optionalVars()));
        }
        String id = statement("with", "With: " + contexts, NodeShape.EXCEPTION, NodeRole.STATEMENT, at,
                stmt.line());
        if (id == null) {
            return null;
        }
        return processList(stmt.body(), id, at.scope(), null);
    }

    @Override
    public String visitAssert(Assert stmt, FlowPosition at) {
        String text = "Assert: " + NodeText.of(stmt.test());
        if (stmt.message() != null) {
            text += ", " + NodeText.of(stmt.message());
        }
        return statement("assert", text, NodeShape.EXCEPTION, NodeRole.EXCEPTION, at, stmt.line());
    }

    @Override
    public String visitPass(Pass stmt, FlowPosition at) {
        return statement("pass", "Pass", NodeShape.STATEMENT, NodeRole.NOOP, at, stmt.line());
    }

    @Override
    public String visitImport(Import stmt, FlowPosition at) {
        String names = stmt.names().stream().map(GraphBuilder::alias).collect(Collectors.joining(", "));
        return importNode("import " + names, at, stmt.line());
    }

    @Override
    public String visitImportFrom(ImportFrom stmt, FlowPosition at) {
        String names = stmt.names().stream().map(GraphBuilder::alias).collect(Collectors.joining(", "));
        String module = stmt.module() == null ? "." : stmt.module();
        return importNode("from " + module + " import " + names, at, stmt.line());
    }

    private static String alias(ImportAlias alias) {
        return alias.asName() == null ? alias.name() : alias.name() + " as " + alias.asName();
    }

    /** 只有第一条 import 画节点，后面的只在它末尾加 "..." */
    private String importNode(String text, FlowPosition at, int line) {
        String first = ctx.firstImportId();
        if (first != null && ctx.store.contains(first)) {
            ctx.store.node(first).markContinued();
            return at.current();
        }
        String id = statement("import", text, NodeShape.IMPORT, NodeRole.IMPORT, at, line);
        ctx.setFirstImportId(id);
        return id;
    }

    @Override
    public String visitUnsupported(Unsupported stmt, FlowPosition at) {
        return statement("unsupported", "Unsupported Node: " + stmt.kind(), NodeShape.IMPORT, NodeRole.STATEMENT,
                at, stmt.line());
    }

    // 定义本身不画节点，函数和方法只在被调用时展开
    @Override
    public String visitFunctionDef(FunctionDef stmt, FlowPosition at) {
        return at.current();
    }

    @Override
    public String visitClassDef(ClassDef stmt, FlowPosition at) {
        return at.current();
    }

    @Override
    public String visitAssign(Assign stmt, FlowPosition at) {
        return calls.assign(stmt, at);
    }

    @Override
    public String visitAugAssign(AugAssign stmt, FlowPosition at) {
        String text = NodeText.of(stmt.target()) + " " + stmt.operator() + "= " + NodeText.of(stmt.value());
        if (Expressions.containsCall(stmt.value())) {
            return calls.withNestedCalls("assign", text, NodeRole.STATEMENT, stmt.value(), at, stmt.line());
        }
        return simpleStatement("assign", text, NodeRole.ASSIGNMENT, at, stmt.line());
    }

    @Override
    public String visitExpression(ExpressionStatement stmt, FlowPosition at) {
        return calls.expression(stmt, at);
    }
}
