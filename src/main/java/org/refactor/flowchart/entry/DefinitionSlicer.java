package org.refactor.flowchart.entry;

import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Module;
import org.refactor.flowchart.ast.Statement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 默认的入口裁剪：
 * FILE 原样返回；FUNCTION / CLASS / METHOD 只保留顶层函数和类定义，
 * 末尾追加一条对入口的调用（f()、C()、C.m()）作为主流程。
 */
public class DefinitionSlicer implements EntrySelector {

    private static final Logger log = LoggerFactory.getLogger(DefinitionSlicer.class);

    @Override
    public Module select(Module module, EntryPoint entry) {
        if (entry == null || entry.kind() == EntryKind.FILE) {
            return module;
        }
        List<Statement> body = new ArrayList<>();
        int lastLine = 0;
        for (Statement statement : module.body()) {
            if (statement instanceof Statement.FunctionDef || statement instanceof Statement.ClassDef) {
                body.add(statement);
                lastLine = Math.max(lastLine, statement.line());
            }
        }
        Expression.Call call = entryCall(entry);
        body.add(new Statement.ExpressionStatement(lastLine + 1, call));
        log.info("Sliced module to {} definitions for {} entry '{}'", body.size() - 1, entry.kind().label(),
                entry.mappingKey());
        return new Module(body);
    }

    private static Expression.Call entryCall(EntryPoint entry) {
        Expression func;
        switch (entry.kind()) {
            case FUNCTION:
                func = new Expression.Name(entry.name());
                break;
            case CLASS:
                func = new Expression.Name(entry.className());
                break;
            case METHOD:
                func = new Expression.Attribute(new Expression.Name(entry.className()), entry.name());
                break;
            default:
                throw new IllegalArgumentException("No entry call for " + entry.kind());
        }
        return new Expression.Call(func, List.of(), List.of());
    }

    /**
     * 顶层函数、类以及 Class.method 到定义行号的映射
     */
    public static Map<String, Integer> lineMapping(Module module) {
        Map<String, Integer> mapping = new LinkedHashMap<>();
        for (Statement statement : module.body()) {
            if (statement instanceof Statement.FunctionDef function) {
                mapping.put(function.name(), function.line());
            } else if (statement instanceof Statement.ClassDef classDef) {
                mapping.put(classDef.name(), classDef.line());
                for (Statement member : classDef.body()) {
                    if (member instanceof Statement.FunctionDef method) {
                        mapping.put(classDef.name() + "." + method.name(), method.line());
                    }
                }
            }
        }
        return mapping;
    }
}
