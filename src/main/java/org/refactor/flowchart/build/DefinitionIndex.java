package org.refactor.flowchart.build;

import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Module;
import org.refactor.flowchart.ast.Statement;
import org.refactor.flowchart.ast.Statement.*;

import java.util.*;
import java.util.function.Consumer;

/**
 * 收集模块顶层的函数、类、类方法定义，供调用展开时查找
 */
public class DefinitionIndex {

    private final Map<String, FunctionDef> functions = new LinkedHashMap<>();
    private final Map<String, ClassDef> classes = new LinkedHashMap<>();
    private final Map<MethodKey, FunctionDef> methods = new LinkedHashMap<>();

    public static DefinitionIndex of(Module module) {
        DefinitionIndex index = new DefinitionIndex();
        for (Statement statement : module.body()) {
            if (statement instanceof FunctionDef function) {
                index.functions.put(function.name(), function);
            } else if (statement instanceof ClassDef classDef) {
                index.classes.put(classDef.name(), classDef);
                for (Statement member : classDef.body()) {
                    if (member instanceof FunctionDef method) {
                        index.methods.put(new MethodKey(classDef.name(), method.name()), method);
                    }
                }
            }
        }
        return index;
    }

    public boolean isFunction(String name) {
        return name != null && functions.containsKey(name);
    }

    public FunctionDef function(String name) {
        return functions.get(name);
    }

    public boolean isClass(String name) {
        return name != null && classes.containsKey(name);
    }

    public FunctionDef method(String className, String methodName) {
        return methods.get(new MethodKey(className, methodName));
    }

    /**
     * name 是否是类的属性：在 __init__ 里以 self.name = ... 赋值，或是类级变量
     */
    public boolean hasProperty(String className, String name) {
        ClassDef classDef = classes.get(className);
        if (classDef == null) {
            return false;
        }
        for (Statement member : classDef.body()) {
            if (member instanceof Assign assign) {
                for (Expression target : assign.targets()) {
                    if (target instanceof Expression.Name n && n.id().equals(name)) {
                        return true;
                    }
                }
            }
        }
        FunctionDef init = method(className, "__init__");
        if (init == null) {
            return false;
        }
        boolean[] found = {false};
        walk(init.body(), statement -> {
            if (statement instanceof Assign assign) {
                for (Expression target : assign.targets()) {
                    if (target instanceof Expression.Attribute attribute && attribute.attr().equals(name)) {
                        found[0] = true;
                    }
                }
            }
        });
        return found[0];
    }

    /** 先序遍历语句列表及所有嵌套的语句块 */
    static void walk(List<Statement> statements, Consumer<Statement> action) {
        for (Statement statement : statements) {
            action.accept(statement);
            if (statement instanceof If s) {
                walk(s.body(), action);
                walk(s.orElse(), action);
            } else if (statement instanceof For s) {
                walk(s.body(), action);
                walk(s.orElse(), action);
            } else if (statement instanceof While s) {
                walk(s.body(), action);
                walk(s.orElse(), action);
            } else if (statement instanceof Try s) {
                walk(s.body(), action);
                s.handlers().forEach(h -> walk(h.body(), action));
                walk(s.orElse(), action);
                walk(s.finalBody(), action);
            } else if (statement instanceof With s) {
                walk(s.body(), action);
            }
        }
    }
}
