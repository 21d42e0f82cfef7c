package org.refactor.flowchart.build;

import org.refactor.flowchart.ast.Expression;
import org.refactor.flowchart.ast.Expression.Attribute;
import org.refactor.flowchart.ast.Expression.Call;
import org.refactor.flowchart.ast.Expression.Name;
import org.refactor.flowchart.ast.Statement.FunctionDef;
import org.refactor.flowchart.graph.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 轻量的类型推断：只记录 "变量 / 形参 / self 属性 → 类名"，
 * 用来把 obj.m() 展开成对应类的方法体。查不到时返回空，不抛异常。
 */
public class TypeResolver {

    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    /**
     * 接收者解析结果
     *
     * @param className    类名
     * @param staticAccess 接收者是类名本身（C.m()），而不是实例
     */
    public record Resolution(String className, boolean staticAccess) {
    }

    private final DefinitionIndex index;

    // 变量 -> 类，全局
    private final Map<String, String> variableTypes = new HashMap<>();
    // 作用域 -> (形参 -> 类)
    private final Map<Scope, Map<String, String>> parameterTypes = new HashMap<>();
    // 方法作用域 -> (self 属性 -> 类)，保持插入顺序，回退查找时结果稳定
    private final Map<Scope, Map<String, String>> attributeTypes = new LinkedHashMap<>();

    public TypeResolver(DefinitionIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * 解析方法调用接收者的类。
     * 顺序：已知类型的变量 / 形参，self，新建实例 C(...)，self.attr，最后是类名本身。
     */
    public Optional<Resolution> resolveReceiver(Expression receiver, Scope scope) {
        if (receiver instanceof Name name) {
            String id = name.id();
            String type = parameterTypes.getOrDefault(scope, Map.of()).get(id);
            if (type == null) {
                type = variableTypes.get(id);
            }
            if (type != null) {
                return Optional.of(new Resolution(type, false));
            }
            if ("self".equals(id) && scope.owningClass() != null) {
                return Optional.of(new Resolution(scope.owningClass(), false));
            }
            if (index.isClass(id)) {
                return Optional.of(new Resolution(id, true));
            }
            return Optional.empty();
        }
        if (receiver instanceof Call call && index.isClass(call.simpleName())) {
            return Optional.of(new Resolution(call.simpleName(), false));
        }
        if (receiver instanceof Attribute attribute && isSelf(attribute.value())) {
            String type = attributeType(attribute.attr(), scope);
            if (type != null) {
                return Optional.of(new Resolution(type, false));
            }
        }
        return Optional.empty();
    }

    /** 表达式作为实例时的类名，类名本身（静态访问）不算 */
    public String instanceType(Expression expr, Scope scope) {
        return resolveReceiver(expr, scope)
                .filter(r -> !r.staticAccess())
                .map(Resolution::className)
                .orElse(null);
    }

    public String variableType(String variable) {
        return variableTypes.get(variable);
    }

    public String parameterType(Scope scope, String parameter) {
        return parameterTypes.getOrDefault(scope, Map.of()).get(parameter);
    }

    /**
     * 记录 var = C(...)，并把实参类型传给构造函数的形参。
     *
     * @param variable 变量名，语句形式的 C(...) 传 null
     */
    public void recordInstantiation(String variable, String className, Call call, Scope scope) {
        if (variable != null) {
            variableTypes.put(variable, className);
            log.debug("Variable '{}' bound to class {}", variable, className);
        }
        FunctionDef init = index.method(className, "__init__");
        if (init != null) {
            propagateArguments(new Scope.Method(className, "__init__"), init, call, scope);
        }
    }

    /**
     * 把调用处能确定类型的实参记到被调函数作用域的形参上
     */
    public void propagateArguments(Scope calleeScope, FunctionDef callee, Call call, Scope callerScope) {
        List<String> params = callee.takesSelf()
                ? callee.params().subList(1, callee.params().size())
                : callee.params();
        for (int i = 0; i < call.args().size() && i < params.size(); i++) {
            recordParameter(calleeScope, params.get(i), instanceType(call.args().get(i), callerScope));
        }
        for (Expression.Keyword keyword : call.keywords()) {
            if (keyword.arg() != null && params.contains(keyword.arg())) {
                recordParameter(calleeScope, keyword.arg(), instanceType(keyword.value(), callerScope));
            }
        }
    }

    private void recordParameter(Scope scope, String param, String type) {
        if (type != null) {
            parameterTypes.computeIfAbsent(scope, k -> new HashMap<>()).put(param, type);
        }
    }

    /**
     * 记录方法体里的 self.attr = param 和 self.attr = C(...)
     */
    public void recordAttributeAssignment(Expression target, Expression value, Scope scope) {
        if (!(target instanceof Attribute attribute) || !isSelf(attribute.value())
                || !(scope instanceof Scope.Method)) {
            return;
        }
        String type = null;
        if (value instanceof Call call && index.isClass(call.simpleName())) {
            type = call.simpleName();
        } else if (value instanceof Name name) {
            type = parameterType(scope, name.id());
            if (type == null) {
                type = variableTypes.get(name.id());
            }
        }
        if (type != null) {
            attributeTypes.computeIfAbsent(scope, k -> new HashMap<>()).put(attribute.attr(), type);
            log.debug("Attribute self.{} in {} bound to class {}", attribute.attr(), scope.id(), type);
        }
    }

    /** 当前方法 -> 构造函数 -> 同类的其它方法 */
    private String attributeType(String attr, Scope scope) {
        String owner = scope.owningClass();
        String type = attributeTypes.getOrDefault(scope, Map.of()).get(attr);
        if (type != null || owner == null) {
            return type;
        }
        type = attributeTypes.getOrDefault(new Scope.Method(owner, "__init__"), Map.of()).get(attr);
        if (type != null) {
            return type;
        }
        for (Map.Entry<Scope, Map<String, String>> entry : attributeTypes.entrySet()) {
            if (entry.getKey() instanceof Scope.Method method && method.className().equals(owner)
                    && entry.getValue().containsKey(attr)) {
                return entry.getValue().get(attr);
            }
        }
        return null;
    }

    private static boolean isSelf(Expression expr) {
        return expr instanceof Name name && "self".equals(name.id());
    }
}
