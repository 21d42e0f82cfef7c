package org.refactor.flowchart.graph;

import java.util.Comparator;
import java.util.Objects;

/**
 * 作用域：主流程、函数、类、类方法，或同一函数的第 k 次调用实例。
 * 子图嵌套、折叠判定都按作用域进行。
 */
public sealed interface Scope {

    Scope MAIN = new Main();

    /** 按 id 排序，渲染和折叠时保证顺序稳定；id 相同时再按作用域种类区分 */
    Comparator<Scope> BY_ID = Comparator.comparing(Scope::id)
            .thenComparing(scope -> scope.getClass().getSimpleName());

    /** 渲染、元数据中使用的字符串 id */
    String id();

    /** 子图标题，主流程没有标题 */
    String title();

    /** 所属类名，非类作用域返回 null */
    default String owningClass() {
        return null;
    }

    /** 函数名（普通函数及其调用实例），其余返回 null；递归检测按它比较 */
    default String functionName() {
        return null;
    }

    /** 折叠规则中按模式匹配时用的名字：类作用域用类名，调用实例用函数名 */
    default String baseName() {
        String owner = owningClass();
        return owner != null ? owner : functionName();
    }

    default String displayName(int nodeCount) {
        String title = title();
        return (title == null ? "Main Flow" : title) + " (" + nodeCount + " nodes)";
    }

    record Main() implements Scope {
        // 不是合法的 Python 标识符，不会和 def main() 撞上
        @Override
        public String id() {
            return "<main>";
        }

        @Override
        public String title() {
            return null;
        }
    }

    record Function(String name) implements Scope {
        public Function {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String id() {
            return name;
        }

        @Override
        public String title() {
            return "Function: " + name + "()";
        }

        @Override
        public String functionName() {
            return name;
        }
    }

    record ClassScope(String name) implements Scope {
        public ClassScope {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String id() {
            return "class_" + name;
        }

        @Override
        public String title() {
            return "Class: " + name;
        }

        @Override
        public String owningClass() {
            return name;
        }
    }

    record Method(String className, String methodName) implements Scope {
        public Method {
            Objects.requireNonNull(className, "className");
            Objects.requireNonNull(methodName, "methodName");
        }

        @Override
        public String id() {
            return "class_" + className + "_" + methodName;
        }

        @Override
        public String title() {
            return "Method: " + methodName;
        }

        @Override
        public String owningClass() {
            return className;
        }

        public ClassScope classScope() {
            return new ClassScope(className);
        }
    }

    /** 同一函数的第 index 次调用（index >= 2），第一次调用用 {@link Function} */
    record CallInstance(String function, int index) implements Scope {
        public CallInstance {
            Objects.requireNonNull(function, "function");
        }

        @Override
        public String id() {
            return function + "_call_" + index;
        }

        @Override
        public String title() {
            return "Function: " + function + "() - Call " + index;
        }

        @Override
        public String functionName() {
            return function;
        }
    }
}
