package org.refactor.flowchart.entry;

import org.refactor.flowchart.graph.Scope;

import java.util.Objects;

/**
 * 调用方指定的流程图入口。
 *
 * @param kind      入口类型
 * @param name      函数名或方法名，CLASS / FILE 时为 null
 * @param className 所属类名，FUNCTION / FILE 时为 null
 * @param filePath  源文件路径，只写进元数据，可以为 null
 */
public record EntryPoint(EntryKind kind, String name, String className, String filePath) {

    public EntryPoint {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case FUNCTION:
                Objects.requireNonNull(name, "name");
                break;
            case CLASS:
                Objects.requireNonNull(className, "className");
                break;
            case METHOD:
                Objects.requireNonNull(name, "name");
                Objects.requireNonNull(className, "className");
                break;
            default:
                break;
        }
    }

    public static EntryPoint file(String filePath) {
        return new EntryPoint(EntryKind.FILE, null, null, filePath);
    }

    public static EntryPoint function(String name) {
        return new EntryPoint(EntryKind.FUNCTION, name, null, null);
    }

    public static EntryPoint ofClass(String className) {
        return new EntryPoint(EntryKind.CLASS, null, className, null);
    }

    public static EntryPoint method(String className, String name) {
        return new EntryPoint(EntryKind.METHOD, name, className, null);
    }

    public EntryPoint withFilePath(String path) {
        return new EntryPoint(kind, name, className, path);
    }

    /** 入口对应的作用域，FILE 没有 */
    public Scope scope() {
        switch (kind) {
            case FUNCTION:
                return new Scope.Function(name);
            case CLASS:
                return new Scope.ClassScope(className);
            case METHOD:
                return new Scope.Method(className, name);
            default:
                return null;
        }
    }

    /** 行号映射中的键：函数名、类名或 Class.method */
    public String mappingKey() {
        switch (kind) {
            case FUNCTION:
                return name;
            case CLASS:
                return className;
            case METHOD:
                return className + "." + name;
            default:
                return null;
        }
    }

    /** 按类访问入口（类入口、方法入口）时，允许直接在类上调用实例方法 */
    public boolean allowsClassAccess(String cls) {
        return (kind == EntryKind.CLASS || kind == EntryKind.METHOD) && cls.equals(className);
    }
}
