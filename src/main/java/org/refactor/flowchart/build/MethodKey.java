package org.refactor.flowchart.build;

import java.util.Objects;

/**
 * (类名, 方法名) 组合键
 */
public record MethodKey(String className, String methodName) {

    public MethodKey {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(methodName, "methodName");
    }

    @Override
    public String toString() {
        return className + "." + methodName;
    }
}
