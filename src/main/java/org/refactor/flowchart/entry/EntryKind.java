package org.refactor.flowchart.entry;

import java.util.Locale;

/**
 * 入口类型：整个文件、单个函数、单个类、类的单个方法
 */
public enum EntryKind {
    FILE,
    FUNCTION,
    CLASS,
    METHOD;

    /** 元数据里使用的小写名字 */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
