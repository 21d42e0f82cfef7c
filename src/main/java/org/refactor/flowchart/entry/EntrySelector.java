package org.refactor.flowchart.entry;

import org.refactor.flowchart.ast.Module;

/**
 * 按入口裁剪模块，得到真正交给构建器的语句
 */
public interface EntrySelector {

    Module select(Module module, EntryPoint entry);
}
