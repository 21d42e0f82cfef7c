package org.refactor.flowchart.config;

import java.util.Locale;

/**
 * 视图模式：决定渲染前隐藏哪些 "噪声" 节点
 */
public enum ViewMode {
    /** 全部节点 */
    DETAILED,
    /** 隐藏 print、import、异常脚手架、诊断、构造函数内部 */
    COMPACT,
    /** 只保留起止、调用、返回、折叠占位 */
    TERSE;

    /**
     * 解析配置值，支持别名 advanced / simple / short / calls。
     * 无法识别时返回 null，由调用方决定默认值。
     */
    public static ViewMode parse(String value) {
        if (value == null) {
            return null;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "detailed":
            case "advanced":
                return DETAILED;
            case "compact":
            case "simple":
            case "short":
                return COMPACT;
            case "terse":
            case "calls":
                return TERSE;
            default:
                return null;
        }
    }
}
