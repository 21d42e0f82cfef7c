package org.refactor.flowchart.build;

/**
 * 当前循环的跳转目标：continue 回到 startId，break 跳到 exitId
 */
record LoopFrame(String startId, String exitId) {
}
