package com.initialone.jmayaff.model;

import java.util.List;

/**
 * 一个目标命令调用点及其收集到的改写项（按源码顺序，可嵌套）。
 */
public final class CallRecord implements CallNode {

    public final String commandName;
    public final List<CallNode> edits;

    public CallRecord(String commandName, List<CallNode> edits) {
        this.commandName = commandName;
        this.edits = List.copyOf(edits);
    }

    @Override
    public String toString() {
        return commandName + edits;
    }
}
