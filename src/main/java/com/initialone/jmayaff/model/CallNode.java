package com.initialone.jmayaff.model;

/** 调用记录里的一项：要么是一个 {@link FlagEdit}，要么是嵌套的 {@link CallRecord}。 */
public interface CallNode {
}
