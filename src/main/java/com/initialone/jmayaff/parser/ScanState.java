package com.initialone.jmayaff.parser;

/**
 * 调用点扫描器的状态。
 */
public enum ScanState {
    /** 在调用之外，寻找命名空间前缀 */
    SEEKING_NAME,
    /** 在某个目标调用的参数列表里（可能是嵌套调用），深度由调用帧记录 */
    IN_CALL_ARGS
}
