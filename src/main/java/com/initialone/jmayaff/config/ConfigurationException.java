package com.initialone.jmayaff.config;

/**
 * 启动阶段的配置错误：模块对写错、版本不存在、flag 表读不出来。
 * 在处理任何文件之前抛出。
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
