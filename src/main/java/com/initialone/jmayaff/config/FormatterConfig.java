package com.initialone.jmayaff.config;

import java.util.List;

/**
 * 一次运行的全部配置：flag 表 + 要识别的模块对。不可变，显式传给解析器。
 */
public final class FormatterConfig {

    private final FlagTable flagTable;
    private final List<ModuleImport> modules;

    public FormatterConfig(FlagTable flagTable, List<ModuleImport> modules) {
        if (flagTable == null) throw new ConfigurationException("Flag table is required");
        if (modules == null || modules.isEmpty()) throw new ConfigurationException("No modules configured");
        this.flagTable = flagTable;
        this.modules = List.copyOf(modules);
    }

    public FormatterConfig(FlagTable flagTable) {
        this(flagTable, ModuleImport.DEFAULTS);
    }

    public FlagTable flagTable() {
        return flagTable;
    }

    public List<ModuleImport> modules() {
        return modules;
    }
}
