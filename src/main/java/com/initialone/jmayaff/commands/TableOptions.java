package com.initialone.jmayaff.commands;

import com.initialone.jmayaff.config.ConfigurationException;
import com.initialone.jmayaff.config.FlagTable;
import com.initialone.jmayaff.config.FlagTables;
import com.initialone.jmayaff.config.FormatterConfig;
import com.initialone.jmayaff.config.ModuleImport;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;

// format / flags 共用的选项：用哪张 flag 表 + 识别哪些模块
public class TableOptions {

    @CommandLine.Spec(CommandLine.Spec.Target.MIXEE)
    CommandLine.Model.CommandSpec mixee;

    @CommandLine.Option(names = {"-t", "--target-version"}, paramLabel = "VERSION",
            description = "Bundled Maya flag table to use (default: latest, see `versions`)")
    public String targetVersion;

    @CommandLine.Option(names = "--config", paramLabel = "JSON",
            description = "Custom flag table file {\"command\": {\"short\": \"long\"}}; excludes --target-version")
    public Path config;

    @CommandLine.Option(names = "--modules", paramLabel = "MODULE:MEMBER[,...]",
            defaultValue = ModuleImport.DEFAULT_MODULES,
            description = "Modules whose imports denote the command namespace (default: ${DEFAULT-VALUE})")
    public String modules;

    /** 配置错误转成 ParameterException，由 picocli 打印用法并返回 2 */
    public FlagTable flagTable() {
        if (targetVersion != null && config != null) {
            throw new CommandLine.ParameterException(mixee.commandLine(),
                    "Error: --target-version and --config are mutually exclusive");
        }
        try {
            if (config != null) return FlagTables.fromFile(config);
            if (targetVersion != null) return FlagTables.bundled(targetVersion);
            return FlagTables.latest();
        } catch (ConfigurationException e) {
            throw new CommandLine.ParameterException(mixee.commandLine(), e.getMessage(), e);
        }
    }

    public List<ModuleImport> moduleImports() {
        try {
            return ModuleImport.parseList(modules);
        } catch (ConfigurationException e) {
            throw new CommandLine.ParameterException(mixee.commandLine(), e.getMessage(), e);
        }
    }

    public FormatterConfig toConfig() {
        List<ModuleImport> imports = moduleImports();
        return new FormatterConfig(flagTable(), imports);
    }
}
