package com.initialone.jmayaff.commands;

import com.initialone.jmayaff.config.FlagTable;
import com.initialone.jmayaff.util.ConsoleStyle;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * 打印某个命令的 短名 → 长名 映射，方便排查某个 flag 为什么没被改写。
 */
@CommandLine.Command(
        name = "flags",
        mixinStandardHelpOptions = true,
        sortOptions = false,
        description = "Print the short -> long flag mapping of one command"
)
public class FlagsCmd implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "COMMAND", description = "Command name, e.g. polyCube")
    String command;

    @CommandLine.Mixin
    TableOptions table;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        FlagTable flags = table.flagTable();

        if (!flags.isCommand(command)) {
            err.println(ConsoleStyle.red(spec.commandLine().getColorScheme().ansi(),
                    "[flags] unknown command '" + command + "' in table " + flags.version()));
            err.flush();
            return 1;
        }

        out.println("[flags] " + command + " (" + flags.version() + ")");
        for (Map.Entry<String, String> e : new TreeMap<>(flags.flagsOf(command)).entrySet()) {
            String longName = e.getValue().isEmpty() ? "(no long name)" : e.getValue();
            out.println("  " + e.getKey() + " -> " + longName);
        }
        out.flush();
        return 0;
    }
}
