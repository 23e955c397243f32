package com.initialone.jmayaff;

import com.initialone.jmayaff.commands.*;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jmayaff",
        version = "0.1.0",
        mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true,
        sortOptions = false,
        description = {
                "Rewrite short Maya command flags to long flags in Python sources.",
                "  cmds.polyCube(n='box', w=2)  ->  cmds.polyCube(name='box', width=2)",
                "",
                "Only calls reached through an import of maya.cmds (or the --modules you give) are touched."
        },
        subcommands = {
                FormatCmd.class, VersionsCmd.class, FlagsCmd.class
        }
)
public class Main implements Runnable {
    public void run() { System.out.println("Use a subcommand. Try --help."); }
    public static void main(String[] args) {
        int code = new CommandLine(new Main()).execute(args);
        System.exit(code);
    }
}
