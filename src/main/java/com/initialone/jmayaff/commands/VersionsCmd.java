package com.initialone.jmayaff.commands;

import com.initialone.jmayaff.config.FlagTables;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "versions",
        mixinStandardHelpOptions = true,
        description = "List the bundled Maya flag table versions"
)
public class VersionsCmd implements Callable<Integer> {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<String> versions = FlagTables.availableVersions();
        String latest = versions.isEmpty() ? null : versions.get(versions.size() - 1);
        for (String v : versions) {
            out.println(v.equals(latest) ? v + " (latest)" : v);
        }
        out.flush();
        return 0;
    }
}
