package com.initialone.jmayaff.commands;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.*;

class FlagsCmdTest {

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(Object command, String... args) {
        CommandLine cmd = new CommandLine(command);
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        cmd.setColorScheme(CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.OFF));
        return cmd.execute(args);
    }

    @Test
    void flags_shouldListShortToLongMapping() {
        assertEquals(0, run(new FlagsCmd(), "delete", "-t", "2018"));

        String o = out.toString();
        assertTrue(o.contains("[flags] delete (2018)"), o);
        assertTrue(o.contains("  ch -> constructionHistory"), o);
        assertTrue(o.contains("  at -> attribute"), o);
    }

    @Test
    void flags_shouldFailForUnknownCommandOrVersion() {
        assertEquals(1, run(new FlagsCmd(), "noSuchCommand"));
        assertTrue(err.toString().contains("unknown command 'noSuchCommand'"), err.toString());

        assertEquals(2, run(new FlagsCmd(), "delete", "-t", "1999"));
    }

    @Test
    void versions_shouldMarkLatest() {
        assertEquals(0, run(new VersionsCmd()));

        assertEquals("2018" + System.lineSeparator() + "2022 (latest)" + System.lineSeparator(), out.toString());
    }
}
