package com.initialone.jmayaff.util;

import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.Style;

/** 终端着色；Ansi 关闭时原样输出 */
public final class ConsoleStyle {

    private ConsoleStyle() {
    }

    public static String red(Ansi ansi, String msg) {
        return paint(ansi, Style.fg_red, msg);
    }

    public static String bold(Ansi ansi, String msg) {
        return paint(ansi, Style.bold, msg);
    }

    private static String paint(Ansi ansi, Style style, String msg) {
        if (ansi == null || !ansi.enabled()) return msg;
        return style.on() + msg + Style.reset.on();
    }
}
