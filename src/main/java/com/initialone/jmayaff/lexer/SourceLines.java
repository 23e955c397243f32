package com.initialone.jmayaff.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 按行切分源码并保留行尾符（\r\n / \n / \r）。
 * 分词器和重写器都用它，保证两边的行号一致。
 */
public final class SourceLines {

    private SourceLines() {
    }

    public static List<String> split(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) return lines;
        int start = 0;
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < n && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
            i++;
        }
        if (start < n) lines.add(text.substring(start));
        return lines;
    }

    /** 行尾符长度：0、1 或 2 */
    public static int terminatorLength(String line) {
        if (line.endsWith("\r\n")) return 2;
        if (line.endsWith("\n") || line.endsWith("\r")) return 1;
        return 0;
    }

    /** 去掉行尾符后的内容 */
    public static String content(String line) {
        return line.substring(0, line.length() - terminatorLength(line));
    }
}
