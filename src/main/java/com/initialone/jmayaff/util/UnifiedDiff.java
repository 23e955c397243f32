package com.initialone.jmayaff.util;

import com.initialone.jmayaff.lexer.SourceLines;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Help.Ansi.Style;

import java.util.ArrayList;
import java.util.List;

/**
 * 生成 unified diff。改写不改变行数，所以逐行对比即可；
 * 行数不一致时退化成一个整体替换的 hunk。
 */
public final class UnifiedDiff {

    public static final int DEFAULT_CONTEXT = 5;

    private UnifiedDiff() {
    }

    public static String render(String before, String after, String fileName, int context) {
        List<String> a = SourceLines.split(before);
        List<String> b = SourceLines.split(after);
        if (a.equals(b)) return "";

        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(fileName).append('\n');
        sb.append("+++ ").append(fileName).append('\n');

        if (a.size() != b.size()) {
            sb.append(header(0, a.size(), 0, b.size()));
            for (String l : a) appendLine(sb, '-', l);
            for (String l : b) appendLine(sb, '+', l);
            return sb.toString();
        }

        List<Integer> changed = new ArrayList<>();
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i).equals(b.get(i))) changed.add(i);
        }

        int ctx = Math.max(0, context);
        int k = 0;
        while (k < changed.size()) {
            // 中间未改动的行不超过 2*context 时合并成一个 hunk
            int first = changed.get(k);
            int last = first;
            int next = k + 1;
            while (next < changed.size() && changed.get(next) - last - 1 <= 2 * ctx) {
                last = changed.get(next);
                next++;
            }
            int start = Math.max(0, first - ctx);
            int end = Math.min(a.size(), last + ctx + 1);
            sb.append(header(start, end - start, start, end - start));

            int i = start;
            while (i < end) {
                if (a.get(i).equals(b.get(i))) {
                    appendLine(sb, ' ', a.get(i));
                    i++;
                    continue;
                }
                int runEnd = i;
                while (runEnd < end && !a.get(runEnd).equals(b.get(runEnd))) runEnd++;
                for (int r = i; r < runEnd; r++) appendLine(sb, '-', a.get(r));
                for (int r = i; r < runEnd; r++) appendLine(sb, '+', b.get(r));
                i = runEnd;
            }
            k = next;
        }
        return sb.toString();
    }

    /** 头部加粗、@@ 青色、+ 绿色、- 红色；终端不支持颜色时原样返回 */
    public static String colorize(String diff, Ansi ansi) {
        if (diff.isEmpty() || !ansi.enabled()) return diff;
        StringBuilder sb = new StringBuilder();
        for (String line : SourceLines.split(diff)) {
            String content = SourceLines.content(line);
            String term = line.substring(content.length());
            Style style = null;
            if (content.startsWith("+++") || content.startsWith("---")) style = Style.bold;
            else if (content.startsWith("@@")) style = Style.fg_cyan;
            else if (content.startsWith("+")) style = Style.fg_green;
            else if (content.startsWith("-")) style = Style.fg_red;

            if (style == null) {
                sb.append(line);
            } else {
                sb.append(style.on()).append(content).append(Style.reset.on()).append(term);
            }
        }
        return sb.toString();
    }

    private static String header(int aStart, int aLen, int bStart, int bLen) {
        return "@@ -" + range(aStart, aLen) + " +" + range(bStart, bLen) + " @@\n";
    }

    private static String range(int start, int len) {
        int first = len == 0 ? start : start + 1;
        return len == 1 ? String.valueOf(first) : first + "," + len;
    }

    private static void appendLine(StringBuilder sb, char prefix, String line) {
        sb.append(prefix).append(line);
        if (SourceLines.terminatorLength(line) == 0) {
            sb.append("\n\\ No newline at end of file\n");
        }
    }
}
