package com.initialone.jmayaff.rewrite;

import com.initialone.jmayaff.lexer.SourceLines;
import com.initialone.jmayaff.model.CallNode;
import com.initialone.jmayaff.model.CallRecord;
import com.initialone.jmayaff.model.FlagEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 把改写项应用到原始文本上。除了 flag 所在的列区间，其余字符（注释、字符串、空行、行尾符）原样保留。
 * 同一行的改写按起始列从右往左应用，列偏移始终基于该行原文。
 */
public final class FlagRewriter {

    private FlagRewriter() {
    }

    /** 展开嵌套记录，保持源码顺序 */
    public static List<FlagEdit> flatten(List<CallRecord> records) {
        List<FlagEdit> out = new ArrayList<>();
        for (CallRecord r : records) collect(r, out);
        return out;
    }

    private static void collect(CallRecord record, List<FlagEdit> out) {
        for (CallNode node : record.edits) {
            if (node instanceof CallRecord) {
                collect((CallRecord) node, out);
            } else {
                out.add((FlagEdit) node);
            }
        }
    }

    public static String rewrite(String source, List<CallRecord> records) {
        Map<Integer, List<FlagEdit>> byLine = new TreeMap<>();
        for (FlagEdit e : flatten(records)) {
            if (!e.hasReplacement()) continue;
            byLine.computeIfAbsent(e.line, k -> new ArrayList<>()).add(e);
        }
        if (byLine.isEmpty()) return source;

        List<String> lines = SourceLines.split(source);
        for (var entry : byLine.entrySet()) {
            int lineNo = entry.getKey();
            if (lineNo < 0 || lineNo >= lines.size()) {
                throw new IllegalStateException("Edit on line " + lineNo + " outside of source with " + lines.size() + " lines");
            }
            lines.set(lineNo, applyLine(lines.get(lineNo), entry.getValue()));
        }
        return String.join("", lines);
    }

    private static String applyLine(String line, List<FlagEdit> edits) {
        String content = SourceLines.content(line);
        String terminator = line.substring(content.length());

        List<FlagEdit> sorted = new ArrayList<>(edits);
        sorted.sort(Comparator.comparingInt((FlagEdit e) -> e.startColumn).reversed());

        StringBuilder sb = new StringBuilder(content);
        int limit = content.length();
        for (FlagEdit e : sorted) {
            if (e.endColumn > limit) {
                throw new IllegalStateException("Overlapping or out of range edit " + e + " on line: " + content);
            }
            if (!content.substring(e.startColumn, e.endColumn).equals(e.shortName)) {
                throw new IllegalStateException("Edit " + e + " does not match source text on line: " + content);
            }
            sb.replace(e.startColumn, e.endColumn, e.longName);
            limit = e.startColumn;
        }
        return sb.append(terminator).toString();
    }
}
