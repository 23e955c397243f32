package com.initialone.jmayaff.lexer;

import java.util.List;

/**
 * ANTLR 的下标按码点计，重写器按 UTF-16 列改行内文本；这里做两者的换算，
 * 再按 {@link SourceLines} 的换行规则（\r\n / \n / \r）求 0-based 的行和列。
 */
final class SourcePositions {

    /** 码点下标 → UTF-16 偏移；全是 BMP 字符时为 null */
    private final int[] offsets;
    private final int codePoints;
    private final int[] lineStarts;

    SourcePositions(String text) {
        codePoints = text.codePointCount(0, text.length());
        if (codePoints == text.length()) {
            offsets = null;
        } else {
            offsets = new int[codePoints + 1];
            int o = 0;
            for (int i = 0; i < codePoints; i++) {
                offsets[i] = o;
                o += Character.charCount(text.codePointAt(o));
            }
            offsets[codePoints] = o;
        }

        List<String> lines = SourceLines.split(text);
        // 以换行结尾（或空文件）时，文件末尾落在一个空的虚拟行上
        boolean trailingLine = lines.isEmpty() || SourceLines.terminatorLength(lines.get(lines.size() - 1)) > 0;
        lineStarts = new int[lines.size() + (trailingLine ? 1 : 0)];
        int start = 0;
        for (int i = 0; i < lines.size(); i++) {
            lineStarts[i] = start;
            start += lines.get(i).length();
        }
        if (trailingLine) lineStarts[lineStarts.length - 1] = start;
    }

    int codePointCount() {
        return codePoints;
    }

    int offset(int codePointIndex) {
        int i = Math.max(0, Math.min(codePointIndex, codePoints));
        return offsets == null ? i : offsets[i];
    }

    int lineOf(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) lo = mid;
            else hi = mid - 1;
        }
        return lo;
    }

    int lineStart(int line) {
        return lineStarts[line];
    }
}
