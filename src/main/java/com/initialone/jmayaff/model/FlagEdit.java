package com.initialone.jmayaff.model;

import com.initialone.jmayaff.lexer.Token;

/**
 * 一处计划中的替换：把第 line 行 [startColumn, endColumn) 的短 flag 换成长名。
 * longName 为空表示该 flag 已登记但没有长名，重写时跳过。
 */
public final class FlagEdit implements CallNode {

    public final String shortName;
    public final String longName;
    /** 0-based */
    public final int line;
    public final int startColumn;
    public final int endColumn;

    public FlagEdit(String shortName, String longName, int line, int startColumn, int endColumn) {
        if (startColumn < 0 || startColumn >= endColumn) {
            throw new IllegalArgumentException("Invalid span [" + startColumn + ", " + endColumn + ") for " + shortName);
        }
        this.shortName = shortName;
        this.longName = longName == null ? "" : longName;
        this.line = line;
        this.startColumn = startColumn;
        this.endColumn = endColumn;
    }

    public static FlagEdit of(Token token, String longName) {
        return new FlagEdit(token.text, longName, token.line, token.column, token.endColumn);
    }

    public boolean hasReplacement() {
        return !longName.isEmpty();
    }

    @Override
    public String toString() {
        return shortName + "->" + longName + "@" + line + ":" + startColumn + "-" + endColumn;
    }
}
