package com.initialone.jmayaff.lexer;

/**
 * 一个词法单元。行号从 0 开始；列是该行内的 UTF-16 偏移（和 String.substring 一致），
 * 结束列不包含在内。
 */
public final class Token {

    public final TokenType type;
    public final String text;
    public final int line;
    public final int column;
    public final int endLine;
    public final int endColumn;

    public Token(TokenType type, String text, int line, int column, int endLine, int endColumn) {
        this.type = type;
        this.text = text;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public boolean is(TokenType t, String s) {
        return type == t && text.equals(s);
    }

    public boolean isOp(String s) {
        return is(TokenType.OP, s);
    }

    @Override
    public String toString() {
        return type + "'" + text + "'@" + line + ":" + column;
    }
}
