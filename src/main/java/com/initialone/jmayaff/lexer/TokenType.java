package com.initialone.jmayaff.lexer;

/**
 * {@link PythonSourceParser} 输出的 token 类别，按标准库 tokenize 的分类归并：
 * 关键字算 NAME，所有运算符和括号算 OP。空行、注释行和括号内的换行不产生 token。
 */
public enum TokenType {
    /** 标识符和关键字 */
    NAME,
    NUMBER,
    /** 任意前缀的字符串字面量，包括跨行的三引号字符串 */
    STRING,
    /** 运算符和括号 */
    OP,
    COMMENT,
    /** 逻辑行结束 */
    NEWLINE,
    INDENT,
    DEDENT,
    ENDMARKER;

    /** 扫描器只关心这几类 */
    public boolean isSignificant() {
        return this == NAME || this == NUMBER || this == STRING || this == OP;
    }
}
