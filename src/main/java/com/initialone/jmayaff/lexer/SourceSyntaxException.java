package com.initialone.jmayaff.lexer;

/**
 * 源码无法按 Python 3 解析（词法错误、语法错误、缩进错误、编码错误等）。
 * 对单个文件是致命的，调用方必须向上抛出并把该文件计为失败。
 */
public class SourceSyntaxException extends Exception {

    private final String fileName;
    /** 1-based，与 Python 的 SyntaxError 保持一致 */
    private final int line;
    private final String reason;

    public SourceSyntaxException(String reason, String fileName, int line) {
        super(format(reason, fileName, line));
        this.reason = reason;
        this.fileName = fileName;
        this.line = line;
    }

    public SourceSyntaxException(String reason, String fileName, int line, Throwable cause) {
        this(reason, fileName, line);
        initCause(cause);
    }

    private static String format(String reason, String fileName, int line) {
        String f = (fileName == null || fileName.isBlank()) ? "<unknown>" : fileName;
        return "File \"" + f + "\", line " + line + ": " + reason;
    }

    public String getFileName() { return fileName; }
    public int getLine() { return line; }
    public String getReason() { return reason; }
}
