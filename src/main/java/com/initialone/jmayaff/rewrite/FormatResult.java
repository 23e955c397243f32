package com.initialone.jmayaff.rewrite;

/**
 * 单个文件的处理结果：改写前后的文本 + 实际应用的改写数。
 */
public final class FormatResult {

    public final String fileName;
    public final String before;
    public final String after;
    public final int editCount;

    public FormatResult(String fileName, String before, String after, int editCount) {
        this.fileName = fileName;
        this.before = before;
        this.after = after;
        this.editCount = editCount;
    }

    static FormatResult unchanged(String fileName, String source) {
        return new FormatResult(fileName, source, source, 0);
    }

    public boolean isChanged() {
        return !before.equals(after);
    }
}
