package com.initialone.jmayaff.util;

import java.nio.charset.Charset;
import java.nio.file.Path;

/** 读入的源文件：文本 + 写回时需要保持的编码信息 */
public final class SourceFile {

    public final Path path;
    public final String text;
    public final Charset charset;
    /** 原文件是否带 UTF-8 BOM */
    public final boolean bom;

    public SourceFile(Path path, String text, Charset charset, boolean bom) {
        this.path = path;
        this.text = text;
        this.charset = charset;
        this.bom = bom;
    }
}
