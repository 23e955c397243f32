package com.initialone.jmayaff.lexer;

import com.initialone.jmayaff.antlr.Python3Parser;

import java.util.List;

/** 一次成功解析的结果：语法树 + 全部 token（含注释，行列为 UTF-16） */
public final class ParsedSource {

    public final Python3Parser.File_inputContext tree;
    public final List<Token> tokens;

    ParsedSource(Python3Parser.File_inputContext tree, List<Token> tokens) {
        this.tree = tree;
        this.tokens = List.copyOf(tokens);
    }
}
