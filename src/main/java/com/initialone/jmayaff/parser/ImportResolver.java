package com.initialone.jmayaff.parser;

import com.initialone.jmayaff.antlr.Python3Parser;
import com.initialone.jmayaff.antlr.Python3ParserBaseListener;
import com.initialone.jmayaff.config.ModuleImport;
import com.initialone.jmayaff.lexer.ParsedSource;
import com.initialone.jmayaff.lexer.PythonSourceParser;
import com.initialone.jmayaff.lexer.SourceSyntaxException;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * 从 import 语句里找出指向目标命名空间的本地名字：
 * - import maya.cmds            → maya.cmds
 * - import maya.cmds as mc      → mc
 * - from maya import cmds       → cmds
 * - from maya import cmds as mc → mc
 *
 * 遍历整棵语法树，函数体、条件分支里的 import 也算。相对导入和 import * 不匹配。
 */
public class ImportResolver {

    private final List<ModuleImport> modules;

    public ImportResolver(List<ModuleImport> modules) {
        this.modules = List.copyOf(modules);
    }

    /** 解析 + 查找；不是合法 Python 3 时抛 {@link SourceSyntaxException} */
    public AliasSet resolve(String source, String fileName) throws SourceSyntaxException {
        return resolve(PythonSourceParser.parse(source, fileName));
    }

    public AliasSet resolve(ParsedSource parsed) {
        ImportListener listener = new ImportListener();
        ParseTreeWalker.DEFAULT.walk(listener, parsed.tree);
        return new AliasSet(listener.found);
    }

    private final class ImportListener extends Python3ParserBaseListener {

        private final List<String> found = new ArrayList<>();

        @Override
        public void enterImport_name(Python3Parser.Import_nameContext ctx) {
            for (Python3Parser.Dotted_as_nameContext item : ctx.dotted_as_names().dotted_as_name()) {
                String dotted = item.dotted_name().getText();
                String alias = item.name() != null ? item.name().getText() : dotted;
                for (ModuleImport m : modules) {
                    if (dotted.equals(m.dottedPath())) found.add(alias);
                }
            }
        }

        @Override
        public void enterImport_from(Python3Parser.Import_fromContext ctx) {
            // from . import x / from .pkg import x / from m import *
            if (ctx.getChild(1).getText().startsWith(".") || ctx.import_as_names() == null) return;
            String module = ctx.dotted_name().getText();
            for (Python3Parser.Import_as_nameContext item : ctx.import_as_names().import_as_name()) {
                String member = item.name(0).getText();
                String alias = item.name().size() > 1 ? item.name(1).getText() : member;
                for (ModuleImport m : modules) {
                    if (module.equals(m.module()) && member.equals(m.member())) found.add(alias);
                }
            }
        }
    }
}
