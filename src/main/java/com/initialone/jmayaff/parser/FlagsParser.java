package com.initialone.jmayaff.parser;

import com.initialone.jmayaff.config.FormatterConfig;
import com.initialone.jmayaff.lexer.ParsedSource;
import com.initialone.jmayaff.lexer.PythonSourceParser;
import com.initialone.jmayaff.lexer.SourceSyntaxException;
import com.initialone.jmayaff.lexer.TokenCursor;
import com.initialone.jmayaff.model.CallRecord;

import java.util.List;

/**
 * 单个文件的解析流程：语法分析 → 导入解析 →（没有目标导入就直接返回）→ 调用点扫描。
 * 无状态，多个线程可共用一个实例。
 */
public class FlagsParser {

    private final ImportResolver resolver;
    private final CallSiteScanner scanner;

    public FlagsParser(FormatterConfig config) {
        this.resolver = new ImportResolver(config.modules());
        this.scanner = new CallSiteScanner(config.flagTable());
    }

    public List<CallRecord> parse(String source, String fileName) throws SourceSyntaxException {
        ParsedSource parsed = PythonSourceParser.parse(source, fileName);

        AliasSet aliases = resolver.resolve(parsed);
        if (aliases.isEmpty()) return List.of();

        return scanner.scan(new TokenCursor(parsed.tokens), aliases);
    }
}
