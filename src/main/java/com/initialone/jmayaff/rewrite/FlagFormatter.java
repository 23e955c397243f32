package com.initialone.jmayaff.rewrite;

import com.initialone.jmayaff.config.FormatterConfig;
import com.initialone.jmayaff.lexer.SourceSyntaxException;
import com.initialone.jmayaff.model.CallRecord;
import com.initialone.jmayaff.model.FlagEdit;
import com.initialone.jmayaff.parser.FlagsParser;

import java.util.List;

/**
 * 对外入口：把源码里的短 flag 改成长名。纯计算，不读写文件，可多线程共用。
 */
public class FlagFormatter {

    private final FlagsParser parser;

    public FlagFormatter(FormatterConfig config) {
        this.parser = new FlagsParser(config);
    }

    public FormatResult format(String source, String fileName) throws SourceSyntaxException {
        List<CallRecord> records = parser.parse(source, fileName);
        if (records.isEmpty()) return FormatResult.unchanged(fileName, source);

        int applied = 0;
        for (FlagEdit e : FlagRewriter.flatten(records)) {
            if (e.hasReplacement()) applied++;
        }
        return new FormatResult(fileName, source, FlagRewriter.rewrite(source, records), applied);
    }

    public String formatString(String source) throws SourceSyntaxException {
        return format(source, "<unknown>").after;
    }
}
