package com.initialone.jmayaff.lexer;

import com.initialone.jmayaff.antlr.Python3Lexer;
import com.initialone.jmayaff.antlr.Python3Parser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;

import java.util.ArrayList;
import java.util.List;

/**
 * 用 ANTLR 生成的 Python3Lexer / Python3Parser 解析整个文件。
 * 遇到第一个语法错误就停止，转成 {@link SourceSyntaxException}；成功时返回语法树，
 * 以及换算成 UTF-16 行列的 token 列表（含 HIDDEN 通道上的注释）。
 */
public final class PythonSourceParser {

    private PythonSourceParser() {
    }

    public static ParsedSource parse(String source, String fileName) throws SourceSyntaxException {
        String text = source == null ? "" : source;
        SourcePositions positions = new SourcePositions(text);
        Python3Lexer lexer = newLexer(text, fileName);
        CommonTokenStream stream = new CommonTokenStream(lexer);
        Python3Parser parser = new Python3Parser(stream);

        SyntaxErrorListener listener = new SyntaxErrorListener(lexer, positions.codePointCount());
        lexer.removeErrorListeners();
        lexer.addErrorListener(listener);
        parser.removeErrorListeners();
        parser.addErrorListener(listener);

        try {
            Python3Parser.File_inputContext tree = parser.file_input();
            return new ParsedSource(tree, convert(stream.getTokens(), positions));
        } catch (SyntaxAbort e) {
            throw e.toException(fileName, positions);
        }
    }

    /** 只做词法分析，不建语法树；括号没闭合的片段也能切分 */
    public static List<Token> tokenize(String source, String fileName) throws SourceSyntaxException {
        String text = source == null ? "" : source;
        SourcePositions positions = new SourcePositions(text);
        Python3Lexer lexer = newLexer(text, fileName);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new SyntaxErrorListener(lexer, positions.codePointCount()));

        CommonTokenStream stream = new CommonTokenStream(lexer);
        try {
            stream.fill();
        } catch (SyntaxAbort e) {
            throw e.toException(fileName, positions);
        }
        return convert(stream.getTokens(), positions);
    }

    private static Python3Lexer newLexer(String text, String fileName) {
        String name = (fileName == null || fileName.isBlank()) ? "<unknown>" : fileName;
        return new Python3Lexer(CharStreams.fromString(text, name));
    }

    private static List<Token> convert(List<org.antlr.v4.runtime.Token> tokens, SourcePositions positions) {
        List<Token> out = new ArrayList<>(tokens.size());
        for (org.antlr.v4.runtime.Token t : tokens) {
            TokenType type = typeOf(t);
            int start = positions.offset(t.getStartIndex());
            int end = Math.max(start, positions.offset(t.getStopIndex() + 1));
            int line = positions.lineOf(start);
            int endLine = positions.lineOf(end);
            String text = type == TokenType.ENDMARKER ? "" : t.getText();
            out.add(new Token(type, text,
                    line, start - positions.lineStart(line),
                    endLine, end - positions.lineStart(endLine)));
        }
        return out;
    }

    private static TokenType typeOf(org.antlr.v4.runtime.Token t) {
        switch (t.getType()) {
            case Python3Lexer.NAME:
                return TokenType.NAME;
            case Python3Lexer.NUMBER:
                return TokenType.NUMBER;
            case Python3Lexer.STRING:
                return TokenType.STRING;
            case Python3Lexer.COMMENT:
                return TokenType.COMMENT;
            case Python3Lexer.NEWLINE:
                return TokenType.NEWLINE;
            case Python3Lexer.INDENT:
                return TokenType.INDENT;
            case Python3Lexer.DEDENT:
                return TokenType.DEDENT;
            case org.antlr.v4.runtime.Token.EOF:
                return TokenType.ENDMARKER;
            default:
                // 关键字和 Python tokenize 一样算 NAME，其余都是运算符
                return Character.isLetter(t.getText().charAt(0)) ? TokenType.NAME : TokenType.OP;
        }
    }

    /** 第一个错误就抛出，带上码点下标，由调用方换算成行号 */
    private static final class SyntaxErrorListener extends BaseErrorListener {

        private final Python3Lexer lexer;
        private final int endIndex;

        SyntaxErrorListener(Python3Lexer lexer, int endIndex) {
            this.lexer = lexer;
            this.endIndex = endIndex;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg, RecognitionException e) {
            if (recognizer instanceof Parser) {
                throw parserError((Parser) recognizer, (org.antlr.v4.runtime.Token) offendingSymbol);
            }
            int index = offendingSymbol instanceof org.antlr.v4.runtime.Token
                    ? ((org.antlr.v4.runtime.Token) offendingSymbol).getStartIndex()
                    : lexer._tokenStartCharIndex;
            throw new SyntaxAbort(msg, index);
        }

        /** ANTLR 的提示换成 CPython 的说法 */
        private SyntaxAbort parserError(Parser parser, org.antlr.v4.runtime.Token t) {
            org.antlr.v4.runtime.Token open = lexer.unclosedBracket();
            if (open != null && t.getStartIndex() >= endIndex) {
                return new SyntaxAbort("'" + open.getText() + "' was never closed", open.getStartIndex());
            }
            if (t.getType() == Python3Lexer.INDENT) {
                return new SyntaxAbort("unexpected indent", t.getStartIndex());
            }
            if (parser.getExpectedTokens().contains(Python3Lexer.INDENT)) {
                return new SyntaxAbort("expected an indented block", t.getStartIndex());
            }
            String legacy = legacyStatement(parser.getTokenStream(), t.getTokenIndex());
            if (legacy != null) {
                return new SyntaxAbort("Missing parentheses in call to '" + legacy + "'. Did you mean "
                        + legacy + "(...)?", t.getStartIndex());
            }
            return new SyntaxAbort("invalid syntax", t.getStartIndex());
        }

        /** 出错的语句以 print / exec 开头、后面直接跟着参数时返回该名字 */
        private static String legacyStatement(TokenStream tokens, int errorIndex) {
            int first = -1;
            for (int i = errorIndex - 1; i >= 0; i--) {
                org.antlr.v4.runtime.Token t = tokens.get(i);
                if (t.getChannel() != org.antlr.v4.runtime.Token.DEFAULT_CHANNEL) continue;
                int type = t.getType();
                if (type == Python3Lexer.NEWLINE || type == Python3Lexer.INDENT
                        || type == Python3Lexer.DEDENT || type == Python3Lexer.SEMI_COLON) {
                    break;
                }
                first = i;
            }
            if (first < 0 || tokens.get(first).getType() != Python3Lexer.NAME) return null;
            String name = tokens.get(first).getText();
            if (!name.equals("print") && !name.equals("exec")) return null;

            org.antlr.v4.runtime.Token next = null;
            for (int i = first + 1; i <= errorIndex; i++) {
                if (tokens.get(i).getChannel() == org.antlr.v4.runtime.Token.DEFAULT_CHANNEL) {
                    next = tokens.get(i);
                    break;
                }
            }
            if (next == null) return null;
            int type = next.getType();
            return (type == Python3Lexer.NAME || type == Python3Lexer.NUMBER || type == Python3Lexer.STRING)
                    ? name : null;
        }
    }

    private static final class SyntaxAbort extends ParseCancellationException {

        private final String reason;
        private final int index;

        SyntaxAbort(String reason, int index) {
            super(reason);
            this.reason = reason;
            this.index = index;
        }

        SourceSyntaxException toException(String fileName, SourcePositions positions) {
            int line = positions.lineOf(positions.offset(index)) + 1;
            return new SourceSyntaxException(reason, fileName, line, this);
        }
    }
}
