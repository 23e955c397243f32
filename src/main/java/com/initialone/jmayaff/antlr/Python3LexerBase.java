package com.initialone.jmayaff.antlr;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.regex.Pattern;

/**
 * 生成的 Python3Lexer 的基类（grammar 里的 superClass），负责 Python 的版面规则：
 * - 行首空白变成 INDENT / DEDENT，逻辑行结束产生 NEWLINE
 * - 括号里的换行、空行和注释行不产生 NEWLINE
 * - 文件末尾补齐 NEWLINE 和剩下的 DEDENT
 * - 括号配对错误、缩进不一致、非法字符按 CPython 的说法报给错误监听器
 *
 * 文件末尾还没闭合的括号不在这里报错，见 {@link #unclosedBracket()}。
 */
public abstract class Python3LexerBase extends Lexer {

    private static final Pattern STRING_START = Pattern.compile("^[rRbBuUfF]{0,2}['\"]");

    private final Deque<Token> pending = new ArrayDeque<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Token> brackets = new ArrayDeque<>();
    private Token lastToken;
    private boolean eofSeen;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        if (token.getType() == Token.EOF && !eofSeen) {
            eofSeen = true;
            closeLayout(token.getStartIndex());
        }
        super.setToken(token);
        pending.offer(token);
        if (token.getChannel() == Token.DEFAULT_CHANNEL) {
            lastToken = token;
        }
    }

    @Override
    public Token nextToken() {
        Token next = super.nextToken();
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        pending.clear();
        indents.clear();
        brackets.clear();
        lastToken = null;
        eofSeen = false;
        super.reset();
    }

    /** 文件读完时仍未闭合的最内层括号；没有则为 null */
    public Token unclosedBracket() {
        return brackets.peek();
    }

    protected boolean atStartOfInput() {
        return _input.index() == 0;
    }

    protected void openBrace() {
        brackets.push(token(getType(), getText(), _tokenStartCharIndex, getCharIndex() - 1));
    }

    protected void closeBrace() {
        String close = getText();
        if (brackets.isEmpty()) {
            report("unmatched '" + close + "'", _tokenStartCharIndex);
            return;
        }
        Token open = brackets.pop();
        if (!pairs(open.getText(), close)) {
            report("closing parenthesis '" + close + "' does not match opening parenthesis '"
                    + open.getText() + "'", _tokenStartCharIndex);
        }
    }

    protected void onNewLine() {
        String text = getText();
        String spaces = text.replaceAll("[\r\n]+", "");
        int newlineLength = text.length() - spaces.length();

        int next = _input.LA(1);
        if (!brackets.isEmpty() || next == '\r' || next == '\n' || next == '#' || next == CharStream.EOF) {
            // 括号内、空行、注释行、文件末尾的空白
            skip();
            return;
        }

        int start = _tokenStartCharIndex;
        emit(token(Python3Lexer.NEWLINE, text.substring(0, newlineLength), start, start + newlineLength - 1));

        int indent = indentationOf(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();
        if (indent > previous) {
            indents.push(indent);
            emit(token(Python3Lexer.INDENT, spaces, start + newlineLength, getCharIndex() - 1));
        } else if (indent < previous) {
            int at = getCharIndex();
            while (!indents.isEmpty() && indents.peek() > indent) {
                indents.pop();
                emit(token(Python3Lexer.DEDENT, "", at, at - 1));
            }
            int level = indents.isEmpty() ? 0 : indents.peek();
            if (level != indent) {
                report("unindent does not match any outer indentation level", at);
            }
        }
    }

    @Override
    public void notifyListeners(LexerNoViableAltException e) {
        String text = _input.getText(Interval.of(_tokenStartCharIndex, _input.index()));
        String message;
        if (STRING_START.matcher(text).find()) {
            message = "unterminated string literal";
        } else if (text.startsWith("\\")) {
            message = "unexpected character after line continuation character";
        } else {
            int cp = text.isEmpty() ? 0 : text.codePointAt(0);
            message = String.format("invalid character '%s' (U+%04X)", new String(Character.toChars(cp)), cp);
        }
        getErrorListenerDispatch().syntaxError(this, null, _tokenStartLine, _tokenStartCharPositionInLine, message, e);
    }

    /** 最后一行没有换行符时补一个 NEWLINE，然后关闭所有缩进 */
    private void closeLayout(int at) {
        if (lastToken != null
                && lastToken.getType() != Python3Lexer.NEWLINE
                && lastToken.getType() != Python3Lexer.DEDENT) {
            emit(token(Python3Lexer.NEWLINE, "", at, at - 1));
        }
        while (!indents.isEmpty()) {
            indents.pop();
            emit(token(Python3Lexer.DEDENT, "", at, at - 1));
        }
    }

    /** Tab 补齐到 8 的倍数，换页符清零 */
    static int indentationOf(String spaces) {
        int count = 0;
        for (int i = 0; i < spaces.length(); i++) {
            char c = spaces.charAt(i);
            if (c == '\t') {
                count = (count / 8 + 1) * 8;
            } else if (c == '\f') {
                count = 0;
            } else {
                count++;
            }
        }
        return count;
    }

    private static boolean pairs(String open, String close) {
        return (open.equals("(") && close.equals(")"))
                || (open.equals("[") && close.equals("]"))
                || (open.equals("{") && close.equals("}"));
    }

    /** 错误位置用 token 的起始下标传给监听器 */
    private void report(String message, int index) {
        Token at = token(Token.INVALID_TYPE, "", index, index - 1);
        getErrorListenerDispatch().syntaxError(this, at, at.getLine(), at.getCharPositionInLine(), message, null);
    }

    private CommonToken token(int type, String text, int start, int stop) {
        CommonToken t = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        t.setText(text);
        t.setLine(_tokenStartLine);
        t.setCharPositionInLine(_tokenStartCharPositionInLine);
        return t;
    }
}
