package com.initialone.jmayaff.parser;

import com.initialone.jmayaff.config.FlagTable;
import com.initialone.jmayaff.lexer.Token;
import com.initialone.jmayaff.lexer.TokenCursor;
import com.initialone.jmayaff.lexer.TokenType;
import com.initialone.jmayaff.model.CallNode;
import com.initialone.jmayaff.model.CallRecord;
import com.initialone.jmayaff.model.FlagEdit;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 在 token 流上找出目标命令调用，并收集其中需要改写的短 flag。
 *
 * 显式状态机：{@link ScanState} + 调用帧栈（每个帧有自己的括号深度），不用递归。
 * - 调用自己的 '(' 让深度从 0 变成 1，回到 0 的 ')' 结束该调用
 * - 只有深度恰好为 1（调用自身的参数层）的 {@code name=} 才算 flag；
 *   元组、普通函数调用等更深的括号里的同名参数不改
 * - 任意深度都能识别嵌套的目标调用，嵌套调用有改写项时才挂到外层
 * - 流结束时未闭合的调用保留已收集的内容，不报错
 */
public class CallSiteScanner {

    private final FlagTable table;

    public CallSiteScanner(FlagTable table) {
        this.table = table;
    }

    public List<CallRecord> scan(TokenCursor cursor, AliasSet aliases) {
        List<CallRecord> records = new ArrayList<>();
        if (aliases == null || aliases.isEmpty()) return records;

        Deque<CallFrame> frames = new ArrayDeque<>();
        ScanState state = ScanState.SEEKING_NAME;

        while (cursor.advance()) {
            Token tok = cursor.current();

            if (state == ScanState.SEEKING_NAME) {
                if (tok.type != TokenType.NAME) continue;
                Token command = matchCommand(cursor, aliases);
                if (command != null) {
                    frames.push(new CallFrame(command));
                    state = ScanState.IN_CALL_ARGS;
                }
                continue;
            }

            CallFrame frame = frames.peek();
            if (tok.isOp("(")) {
                frame.depth++;
                continue;
            }
            if (tok.isOp(")")) {
                frame.depth--;
                if (frame.depth <= 0) {
                    close(frames, records);
                    state = frames.isEmpty() ? ScanState.SEEKING_NAME : ScanState.IN_CALL_ARGS;
                }
                continue;
            }
            if (tok.type != TokenType.NAME) continue;

            Token nested = matchCommand(cursor, aliases);
            if (nested != null) {
                frames.push(new CallFrame(nested));
                continue;
            }

            // matchCommand 可能已经消费了前缀 token
            tok = cursor.current();
            if (frame.depth == 1 && isFlag(frame.command, tok, cursor.peek())) {
                frame.edits.add(FlagEdit.of(tok, table.longNameOf(frame.command, tok.text)));
            }
        }

        while (!frames.isEmpty()) {
            close(frames, records);
        }
        return records;
    }

    /**
     * 当前 token 是否开始一个目标调用：别名路径 + 已知命令名 + '('。
     * 成功时游标停在命令名上（'(' 尚未消费），返回命令名 token。
     * 点号路径贪婪还原：只有加上下一个 token 后仍是某个别名路径的前缀才消费它。
     */
    private Token matchCommand(TokenCursor cursor, AliasSet aliases) {
        Token first = cursor.current();
        if (first == null || first.type != TokenType.NAME) return null;

        StringBuilder path = new StringBuilder(first.text);
        if (!aliases.isPathPrefix(path.toString())) return null;

        while (true) {
            Token next = cursor.peek();
            if (next == null) break;
            boolean wantDot = path.charAt(path.length() - 1) != '.';
            if (wantDot ? !next.isOp(".") : next.type != TokenType.NAME) break;
            if (!aliases.isPathPrefix(path + next.text)) break;
            cursor.advance();
            path.append(next.text);
        }
        if (!aliases.isNamespacePath(path.toString())) return null;

        Token name = cursor.peek();
        if (name == null || name.type != TokenType.NAME || !table.isCommand(name.text)) return null;
        cursor.advance();

        Token open = cursor.peek();
        if (open == null || !open.isOp("(")) return null;
        return name;
    }

    private boolean isFlag(String command, Token tok, Token next) {
        return tok.type == TokenType.NAME
                && table.isFlag(command, tok.text)
                && next != null && next.isOp("=");
    }

    /** 弹出当前帧；有改写项才保留（顶层进结果，嵌套挂到外层） */
    private static void close(Deque<CallFrame> frames, List<CallRecord> records) {
        CallFrame done = frames.pop();
        if (done.edits.isEmpty()) return;
        CallRecord record = new CallRecord(done.command, done.edits);
        if (frames.isEmpty()) {
            records.add(record);
        } else {
            frames.peek().edits.add(record);
        }
    }

    private static final class CallFrame {
        final String command;
        final List<CallNode> edits = new ArrayList<>();
        int depth;

        CallFrame(Token commandToken) {
            this.command = commandToken.text;
        }
    }
}
