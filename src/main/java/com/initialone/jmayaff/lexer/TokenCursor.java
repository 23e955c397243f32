package com.initialone.jmayaff.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * 只包含有效 token（NAME / NUMBER / STRING / OP）的游标，支持向前看一个。
 * 注释、字符串内容、换行和缩进都不会出现在这里。
 *
 * 流结束时 {@link #advance()} 返回 false，{@link #peek()} 返回 null，不抛异常。
 */
public final class TokenCursor {

    private final List<Token> tokens;
    private int index = -1;

    public TokenCursor(List<Token> all) {
        List<Token> significant = new ArrayList<>(all.size());
        for (Token t : all) {
            if (t.type.isSignificant()) significant.add(t);
        }
        this.tokens = significant;
    }

    /** 消费下一个 token；没有了返回 false */
    public boolean advance() {
        if (index + 1 >= tokens.size()) {
            index = tokens.size();
            return false;
        }
        index++;
        return true;
    }

    /** 当前 token；还没 advance 或已越界时为 null */
    public Token current() {
        return (index >= 0 && index < tokens.size()) ? tokens.get(index) : null;
    }

    /** 下一个 token，不消费 */
    public Token peek() {
        int i = index + 1;
        return i < tokens.size() ? tokens.get(i) : null;
    }
}
