package com.initialone.jmayaff.lexer;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonSourceParserTest {

    private static SourceSyntaxException fail(String src) {
        return assertThrows(SourceSyntaxException.class, () -> PythonSourceParser.parse(src, "t.py"));
    }

    private static Token find(List<Token> ts, String text) {
        for (Token t : ts) {
            if (t.text.equals(text)) return t;
        }
        throw new AssertionError("no token " + text + " in " + ts);
    }

    private static List<TokenType> types(List<Token> ts) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : ts) out.add(t.type);
        return out;
    }

    @Test
    void parse_shouldRejectIncompleteExpressionsAndStatements() {
        for (String src : List.of("x = (1 +)\n", "a = = b\n", "for in x:\n    pass\n", "x = 1 +\n", "def f(:\n    pass\n")) {
            SourceSyntaxException e = fail(src);
            assertEquals("invalid syntax", e.getReason(), src);
            assertEquals(1, e.getLine(), src);
            assertEquals("t.py", e.getFileName());
        }
    }

    @Test
    void parse_shouldAcceptModernPython3() throws Exception {
        PythonSourceParser.parse("\ud835\udc65 = 1\n", "t.py");
        PythonSourceParser.parse("y = 1if x else 2\n", "t.py");
        PythonSourceParser.parse("s = f\"{d[\"k\"]}\"\n", "t.py");
        PythonSourceParser.parse(""
                + "import maya.cmds as mc\n"
                + "\n"
                + "@decorate(mc)\n"
                + "async def f(a, /, b: int = 0, *args, c, **kw) -> None:\n"
                + "    if (n := len(args)) > 1:\n"
                + "        await g(*args, **kw)\n"
                + "    with (open(a) as x, open(b) as y):\n"
                + "        pass\n"
                + "    return [i for i in range(n) if i % 2]\n"
                + "\n"
                + "try:\n"
                + "    f(1)\n"
                + "except* ValueError as e:\n"
                + "    raise RuntimeError(f'{e!r:>{10}}') from e\n", "t.py");
    }

    @Test
    void parse_shouldTreatMatchAndCaseAsSoftKeywords() throws Exception {
        PythonSourceParser.parse(""
                + "match = 1\n"
                + "case = match\n"
                + "match command.split():\n"
                + "    case [\"go\", direction] if direction:\n"
                + "        pass\n"
                + "    case {\"x\": 1, **rest} | Point(x=0) as p:\n"
                + "        pass\n"
                + "    case _:\n"
                + "        pass\n", "t.py");
    }

    @Test
    void parse_shouldExplainPython2Statements() {
        SourceSyntaxException print = fail("x = 1\nprint \"hi\"\n");
        assertEquals("Missing parentheses in call to 'print'. Did you mean print(...)?", print.getReason());
        assertEquals(2, print.getLine());

        SourceSyntaxException exec = fail("if x:\n    exec code\n");
        assertEquals("Missing parentheses in call to 'exec'. Did you mean exec(...)?", exec.getReason());
        assertEquals(2, exec.getLine());

        assertEquals(3, fail("try:\n    pass\nexcept E, e:\n    pass\n").getLine());
        assertEquals(1, fail("if 1 <> 2:\n    pass\n").getLine());
        assertEquals(1, fail("x = 0777\n").getLine());
    }

    @Test
    void parse_shouldReportBracketErrors() {
        SourceSyntaxException open = fail("x = 1\ny = (1,\n    2,\n");
        assertEquals("'(' was never closed", open.getReason());
        assertEquals(2, open.getLine());

        assertEquals("unmatched ')'", fail("x = 1)\n").getReason());
        assertEquals("closing parenthesis ']' does not match opening parenthesis '('",
                fail("x = (1]\n").getReason());
    }

    @Test
    void parse_shouldReportIndentationErrors() {
        SourceSyntaxException block = fail("if x:\npass\n");
        assertEquals("expected an indented block", block.getReason());
        assertEquals(2, block.getLine());

        SourceSyntaxException indent = fail("x = 1\n    y = 2\n");
        assertEquals("unexpected indent", indent.getReason());
        assertEquals(2, indent.getLine());

        SourceSyntaxException dedent = fail("if x:\n        a\n    b\n");
        assertEquals("unindent does not match any outer indentation level", dedent.getReason());
        assertEquals(3, dedent.getLine());
    }

    @Test
    void parse_shouldReportLexicalErrors() {
        assertEquals("unterminated string literal", fail("x = 1\ny = 'abc\n").getReason());
        assertEquals(2, fail("x = 1\ny = 'abc\n").getLine());
        assertEquals("unexpected character after line continuation character", fail("x = 1 \\ 2\n").getReason());
        assertEquals("invalid character '$' (U+0024)", fail("x = $\n").getReason());
        assertEquals("invalid character '\ud83d\ude00' (U+1F600)", fail("x = 1 \ud83d\ude00\n").getReason());
    }

    @Test
    void parse_shouldCountLinesForEveryLineTerminator() {
        assertEquals(3, fail("a = 1\r\nb = 2\rc = = 3\n").getLine());
        assertEquals("File \"t.py\", line 1: invalid syntax", fail("a = = 1").getMessage());
    }

    @Test
    void parse_shouldAcceptEmptyAndUnterminatedLastLine() throws Exception {
        assertEquals(List.of(TokenType.ENDMARKER), types(PythonSourceParser.parse("", "t.py").tokens));
        PythonSourceParser.parse("x = 1", "t.py");
        PythonSourceParser.parse("# only a comment", "t.py");
        PythonSourceParser.parse("if x:\n    y = 1\n\n\n", "t.py");
    }

    @Test
    void tokenize_shouldReportUtf16Columns() throws Exception {
        List<Token> ts = PythonSourceParser.tokenize("\ud835\udc65 = cmds.ls(sl=1)\n", "t.py");

        Token sl = find(ts, "sl");
        assertEquals(0, sl.line);
        assertEquals(13, sl.column);
        assertEquals(15, sl.endColumn);
        assertEquals(3, find(ts, "=").column);
    }

    @Test
    void tokenize_shouldProduceLayoutTokensAndKeepComments() throws Exception {
        List<Token> ts = PythonSourceParser.tokenize("if a:  # c\n    b\nc\n", "t.py");

        assertEquals(List.of(TokenType.NAME, TokenType.NAME, TokenType.OP, TokenType.COMMENT, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE, TokenType.DEDENT,
                TokenType.NAME, TokenType.NEWLINE, TokenType.ENDMARKER), types(ts));
        assertEquals("# c", find(ts, "# c").text);
        assertEquals(1, find(ts, "b").line);
        assertEquals(4, find(ts, "b").column);
    }

    @Test
    void tokenize_shouldJoinBracketedAndContinuedLines() throws Exception {
        List<Token> ts = PythonSourceParser.tokenize("x = f(1,\n      2) + \\\n    3\n", "t.py");

        long newlines = ts.stream().filter(t -> t.type == TokenType.NEWLINE).count();
        assertEquals(1, newlines);
        assertEquals(2, find(ts, "3").line);
    }

    @Test
    void tokenize_shouldKeepMultilineStringsAsOneToken() throws Exception {
        List<Token> ts = PythonSourceParser.tokenize("s = '''a\nb'''\ny = 1\n", "t.py");

        Token str = find(ts, "'''a\nb'''");
        assertEquals(TokenType.STRING, str.type);
        assertEquals(0, str.line);
        assertEquals(4, str.column);
        assertEquals(1, str.endLine);
        assertEquals(2, find(ts, "y").line);
    }
}
