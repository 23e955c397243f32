package com.initialone.jmayaff.util;

import com.initialone.jmayaff.lexer.SourceSyntaxException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按 Python 的规则读写源文件：
 * - UTF-8 BOM
 * - 前两行里的 coding cookie（PEP 263），例如 {@code # -*- coding: latin-1 -*-}
 * - 默认 UTF-8
 * 写回时使用原编码和 BOM；行尾符本来就保留在文本里。
 */
public final class SourceFiles {

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final Pattern CODING_COOKIE = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
    private static final Pattern BLANK_OR_COMMENT = Pattern.compile("^[ \\t\\f]*(?:[#\\r\\n]|$)");

    private SourceFiles() {
    }

    public static SourceFile read(Path path) throws IOException, SourceSyntaxException {
        byte[] bytes = Files.readAllBytes(path);
        boolean bom = startsWith(bytes, UTF8_BOM);
        int offset = bom ? UTF8_BOM.length : 0;

        String fileName = path.toString();
        Charset charset = detectEncoding(bytes, offset, fileName);
        if (bom && !charset.equals(StandardCharsets.UTF_8)) {
            throw new SourceSyntaxException("encoding problem: " + charset.name() + " with BOM", fileName, 1);
        }

        try {
            String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset))
                    .toString();
            return new SourceFile(path, text, charset, bom);
        } catch (CharacterCodingException e) {
            throw new SourceSyntaxException("(unicode error) cannot decode source as " + charset.name(), fileName, 1, e);
        }
    }

    public static void write(SourceFile file, String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length() + 8);
        if (file.bom) out.write(UTF8_BOM);
        out.write(text.getBytes(file.charset));
        Files.write(file.path, out.toByteArray(),
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    /** 只看前两行；第二行的 cookie 仅当第一行是空行或注释时有效 */
    static Charset detectEncoding(byte[] bytes, int offset, String fileName) throws SourceSyntaxException {
        String head = new String(bytes, offset, Math.min(bytes.length - offset, 1024), StandardCharsets.ISO_8859_1);
        String[] lines = head.split("\\r\\n|\\n|\\r", 3);

        for (int i = 0; i < Math.min(2, lines.length); i++) {
            Matcher m = CODING_COOKIE.matcher(lines[i]);
            if (m.find()) {
                return charsetOf(m.group(1), fileName, i + 1);
            }
            if (!BLANK_OR_COMMENT.matcher(lines[i]).find()) break;
        }
        return StandardCharsets.UTF_8;
    }

    static Charset charsetOf(String pythonName, String fileName, int line) throws SourceSyntaxException {
        String n = pythonName.toLowerCase(Locale.ROOT).replace('_', '-');
        if (n.equals("utf-8") || n.startsWith("utf-8-") || n.equals("utf8")) return StandardCharsets.UTF_8;
        if (n.equals("latin-1") || n.startsWith("latin-1-")
                || n.equals("iso-8859-1") || n.startsWith("iso-8859-1-")
                || n.equals("iso-latin-1") || n.startsWith("iso-latin-1-")) {
            return StandardCharsets.ISO_8859_1;
        }
        try {
            return Charset.forName(n);
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new SourceSyntaxException("unknown encoding: " + pythonName, fileName, line, e);
        }
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) return false;
        }
        return true;
    }
}
