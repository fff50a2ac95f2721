package org.fslogger.scanner;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 按文件内容前缀嗅探 MIME 类型。
 * <p>
 * 说明：
 * <ul>
 *   <li>只看前 {@link #SNIFF_LENGTH} 字节，避免为了判断类型把大文件读入内存。</li>
 *   <li>先匹配常见格式的魔数（PDF/PNG/JPEG/ZIP/GZIP...），再识别 HTML/XML 标记与 BOM。</li>
 *   <li>都不命中时按“是否含有二进制控制字符”区分 {@code text/plain} 与 {@code application/octet-stream}。</li>
 * </ul>
 */
public final class ContentTypeSniffer {

    public static final int SNIFF_LENGTH = 512;

    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String OCTET_STREAM = "application/octet-stream";

    private static final List<Signature> SIGNATURES = List.of(
            new Signature(0, bytes("%PDF-"), "application/pdf"),
            new Signature(0, bytes("%!PS-Adobe-"), "application/postscript"),
            new Signature(0, new byte[]{(byte) 0xFE, (byte) 0xFF}, "text/plain; charset=utf-16be"),
            new Signature(0, new byte[]{(byte) 0xFF, (byte) 0xFE}, "text/plain; charset=utf-16le"),
            new Signature(0, new byte[]{(byte) 0xEF, (byte) 0xBB, (byte) 0xBF}, TEXT_PLAIN),
            new Signature(0, new byte[]{0x00, 0x00, 0x01, 0x00}, "image/x-icon"),
            new Signature(0, bytes("BM"), "image/bmp"),
            new Signature(0, bytes("GIF87a"), "image/gif"),
            new Signature(0, bytes("GIF89a"), "image/gif"),
            new Signature(0, new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}, "image/png"),
            new Signature(0, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}, "image/jpeg"),
            riff("WEBPVP", "image/webp"),
            riff("WAVE", "audio/wave"),
            riff("AVI ", "video/avi"),
            new Signature(0, bytes("OggS\0"), "application/ogg"),
            new Signature(0, bytes("ID3"), "audio/mpeg"),
            new Signature(4, bytes("ftyp"), "video/mp4"),
            new Signature(0, new byte[]{0x1A, 0x45, (byte) 0xDF, (byte) 0xA3}, "video/webm"),
            new Signature(0, bytes("wOFF"), "font/woff"),
            new Signature(0, bytes("wOF2"), "font/woff2"),
            new Signature(0, new byte[]{0x1F, (byte) 0x8B, 0x08}, "application/x-gzip"),
            new Signature(0, bytes("PK\u0003\u0004"), "application/zip"),
            new Signature(0, bytes("Rar!\u001A\u0007\u0000"), "application/x-rar-compressed"),
            new Signature(0, bytes("Rar!\u001A\u0007\u0001\u0000"), "application/x-rar-compressed"),
            new Signature(0, new byte[]{0x00, 'a', 's', 'm'}, "application/wasm")
    );

    private static final List<String> HTML_TAGS = List.of(
            "<!DOCTYPE HTML", "<HTML", "<HEAD", "<SCRIPT", "<IFRAME", "<H1", "<DIV", "<FONT",
            "<TABLE", "<A", "<STYLE", "<TITLE", "<B", "<BODY", "<BR", "<P", "<!--"
    );

    private ContentTypeSniffer() {
    }

    /**
     * 读取文件前 512 字节并嗅探类型；读到 0 字节视为空文本，不算失败。
     */
    public static String sniff(Path file) throws IOException {
        byte[] prefix;
        try (InputStream in = Files.newInputStream(file)) {
            prefix = in.readNBytes(SNIFF_LENGTH);
        }
        return detect(prefix, prefix.length);
    }

    public static String detect(byte[] data, int length) {
        int n = Math.min(Math.min(length, data.length), SNIFF_LENGTH);

        int firstNonWs = 0;
        while (firstNonWs < n && isWhitespace(data[firstNonWs])) {
            firstNonWs++;
        }
        if (isHtml(data, firstNonWs, n)) {
            return "text/html; charset=utf-8";
        }
        if (startsWithIgnoreCase(data, firstNonWs, n, "<?XML")) {
            return "text/xml; charset=utf-8";
        }

        for (Signature s : SIGNATURES) {
            if (s.matches(data, n)) {
                return s.mimeType();
            }
        }

        for (int i = 0; i < n; i++) {
            if (isBinaryByte(data[i])) {
                return OCTET_STREAM;
            }
        }
        return TEXT_PLAIN;
    }

    /**
     * MIME 主类型（{@code /} 之前的部分），例如 {@code text/plain; charset=utf-8} -> {@code text}。
     */
    public static String primaryType(String mimeType) {
        if (mimeType == null || mimeType.isEmpty()) {
            return null;
        }
        int slash = mimeType.indexOf('/');
        return (slash < 0) ? mimeType : mimeType.substring(0, slash);
    }

    private static boolean isHtml(byte[] data, int offset, int n) {
        for (String tag : HTML_TAGS) {
            if (!startsWithIgnoreCase(data, offset, n, tag)) {
                continue;
            }
            // 标签后必须是空格或 '>'，避免把 "<ABC" 误判为 "<A"
            int end = offset + tag.length();
            if (end < n && (data[end] == ' ' || data[end] == '>')) {
                return true;
            }
        }
        return false;
    }

    private static boolean startsWithIgnoreCase(byte[] data, int offset, int n, String token) {
        if (n - offset < token.length()) {
            return false;
        }
        String head = new String(data, offset, token.length(), StandardCharsets.ISO_8859_1);
        return head.toUpperCase(Locale.ROOT).equals(token);
    }

    private static boolean isWhitespace(byte b) {
        return b == '\t' || b == '\n' || b == 0x0C || b == '\r' || b == ' ';
    }

    private static boolean isBinaryByte(byte b) {
        int v = b & 0xFF;
        return v <= 0x08 || v == 0x0B || (v >= 0x0E && v <= 0x1A) || (v >= 0x1C && v <= 0x1F);
    }

    private static byte[] bytes(String ascii) {
        return ascii.getBytes(StandardCharsets.ISO_8859_1);
    }

    private static Signature riff(String format, String mimeType) {
        return new Signature(bytes("RIFF"), 8, bytes(format), mimeType);
    }

    /**
     * 魔数签名：可选的固定前缀 + 指定偏移处的魔数（RIFF 容器的格式标识位于偏移 8）。
     */
    private record Signature(byte[] prefix, int offset, byte[] magic, String mimeType) {

        Signature(int offset, byte[] magic, String mimeType) {
            this(new byte[0], offset, magic, mimeType);
        }

        boolean matches(byte[] data, int n) {
            return regionEquals(data, n, 0, prefix) && regionEquals(data, n, offset, magic);
        }

        private static boolean regionEquals(byte[] data, int n, int at, byte[] expected) {
            if (n < at + expected.length) {
                return false;
            }
            for (int i = 0; i < expected.length; i++) {
                if (data[at + i] != expected[i]) {
                    return false;
                }
            }
            return true;
        }
    }
}
