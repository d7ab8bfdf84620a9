package org.stepaas.assembly;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * STEP 文档读取：按字节上限流式读取，并尽力识别编码。
 * <p>
 * STEP 文件在中文/德文环境里可能是 UTF-8，也可能是 GB18030 或 ISO-8859-1：
 * <ul>
 *   <li>严格 UTF-8 校验通过：按 UTF-8 解码</li>
 *   <li>被截断且只有末尾序列不完整：仍按 UTF-8 解码并提示</li>
 *   <li>其他情况：按 GB18030 替换非法字符解码并提示（不可用时退回 ISO-8859-1）</li>
 * </ul>
 * 读取失败抛出 {@link IOException}，由调用方把文档记为不可读。
 */
public class StepDocumentReader {

    private final long maxBytes;

    public StepDocumentReader(long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes 必须大于 0");
        }
        this.maxBytes = maxBytes;
    }

    /**
     * @param text      解码后的文本
     * @param charset   实际使用的编码（小写）
     * @param truncated 是否因超过上限而截断
     * @param warnings  解码过程中的提示（可能为空列表）
     */
    public record DocumentText(String text, String charset, boolean truncated, List<String> warnings) {
    }

    public DocumentText read(Path file) throws IOException {
        long size = Files.size(file);
        boolean truncated = size > maxBytes;
        byte[] bytes = readUpTo(file, maxBytes);
        List<String> warnings = new ArrayList<>();
        if (truncated) {
            warnings.add("文档超过 " + maxBytes + " 字节，已截断读取：" + file.getFileName());
        }
        return decode(bytes, truncated, warnings);
    }

    private static byte[] readUpTo(Path file, long maxBytes) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(maxBytes, 1024 * 1024));
            byte[] buffer = new byte[8192];
            long remaining = maxBytes;
            int read;
            while (remaining > 0 && (read = in.read(buffer, 0, (int) Math.min(buffer.length, remaining))) >= 0) {
                out.write(buffer, 0, read);
                remaining -= read;
            }
            return out.toByteArray();
        }
    }

    static DocumentText decode(byte[] bytes, boolean truncated, List<String> warnings) {
        if (bytes.length == 0) {
            return new DocumentText("", "utf-8", truncated, List.copyOf(warnings));
        }
        if (isValidUtf8(bytes)) {
            return new DocumentText(new String(bytes, StandardCharsets.UTF_8), "utf-8", truncated, List.copyOf(warnings));
        }
        if (truncated && isUtf8PrefixAllowTruncatedTail(bytes)) {
            warnings.add("文档被截断，末尾可能存在不完整 UTF-8 序列；已按 UTF-8 尽力解码。");
            return new DocumentText(new String(bytes, StandardCharsets.UTF_8), "utf-8", truncated, List.copyOf(warnings));
        }

        Charset charset = fallbackCharset();
        String text;
        try {
            text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            text = new String(bytes, charset);
        }
        warnings.add("文档不是有效 UTF-8，已使用 " + charset.name() + " 尝试解码。");
        return new DocumentText(text, charset.name().toLowerCase(Locale.ROOT), truncated, List.copyOf(warnings));
    }

    private static Charset fallbackCharset() {
        return Charset.isSupported("GB18030") ? Charset.forName("GB18030") : StandardCharsets.ISO_8859_1;
    }

    private static boolean isValidUtf8(byte[] bytes) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    private static boolean isUtf8PrefixAllowTruncatedTail(byte[] bytes) {
        // endOfInput=false：末尾不完整序列视为 UNDERFLOW，中间非法字节才是 ERROR
        var decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(bytes);
        CharBuffer out = CharBuffer.allocate(4096);
        while (true) {
            CoderResult r = decoder.decode(in, out, false);
            if (r.isError()) {
                return false;
            }
            if (r.isOverflow()) {
                out.clear();
                continue;
            }
            return true;
        }
    }
}
