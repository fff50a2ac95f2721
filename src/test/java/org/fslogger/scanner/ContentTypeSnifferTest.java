package org.fslogger.scanner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentTypeSnifferTest {

    @Test
    void detect_recognisesCommonSignatures() {
        assertThat(detect("%PDF-1.7\n...")).isEqualTo("application/pdf");
        assertThat(detect(new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 0, 0}))
                .isEqualTo("image/png");
        assertThat(detect(new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0})).isEqualTo("image/jpeg");
        assertThat(detect("GIF89a......")).isEqualTo("image/gif");
        assertThat(detect(new byte[]{'P', 'K', 3, 4, 20, 0})).isEqualTo("application/zip");
        assertThat(detect(new byte[]{0x1F, (byte) 0x8B, 0x08, 0})).isEqualTo("application/x-gzip");
        assertThat(detect("RIFF\0\0\0\0WAVEfmt ")).isEqualTo("audio/wave");
    }

    @Test
    void detect_textHtmlAndXml() {
        assertThat(detect("hello world\n")).isEqualTo(ContentTypeSniffer.TEXT_PLAIN);
        assertThat(detect("  \n<!DOCTYPE html><html></html>")).isEqualTo("text/html; charset=utf-8");
        assertThat(detect("<p>paragraph</p>")).isEqualTo("text/html; charset=utf-8");
        assertThat(detect("<?xml version=\"1.0\"?><a/>")).isEqualTo("text/xml; charset=utf-8");
        // "<ABC" 不能被误判为 "<A" 标签
        assertThat(detect("<ABC>")).isEqualTo(ContentTypeSniffer.TEXT_PLAIN);
    }

    @Test
    void detect_binaryBytesFallBackToOctetStream() {
        assertThat(detect(new byte[]{'a', 'b', 0x00, 'c'})).isEqualTo(ContentTypeSniffer.OCTET_STREAM);
    }

    @Test
    void detect_textWithRiffWordIsNotMisreadAsMedia() {
        assertThat(detect("notRIFFWAVE text")).isEqualTo(ContentTypeSniffer.TEXT_PLAIN);
    }

    @Test
    void detect_emptyInputIsPlainText() {
        assertThat(ContentTypeSniffer.detect(new byte[0], 0)).isEqualTo(ContentTypeSniffer.TEXT_PLAIN);
    }

    @Test
    void detect_onlyLooksAtFirst512Bytes() {
        byte[] data = new byte[1024];
        Arrays.fill(data, (byte) 'a');
        data[700] = 0x00;

        assertThat(ContentTypeSniffer.detect(data, data.length)).isEqualTo(ContentTypeSniffer.TEXT_PLAIN);
    }

    @Test
    void sniff_readsFilePrefix(@TempDir Path dir) throws IOException {
        Path pdf = dir.resolve("doc.bin");
        Files.write(pdf, "%PDF-1.4 rest of the document".getBytes(StandardCharsets.US_ASCII));
        Path empty = Files.createFile(dir.resolve("empty"));

        assertThat(ContentTypeSniffer.sniff(pdf)).isEqualTo("application/pdf");
        assertThat(ContentTypeSniffer.sniff(empty)).isEqualTo(ContentTypeSniffer.TEXT_PLAIN);
    }

    @Test
    void sniff_missingFileThrows(@TempDir Path dir) {
        assertThatThrownBy(() -> ContentTypeSniffer.sniff(dir.resolve("missing.txt")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void primaryType_stripsSubtypeAndParameters() {
        assertThat(ContentTypeSniffer.primaryType("text/plain; charset=utf-8")).isEqualTo("text");
        assertThat(ContentTypeSniffer.primaryType("application/pdf")).isEqualTo("application");
        assertThat(ContentTypeSniffer.primaryType(null)).isNull();
    }

    private static String detect(String ascii) {
        return detect(ascii.getBytes(StandardCharsets.ISO_8859_1));
    }

    private static String detect(byte[] data) {
        return ContentTypeSniffer.detect(data, data.length);
    }
}
