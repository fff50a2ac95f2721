package org.fslogger.scanner;

import org.fslogger.scanner.dto.FileRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BlockingRuleClassifierTest {

    private static final long MIB = 1024L * 1024;

    @Test
    void sizeLimit_isInclusive() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder().maxFileSizeMb(1).build());

        assertThat(classifier.isFileSizeAllowed(MIB)).isTrue();
        assertThat(classifier.isFileSizeAllowed(MIB + 1)).isFalse();

        FileRecord exact = classifier.classify(file("exact.bin", ".bin", MIB));
        FileRecord over = classifier.classify(file("over.bin", ".bin", MIB + 1));
        assertThat(exact.blocked()).isFalse();
        assertThat(exact.blockReason()).isNull();
        assertThat(over.blocked()).isTrue();
        assertThat(over.blockReason()).isEqualTo(BlockingRuleClassifier.REASON_SIZE);
    }

    @Test
    void zeroSizeLimit_blocksEveryNonEmptyFile() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder().maxFileSizeMb(0).build());

        assertThat(classifier.isBlocked(file("empty.txt", ".txt", 0))).isFalse();
        assertThat(classifier.isBlocked(file("one.txt", ".txt", 1))).isTrue();
    }

    @Test
    void allowList_isCaseInsensitiveAndAcceptsMissingDot() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder()
                .allowedTypes(List.of("TXT", ".Pdf"))
                .build());

        assertThat(classifier.isBlocked(file("a.txt", ".txt", 10))).isFalse();
        assertThat(classifier.isBlocked(file("b.pdf", ".pdf", 10))).isFalse();
        assertThat(classifier.blockReason(file("c.md", ".md", 10))).isEqualTo(BlockingRuleClassifier.REASON_TYPE);
        // 没有扩展名的文件不在允许列表里
        assertThat(classifier.blockReason(file("Makefile", "", 10))).isEqualTo(BlockingRuleClassifier.REASON_TYPE);
    }

    @Test
    void emptyAllowList_allowsEveryType() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder().build());

        assertThat(classifier.isBlocked(file("x.exe", ".exe", 10))).isFalse();
        assertThat(classifier.isBlocked(file("noext", "", 10))).isFalse();
    }

    @Test
    void pattern_reasonNamesTheFirstMatchingGlob() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder()
                .blockedPatterns(List.of("secret-*", "*.log", "*.txt"))
                .build());

        assertThat(classifier.blockReason(file("app.log", ".log", 10)))
                .isEqualTo(BlockingRuleClassifier.REASON_PATTERN_PREFIX + "*.log");
        assertThat(classifier.blockReason(file("secret-notes.txt", ".txt", 10)))
                .isEqualTo(BlockingRuleClassifier.REASON_PATTERN_PREFIX + "secret-*");
        assertThat(classifier.isBlocked(file("readme.md", ".md", 10))).isFalse();
    }

    @Test
    void pattern_isCaseSensitive() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder()
                .blockedPatterns(List.of("*.log"))
                .build());

        assertThat(classifier.isBlocked(file("APP.LOG", ".log", 10))).isFalse();
    }

    @Test
    void ruleOrder_sizeWinsOverTypeAndPattern() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder()
                .maxFileSizeMb(1)
                .allowedTypes(List.of(".txt"))
                .blockedPatterns(List.of("*.bin"))
                .build());

        assertThat(classifier.blockReason(file("big.bin", ".bin", 2 * MIB))).isEqualTo(BlockingRuleClassifier.REASON_SIZE);
        assertThat(classifier.blockReason(file("small.bin", ".bin", 10))).isEqualTo(BlockingRuleClassifier.REASON_TYPE);
    }

    @Test
    void accessError_blocksWhenNoOtherRuleApplies() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder().build());
        FileRecord unreadable = new FileRecord("/r/locked.txt", "locked.txt", 10, null, "txt", ".txt",
                Instant.EPOCH, false, false, null, "Permission denied");

        FileRecord classified = classifier.classify(unreadable);

        assertThat(classified.blocked()).isTrue();
        assertThat(classified.blockReason()).isEqualTo(BlockingRuleClassifier.REASON_ACCESS);
        assertThat(classified.accessError()).isEqualTo("Permission denied");
    }

    @Test
    void blockReason_fallsBackToUnknownForAllowedRecord() {
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(ScanConfiguration.builder().build());

        assertThat(classifier.blockReason(file("ok.txt", ".txt", 1))).isEqualTo(BlockingRuleClassifier.REASON_UNKNOWN);
    }

    private static FileRecord file(String name, String extension, long size) {
        return new FileRecord("/r/" + name, name, size, "text/plain; charset=utf-8", "txt", extension,
                Instant.EPOCH, false, false, null, null);
    }
}
