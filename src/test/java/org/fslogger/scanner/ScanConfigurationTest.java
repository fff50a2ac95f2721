package org.fslogger.scanner;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanConfigurationTest {

    @Test
    void build_fillsDefaultsForNonPositiveCapacities() {
        ScanConfiguration config = ScanConfiguration.builder()
                .workerCount(0)
                .queueCapacity(-1)
                .resultQueueCapacity(0)
                .maxTraversalThreads(-3)
                .exportFileName(" ")
                .build();

        assertThat(config.workerCount()).isEqualTo(ScanConfiguration.DEFAULT_WORKER_COUNT);
        assertThat(config.queueCapacity()).isEqualTo(ScanConfiguration.DEFAULT_QUEUE_CAPACITY);
        assertThat(config.resultQueueCapacity()).isEqualTo(config.queueCapacity());
        assertThat(config.maxTraversalThreads()).isZero();
        assertThat(config.exportFileName()).isEqualTo(ScanConfiguration.DEFAULT_EXPORT_FILE_NAME);
        assertThat(config.maxFileSizeMb()).isEqualTo(50);
        assertThat(config.recursive()).isTrue();
    }

    @Test
    void allowedTypes_areNormalised() {
        ScanConfiguration config = ScanConfiguration.builder()
                .allowedTypes(List.of("TXT", ".Md", " pdf ", ""))
                .build();

        assertThat(config.allowedTypes()).containsExactlyInAnyOrder(".txt", ".md", ".pdf");
    }

    @Test
    void negativeSizeLimit_isRejected() {
        assertThatThrownBy(() -> ScanConfiguration.builder().maxFileSizeMb(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalidGlob_isRejectedAtConstruction() {
        assertThatThrownBy(() -> ScanConfiguration.builder().blockedPatterns(List.of("[abc")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[abc");
        assertThatThrownBy(() -> ScanConfiguration.builder().blockedPatterns(List.of("")).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void maxFileSizeBytes_usesMebibytes() {
        assertThat(ScanConfiguration.builder().maxFileSizeMb(3).build().maxFileSizeBytes()).isEqualTo(3L * 1024 * 1024);
    }

    @Test
    void toBuilder_copiesEveryField() {
        ScanConfiguration original = ScanConfiguration.builder()
                .maxFileSizeMb(7)
                .recursive(false)
                .allowedTypes(List.of(".txt"))
                .blockedPatterns(List.of("*.log"))
                .workerCount(3)
                .queueCapacity(10)
                .resultQueueCapacity(20)
                .maxTraversalThreads(2)
                .exportBlockedToJson(true)
                .exportFileName("out.json")
                .build();

        assertThat(original.toBuilder().build()).isEqualTo(original);
    }
}
