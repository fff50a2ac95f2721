package org.fslogger.scanner;

import org.fslogger.scanner.ScanRegistry.ScanJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanRegistryTest {

    @TempDir
    Path root;

    private ScanRegistry registry;

    @AfterEach
    void tearDown() {
        if (registry != null) {
            registry.shutdown();
        }
    }

    @Test
    void start_runsScanAsynchronouslyAndKeepsResult() throws Exception {
        Files.writeString(root.resolve("a.txt"), "a");
        Files.writeString(root.resolve("b.exe"), "b");
        registry = new ScanRegistry(Duration.ofMinutes(5), 2, null);

        ScanJob job = registry.start("root0", root, ScanConfiguration.builder().allowedTypes(List.of(".txt")).build());
        awaitFinished(job);

        assertThat(job.state()).isEqualTo(ScanJob.STATE_COMPLETED);
        assertThat(job.result().files()).hasSize(3);
        assertThat(job.result().blockedCount()).isEqualTo(1);
        assertThat(job.finishedAt()).isNotNull();
        assertThat(registry.find(job.id())).containsSame(job);
    }

    @Test
    void fatalScanError_isReportedAsErrorState() throws Exception {
        registry = new ScanRegistry(Duration.ofMinutes(5), 1, null);

        ScanJob job = registry.start("root0", root.resolve("gone"), ScanConfiguration.builder().build());
        awaitFinished(job);

        assertThat(job.state()).isEqualTo(ScanJob.STATE_ERROR);
        assertThat(job.error()).contains("gone");
        assertThat(job.result()).isNull();
    }

    @Test
    void unknownId_isNotFound() {
        registry = new ScanRegistry(Duration.ofMinutes(5), 1, null);

        assertThat(registry.find("nope")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
        assertThat(registry.cancel("nope")).isEmpty();
    }

    @Test
    void cancel_marksScannerCancelled() throws Exception {
        Files.writeString(root.resolve("a.txt"), "a");
        registry = new ScanRegistry(Duration.ofMinutes(5), 1, null);
        ScanJob job = registry.start("root0", root, ScanConfiguration.builder().build());

        assertThat(registry.cancel(job.id())).containsSame(job);
        awaitFinished(job);

        assertThat(job.scanner().isCancelled()).isTrue();
        assertThat(job.state()).isEqualTo(ScanJob.STATE_COMPLETED);
    }

    @Test
    void finishedJobs_expireAfterTtl() throws Exception {
        Files.writeString(root.resolve("a.txt"), "a");
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        registry = new ScanRegistry(Duration.ofMinutes(30), 1, null, clock);

        ScanJob job = registry.start("root0", root, ScanConfiguration.builder().build());
        awaitFinished(job);
        assertThat(registry.find(job.id())).isPresent();

        clock.advance(Duration.ofMinutes(31));

        assertThat(registry.find(job.id())).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void start_afterShutdownIsRejected() {
        registry = new ScanRegistry(Duration.ofMinutes(5), 1, null);
        registry.shutdown();

        assertThatThrownBy(() -> registry.start("root0", root, ScanConfiguration.builder().build()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.size()).isZero();
    }

    private static void awaitFinished(ScanJob job) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (ScanJob.STATE_RUNNING.equals(job.state())) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("扫描任务超时未结束：" + job.id());
            }
            Thread.sleep(10);
        }
    }

    private static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
