package org.fslogger.scanner;

import org.fslogger.scanner.dto.ScanProgressSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class ScanProgressTest {

    @Test
    void counters_accumulateDiscoveredAndScanned() {
        ScanProgress progress = new ScanProgress();

        progress.recordDiscovered(0);
        progress.recordDiscovered(100);
        progress.recordScanned(100, true);
        progress.recordBlocked();

        ScanProgressSnapshot snapshot = progress.snapshot();
        assertThat(snapshot.totalFiles()).isEqualTo(2);
        assertThat(snapshot.totalSize()).isEqualTo(100);
        assertThat(snapshot.scannedFiles()).isEqualTo(1);
        assertThat(snapshot.scannedSize()).isEqualTo(100);
        assertThat(snapshot.blockedFiles()).isEqualTo(2);
    }

    @Test
    void addError_updatesTimestampTogetherWithErrorList() {
        Instant start = Instant.parse("2026-01-01T00:00:00Z");
        ScanProgress progress = new ScanProgress(Clock.fixed(start, ZoneOffset.UTC));

        assertThat(progress.snapshot().lastUpdated()).isNull();
        progress.addError("读取目录失败：/x");

        ScanProgressSnapshot snapshot = progress.snapshot();
        assertThat(snapshot.errors()).containsExactly("读取目录失败：/x");
        assertThat(snapshot.lastUpdated()).isEqualTo(start);
        assertThat(snapshot.startTime()).isEqualTo(start);
    }

    @Test
    void snapshot_isDetachedFromLaterUpdates() {
        ScanProgress progress = new ScanProgress();
        progress.addError("first");
        progress.recordArrival("/a");

        ScanProgressSnapshot before = progress.snapshot();
        progress.addError("second");
        progress.recordArrival("/b");

        assertThat(before.errors()).containsExactly("first");
        assertThat(before.currentDirectory()).isEqualTo("/a");
        assertThat(progress.snapshot().errors()).containsExactly("first", "second");
        assertThat(progress.snapshot().currentDirectory()).isEqualTo("/b");
    }

    @Test
    void concurrentUpdates_loseNothing() throws Exception {
        ScanProgress progress = new ScanProgress();
        int threads = 8;
        int perThread = 10_000;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startSignal = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(executor.submit(() -> {
                    startSignal.await();
                    for (int i = 0; i < perThread; i++) {
                        progress.recordDiscovered(2);
                        progress.recordScanned(2, i % 2 == 0);
                        if (i % 1000 == 0) {
                            progress.addError("t" + id + "-" + i);
                            progress.snapshot();
                        }
                    }
                    return null;
                }));
            }
            startSignal.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            executor.shutdownNow();
        }

        ScanProgressSnapshot snapshot = progress.snapshot();
        long total = (long) threads * perThread;
        assertThat(snapshot.totalFiles()).isEqualTo(total);
        assertThat(snapshot.scannedFiles()).isEqualTo(total);
        assertThat(snapshot.totalSize()).isEqualTo(total * 2);
        assertThat(snapshot.scannedSize()).isEqualTo(total * 2);
        assertThat(snapshot.blockedFiles()).isEqualTo(total / 2);
        assertThat(snapshot.errors()).hasSize(threads * (perThread / 1000));
    }
}
