package org.fslogger.scanner;

import org.fslogger.scanner.dto.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 异步扫描任务登记表（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code scan_start}：生成 scanId，创建扫描器并提交到固定大小的线程池。</li>
 *   <li>{@code scan_status}/{@code scan_list_files}：按 scanId 查询实时进度或最终结果。</li>
 *   <li>{@code scan_cancel}：请求取消，扫描器会尽快收尾并返回部分结果。</li>
 * </ol>
 * <p>
 * 已结束的任务保留 {@code finishedScanTtl}，过期后在下一次调用时清理。
 * 仅用于单进程场景；多实例共享需要替换为外部存储。
 */
public class ScanRegistry {

    private static final Logger log = LoggerFactory.getLogger(ScanRegistry.class);

    private final Duration finishedTtl;
    private final ScanExporter exporter;
    private final Clock clock;
    private final ExecutorService executor;
    private final ConcurrentHashMap<String, ScanJob> jobs = new ConcurrentHashMap<>();

    public ScanRegistry(Duration finishedTtl, int maxConcurrentScans, ScanExporter exporter) {
        this(finishedTtl, maxConcurrentScans, exporter, Clock.systemUTC());
    }

    public ScanRegistry(Duration finishedTtl, int maxConcurrentScans, ScanExporter exporter, Clock clock) {
        if (maxConcurrentScans < 1) {
            throw new IllegalArgumentException("maxConcurrentScans 必须大于 0：" + maxConcurrentScans);
        }
        this.finishedTtl = Objects.requireNonNull(finishedTtl, "finishedTtl");
        this.exporter = exporter;
        this.clock = Objects.requireNonNull(clock, "clock");

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scan-job-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newFixedThreadPool(maxConcurrentScans, threadFactory);
    }

    /**
     * 提交一次异步扫描。线程池已满时任务排队，期间状态仍为 running。
     */
    public ScanJob start(String rootId, Path target, ScanConfiguration config) {
        cleanupExpired();
        Objects.requireNonNull(target, "target");

        FileSystemScanner scanner = new FileSystemScanner(config, exporter, clock);
        ScanJob job = new ScanJob(UUID.randomUUID().toString(), rootId, target, scanner, clock.instant());
        jobs.put(job.id(), job);
        try {
            executor.execute(() -> run(job));
        } catch (RejectedExecutionException e) {
            jobs.remove(job.id());
            throw new IllegalStateException("扫描服务正在关闭，无法启动新的扫描", e);
        }
        log.info("已提交扫描任务：{} -> {}", job.id(), target);
        return job;
    }

    public Optional<ScanJob> find(String scanId) {
        cleanupExpired();
        if (scanId == null || scanId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(jobs.get(scanId));
    }

    /**
     * 请求取消扫描；任务不存在时返回空。
     */
    public Optional<ScanJob> cancel(String scanId) {
        Optional<ScanJob> job = find(scanId);
        job.ifPresent(j -> j.scanner().cancel());
        return job;
    }

    public int size() {
        return jobs.size();
    }

    /**
     * 取消所有扫描并停止线程池（随 Spring 容器关闭调用）。
     */
    public void shutdown() {
        for (ScanJob job : jobs.values()) {
            job.scanner().cancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private void run(ScanJob job) {
        try {
            ScanResult result = job.scanner().scan(job.path().toString());
            job.complete(result, clock.instant());
        } catch (RuntimeException e) {
            log.warn("扫描任务失败：{} -> {}（{}）", job.id(), job.path(), e.getMessage());
            job.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), clock.instant());
        }
    }

    private void cleanupExpired() {
        Instant now = clock.instant();
        for (Map.Entry<String, ScanJob> entry : jobs.entrySet()) {
            Instant finishedAt = entry.getValue().finishedAt();
            if (finishedAt != null && finishedAt.plus(finishedTtl).isBefore(now)) {
                jobs.remove(entry.getKey());
            }
        }
    }

    /**
     * 登记表中的一个扫描任务。
     * <p>
     * 结果/错误/结束时间由扫描线程写入一次，其余线程只读。
     */
    public static final class ScanJob {

        public static final String STATE_RUNNING = "running";
        public static final String STATE_COMPLETED = "completed";
        public static final String STATE_ERROR = "error";

        private final String id;
        private final String rootId;
        private final Path path;
        private final FileSystemScanner scanner;
        private final Instant startedAt;

        private volatile ScanResult result;
        private volatile String error;
        private volatile Instant finishedAt;

        ScanJob(String id, String rootId, Path path, FileSystemScanner scanner, Instant startedAt) {
            this.id = id;
            this.rootId = rootId;
            this.path = path;
            this.scanner = scanner;
            this.startedAt = startedAt;
        }

        void complete(ScanResult result, Instant at) {
            this.result = result;
            this.finishedAt = at;
        }

        void fail(String error, Instant at) {
            this.error = error;
            this.finishedAt = at;
        }

        public String state() {
            if (finishedAt == null) {
                return STATE_RUNNING;
            }
            return (error != null) ? STATE_ERROR : STATE_COMPLETED;
        }

        public String id() {
            return id;
        }

        public String rootId() {
            return rootId;
        }

        public Path path() {
            return path;
        }

        public FileSystemScanner scanner() {
            return scanner;
        }

        public Instant startedAt() {
            return startedAt;
        }

        public ScanResult result() {
            return result;
        }

        public String error() {
            return error;
        }

        public Instant finishedAt() {
            return finishedAt;
        }
    }
}
