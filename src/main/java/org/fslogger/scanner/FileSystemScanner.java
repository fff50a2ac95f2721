package org.fslogger.scanner;

import org.fslogger.scanner.dto.FileRecord;
import org.fslogger.scanner.dto.ScanProgressSnapshot;
import org.fslogger.scanner.dto.ScanResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 扫描编排器：负责一次扫描的完整生命周期。
 * <p>
 * 启动顺序：结果收集器 -> 工作线程池 -> 目录遍历。收集器最先启动，保证任何结果都有人消费；
 * 线程池先于遍历启动，避免启动阶段工作队列被无谓地填满。
 * <p>
 * 等待顺序（严格）：
 * <ol>
 *   <li>等待所有目录遍历任务结束，然后关闭工作队列；</li>
 *   <li>等待所有工作线程退出，然后关闭结果队列；</li>
 *   <li>等待结果收集器结束，然后冻结进度快照、组装结果。</li>
 * </ol>
 * 因此冻结快照时不会再有计数器自增在进行中。
 * <p>
 * 一个实例只能执行一次 {@link #scan(String)}；{@link #progress()} 与 {@link #cancel()} 可在任意线程随时调用。
 */
public class FileSystemScanner {

    private static final Logger log = LoggerFactory.getLogger(FileSystemScanner.class);

    private final ScanConfiguration config;
    private final ScanExporter exporter;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile ScanState state = ScanState.IDLE;
    private volatile ScanProgress progress;

    public FileSystemScanner(ScanConfiguration config) {
        this(config, null);
    }

    public FileSystemScanner(ScanConfiguration config, ScanExporter exporter) {
        this(config, exporter, Clock.systemUTC());
    }

    public FileSystemScanner(ScanConfiguration config, ScanExporter exporter, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.exporter = exporter;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.progress = new ScanProgress(clock);
    }

    /**
     * 同步执行扫描。
     *
     * @param rootPath 根路径（目录或单个文件）
     * @return 扫描结果（扫描被取消时同样返回，{@link ScanResult#error()} 说明原因）
     * @throws IllegalArgumentException 路径为空、不存在或无法读取属性（此时不产生任何结果）
     * @throws IllegalStateException    实例已经执行过扫描，或等待过程中线程被中断
     */
    public ScanResult scan(String rootPath) {
        synchronized (this) {
            if (state != ScanState.IDLE) {
                throw new IllegalStateException("每个扫描器实例只能执行一次扫描（当前状态：" + state + "）");
            }
            state = ScanState.VALIDATING;
        }

        Path root;
        BasicFileAttributes rootAttrs;
        try {
            root = validateRoot(rootPath);
            rootAttrs = Files.readAttributes(root, BasicFileAttributes.class);
        } catch (IOException e) {
            state = ScanState.FAILED;
            throw new IllegalArgumentException("路径不存在或无法访问：" + rootPath + "（" + IoErrors.describe(e) + "）", e);
        } catch (RuntimeException e) {
            state = ScanState.FAILED;
            throw e;
        }

        ScanProgress current = new ScanProgress(clock);
        this.progress = current;

        ScanQueue<WorkItem> workQueue = new ScanQueue<>(config.queueCapacity());
        ScanQueue<WorkResult> resultQueue = new ScanQueue<>(config.resultQueueCapacity());
        BlockingRuleClassifier classifier = new BlockingRuleClassifier(config);
        ResultCollector collector = new ResultCollector(current, resultQueue);
        WorkerPool pool = new WorkerPool(config, classifier, current, workQueue, resultQueue, cancelled::get);
        TraversalCoordinator coordinator = new TraversalCoordinator(config, current, workQueue, resultQueue, cancelled::get);

        log.info("开始扫描：{}（workers={}, queue={}, recursive={}）",
                root, config.workerCount(), config.queueCapacity(), config.recursive());
        state = ScanState.RUNNING;

        List<FileRecord> files;
        try {
            collector.start();
            pool.start();
            coordinator.start(root, rootAttrs);

            coordinator.awaitCompletion();
            state = ScanState.DRAINING;
            workQueue.close();

            pool.awaitCompletion();
            resultQueue.close();

            files = collector.awaitFiles();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelled.set(true);
            state = ScanState.FAILED;
            throw new IllegalStateException("扫描被中断：" + root, e);
        } catch (RuntimeException e) {
            cancelled.set(true);
            state = ScanState.FAILED;
            throw e;
        } finally {
            coordinator.shutdown();
            pool.shutdown();
            collector.shutdown();
        }

        String topLevelError = null;
        if (cancelled.get()) {
            topLevelError = "扫描已被取消：" + root;
            current.addError(topLevelError);
        }

        long durationMillis = Duration.between(current.startTime(), clock.instant()).toMillis();
        ScanResult result = assemble(files, current, durationMillis, topLevelError);

        if (config.exportBlockedToJson() && exporter != null) {
            result = export(exportPath(root, rootAttrs), result, files, current, durationMillis, topLevelError);
        }

        state = ScanState.COMPLETED;
        ScanProgressSnapshot summary = result.progress();
        log.info("扫描完成：{}（条目 {}，阻止 {}，错误 {}，耗时 {} ms）",
                root, files.size(), summary.blockedFiles(), summary.errors().size(), durationMillis);
        return result;
    }

    /**
     * 当前进度的深拷贝快照（扫描开始前返回全零快照）。
     */
    public ScanProgressSnapshot progress() {
        return progress.snapshot();
    }

    public ScanState state() {
        return state;
    }

    /**
     * 请求取消：工作线程不再领取新条目，遍历任务不再处理新的子条目。
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("已请求取消扫描（当前状态：{}）", state);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private static Path validateRoot(String rootPath) {
        if (rootPath == null || rootPath.isBlank()) {
            throw new IllegalArgumentException("扫描路径不能为空");
        }
        try {
            return Path.of(rootPath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("非法的扫描路径：" + rootPath, e);
        }
    }

    private Path exportPath(Path root, BasicFileAttributes rootAttrs) {
        Path dir = rootAttrs.isDirectory() ? root : root.getParent();
        if (dir == null) {
            dir = root;
        }
        return dir.resolve(config.exportFileName());
    }

    private ScanResult export(
            Path outputPath,
            ScanResult result,
            List<FileRecord> files,
            ScanProgress current,
            long durationMillis,
            String topLevelError
    ) {
        try {
            exporter.export(result, outputPath);
            log.info("已导出阻止文件列表：{}", outputPath);
            return result;
        } catch (IOException | RuntimeException e) {
            String message = "导出阻止文件列表失败：" + outputPath + "（" + IoErrors.describe(e) + "）";
            log.warn(message, e);
            current.addError(message);
            return assemble(files, current, durationMillis, topLevelError);
        }
    }

    private static ScanResult assemble(List<FileRecord> files, ScanProgress current, long durationMillis, String error) {
        ScanProgressSnapshot snapshot = current.snapshot();
        return new ScanResult(files, snapshot, durationMillis, snapshot.errors().isEmpty(), error);
    }
}
