package org.fslogger.scanner;

import org.fslogger.scanner.dto.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/**
 * 固定大小的文件处理线程池。
 * <p>
 * 每个工作线程循环：从工作队列取一个 {@link WorkItem}（队列关闭且取空则退出），读取元数据（跟随链接）、嗅探内容类型、分类，
 * 再把结果放入结果队列。每个取出的 WorkItem 恰好产出一条结果。
 * <p>
 * 取消后不再取新的条目；已经取出的条目仍会处理完，避免丢失已完成一半的分类状态。
 */
final class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ScanConfiguration config;
    private final BlockingRuleClassifier classifier;
    private final ScanProgress progress;
    private final ScanQueue<WorkItem> workQueue;
    private final ScanQueue<WorkResult> resultQueue;
    private final BooleanSupplier cancelled;
    private final ExecutorService executor;
    private final List<Future<Void>> workers = new ArrayList<>();

    WorkerPool(
            ScanConfiguration config,
            BlockingRuleClassifier classifier,
            ScanProgress progress,
            ScanQueue<WorkItem> workQueue,
            ScanQueue<WorkResult> resultQueue,
            BooleanSupplier cancelled
    ) {
        this.config = config;
        this.classifier = classifier;
        this.progress = progress;
        this.workQueue = workQueue;
        this.resultQueue = resultQueue;
        this.cancelled = cancelled;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scan-worker-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newFixedThreadPool(config.workerCount(), threadFactory);
    }

    void start() {
        for (int i = 0; i < config.workerCount(); i++) {
            workers.add(executor.submit(this::runWorker));
        }
    }

    /**
     * 等待所有工作线程退出（工作队列关闭并取空，或扫描被取消）。
     */
    void awaitCompletion() throws InterruptedException {
        for (Future<Void> worker : workers) {
            try {
                worker.get();
            } catch (ExecutionException e) {
                throw new IllegalStateException("工作线程异常退出", e.getCause());
            }
        }
    }

    void shutdown() {
        executor.shutdownNow();
    }

    private Void runWorker() throws InterruptedException {
        while (!cancelled.getAsBoolean()) {
            WorkItem item = workQueue.take();
            if (item == null) {
                break;
            }
            resultQueue.put(process(item));
        }
        return null;
    }

    WorkResult process(WorkItem item) {
        Path path = item.path();
        String name = IoErrors.fileName(path);
        String extension = extensionOf(name);

        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException | RuntimeException e) {
            // 元数据都拿不到：不做内容嗅探，记录错误并按策略阻止
            String cause = IoErrors.describe(e);
            FileRecord record = classifier.classify(new FileRecord(
                    path.toString(), name, 0L, null, null, extension, null, false, false, null, cause));
            progress.recordScanned(0L, record.blocked());
            log.warn("读取文件属性失败：{}（{}）", path, cause);
            return WorkResult.failed(record, "读取文件属性失败：" + path + "（" + cause + "）");
        }

        // 入队后类型可能已变化（或根路径本身就是特殊文件）：只对普通文件读取内容，管道等打开会一直阻塞
        Instant modifiedAt = (attrs.lastModifiedTime() != null) ? attrs.lastModifiedTime().toInstant() : null;
        if (attrs.isDirectory()) {
            progress.recordScanned(0L, false);
            return WorkResult.of(FileRecord.directory(path.toString(), name, modifiedAt));
        }
        if (!attrs.isRegularFile()) {
            progress.recordScanned(0L, true);
            return WorkResult.of(FileRecord.specialFile(
                    path.toString(), name, extension, modifiedAt, BlockingRuleClassifier.REASON_NOT_REGULAR));
        }

        String mimeType = null;
        String accessError = null;
        try {
            mimeType = ContentTypeSniffer.sniff(path);
        } catch (IOException | RuntimeException e) {
            accessError = IoErrors.describe(e);
            log.warn("读取文件内容失败：{}（{}）", path, accessError);
        }

        String fileType = !extension.isEmpty() ? extension.substring(1) : ContentTypeSniffer.primaryType(mimeType);
        FileRecord record = classifier.classify(new FileRecord(
                path.toString(),
                name,
                attrs.size(),
                mimeType,
                fileType,
                extension,
                modifiedAt,
                false,
                false,
                null,
                accessError
        ));

        progress.recordScanned(record.sizeBytes(), record.blocked());
        if (record.blocked()) {
            log.debug("已阻止：{}（{}）", path, record.blockReason());
        }

        if (accessError != null) {
            return WorkResult.failed(record, "读取文件内容失败：" + path + "（" + accessError + "）");
        }
        return WorkResult.of(record);
    }

    /**
     * 小写扩展名（含前导点），没有扩展名时返回空字符串。
     */
    static String extensionOf(String name) {
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
