package org.fslogger.scanner;

import org.fslogger.scanner.dto.FileRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;

/**
 * 目录遍历协调器：列出目录条目，把文件作为 {@link WorkItem} 放入工作队列，把目录记录直接放入结果队列。
 * <p>
 * 遍历规则：
 * <ul>
 *   <li>每个遍历任务先尝试打开自己的目录，再产出该目录的记录；打不开的目录记录带 accessError 并按策略标记为阻止，不再向下遍历。</li>
 *   <li>递归模式：每个子目录派生一个新的遍历任务；非递归模式：根目录的直接子目录只记录、不进入。</li>
 *   <li>与导出文件同名的文件在开启导出时跳过，避免把上一次的导出结果当作扫描对象。</li>
 *   <li>只有普通文件进入工作队列；指向目录的链接只记录、不跟随；特殊文件（管道等）不打开，记录为阻止。</li>
 *   <li>工作队列满时入队阻塞遍历任务（背压）；每处理一个子条目前检查一次取消标志。</li>
 * </ul>
 * <p>
 * 线程模型：{@code maxTraversalThreads=0} 时使用 cached 线程池，即每个正在列举的目录一个线程，
 * 目录树非常宽时线程数会随之增长；大于 0 时使用固定大小的线程池，子任务排队等待而不会阻塞父任务。
 * 所有任务结束（{@link TraversalTracker} 归零）后，调用方才可以关闭工作队列。
 */
final class TraversalCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TraversalCoordinator.class);

    private final ScanConfiguration config;
    private final ScanProgress progress;
    private final ScanQueue<WorkItem> workQueue;
    private final ScanQueue<WorkResult> resultQueue;
    private final BooleanSupplier cancelled;
    private final TraversalTracker tracker = new TraversalTracker();
    private final ExecutorService executor;

    TraversalCoordinator(
            ScanConfiguration config,
            ScanProgress progress,
            ScanQueue<WorkItem> workQueue,
            ScanQueue<WorkResult> resultQueue,
            BooleanSupplier cancelled
    ) {
        this.config = config;
        this.progress = progress;
        this.workQueue = workQueue;
        this.resultQueue = resultQueue;
        this.cancelled = cancelled;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scan-dir-");
        threadFactory.setDaemon(true);
        this.executor = (config.maxTraversalThreads() > 0)
                ? Executors.newFixedThreadPool(config.maxTraversalThreads(), threadFactory)
                : Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * 从根路径开始遍历（异步）。根路径不是目录时只把它本身入队，由工作线程判断类型。
     */
    void start(Path root, BasicFileAttributes rootAttrs) {
        if (rootAttrs.isDirectory()) {
            spawn(root, rootAttrs);
            return;
        }
        tracker.register();
        submit(() -> {
            try {
                enqueueFile(root, rootAttrs.size());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                tracker.arrive();
            }
        });
    }

    void awaitCompletion() throws InterruptedException {
        tracker.await();
    }

    void shutdown() {
        executor.shutdownNow();
    }

    private void spawn(Path dir, BasicFileAttributes attrs) {
        tracker.register();
        submit(() -> traverse(dir, attrs));
    }

    private void submit(Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            // 任务没有机会执行，登记的计数需要在这里归还
            tracker.arrive();
            progress.addError("无法启动目录遍历任务（" + IoErrors.describe(e) + "）");
        }
    }

    private void traverse(Path dir, BasicFileAttributes attrs) {
        try {
            scanDirectory(dir, attrs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("遍历目录异常：{}", dir, e);
            progress.addError("遍历目录失败：" + dir + "（" + IoErrors.describe(e) + "）");
        } finally {
            tracker.arrive();
        }
    }

    private void scanDirectory(Path dir, BasicFileAttributes attrs) throws InterruptedException {
        DirectoryStream<Path> stream;
        try {
            stream = Files.newDirectoryStream(dir);
        } catch (IOException e) {
            String cause = IoErrors.describe(e);
            log.warn("读取目录失败：{}（{}）", dir, cause);
            progress.recordDiscovered(0);
            progress.recordBlocked();
            FileRecord record = FileRecord.unreadableDirectory(
                    dir.toString(), IoErrors.fileName(dir), BlockingRuleClassifier.REASON_ACCESS, cause);
            resultQueue.put(WorkResult.failed(record, "读取目录失败：" + dir + "（" + cause + "）"));
            return;
        }

        try (stream) {
            emitDirectory(dir, attrs);
            for (Path child : stream) {
                if (cancelled.getAsBoolean()) {
                    return;
                }
                BasicFileAttributes childAttrs;
                try {
                    childAttrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    resultQueue.put(WorkResult.error("读取文件属性失败：" + child + "（" + IoErrors.describe(e) + "）"));
                    continue;
                }

                if (childAttrs.isDirectory()) {
                    if (config.recursive()) {
                        spawn(child, childAttrs);
                    } else {
                        // 非递归模式只有根目录会被列举，这里的子目录都是根目录的直接子目录
                        emitDirectory(child, childAttrs);
                    }
                } else if (!isExportFile(child)) {
                    if (!emitEntry(child, childAttrs)) {
                        return;
                    }
                }
            }
        } catch (IOException | DirectoryIteratorException e) {
            Exception cause = (e instanceof DirectoryIteratorException die) ? die.getCause() : (Exception) e;
            log.warn("列举目录失败：{}（{}）", dir, IoErrors.describe(cause));
            resultQueue.put(WorkResult.error("读取目录失败：" + dir + "（" + IoErrors.describe(cause) + "）"));
        }
    }

    private void emitDirectory(Path dir, BasicFileAttributes attrs) throws InterruptedException {
        progress.recordDiscovered(0);
        FileRecord record = FileRecord.directory(
                dir.toString(),
                IoErrors.fileName(dir),
                attrs.lastModifiedTime() != null ? attrs.lastModifiedTime().toInstant() : null
        );
        resultQueue.put(WorkResult.of(record));
    }

    /**
     * 处理一个非目录条目。只有普通文件（或指向普通文件的链接）会进入工作队列；
     * 指向目录的链接只记录、不进入；管道/套接字/设备等特殊文件不打开，直接记录为阻止。
     *
     * @return false 表示扫描已被取消，调用方应停止遍历
     */
    private boolean emitEntry(Path child, BasicFileAttributes linkAttrs) throws InterruptedException {
        BasicFileAttributes attrs = linkAttrs;
        if (linkAttrs.isSymbolicLink()) {
            try {
                attrs = Files.readAttributes(child, BasicFileAttributes.class);
            } catch (IOException e) {
                // 悬空链接：交给工作线程，由它记录读取失败
                return enqueueFile(child, 0L);
            }
        }

        if (attrs.isRegularFile()) {
            return enqueueFile(child, attrs.size());
        }
        if (attrs.isDirectory()) {
            emitDirectory(child, attrs);
            return true;
        }
        emitSpecialFile(child, attrs);
        return true;
    }

    private void emitSpecialFile(Path file, BasicFileAttributes attrs) throws InterruptedException {
        progress.recordDiscovered(0);
        progress.recordBlocked();
        String name = IoErrors.fileName(file);
        FileRecord record = FileRecord.specialFile(
                file.toString(),
                name,
                WorkerPool.extensionOf(name),
                attrs.lastModifiedTime() != null ? attrs.lastModifiedTime().toInstant() : null,
                BlockingRuleClassifier.REASON_NOT_REGULAR
        );
        log.debug("跳过特殊文件：{}", file);
        resultQueue.put(WorkResult.of(record));
    }

    private boolean enqueueFile(Path file, long sizeBytes) throws InterruptedException {
        progress.recordDiscovered(sizeBytes);
        return workQueue.put(WorkItem.file(file), cancelled);
    }

    private boolean isExportFile(Path file) {
        return config.exportBlockedToJson() && config.exportFileName().equals(IoErrors.fileName(file));
    }
}
