package org.fslogger.scanner;

import org.fslogger.scanner.dto.FileRecord;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 结果收集器：单线程消费结果队列，直到队列关闭并取空。
 * <p>
 * 错误写入进度的错误列表；记录追加到结果列表（按到达顺序），同时更新“当前目录”（记录路径的父目录）。
 * 结果列表只由收集线程写入，{@link #awaitFiles()} 返回后不再修改。
 */
final class ResultCollector {

    private final ScanProgress progress;
    private final ScanQueue<WorkResult> resultQueue;
    private final ExecutorService executor;
    private Future<List<FileRecord>> collecting;

    ResultCollector(ScanProgress progress, ScanQueue<WorkResult> resultQueue) {
        this.progress = progress;
        this.resultQueue = resultQueue;

        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scan-collector-");
        threadFactory.setDaemon(true);
        this.executor = Executors.newSingleThreadExecutor(threadFactory);
    }

    void start() {
        collecting = executor.submit(this::collect);
    }

    List<FileRecord> awaitFiles() throws InterruptedException {
        if (collecting == null) {
            throw new IllegalStateException("结果收集器尚未启动");
        }
        try {
            return collecting.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("结果收集线程异常退出", e.getCause());
        }
    }

    void shutdown() {
        executor.shutdownNow();
    }

    private List<FileRecord> collect() throws InterruptedException {
        List<FileRecord> files = new ArrayList<>();
        WorkResult result;
        while ((result = resultQueue.take()) != null) {
            if (result.error() != null) {
                progress.addError(result.error());
            }
            if (result.record() != null) {
                files.add(result.record());
                progress.recordArrival(parentOf(result.record().path()));
            }
        }
        return files;
    }

    private static String parentOf(String path) {
        Path parent = Path.of(path).getParent();
        return (parent != null) ? parent.toString() : path;
    }
}
