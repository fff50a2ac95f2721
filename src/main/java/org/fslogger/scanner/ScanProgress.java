package org.fslogger.scanner;

import org.fslogger.scanner.dto.ScanProgressSnapshot;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 扫描进度累加器：所有遍历任务与工作线程共享的唯一可变对象。
 * <p>
 * 并发约定：
 * <ul>
 *   <li>数值计数器只通过原子自增更新（高频、无锁）。</li>
 *   <li>错误列表、最后更新时间、当前目录只在同一把锁 {@link #lock} 内读写；一次逻辑更新（例如“追加错误 + 更新时间”）在同一个临界区内完成。</li>
 *   <li>同一个字段不会同时使用两种方式保护。</li>
 * </ul>
 * 外部只能通过 {@link #snapshot()} 拿到深拷贝。
 */
public class ScanProgress {

    private final Clock clock;

    private final AtomicLong totalFiles = new AtomicLong();
    private final AtomicLong scannedFiles = new AtomicLong();
    private final AtomicLong totalSize = new AtomicLong();
    private final AtomicLong scannedSize = new AtomicLong();
    private final AtomicLong blockedFiles = new AtomicLong();

    private final Object lock = new Object();
    private final List<String> errors = new ArrayList<>();
    private final Instant startTime;
    private Instant lastUpdated;
    private String currentDirectory;

    public ScanProgress() {
        this(Clock.systemUTC());
    }

    public ScanProgress(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public Instant startTime() {
        return startTime;
    }

    /**
     * 遍历阶段发现一个条目（目录记录或入队的文件）。
     */
    public void recordDiscovered(long sizeBytes) {
        totalFiles.incrementAndGet();
        if (sizeBytes > 0) {
            totalSize.addAndGet(sizeBytes);
        }
    }

    /**
     * 工作线程处理完一个文件。
     */
    public void recordScanned(long sizeBytes, boolean blocked) {
        scannedFiles.incrementAndGet();
        if (sizeBytes > 0) {
            scannedSize.addAndGet(sizeBytes);
        }
        if (blocked) {
            blockedFiles.incrementAndGet();
        }
    }

    /**
     * 遍历阶段直接判定为阻止的条目（例如无法读取的目录）。
     */
    public void recordBlocked() {
        blockedFiles.incrementAndGet();
    }

    public void addError(String message) {
        synchronized (lock) {
            errors.add(message);
            lastUpdated = clock.instant();
        }
    }

    public void recordArrival(String directory) {
        synchronized (lock) {
            lastUpdated = clock.instant();
            currentDirectory = directory;
        }
    }

    public ScanProgressSnapshot snapshot() {
        List<String> errorsCopy;
        Instant lastUpdatedCopy;
        String currentDirectoryCopy;
        synchronized (lock) {
            errorsCopy = new ArrayList<>(errors);
            lastUpdatedCopy = lastUpdated;
            currentDirectoryCopy = currentDirectory;
        }
        return new ScanProgressSnapshot(
                totalFiles.get(),
                scannedFiles.get(),
                totalSize.get(),
                scannedSize.get(),
                blockedFiles.get(),
                errorsCopy,
                startTime,
                lastUpdatedCopy,
                currentDirectoryCopy
        );
    }
}
