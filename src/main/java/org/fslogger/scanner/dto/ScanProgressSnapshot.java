package org.fslogger.scanner.dto;

import java.time.Instant;
import java.util.List;

/**
 * 扫描进度的时间点快照（深拷贝，可在扫描进行中安全读取）。
 *
 * @param totalFiles       已发现的条目数（文件 + 目录）
 * @param scannedFiles     已处理的文件数
 * @param totalSize        已发现文件的总字节数
 * @param scannedSize      已处理文件的总字节数
 * @param blockedFiles     被阻止的条目数
 * @param errors           按记录顺序排列的错误信息
 * @param startTime        扫描开始时间
 * @param lastUpdated      最后一次更新时间
 * @param currentDirectory 当前正在处理的目录
 */
public record ScanProgressSnapshot(
        long totalFiles,
        long scannedFiles,
        long totalSize,
        long scannedSize,
        long blockedFiles,
        List<String> errors,
        Instant startTime,
        Instant lastUpdated,
        String currentDirectory
) {
    public ScanProgressSnapshot {
        errors = (errors == null) ? List.of() : List.copyOf(errors);
    }
}
