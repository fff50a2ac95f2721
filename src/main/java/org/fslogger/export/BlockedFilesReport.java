package org.fslogger.export;

import org.fslogger.scanner.dto.FileRecord;

import java.time.Instant;
import java.util.List;

/**
 * 阻止文件导出清单（{@code blocked_files.json} 的内容）。
 *
 * @param timestamp          导出时间
 * @param totalFiles         扫描发现的条目总数
 * @param blockedFiles       被阻止的条目
 * @param scanDurationMillis 扫描耗时（毫秒）
 * @param blockedCount       被阻止的条目数
 * @param totalSize          扫描发现的文件总字节数
 * @param blockedSize        被阻止条目的总字节数
 */
public record BlockedFilesReport(
        Instant timestamp,
        long totalFiles,
        List<FileRecord> blockedFiles,
        long scanDurationMillis,
        long blockedCount,
        long totalSize,
        long blockedSize
) {
}
