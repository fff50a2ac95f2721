package org.fslogger.mcp.dto;

import org.fslogger.scanner.dto.FileRecord;

import java.util.List;

/**
 * {@code scan_list_files} 的返回结果。
 *
 * @param scanId      扫描任务标识
 * @param blockedOnly 是否只返回被阻止的条目
 * @param offset      分页偏移
 * @param limit       分页大小
 * @param total       过滤后的条目总数
 * @param hasMore     是否还有更多数据
 * @param files       条目列表
 */
public record ScanFilesResult(
        String scanId,
        boolean blockedOnly,
        int offset,
        int limit,
        int total,
        boolean hasMore,
        List<FileRecord> files
) {
}
