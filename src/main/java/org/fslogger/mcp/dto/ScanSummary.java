package org.fslogger.mcp.dto;

import java.util.List;

/**
 * 已完成扫描的结果摘要（不含条目列表，条目请用 {@code scan_list_files} 分页获取）。
 *
 * @param entries        结果中的条目数（文件 + 目录）
 * @param totalFiles     发现的条目数
 * @param blockedFiles   被阻止的条目数
 * @param totalSize      文件总字节数
 * @param durationMillis 扫描耗时（毫秒）
 * @param success        是否没有任何错误
 * @param error          顶层错误（例如扫描被取消）
 * @param errors         全部错误信息
 */
public record ScanSummary(
        int entries,
        long totalFiles,
        long blockedFiles,
        long totalSize,
        long durationMillis,
        boolean success,
        String error,
        List<String> errors
) {
}
