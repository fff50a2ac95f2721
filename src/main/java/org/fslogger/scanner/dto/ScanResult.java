package org.fslogger.scanner.dto;

import java.util.List;

/**
 * 一次扫描的最终结果。
 *
 * @param files          全部条目（按到达结果收集器的顺序，不保证与遍历顺序一致）
 * @param progress       扫描结束时冻结的进度快照
 * @param durationMillis 扫描耗时（毫秒）
 * @param success        错误列表为空时为 true
 * @param error          顶层错误信息（例如扫描被取消），正常完成时为 null
 */
public record ScanResult(
        List<FileRecord> files,
        ScanProgressSnapshot progress,
        long durationMillis,
        boolean success,
        String error
) {
    public ScanResult {
        files = (files == null) ? List.of() : List.copyOf(files);
    }

    public long blockedCount() {
        return files.stream().filter(FileRecord::blocked).count();
    }
}
