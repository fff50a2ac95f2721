package org.fslogger.mcp.dto;

import org.fslogger.scanner.dto.ScanProgressSnapshot;

import java.time.Instant;

/**
 * {@code scan_status} / {@code scan_cancel} 的返回结果。
 * <p>
 * 按 state 不同填充不同字段：running 填 progress；completed 填 summary；error 填 error；not_found 只有 scanId。
 *
 * @param scanId     扫描任务标识
 * @param state      running / completed / error / not_found
 * @param path       扫描目标的绝对路径
 * @param startedAt  提交时间
 * @param finishedAt 结束时间（running 时为 null）
 * @param cancelled  是否已请求取消
 * @param progress   实时进度快照
 * @param summary    结果摘要
 * @param error      致命错误信息（例如路径不可访问）
 */
public record ScanStatusResult(
        String scanId,
        String state,
        String path,
        Instant startedAt,
        Instant finishedAt,
        boolean cancelled,
        ScanProgressSnapshot progress,
        ScanSummary summary,
        String error
) {
}
