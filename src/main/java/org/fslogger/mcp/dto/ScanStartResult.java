package org.fslogger.mcp.dto;

import java.time.Instant;

/**
 * {@code scan_start} 的返回结果。
 *
 * @param scanId    扫描任务标识（后续查询/取消使用）
 * @param rootId    命中的根目录标识
 * @param path      扫描目标的绝对路径
 * @param state     任务状态（刚提交时为 running）
 * @param startedAt 提交时间
 */
public record ScanStartResult(
        String scanId,
        String rootId,
        String path,
        String state,
        Instant startedAt
) {
}
