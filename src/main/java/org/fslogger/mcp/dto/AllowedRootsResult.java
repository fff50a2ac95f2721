package org.fslogger.mcp.dto;

import org.fslogger.scanner.dto.AllowedRoot;

import java.util.List;

/**
 * {@code scan_list_roots} 的返回结果。
 *
 * @param roots 允许扫描的根目录白名单
 */
public record AllowedRootsResult(List<AllowedRoot> roots) {
}
