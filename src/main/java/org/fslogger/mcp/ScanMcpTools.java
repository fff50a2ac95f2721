package org.fslogger.mcp;

import org.fslogger.mcp.dto.AllowedRootsResult;
import org.fslogger.mcp.dto.ScanFilesResult;
import org.fslogger.mcp.dto.ScanStartResult;
import org.fslogger.mcp.dto.ScanStatusResult;
import org.fslogger.mcp.dto.ScanSummary;
import org.fslogger.scanner.ScanConfiguration;
import org.fslogger.scanner.ScanPathResolver;
import org.fslogger.scanner.ScanRegistry;
import org.fslogger.scanner.ScanRegistry.ScanJob;
import org.fslogger.scanner.ScannerProperties;
import org.fslogger.scanner.dto.FileRecord;
import org.fslogger.scanner.dto.ScanResult;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 文件扫描 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出允许扫描的根目录（{@code scan_list_roots}）。</li>
 *   <li>异步启动扫描（{@code scan_start}），轮询进度/结果（{@code scan_status}）。</li>
 *   <li>分页读取扫描结果条目（{@code scan_list_files}），可只看被阻止的条目。</li>
 *   <li>取消扫描（{@code scan_cancel}）。</li>
 * </ul>
 * <p>
 * 安全策略：扫描路径必须位于 {@code app.scan.roots} 白名单内，默认禁止经过符号链接。
 */
@Component
public class ScanMcpTools {

    private static final String STATE_NOT_FOUND = "not_found";

    private final ScannerProperties properties;
    private final ScanPathResolver pathResolver;
    private final ScanRegistry registry;

    public ScanMcpTools(ScannerProperties properties, ScanPathResolver pathResolver, ScanRegistry registry) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.registry = registry;
    }

    @Tool(
            name = "scan_list_roots",
            description = "列出允许扫描的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    /**
     * 启动一次扫描。
     * <p>
     * 未传的参数使用 {@code app.scan.*} 的默认值；工作队列容量、遍历线程上限等资源参数只能通过服务端配置调整。
     */
    @Tool(
            name = "scan_start",
            description = "异步扫描目录（或单个文件）：按大小上限、允许的扩展名、文件名 glob 分类每个文件，返回 scanId；"
                    + "之后用 scan_status 轮询进度，用 scan_list_files 分页读取结果。"
    )
    public ScanStartResult startScan(
            @ToolParam(required = false, description = "rootId（可从 scan_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "扫描路径（相对 rootId 或绝对路径；为空则扫描整个根目录）") String path,
            @ToolParam(required = false, description = "文件大小上限（MB），超过则阻止；等于上限不阻止") Integer maxFileSizeMb,
            @ToolParam(required = false, description = "是否递归扫描子目录") Boolean recursive,
            @ToolParam(required = false, description = "允许的扩展名列表，例如 [\".txt\", \"pdf\"]；为空表示允许所有类型") List<String> allowedTypes,
            @ToolParam(required = false, description = "阻止的文件名 glob 列表（区分大小写），例如 [\"*.exe\"]") List<String> blockedPatterns,
            @ToolParam(required = false, description = "工作线程数（上限 app.scan.worker-count 的 16 倍）") Integer workerCount,
            @ToolParam(required = false, description = "扫描完成后是否把被阻止的条目导出为根目录下的 JSON 文件") Boolean exportBlockedToJson
    ) {
        ScanPathResolver.ResolvedPath resolved = pathResolver.resolve(rootId, path);

        ScanConfiguration.Builder builder = properties.toScanConfiguration().toBuilder();
        if (maxFileSizeMb != null) {
            if (maxFileSizeMb < 0) {
                throw new IllegalArgumentException("参数错误：maxFileSizeMb 不能为负数（" + maxFileSizeMb + "）");
            }
            builder.maxFileSizeMb(maxFileSizeMb);
        }
        if (recursive != null) {
            builder.recursive(recursive);
        }
        if (allowedTypes != null) {
            builder.allowedTypes(allowedTypes);
        }
        if (blockedPatterns != null) {
            builder.blockedPatterns(blockedPatterns);
        }
        if (workerCount != null) {
            builder.workerCount(resolveWorkerCount(workerCount));
        }
        if (exportBlockedToJson != null) {
            builder.exportBlockedToJson(exportBlockedToJson);
        }

        ScanJob job = registry.start(resolved.rootId(), resolved.absolutePath(), builder.build());
        return new ScanStartResult(job.id(), job.rootId(), job.path().toString(), job.state(), job.startedAt());
    }

    @Tool(
            name = "scan_status",
            description = "查询扫描状态：running 时返回实时进度，completed 时返回结果摘要，error 时返回错误信息；未知或已过期的 scanId 返回 not_found。"
    )
    public ScanStatusResult scanStatus(
            @ToolParam(description = "scan_start 返回的 scanId") String scanId
    ) {
        return registry.find(scanId)
                .map(ScanMcpTools::toStatus)
                .orElseGet(() -> notFound(scanId));
    }

    @Tool(
            name = "scan_list_files",
            description = "分页读取已完成扫描的条目（文件与目录的分类结果，按到达顺序），可只返回被阻止的条目。"
    )
    public ScanFilesResult listFiles(
            @ToolParam(description = "scan_start 返回的 scanId") String scanId,
            @ToolParam(required = false, description = "只返回被阻止的条目（默认 false）") Boolean blockedOnly,
            @ToolParam(required = false, description = "偏移量，从 0 开始") Integer offset,
            @ToolParam(required = false, description = "分页大小（默认 app.scan.result-default-limit，上限 app.scan.result-max-limit）") Integer limit
    ) {
        ScanJob job = registry.find(scanId)
                .orElseThrow(() -> new IllegalArgumentException("未知或已过期的 scanId：" + scanId));
        ScanResult result = job.result();
        if (result == null) {
            throw new IllegalArgumentException("扫描尚未完成或已失败（state=" + job.state() + "）：" + scanId);
        }

        boolean onlyBlocked = Boolean.TRUE.equals(blockedOnly);
        List<FileRecord> files = onlyBlocked
                ? result.files().stream().filter(FileRecord::blocked).toList()
                : result.files();

        int resolvedOffset = Math.max(0, offset == null ? 0 : offset);
        int resolvedLimit = resolveLimit(limit);
        int from = Math.min(resolvedOffset, files.size());
        int to = (int) Math.min((long) from + resolvedLimit, files.size());
        return new ScanFilesResult(
                scanId,
                onlyBlocked,
                resolvedOffset,
                resolvedLimit,
                files.size(),
                to < files.size(),
                List.copyOf(files.subList(from, to))
        );
    }

    @Tool(
            name = "scan_cancel",
            description = "请求取消扫描：不再处理新的条目，已发现的条目仍会返回；返回请求后的状态。"
    )
    public ScanStatusResult cancelScan(
            @ToolParam(description = "scan_start 返回的 scanId") String scanId
    ) {
        return registry.cancel(scanId)
                .map(ScanMcpTools::toStatus)
                .orElseGet(() -> notFound(scanId));
    }

    private static ScanStatusResult toStatus(ScanJob job) {
        String state = job.state();
        ScanResult result = job.result();
        return new ScanStatusResult(
                job.id(),
                state,
                job.path().toString(),
                job.startedAt(),
                job.finishedAt(),
                job.scanner().isCancelled(),
                ScanJob.STATE_RUNNING.equals(state) ? job.scanner().progress() : null,
                (result != null) ? summarize(result) : null,
                job.error()
        );
    }

    private static ScanSummary summarize(ScanResult result) {
        return new ScanSummary(
                result.files().size(),
                result.progress().totalFiles(),
                result.progress().blockedFiles(),
                result.progress().totalSize(),
                result.durationMillis(),
                result.success(),
                result.error(),
                result.progress().errors()
        );
    }

    private static ScanStatusResult notFound(String scanId) {
        return new ScanStatusResult(scanId, STATE_NOT_FOUND, null, null, null, false, null, null, null);
    }

    private int resolveLimit(Integer limit) {
        // 分页上限保护：避免一次性返回过多条目
        int resolved = (limit == null) ? properties.getResultDefaultLimit() : limit;
        resolved = Math.max(1, resolved);
        return Math.min(resolved, properties.getResultMaxLimit());
    }

    private int resolveWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("参数错误：workerCount 必须大于 0（" + workerCount + "）");
        }
        return Math.min(workerCount, properties.getWorkerCount() * 16);
    }
}
