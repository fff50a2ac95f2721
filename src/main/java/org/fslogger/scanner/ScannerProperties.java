package org.fslogger.scanner;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 扫描服务的业务配置（{@code app.scan.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许扫描的根目录白名单，MCP 调用方只能扫描这些目录内的路径。</li>
 *   <li>{@code max-file-size-mb/allowed-types/blocked-patterns/recursive/...} 是每次扫描的默认值，调用方可按次覆盖。</li>
 *   <li>{@code worker-count/queue-capacity/max-traversal-threads} 控制并发度与内存占用。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.scan")
public class ScannerProperties {

    /**
     * 允许扫描的根目录白名单。
     * <p>
     * 每个 root 会自动分配一个 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许扫描路径经过符号链接（默认不允许，防止路径逃逸出白名单）。
     */
    private boolean allowSymlink = false;

    /**
     * 默认文件大小上限（MB），超过则阻止；等于上限不阻止。
     */
    @Min(0)
    @Max(1_048_576)
    private int maxFileSizeMb = 50;

    /**
     * 默认是否递归扫描子目录。
     */
    private boolean recursive = true;

    /**
     * 默认允许的扩展名（为空表示允许所有类型），例如 {@code .txt}、{@code pdf}。
     */
    @NotNull
    private List<String> allowedTypes = new ArrayList<>();

    /**
     * 默认阻止的文件名 glob（区分大小写），例如 {@code *.exe}、{@code secret-*}。
     */
    @NotNull
    private List<String> blockedPatterns = new ArrayList<>();

    /**
     * 默认工作线程数。
     */
    @Min(1)
    @Max(1_024)
    private int workerCount = ScanConfiguration.DEFAULT_WORKER_COUNT;

    /**
     * 工作队列容量（队列满时目录遍历会阻塞等待）。
     */
    @Min(1)
    @Max(10_000_000)
    private int queueCapacity = ScanConfiguration.DEFAULT_QUEUE_CAPACITY;

    /**
     * 结果队列容量（队列满时工作线程会阻塞等待）。
     */
    @Min(1)
    @Max(10_000_000)
    private int resultQueueCapacity = ScanConfiguration.DEFAULT_QUEUE_CAPACITY;

    /**
     * 目录遍历线程上限。
     * <p>
     * 0 表示不设上限（每个正在列举的目录一个线程）；目录树非常宽时建议设置为固定值。
     */
    @Min(0)
    @Max(10_000)
    private int maxTraversalThreads = 0;

    /**
     * 默认是否在扫描完成后导出阻止文件列表。
     */
    private boolean exportBlockedToJson = false;

    /**
     * 导出文件名（写在扫描根目录下；遍历时会跳过同名文件）。
     */
    @NotBlank
    private String exportFileName = ScanConfiguration.DEFAULT_EXPORT_FILE_NAME;

    /**
     * 同时运行的扫描任务数上限。
     */
    @Min(1)
    @Max(1_000)
    private int maxConcurrentScans = 4;

    /**
     * 已结束的扫描任务保留多久（超过后查询返回 not_found）。
     */
    @NotNull
    private Duration finishedScanTtl = Duration.ofMinutes(30);

    /**
     * {@code scan_list_files} 默认返回条数（分页大小）。
     */
    @Min(1)
    @Max(100_000)
    private int resultDefaultLimit = 200;

    /**
     * {@code scan_list_files} 允许的最大返回条数（上限保护）。
     */
    @Min(1)
    @Max(100_000)
    private int resultMaxLimit = 5_000;

    /**
     * 按当前默认值生成一份扫描配置。
     */
    public ScanConfiguration toScanConfiguration() {
        return ScanConfiguration.builder()
                .maxFileSizeMb(maxFileSizeMb)
                .recursive(recursive)
                .allowedTypes(allowedTypes)
                .blockedPatterns(blockedPatterns)
                .workerCount(workerCount)
                .queueCapacity(queueCapacity)
                .resultQueueCapacity(resultQueueCapacity)
                .maxTraversalThreads(maxTraversalThreads)
                .exportBlockedToJson(exportBlockedToJson)
                .exportFileName(exportFileName)
                .build();
    }

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public int getMaxFileSizeMb() {
        return maxFileSizeMb;
    }

    public void setMaxFileSizeMb(int maxFileSizeMb) {
        this.maxFileSizeMb = maxFileSizeMb;
    }

    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    public List<String> getAllowedTypes() {
        return allowedTypes;
    }

    public void setAllowedTypes(List<String> allowedTypes) {
        this.allowedTypes = allowedTypes;
    }

    public List<String> getBlockedPatterns() {
        return blockedPatterns;
    }

    public void setBlockedPatterns(List<String> blockedPatterns) {
        this.blockedPatterns = blockedPatterns;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getResultQueueCapacity() {
        return resultQueueCapacity;
    }

    public void setResultQueueCapacity(int resultQueueCapacity) {
        this.resultQueueCapacity = resultQueueCapacity;
    }

    public int getMaxTraversalThreads() {
        return maxTraversalThreads;
    }

    public void setMaxTraversalThreads(int maxTraversalThreads) {
        this.maxTraversalThreads = maxTraversalThreads;
    }

    public boolean isExportBlockedToJson() {
        return exportBlockedToJson;
    }

    public void setExportBlockedToJson(boolean exportBlockedToJson) {
        this.exportBlockedToJson = exportBlockedToJson;
    }

    public String getExportFileName() {
        return exportFileName;
    }

    public void setExportFileName(String exportFileName) {
        this.exportFileName = exportFileName;
    }

    public int getMaxConcurrentScans() {
        return maxConcurrentScans;
    }

    public void setMaxConcurrentScans(int maxConcurrentScans) {
        this.maxConcurrentScans = maxConcurrentScans;
    }

    public Duration getFinishedScanTtl() {
        return finishedScanTtl;
    }

    public void setFinishedScanTtl(Duration finishedScanTtl) {
        this.finishedScanTtl = finishedScanTtl;
    }

    public int getResultDefaultLimit() {
        return resultDefaultLimit;
    }

    public void setResultDefaultLimit(int resultDefaultLimit) {
        this.resultDefaultLimit = resultDefaultLimit;
    }

    public int getResultMaxLimit() {
        return resultMaxLimit;
    }

    public void setResultMaxLimit(int resultMaxLimit) {
        this.resultMaxLimit = resultMaxLimit;
    }
}
