package org.fslogger.scanner;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

/**
 * 单次扫描的配置（不可变，构造时即完成校验与默认值填充）。
 * <p>
 * 说明：
 * <ul>
 *   <li>{@code workerCount/queueCapacity/resultQueueCapacity} 小于 1 时回落到默认值，扫描过程中不会再改变。</li>
 *   <li>{@code allowedTypes} 统一规范化为“小写 + 前导点”（{@code TXT} 与 {@code .txt} 等价），为空表示允许所有类型。</li>
 *   <li>{@code blockedPatterns} 为 shell 风格 glob，只匹配文件名，区分大小写；非法 glob 在构造时直接报错。</li>
 *   <li>{@code maxTraversalThreads} 为 0 表示每个目录一个遍历任务（不设上限），大于 0 时改用固定大小的目录遍历线程池。</li>
 * </ul>
 */
public record ScanConfiguration(
        int maxFileSizeMb,
        boolean recursive,
        Set<String> allowedTypes,
        List<String> blockedPatterns,
        int workerCount,
        int queueCapacity,
        int resultQueueCapacity,
        int maxTraversalThreads,
        boolean exportBlockedToJson,
        String exportFileName
) {

    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final String DEFAULT_EXPORT_FILE_NAME = "blocked_files.json";

    public ScanConfiguration {
        if (maxFileSizeMb < 0) {
            throw new IllegalArgumentException("文件大小上限不能为负数：" + maxFileSizeMb);
        }
        workerCount = (workerCount <= 0) ? DEFAULT_WORKER_COUNT : workerCount;
        queueCapacity = (queueCapacity <= 0) ? DEFAULT_QUEUE_CAPACITY : queueCapacity;
        resultQueueCapacity = (resultQueueCapacity <= 0) ? queueCapacity : resultQueueCapacity;
        maxTraversalThreads = Math.max(0, maxTraversalThreads);
        allowedTypes = normalizeTypes(allowedTypes);
        blockedPatterns = (blockedPatterns == null) ? List.of() : List.copyOf(blockedPatterns);
        for (String pattern : blockedPatterns) {
            compileGlob(pattern);
        }
        exportFileName = (exportFileName == null || exportFileName.isBlank()) ? DEFAULT_EXPORT_FILE_NAME : exportFileName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxFileSizeMb(maxFileSizeMb)
                .recursive(recursive)
                .allowedTypes(List.copyOf(allowedTypes))
                .blockedPatterns(blockedPatterns)
                .workerCount(workerCount)
                .queueCapacity(queueCapacity)
                .resultQueueCapacity(resultQueueCapacity)
                .maxTraversalThreads(maxTraversalThreads)
                .exportBlockedToJson(exportBlockedToJson)
                .exportFileName(exportFileName);
    }

    /**
     * 文件大小上限（字节），等于上限的文件不会被阻止。
     */
    public long maxFileSizeBytes() {
        return (long) maxFileSizeMb * 1024 * 1024;
    }

    static PathMatcher compileGlob(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("blockedPatterns 中不能包含空的 glob");
        }
        try {
            return FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("非法的 glob：" + pattern + "（" + e.getDescription() + "）", e);
        }
    }

    private static Set<String> normalizeTypes(Set<String> types) {
        if (types == null || types.isEmpty()) {
            return Set.of();
        }
        Set<String> normalized = new LinkedHashSet<>();
        for (String type : types) {
            if (type == null || type.isBlank()) {
                continue;
            }
            String t = type.trim().toLowerCase(Locale.ROOT);
            normalized.add(t.startsWith(".") ? t : "." + t);
        }
        return Set.copyOf(normalized);
    }

    public static final class Builder {
        private int maxFileSizeMb = 50;
        private boolean recursive = true;
        private final List<String> allowedTypes = new ArrayList<>();
        private final List<String> blockedPatterns = new ArrayList<>();
        private int workerCount = DEFAULT_WORKER_COUNT;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private int resultQueueCapacity;
        private int maxTraversalThreads;
        private boolean exportBlockedToJson;
        private String exportFileName = DEFAULT_EXPORT_FILE_NAME;

        private Builder() {
        }

        public Builder maxFileSizeMb(int maxFileSizeMb) {
            this.maxFileSizeMb = maxFileSizeMb;
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        public Builder allowedTypes(List<String> allowedTypes) {
            this.allowedTypes.clear();
            if (allowedTypes != null) {
                this.allowedTypes.addAll(allowedTypes);
            }
            return this;
        }

        public Builder blockedPatterns(List<String> blockedPatterns) {
            this.blockedPatterns.clear();
            if (blockedPatterns != null) {
                this.blockedPatterns.addAll(blockedPatterns);
            }
            return this;
        }

        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder resultQueueCapacity(int resultQueueCapacity) {
            this.resultQueueCapacity = resultQueueCapacity;
            return this;
        }

        public Builder maxTraversalThreads(int maxTraversalThreads) {
            this.maxTraversalThreads = maxTraversalThreads;
            return this;
        }

        public Builder exportBlockedToJson(boolean exportBlockedToJson) {
            this.exportBlockedToJson = exportBlockedToJson;
            return this;
        }

        public Builder exportFileName(String exportFileName) {
            this.exportFileName = exportFileName;
            return this;
        }

        public ScanConfiguration build() {
            return new ScanConfiguration(
                    maxFileSizeMb,
                    recursive,
                    new LinkedHashSet<>(allowedTypes),
                    blockedPatterns,
                    workerCount,
                    queueCapacity,
                    resultQueueCapacity,
                    maxTraversalThreads,
                    exportBlockedToJson,
                    exportFileName
            );
        }
    }
}
