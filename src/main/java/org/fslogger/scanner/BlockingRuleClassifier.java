package org.fslogger.scanner;

import org.fslogger.scanner.dto.FileRecord;

import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 文件阻止规则分类器（无共享可变状态，可被多个工作线程同时调用）。
 * <p>
 * 规则按以下顺序求值，第一个命中的规则决定阻止原因：
 * <ol>
 *   <li>大小规则：{@code size > maxFileSizeMb * 1024 * 1024}（等于上限不阻止）。</li>
 *   <li>类型白名单：白名单非空且扩展名（忽略大小写）不在其中。</li>
 *   <li>文件名 glob：文件名匹配任一 glob（区分大小写），原因中给出第一个命中的 glob。</li>
 *   <li>访问规则：元数据或内容读取失败的文件无法安全分类，按策略阻止。</li>
 * </ol>
 * 是否阻止与阻止原因都来自同一次有序求值 {@link #firstViolation(FileRecord)}，两者不会不一致。
 */
public class BlockingRuleClassifier {

    public static final String REASON_SIZE = "File size exceeds limit";
    public static final String REASON_TYPE = "File type not allowed";
    public static final String REASON_PATTERN_PREFIX = "File matches blocked pattern: ";
    public static final String REASON_ACCESS = "File could not be read";
    public static final String REASON_UNKNOWN = "Unknown reason";
    public static final String REASON_NOT_REGULAR = "Not a regular file";

    private final ScanConfiguration config;
    private final List<NamedMatcher> patterns;

    public BlockingRuleClassifier(ScanConfiguration config) {
        this.config = config;
        List<NamedMatcher> compiled = new ArrayList<>(config.blockedPatterns().size());
        for (String pattern : config.blockedPatterns()) {
            compiled.add(new NamedMatcher(pattern, ScanConfiguration.compileGlob(pattern)));
        }
        this.patterns = List.copyOf(compiled);
    }

    /**
     * 对记录分类，返回带有 blocked/blockReason 的新记录。
     */
    public FileRecord classify(FileRecord record) {
        return record.withBlock(firstViolation(record).orElse(null));
    }

    public boolean isBlocked(FileRecord record) {
        return firstViolation(record).isPresent();
    }

    public String blockReason(FileRecord record) {
        return firstViolation(record).orElse(REASON_UNKNOWN);
    }

    public boolean isFileSizeAllowed(long sizeBytes) {
        return sizeBytes <= config.maxFileSizeBytes();
    }

    Optional<String> firstViolation(FileRecord record) {
        if (!isFileSizeAllowed(record.sizeBytes())) {
            return Optional.of(REASON_SIZE);
        }
        if (!isTypeAllowed(record.extension())) {
            return Optional.of(REASON_TYPE);
        }
        String name = record.name();
        if (name != null && !name.isEmpty()) {
            Path namePath = Path.of(name);
            for (NamedMatcher p : patterns) {
                if (p.matcher().matches(namePath)) {
                    return Optional.of(REASON_PATTERN_PREFIX + p.pattern());
                }
            }
        }
        if (record.accessError() != null) {
            return Optional.of(REASON_ACCESS);
        }
        return Optional.empty();
    }

    private boolean isTypeAllowed(String extension) {
        if (config.allowedTypes().isEmpty()) {
            return true;
        }
        String ext = (extension == null) ? "" : extension.toLowerCase(Locale.ROOT);
        return config.allowedTypes().contains(ext);
    }

    private record NamedMatcher(String pattern, PathMatcher matcher) {
    }
}
