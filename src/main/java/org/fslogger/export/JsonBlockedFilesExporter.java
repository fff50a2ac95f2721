package org.fslogger.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fslogger.scanner.ScanExporter;
import org.fslogger.scanner.dto.FileRecord;
import org.fslogger.scanner.dto.ScanResult;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把扫描结果中被阻止的条目导出为 JSON 清单。
 * <p>
 * 说明：
 * <ul>
 *   <li>父目录不存在时自动创建。</li>
 *   <li>先写同目录临时文件再 move 到目标路径，避免读者看到写了一半的文件（ATOMIC_MOVE 不支持时降级为普通 move）。</li>
 * </ul>
 */
public class JsonBlockedFilesExporter implements ScanExporter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JsonBlockedFilesExporter() {
        this(defaultObjectMapper(), Clock.systemUTC());
    }

    public JsonBlockedFilesExporter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public BlockedFilesReport buildReport(ScanResult result) {
        List<FileRecord> blocked = new ArrayList<>();
        long blockedSize = 0;
        for (FileRecord file : result.files()) {
            if (file.blocked()) {
                blocked.add(file);
                blockedSize += file.sizeBytes();
            }
        }
        return new BlockedFilesReport(
                clock.instant(),
                result.progress().totalFiles(),
                blocked,
                result.durationMillis(),
                blocked.size(),
                result.progress().totalSize(),
                blockedSize
        );
    }

    @Override
    public void export(ScanResult result, Path outputPath) throws IOException {
        Path target = outputPath.toAbsolutePath().normalize();
        Path parent = target.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("导出路径无效：" + outputPath);
        }
        Files.createDirectories(parent);

        byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(buildReport(result));

        Path tmp = Files.createTempFile(parent, "blocked-", ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
