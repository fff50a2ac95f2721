package org.fslogger.scanner;

import org.fslogger.scanner.dto.ScanResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 扫描完成后的导出协作方。
 * <p>
 * 导出失败不会让扫描失败：扫描器会把失败原因追加到错误列表。
 */
@FunctionalInterface
public interface ScanExporter {

    /**
     * @param result     最终扫描结果
     * @param outputPath 导出文件路径（父目录不存在时由实现负责创建）
     */
    void export(ScanResult result, Path outputPath) throws IOException;
}
