package org.fslogger.scanner.dto;

import java.time.Instant;

/**
 * 一次扫描中观察到的单个文件系统条目（文件或目录）及其分类结果。
 * <p>
 * 由工作线程或目录遍历任务创建，之后不可变；经结果队列交给结果收集器，最终归 {@link ScanResult} 所有。
 *
 * @param path         绝对路径
 * @param name         文件名/目录名（不含路径）
 * @param sizeBytes    文件大小（目录为 0）
 * @param mimeType     按内容前 512 字节嗅探出的 MIME 类型（目录或读取失败时为 null）
 * @param fileType     文件类型标签：有扩展名时为去掉点的扩展名，否则为 MIME 主类型
 * @param extension    小写扩展名（含前导点，没有扩展名时为空字符串）
 * @param modifiedAt   最后修改时间（读取失败时为 null）
 * @param directory    是否为目录
 * @param blocked      是否被阻止
 * @param blockReason  阻止原因（仅 blocked=true 时存在）
 * @param accessError  读取元数据/内容失败时的错误信息
 */
public record FileRecord(
        String path,
        String name,
        long sizeBytes,
        String mimeType,
        String fileType,
        String extension,
        Instant modifiedAt,
        boolean directory,
        boolean blocked,
        String blockReason,
        String accessError
) {

    public static FileRecord directory(String path, String name, Instant modifiedAt) {
        return new FileRecord(path, name, 0L, null, null, "", modifiedAt, true, false, null, null);
    }

    /**
     * 无法读取的目录：按策略标记为阻止。
     */
    public static FileRecord unreadableDirectory(String path, String name, String reason, String accessError) {
        return new FileRecord(path, name, 0L, null, null, "", null, true, true, reason, accessError);
    }

    /**
     * 管道、套接字、设备等特殊文件：不读取内容，直接标记为阻止。
     */
    public static FileRecord specialFile(String path, String name, String extension, Instant modifiedAt, String reason) {
        return new FileRecord(path, name, 0L, null, null, extension, modifiedAt, false, true, reason, null);
    }

    public FileRecord withBlock(String reason) {
        return new FileRecord(path, name, sizeBytes, mimeType, fileType, extension, modifiedAt, directory,
                reason != null, reason, accessError);
    }
}
