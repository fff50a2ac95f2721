package org.fslogger.scanner;

import java.nio.file.FileSystemException;
import java.nio.file.Path;

/**
 * 路径/IO 异常相关的小工具。
 */
final class IoErrors {

    private IoErrors() {
    }

    /**
     * 把异常转换成适合写入错误列表的简短原因（路径由调用方单独拼接）。
     */
    static String describe(Exception e) {
        // FileSystemException 的 getMessage() 会重复带上路径，这里只取原因
        if (e instanceof FileSystemException fse) {
            String reason = fse.getReason();
            return (reason != null && !reason.isBlank()) ? reason : e.getClass().getSimpleName();
        }
        String message = e.getMessage();
        return (message != null && !message.isBlank()) ? message : e.getClass().getSimpleName();
    }

    static String fileName(Path path) {
        Path name = path.getFileName();
        return (name != null) ? name.toString() : path.toString();
    }
}
