package org.fslogger.scanner;

import java.nio.file.Path;

/**
 * 待工作线程处理的路径。当前只有文件会入队，目录由遍历任务直接处理。
 */
record WorkItem(Path path, boolean directory) {

    static WorkItem file(Path path) {
        return new WorkItem(path, false);
    }
}
