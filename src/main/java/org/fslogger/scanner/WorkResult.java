package org.fslogger.scanner;

import org.fslogger.scanner.dto.FileRecord;

/**
 * 结果队列中的一项：一条记录、一条错误，或两者兼有（读取失败但仍然产出了带 accessError 的记录）。
 */
record WorkResult(FileRecord record, String error) {

    static WorkResult of(FileRecord record) {
        return new WorkResult(record, null);
    }

    static WorkResult failed(FileRecord record, String error) {
        return new WorkResult(record, error);
    }

    static WorkResult error(String error) {
        return new WorkResult(null, error);
    }
}
