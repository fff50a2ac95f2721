package org.fslogger.scanner;

/**
 * 扫描生命周期状态。
 * <p>
 * IDLE -> VALIDATING -> RUNNING -> DRAINING -> COMPLETED；根路径校验失败（或等待过程被中断）时进入 FAILED。
 */
public enum ScanState {
    IDLE,
    VALIDATING,
    RUNNING,
    DRAINING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
