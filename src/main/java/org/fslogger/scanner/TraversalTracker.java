package org.fslogger.scanner;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 统计仍在进行中的目录遍历任务数（计数型 wait-group）。
 * <p>
 * 根任务登记 1 次，每派生一个子目录任务在提交前登记 1 次，每个任务结束时到达 1 次；
 * 子任务总是在父任务到达之前登记，所以计数只会在全部任务结束时归零一次。
 */
final class TraversalTracker {

    private final AtomicLong pending = new AtomicLong();
    private final CountDownLatch finished = new CountDownLatch(1);

    void register() {
        if (finished.getCount() == 0) {
            throw new IllegalStateException("遍历已经结束，不能再登记新任务");
        }
        pending.incrementAndGet();
    }

    void arrive() {
        long left = pending.decrementAndGet();
        if (left == 0) {
            finished.countDown();
        } else if (left < 0) {
            throw new IllegalStateException("遍历任务计数出现负数");
        }
    }

    void await() throws InterruptedException {
        finished.await();
    }
}
