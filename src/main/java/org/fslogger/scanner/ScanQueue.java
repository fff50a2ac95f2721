package org.fslogger.scanner;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 可关闭的有界队列（工作队列与结果队列共用）。
 * <p>
 * 说明：
 * <ul>
 *   <li>队列满时 {@code put} 阻塞生产者，这是遍历速度与处理速度之间唯一的背压手段。</li>
 *   <li>{@link #close()} 只能在所有生产者都结束之后调用；之后消费者把剩余元素取完即收到 {@code null}（结束信号）。</li>
 *   <li>消费者以短超时轮询，既能及时发现关闭，也能及时响应取消。</li>
 * </ul>
 */
final class ScanQueue<T> {

    private static final long POLL_INTERVAL_MILLIS = 50;

    private final BlockingQueue<T> queue;
    private volatile boolean closed;

    ScanQueue(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    void put(T item) throws InterruptedException {
        ensureOpen();
        queue.put(item);
    }

    /**
     * 可取消的入队：队列满时等待，期间扫描被取消则放弃入队并返回 false。
     */
    boolean put(T item, BooleanSupplier cancelled) throws InterruptedException {
        ensureOpen();
        while (!queue.offer(item, POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
            if (cancelled.getAsBoolean()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 取出一个元素；队列已关闭且为空时返回 null。
     */
    T take() throws InterruptedException {
        while (true) {
            T item = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            if (item != null) {
                return item;
            }
            if (closed && queue.isEmpty()) {
                return null;
            }
        }
    }

    void close() {
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("队列已关闭，不能再写入");
        }
    }
}
