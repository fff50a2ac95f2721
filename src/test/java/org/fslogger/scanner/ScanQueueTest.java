package org.fslogger.scanner;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanQueueTest {

    @Test
    void take_drainsRemainingItemsAfterClose() throws InterruptedException {
        ScanQueue<String> queue = new ScanQueue<>(4);
        queue.put("a");
        queue.put("b");
        queue.close();

        assertThat(queue.take()).isEqualTo("a");
        assertThat(queue.take()).isEqualTo("b");
        assertThat(queue.take()).isNull();
    }

    @Test
    void put_afterCloseIsRejected() {
        ScanQueue<String> queue = new ScanQueue<>(1);
        queue.close();

        assertThatThrownBy(() -> queue.put("x")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancellablePut_givesUpWhenQueueStaysFull() throws Exception {
        ScanQueue<String> queue = new ScanQueue<>(1);
        queue.put("first");
        AtomicBoolean cancelled = new AtomicBoolean(false);

        CompletableFuture<Boolean> blocked = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.put("second", cancelled::get);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        Thread.sleep(120);
        assertThat(blocked).isNotDone();

        cancelled.set(true);
        assertThat(blocked.get(2, TimeUnit.SECONDS)).isFalse();
        queue.close();
        assertThat(queue.take()).isEqualTo("first");
        assertThat(queue.take()).isNull();
    }

    @Test
    void cancellablePut_succeedsOnceConsumerMakesRoom() throws Exception {
        ScanQueue<String> queue = new ScanQueue<>(1);
        queue.put("first");

        CompletableFuture<Boolean> producer = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.put("second", () -> false);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        assertThat(queue.take()).isEqualTo("first");
        assertThat(producer.get(2, TimeUnit.SECONDS)).isTrue();
        assertThat(queue.take()).isEqualTo("second");
    }
}
