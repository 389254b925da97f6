package xyz.vvrf.reactor.pipeline.core;

import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import xyz.vvrf.reactor.pipeline.test.util.TestFrame;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageQueueTest {

    private static Buffer buffer(String text) {
        return new Buffer(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String text(Message message) {
        return new String(((Buffer) message).getData(), StandardCharsets.UTF_8);
    }

    @Test
    void defaults_shouldBeSixteenAndBlocking() {
        MessageQueue queue = new MessageQueue();

        assertThat(queue.getMaxSize()).isEqualTo(16);
        assertThat(queue.isBlocking()).isTrue();
        assertThat(queue.isEmpty()).isTrue();
        assertThat(queue.isClosed()).isFalse();
    }

    @Test
    void constructor_shouldRejectSizeBelowOne() {
        assertThatThrownBy(() -> new MessageQueue(0, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void send_shouldKeepFifoOrder() {
        MessageQueue queue = new MessageQueue(4, true);
        queue.send(buffer("a"));
        queue.send(buffer("b"));
        queue.send(buffer("c"));

        assertThat(queue.size()).isEqualTo(3);
        assertThat(text(queue.tryGet().get())).isEqualTo("a");
        assertThat(text(queue.tryGet().get())).isEqualTo("b");
        assertThat(text(queue.tryGet().get())).isEqualTo("c");
        assertThat(queue.tryGet()).isEmpty();
    }

    @Test
    void overwritingQueue_shouldDropOldestWhenFull() {
        MessageQueue queue = new MessageQueue(2, false);
        queue.send(buffer("a"));
        queue.send(buffer("b"));
        queue.send(buffer("c"));

        List<String> contents = new ArrayList<>();
        for (Message message : queue.tryGetAll()) {
            contents.add(text(message));
        }
        assertThat(contents).containsExactly("b", "c");
    }

    @Test
    void overwritingQueue_trySendShouldAlwaysSucceed() {
        MessageQueue queue = new MessageQueue(1, false);

        assertThat(queue.trySend(buffer("a"))).isTrue();
        assertThat(queue.trySend(buffer("b"))).isTrue();
        assertThat(text(queue.tryGet().get())).isEqualTo("b");
    }

    @Test
    void blockingQueue_trySendShouldFailWhenFull() {
        MessageQueue queue = new MessageQueue(1, true);

        assertThat(queue.trySend(buffer("a"))).isTrue();
        assertThat(queue.trySend(buffer("b"))).isFalse();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(text(queue.front().get())).isEqualTo("a");
    }

    @Test
    void blockingQueue_sendWithTimeoutShouldGiveUp() {
        MessageQueue queue = new MessageQueue(1, true);
        queue.send(buffer("a"));

        long begin = System.nanoTime();
        boolean accepted = queue.send(buffer("b"), Duration.ofMillis(50));

        assertThat(accepted).isFalse();
        assertThat(System.nanoTime() - begin).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(40));
    }

    @Test
    void blockingQueue_producerShouldWaitUntilConsumerTakes() throws Exception {
        MessageQueue queue = new MessageQueue(1, true);
        queue.send(buffer("first"));
        CountDownLatch producerStarted = new CountDownLatch(1);

        CompletableFuture<Boolean> producer = CompletableFuture.supplyAsync(() -> {
            producerStarted.countDown();
            return queue.send(buffer("second"));
        });
        assertThat(producerStarted.await(1, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(50);
        assertThat(producer).isNotDone();

        assertThat(text(queue.get().get())).isEqualTo("first");
        assertThat(producer.get(1, TimeUnit.SECONDS)).isTrue();
        assertThat(text(queue.get().get())).isEqualTo("second");
    }

    @Test
    void get_shouldWaitForProducer() throws Exception {
        MessageQueue queue = new MessageQueue();
        CompletableFuture<Optional<Message>> consumer = CompletableFuture.supplyAsync(queue::get);
        Thread.sleep(50);
        assertThat(consumer).isNotDone();

        queue.send(buffer("late"));

        assertThat(consumer.get(1, TimeUnit.SECONDS)).map(MessageQueueTest::text).contains("late");
    }

    @Test
    void getWithTimeout_shouldReturnEmptyWhenNothingArrives() {
        MessageQueue queue = new MessageQueue();

        assertThat(queue.get(Duration.ofMillis(20))).isEmpty();
        assertThat(queue.getAll(Duration.ofMillis(20))).isEmpty();
    }

    @Test
    void close_shouldWakeBlockedConsumer() throws Exception {
        MessageQueue queue = new MessageQueue();
        CompletableFuture<Optional<Message>> consumer = CompletableFuture.supplyAsync(queue::get);
        Thread.sleep(50);

        queue.close();

        assertThat(consumer.get(1, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    void close_shouldWakeBlockedProducerWithException() throws Exception {
        MessageQueue queue = new MessageQueue(1, true);
        queue.send(buffer("a"));
        CompletableFuture<Boolean> producer = CompletableFuture.supplyAsync(() -> queue.send(buffer("b")));
        Thread.sleep(50);

        queue.close();

        assertThatThrownBy(() -> producer.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(MessageQueueClosedException.class);
    }

    @Test
    void closedQueue_shouldRejectSendButStillDrain() {
        MessageQueue queue = new MessageQueue();
        queue.send(buffer("a"));
        queue.close();
        queue.close();

        assertThatThrownBy(() -> queue.send(buffer("b"))).isInstanceOf(MessageQueueClosedException.class);
        assertThat(queue.get()).map(MessageQueueTest::text).contains("a");
        assertThat(queue.get()).isEmpty();
    }

    @Test
    void interruptedGet_shouldReturnEmptyAndRestoreFlag() {
        MessageQueue queue = new MessageQueue();
        Thread.currentThread().interrupt();
        try {
            assertThat(queue.get()).isEmpty();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void typedGet_shouldConsumeMismatchingFrontMessage() {
        MessageQueue queue = new MessageQueue();
        queue.send(buffer("plain"));
        queue.send(new TestFrame("frame"));

        assertThat(queue.has(TestFrame.class)).isFalse();
        assertThat(queue.front(TestFrame.class)).isEmpty();
        assertThat(queue.tryGet(TestFrame.class)).isEmpty();
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.tryGet(TestFrame.class)).map(TestFrame::getLabel).contains("frame");
    }

    @Test
    void typedGetAll_shouldSkipMismatchingMessages() {
        MessageQueue queue = new MessageQueue();
        queue.send(new TestFrame("one"));
        queue.send(buffer("plain"));
        queue.send(new TestFrame("two"));

        List<TestFrame> frames = queue.getAll(TestFrame.class);

        assertThat(frames).extracting(TestFrame::getLabel).containsExactly("one", "two");
        assertThat(queue.isEmpty()).isTrue();
    }

    @Test
    void lastRelease_shouldCloseQueue() {
        MessageQueue queue = new MessageQueue();
        assertThat(queue.retain()).isTrue();
        assertThat(queue.retain()).isTrue();

        queue.release();
        assertThat(queue.isClosed()).isFalse();
        queue.release();

        assertThat(queue.getReferenceCount()).isZero();
        assertThat(queue.isClosed()).isTrue();
        assertThat(queue.retain()).isFalse();
    }

    @Test
    void shrinkingOverwritingQueue_shouldDropOldest() {
        MessageQueue queue = new MessageQueue(4, false);
        queue.send(buffer("a"));
        queue.send(buffer("b"));
        queue.send(buffer("c"));

        queue.setMaxSize(1);

        assertThat(queue.size()).isEqualTo(1);
        assertThat(text(queue.tryGet().get())).isEqualTo("c");
    }

    @Test
    void switchingToOverwrite_shouldReleaseBlockedProducer() throws Exception {
        MessageQueue queue = new MessageQueue(1, true);
        queue.send(buffer("a"));
        CompletableFuture<Boolean> producer = CompletableFuture.supplyAsync(() -> queue.send(buffer("b")));
        Thread.sleep(50);
        assertThat(producer).isNotDone();

        queue.setBlocking(false);

        assertThat(producer.get(1, TimeUnit.SECONDS)).isTrue();
        assertThat(text(queue.tryGet().get())).isEqualTo("b");
    }

    @Test
    void callbacks_shouldRunAfterInsertAndBeIsolated() {
        MessageQueue queue = new MessageQueue();
        List<Message> seen = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger failures = new AtomicInteger();
        queue.addCallback(message -> {
            failures.incrementAndGet();
            throw new IllegalStateException("callback failure");
        });
        Disposable registration = queue.addCallback(seen::add);

        queue.send(buffer("a"));
        registration.dispose();
        queue.send(buffer("b"));

        assertThat(seen).hasSize(1);
        assertThat(failures.get()).isEqualTo(2);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    void release_shouldNotCloseQueueRetainedConcurrently() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 2000; round++) {
                MessageQueue queue = new MessageQueue();
                queue.retain();
                CountDownLatch gate = new CountDownLatch(1);
                Future<?> releaser = executor.submit(() -> {
                    gate.await();
                    queue.release();
                    return null;
                });
                Future<Boolean> retainer = executor.submit(() -> {
                    gate.await();
                    return queue.retain();
                });
                gate.countDown();
                releaser.get(5, TimeUnit.SECONDS);

                if (retainer.get(5, TimeUnit.SECONDS)) {
                    assertThat(queue.isClosed()).isFalse();
                    assertThat(queue.getReferenceCount()).isEqualTo(1);
                } else {
                    assertThat(queue.isClosed()).isTrue();
                    assertThat(queue.getReferenceCount()).isZero();
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
