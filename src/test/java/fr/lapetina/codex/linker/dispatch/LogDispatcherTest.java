package fr.lapetina.codex.linker.dispatch;

import fr.lapetina.codex.linker.domain.model.DispatcherState;
import fr.lapetina.codex.linker.domain.model.LogRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.LockSupport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogDispatcherTest {

    private LogDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    private static LogRecord record(int i) {
        return LogRecord.of(Level.INFO, "record-" + i);
    }

    /**
     * Transport recording delivered messages. When a gate is set, the first send
     * signals {@code entered} and blocks until the gate opens.
     */
    static final class RecordingTransport implements LogTransport {
        final List<String> messages = Collections.synchronizedList(new ArrayList<>());
        final List<String> threads = Collections.synchronizedList(new ArrayList<>());
        final CountDownLatch entered = new CountDownLatch(1);
        final AtomicInteger closeCount = new AtomicInteger();
        final AtomicInteger sendsAfterClose = new AtomicInteger();
        private final CountDownLatch gate;

        RecordingTransport(CountDownLatch gate) {
            this.gate = gate;
        }

        RecordingTransport() {
            this(null);
        }

        @Override
        public void send(LogRecord record) throws Exception {
            if (closeCount.get() > 0) {
                sendsAfterClose.incrementAndGet();
            }
            threads.add(Thread.currentThread().getName());
            if (gate != null && entered.getCount() > 0) {
                entered.countDown();
                gate.await();
            }
            messages.add(record.message());
        }

        @Override
        public void close() {
            closeCount.incrementAndGet();
        }
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("should deliver every record in order on graceful close")
        void shouldDrainOnClose() {
            RecordingTransport transport = new RecordingTransport();
            dispatcher = LogDispatcher.builder().transport(transport).capacity(64).build();

            for (int i = 0; i < 20; i++) {
                assertThat(dispatcher.enqueue(record(i))).isTrue();
            }
            dispatcher.close();

            assertThat(transport.messages).hasSize(20);
            assertThat(transport.messages.get(0)).isEqualTo("record-0");
            assertThat(transport.messages.get(19)).isEqualTo("record-19");
            assertThat(dispatcher.getDeliveredCount()).isEqualTo(20);
            assertThat(dispatcher.getDroppedCount()).isZero();
            assertThat(dispatcher.getState()).isEqualTo(DispatcherState.STOPPED);
        }

        @Test
        @DisplayName("should ship on a dedicated worker thread")
        void shouldShipOnWorkerThread() {
            RecordingTransport transport = new RecordingTransport();
            dispatcher = LogDispatcher.builder().transport(transport).threadName("test-shipper").build();

            dispatcher.enqueue(record(0));
            dispatcher.close();

            assertThat(transport.threads).containsExactly("test-shipper");
        }

        @Test
        @DisplayName("should count transport failures and keep going")
        void shouldCountTransportFailures() {
            AtomicInteger calls = new AtomicInteger();
            List<String> delivered = Collections.synchronizedList(new ArrayList<>());
            dispatcher = LogDispatcher.builder()
                    .transport(record -> {
                        if (calls.getAndIncrement() == 0) {
                            throw new IOException("Connection refused");
                        }
                        delivered.add(record.message());
                    })
                    .build();

            dispatcher.enqueue(record(0));
            dispatcher.enqueue(record(1));
            dispatcher.enqueue(record(2));
            dispatcher.close();

            assertThat(dispatcher.getFailedCount()).isEqualTo(1);
            assertThat(dispatcher.getDeliveredCount()).isEqualTo(2);
            assertThat(delivered).containsExactly("record-1", "record-2");
        }

        @Test
        @DisplayName("should deliver on the caller thread in synchronous mode")
        void shouldDeliverSynchronously() {
            RecordingTransport transport = new RecordingTransport();
            dispatcher = LogDispatcher.builder().transport(transport).synchronous(true).build();

            dispatcher.enqueue(record(0));

            // No close needed: delivery already happened
            assertThat(dispatcher.isSynchronous()).isTrue();
            assertThat(transport.messages).containsExactly("record-0");
            assertThat(transport.threads).containsExactly(Thread.currentThread().getName());
        }
    }

    @Nested
    @DisplayName("backpressure")
    class Backpressure {

        @Test
        @DisplayName("should drop the oldest records when the queue is full")
        void shouldDropOldest() throws InterruptedException {
            CountDownLatch gate = new CountDownLatch(1);
            RecordingTransport transport = new RecordingTransport(gate);
            dispatcher = LogDispatcher.builder().transport(transport).capacity(4).build();

            dispatcher.enqueue(record(0));
            assertThat(transport.entered.await(2, TimeUnit.SECONDS)).isTrue();

            // Worker holds record-0; six more records into a queue of four
            for (int i = 1; i <= 6; i++) {
                assertThat(dispatcher.enqueue(record(i))).isTrue();
            }

            assertThat(dispatcher.getDroppedCount()).isEqualTo(2);
            assertThat(dispatcher.getQueueSize()).isEqualTo(4);

            gate.countDown();
            dispatcher.close();

            assertThat(transport.messages)
                    .containsExactly("record-0", "record-3", "record-4", "record-5", "record-6");
        }

        @Test
        @DisplayName("should never block producers on a stalled transport")
        void shouldNotBlockProducers() throws InterruptedException {
            CountDownLatch gate = new CountDownLatch(1);
            RecordingTransport transport = new RecordingTransport(gate);
            dispatcher = LogDispatcher.builder()
                    .transport(transport)
                    .capacity(8)
                    .drainTimeout(Duration.ofMillis(100))
                    .build();

            dispatcher.enqueue(record(0));
            assertThat(transport.entered.await(2, TimeUnit.SECONDS)).isTrue();

            long start = System.nanoTime();
            for (int i = 1; i <= 1000; i++) {
                assertThat(dispatcher.enqueue(record(i))).isTrue();
            }
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsedMs).isLessThan(500);
            assertThat(dispatcher.getQueueSize()).isEqualTo(8);
            assertThat(dispatcher.getDroppedCount()).isEqualTo(1000 - 8);
        }
    }

    @Nested
    @DisplayName("shutdown")
    class Shutdown {

        @Test
        @DisplayName("should bound close by the drain timeout when the transport stalls")
        void shouldBoundDrain() throws InterruptedException {
            CountDownLatch gate = new CountDownLatch(1);
            RecordingTransport transport = new RecordingTransport(gate);
            dispatcher = LogDispatcher.builder()
                    .transport(transport)
                    .capacity(16)
                    .drainTimeout(Duration.ofMillis(200))
                    .build();

            dispatcher.enqueue(record(0));
            assertThat(transport.entered.await(2, TimeUnit.SECONDS)).isTrue();
            for (int i = 1; i <= 4; i++) {
                dispatcher.enqueue(record(i));
            }

            long start = System.nanoTime();
            dispatcher.close();
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsedMs).isLessThan(1_500);
            assertThat(dispatcher.getState()).isEqualTo(DispatcherState.STOPPED);
            assertThat(dispatcher.getDroppedCount()).isEqualTo(4);
            assertThat(dispatcher.getQueueSize()).isZero();
        }

        @Test
        @DisplayName("should reject records enqueued after close")
        void shouldRejectAfterClose() {
            RecordingTransport transport = new RecordingTransport();
            dispatcher = LogDispatcher.builder().transport(transport).build();
            dispatcher.close();

            assertThat(dispatcher.enqueue(record(0))).isFalse();
            assertThat(dispatcher.getRejectedCount()).isEqualTo(1);
            assertThat(transport.messages).isEmpty();
        }

        @Test
        @DisplayName("should reject in synchronous mode after close")
        void shouldRejectSynchronousAfterClose() {
            RecordingTransport transport = new RecordingTransport();
            dispatcher = LogDispatcher.builder().transport(transport).synchronous(true).build();
            dispatcher.close();

            assertThat(dispatcher.enqueue(record(0))).isFalse();
            assertThat(transport.messages).isEmpty();
        }

        @Test
        @DisplayName("should close the transport exactly once")
        void shouldBeIdempotent() {
            RecordingTransport transport = new RecordingTransport();
            dispatcher = LogDispatcher.builder().transport(transport).build();

            dispatcher.enqueue(record(0));
            dispatcher.close();
            dispatcher.close();
            dispatcher.close();

            assertThat(transport.closeCount).hasValue(1);
            assertThat(transport.messages).containsExactly("record-0");
            assertThat(dispatcher.getState()).isEqualTo(DispatcherState.STOPPED);
        }

        @Test
        @DisplayName("should close promptly with an empty queue")
        void shouldCloseIdleDispatcherPromptly() {
            dispatcher = LogDispatcher.builder()
                    .transport(new RecordingTransport())
                    .drainTimeout(Duration.ofSeconds(5))
                    .build();

            long start = System.nanoTime();
            dispatcher.close();

            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1_000);
        }
    }

    @Nested
    @DisplayName("concurrent producers")
    class ConcurrentProducers {

        private static final int PRODUCERS = 4;
        private static final int PER_PRODUCER = 500;

        @Test
        @DisplayName("should account for every record without duplicates or reordering")
        void shouldAccountForEveryRecord() throws InterruptedException {
            List<String> delivered = Collections.synchronizedList(new ArrayList<>());
            LogTransport slowTransport = record -> {
                LockSupport.parkNanos(TimeUnit.MICROSECONDS.toNanos(50));
                delivered.add(record.message());
            };
            dispatcher = LogDispatcher.builder()
                    .transport(slowTransport)
                    .capacity(8)
                    .drainTimeout(Duration.ofSeconds(10))
                    .build();

            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(PRODUCERS);
            AtomicInteger accepted = new AtomicInteger();
            for (int p = 0; p < PRODUCERS; p++) {
                int producer = p;
                Thread thread = new Thread(() -> {
                    try {
                        start.await();
                        for (int i = 0; i < PER_PRODUCER; i++) {
                            if (dispatcher.enqueue(LogRecord.of(Level.INFO, "p" + producer + "-" + i))) {
                                accepted.incrementAndGet();
                            }
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                }, "producer-" + p);
                thread.start();
            }

            start.countDown();
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            dispatcher.close();

            assertThat(accepted).hasValue(PRODUCERS * PER_PRODUCER);
            assertThat(dispatcher.getFailedCount()).isZero();
            assertThat(dispatcher.getDeliveredCount() + dispatcher.getDroppedCount())
                    .isEqualTo(PRODUCERS * PER_PRODUCER);

            List<String> messages = new ArrayList<>(delivered);
            assertThat(messages).hasSize((int) dispatcher.getDeliveredCount());
            assertThat(messages).doesNotHaveDuplicates();

            for (int p = 0; p < PRODUCERS; p++) {
                String prefix = "p" + p + "-";
                List<Integer> sequence = new ArrayList<>();
                for (String message : messages) {
                    if (message.startsWith(prefix)) {
                        sequence.add(Integer.parseInt(message.substring(prefix.length())));
                    }
                }
                assertThat(sequence).isSorted();
            }
        }

        @Test
        @DisplayName("should let an in-flight synchronous send finish before closing the transport")
        void shouldNotCloseTransportUnderSynchronousSend() throws InterruptedException {
            CountDownLatch gate = new CountDownLatch(1);
            RecordingTransport transport = new RecordingTransport(gate);
            dispatcher = LogDispatcher.builder().transport(transport).synchronous(true).build();

            Thread producer = new Thread(() -> dispatcher.enqueue(record(0)), "sync-producer");
            producer.start();
            assertThat(transport.entered.await(2, TimeUnit.SECONDS)).isTrue();

            Thread closer = new Thread(dispatcher::close, "closer");
            closer.start();
            closer.join(200);

            // Send still blocked: the transport must stay open
            assertThat(transport.closeCount).hasValue(0);

            gate.countDown();
            producer.join(2_000);
            closer.join(2_000);

            assertThat(closer.isAlive()).isFalse();
            assertThat(transport.messages).containsExactly("record-0");
            assertThat(transport.sendsAfterClose).hasValue(0);
            assertThat(transport.closeCount).hasValue(1);
            assertThat(dispatcher.enqueue(record(1))).isFalse();
        }
    }

    @Nested
    @DisplayName("builder")
    class BuilderValidation {

        @Test
        @DisplayName("should reject a capacity below one")
        void shouldRejectZeroCapacity() {
            assertThatThrownBy(() -> LogDispatcher.builder().capacity(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should require a transport")
        void shouldRequireTransport() {
            assertThatThrownBy(() -> LogDispatcher.builder().build())
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("LogTransport");
        }

        @Test
        @DisplayName("should default to a queue of 256 records")
        void shouldDefaultCapacity() {
            dispatcher = LogDispatcher.builder().transport(new RecordingTransport()).build();

            assertThat(dispatcher.getCapacity()).isEqualTo(256);
            assertThat(dispatcher.getState()).isEqualTo(DispatcherState.RUNNING);
        }
    }
}
