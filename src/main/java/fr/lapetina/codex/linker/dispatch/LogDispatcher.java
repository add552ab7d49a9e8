package fr.lapetina.codex.linker.dispatch;

import fr.lapetina.codex.linker.domain.model.DispatcherState;
import fr.lapetina.codex.linker.domain.model.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asynchronous, best-effort sink shipping log records to a {@link LogTransport}.
 *
 * BOUNDED QUEUE, DROP-OLDEST:
 *
 * Producers never block on the transport. {@link #enqueue} appends to a fixed-capacity
 * FIFO under a short critical section; when the queue is full the oldest record is
 * evicted and counted before the new one is appended, in the same lock acquisition.
 * Under sustained overload the newest information always survives and the surviving
 * records keep their relative order.
 *
 * SINGLE WORKER:
 *
 * One daemon thread waits on the queue condition, takes one record at a time and
 * forwards it. Transport errors discard the record and are counted; nothing is retried.
 *
 * SHUTDOWN: RUNNING → DRAINING → STOPPED
 *
 * {@link #close()} stops accepting records (later enqueues return {@code false} and are
 * counted as rejected), lets the worker empty the queue for at most the drain timeout,
 * then discards whatever is left (counted as dropped), interrupts a worker stuck in the
 * transport and closes the transport exactly once.
 *
 * SYNCHRONOUS MODE:
 *
 * When built with {@code synchronous(true)} no worker is started and {@link #enqueue}
 * forwards on the caller's thread, one record at a time. {@link #close()} waits for an
 * in-flight send before closing the transport. Intended for deterministic tests.
 */
public final class LogDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LogDispatcher.class);

    private final LogTransport transport;
    private final int capacity;
    private final Duration drainTimeout;
    private final boolean synchronous;

    // Guarded by lock
    private final ArrayDeque<LogRecord> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile DispatcherState state = DispatcherState.RUNNING;

    // Updated under lock alongside the queue mutation that causes it
    private final AtomicLong dropped = new AtomicLong();

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicBoolean transportClosed = new AtomicBoolean(false);

    private final Thread worker;

    private LogDispatcher(Builder builder) {
        this.transport = builder.transport;
        this.capacity = builder.capacity;
        this.drainTimeout = builder.drainTimeout;
        this.synchronous = builder.synchronous;
        this.queue = new ArrayDeque<>(capacity);
        this.worker = synchronous ? null : new Thread(this::drainLoop, builder.threadName);

        log.debug("LogDispatcher created: capacity={}, drainTimeoutMs={}, synchronous={}",
                capacity, drainTimeout.toMillis(), synchronous);
    }

    private void startWorker() {
        if (worker != null) {
            worker.setDaemon(true);
            worker.start();
        }
    }

    /**
     * Offers a record for delivery without blocking on the transport.
     *
     * @param record Record to ship
     * @return {@code true} if the record was queued (or, in synchronous mode, handed to
     * the transport); {@code false} once shutdown has started
     */
    public boolean enqueue(LogRecord record) {
        Objects.requireNonNull(record, "Record is required");

        if (synchronous) {
            return deliverSynchronously(record);
        }

        lock.lock();
        try {
            if (state != DispatcherState.RUNNING) {
                rejected.incrementAndGet();
                return false;
            }
            if (queue.size() >= capacity) {
                queue.pollFirst();
                dropped.incrementAndGet();
            }
            queue.addLast(record);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    // Holding the lock across the send keeps close() from closing the transport mid-delivery
    private boolean deliverSynchronously(LogRecord record) {
        lock.lock();
        try {
            if (state != DispatcherState.RUNNING) {
                rejected.incrementAndGet();
                return false;
            }
            deliver(record);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void drainLoop() {
        log.debug("Log dispatcher worker started");
        while (true) {
            LogRecord record;
            lock.lock();
            try {
                while (queue.isEmpty() && state == DispatcherState.RUNNING) {
                    notEmpty.await();
                }
                if (state == DispatcherState.STOPPED || queue.isEmpty()) {
                    break;
                }
                record = queue.pollFirst();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                lock.unlock();
            }
            deliver(record);
        }
        log.debug("Log dispatcher worker exited: delivered={}, failed={}", delivered.get(), failed.get());
    }

    private void deliver(LogRecord record) {
        try {
            transport.send(record);
            delivered.incrementAndGet();
        } catch (InterruptedException e) {
            failed.incrementAndGet();
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            failed.incrementAndGet();
            log.debug("Log delivery failed, record discarded: error={}", e.getMessage());
        }
    }

    /**
     * Drains and stops the dispatcher. Safe to call more than once; only the first call
     * waits, for at most the drain timeout.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (state != DispatcherState.RUNNING) {
                return;
            }
            state = DispatcherState.DRAINING;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }

        log.debug("Draining log dispatcher: pending={}, drainTimeoutMs={}", getQueueSize(), drainTimeout.toMillis());

        if (worker != null) {
            try {
                worker.join(Math.max(1, drainTimeout.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        int discarded;
        lock.lock();
        try {
            state = DispatcherState.STOPPED;
            discarded = queue.size();
            queue.clear();
            dropped.addAndGet(discarded);
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }

        if (worker != null && worker.isAlive()) {
            // Stuck inside the transport; unblock it if the transport honors interrupts
            worker.interrupt();
        }

        closeTransport();

        if (discarded > 0) {
            log.warn("Log dispatcher drain timed out, discarded {} records", discarded);
        }
        log.debug("Log dispatcher stopped: delivered={}, dropped={}, failed={}, rejected={}",
                delivered.get(), dropped.get(), failed.get(), rejected.get());
    }

    private void closeTransport() {
        if (transportClosed.compareAndSet(false, true)) {
            try {
                transport.close();
            } catch (Exception e) {
                log.debug("Error closing log transport: error={}", e.getMessage());
            }
        }
    }

    public DispatcherState getState() {
        return state;
    }

    public boolean isSynchronous() {
        return synchronous;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getQueueSize() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records evicted under backpressure plus records discarded at drain timeout.
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    public long getDeliveredCount() {
        return delivered.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    public long getRejectedCount() {
        return rejected.get();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for LogDispatcher.
     */
    public static final class Builder {
        private LogTransport transport;
        private int capacity = 256;
        private Duration drainTimeout = Duration.ofSeconds(2);
        private boolean synchronous = false;
        private String threadName = "log-dispatcher";

        public Builder transport(LogTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder capacity(int capacity) {
            if (capacity < 1) {
                throw new IllegalArgumentException("Queue capacity must be at least 1");
            }
            this.capacity = capacity;
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            if (drainTimeout == null || drainTimeout.isNegative()) {
                throw new IllegalArgumentException("Drain timeout must be zero or positive");
            }
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder synchronous(boolean synchronous) {
            this.synchronous = synchronous;
            return this;
        }

        public Builder threadName(String threadName) {
            this.threadName = threadName;
            return this;
        }

        /**
         * Builds the dispatcher and, unless synchronous, starts its worker.
         */
        public LogDispatcher build() {
            if (transport == null) {
                throw new IllegalStateException("LogTransport is required");
            }
            LogDispatcher dispatcher = new LogDispatcher(this);
            dispatcher.startWorker();
            return dispatcher;
        }
    }
}
