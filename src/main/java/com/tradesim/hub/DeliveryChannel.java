package com.tradesim.hub;

import com.tradesim.domain.model.MarketEvent;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded single-consumer buffer between the hub and one subscriber.
 *
 * <p>{@link #offer(MarketEvent)} never blocks: when the buffer is full the oldest buffered event
 * is evicted and counted, so a slow subscriber loses its own history and never stalls the
 * adapter or its siblings. After {@link #close()} the consumer drains what is left and then
 * sees {@link #isExhausted()}.
 */
public class DeliveryChannel {

    private final int capacity;
    private final ArrayDeque<MarketEvent> buffer;
    private final Runnable onDrop;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();

    private volatile boolean closed;

    public DeliveryChannel(int capacity) {
        this(capacity, () -> {});
    }

    /** @param onDrop invoked once per evicted event, outside of any caller-visible state */
    public DeliveryChannel(int capacity, Runnable onDrop) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Channel capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new ArrayDeque<>(capacity);
        this.onDrop = onDrop;
    }

    /**
     * Enqueues an event, evicting the oldest one if the buffer is full.
     *
     * @return false if the channel is closed and the event was discarded
     */
    public boolean offer(MarketEvent event) {
        boolean evicted = false;
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            if (buffer.size() == capacity) {
                buffer.pollFirst();
                evicted = true;
            }
            buffer.addLast(event);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
        if (evicted) {
            dropped.incrementAndGet();
            onDrop.run();
        }
        return true;
    }

    /**
     * Takes the next event, waiting up to {@code timeout}.
     *
     * @return the event, or null on timeout or when the channel is closed and empty
     */
    public MarketEvent poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (buffer.isEmpty()) {
                if (closed || nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            delivered.incrementAndGet();
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /** Non-blocking variant of {@link #poll(Duration)}. */
    public MarketEvent pollNow() {
        lock.lock();
        try {
            MarketEvent event = buffer.pollFirst();
            if (event != null) {
                delivered.incrementAndGet();
            }
            return event;
        } finally {
            lock.unlock();
        }
    }

    /** Stops accepting events and wakes a waiting consumer. Buffered events stay drainable. */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /** True once the channel is closed and everything buffered has been taken. */
    public boolean isExhausted() {
        lock.lock();
        try {
            return closed && buffer.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long deliveredCount() {
        return delivered.get();
    }
}
