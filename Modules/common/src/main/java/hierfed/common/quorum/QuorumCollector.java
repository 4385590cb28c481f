package hierfed.common.quorum;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Bounded-wait collection of one value per sender. The first value from a sender wins;
 * waiters wake when a condition over the collected values holds or when the deadline passes,
 * whichever comes first. Once closed, further offers are refused.
 */
public final class QuorumCollector<V> {
    public enum Offer { ACCEPTED, DUPLICATE, CLOSED }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Map<String, V> values = new LinkedHashMap<>();
    private boolean closed = false;

    public Offer offer(String senderId, V value) {
        lock.lock();
        try {
            if (closed) return Offer.CLOSED;
            if (values.containsKey(senderId)) return Offer.DUPLICATE;
            values.put(senderId, value);
            changed.signalAll();
            return Offer.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    /** Waits until {@code required} values arrived or {@code deadlineNanos} (System.nanoTime based) passes. */
    public Map<String, V> awaitCount(int required, long deadlineNanos) throws InterruptedException {
        return await(m -> m.size() >= required, deadlineNanos);
    }

    /**
     * Waits until {@code done} holds over the collected values or the deadline passes, then returns
     * a snapshot of what was collected.
     */
    public Map<String, V> await(Predicate<Map<String, V>> done, long deadlineNanos) throws InterruptedException {
        lock.lock();
        try {
            while (!closed && !done.test(Collections.unmodifiableMap(values))) {
                long remaining = deadlineNanos - System.nanoTime();
                if (remaining <= 0L) break;
                changed.awaitNanos(remaining);
            }
            return Map.copyOf(values);
        } finally {
            lock.unlock();
        }
    }

    /** Refuses further offers and releases waiters. Returns the final snapshot. */
    public Map<String, V> close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
            return Map.copyOf(values);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return values.size();
        } finally {
            lock.unlock();
        }
    }

    public static long deadlineAfter(long millis) {
        return System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis);
    }
}
