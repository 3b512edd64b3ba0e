package work.rescuekit.exec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO queue with an outstanding-work counter.
 *
 * <p>Every {@link #put} increments the counter and every {@link #taskDone} decrements it, so
 * {@link #awaitDrained} returns only once each item ever enqueued has been both taken and acknowledged.</p>
 */
final class WorkQueue<E> {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition drained = lock.newCondition();
    private final Deque<E> items = new ArrayDeque<>();
    private int outstanding;

    void put(E item) {
        lock.lock();
        try {
            items.addLast(item);
            outstanding++;
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until an item is available.
     */
    E take() throws InterruptedException {
        lock.lock();
        try {
            while (items.isEmpty()) {
                notEmpty.await();
            }
            return items.removeFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Acknowledges one previously taken item.
     *
     * @throws IllegalStateException when called more often than items were put
     */
    void taskDone() {
        lock.lock();
        try {
            if (outstanding <= 0) {
                throw new IllegalStateException("taskDone() called more times than there were items");
            }
            outstanding--;
            if (outstanding == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    void awaitDrained() throws InterruptedException {
        lock.lock();
        try {
            while (outstanding > 0) {
                drained.await();
            }
        } finally {
            lock.unlock();
        }
    }

    int outstanding() {
        lock.lock();
        try {
            return outstanding;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }
}
