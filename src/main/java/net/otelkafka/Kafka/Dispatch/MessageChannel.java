package net.otelkafka.Kafka.Dispatch;

import org.springframework.lang.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbuffered, closable channel between one producing thread and its consumers.
 *
 * <p>
 * {@link #send} returns only after a receiver has taken the element, so a sender is never more than
 * one element ahead of its consumer. {@link #close()} wakes a blocked sender, which withdraws its
 * element and fails unless a receiver took it first. Once closed and drained, {@link #receive()}
 * returns {@code null}.
 * </p>
 *
 * <pre>
 * for (ConsumerRecord&lt;String, String&gt; record : channel) {
 *     // blocks until the next record arrives, ends when the channel is closed
 * }
 * </pre>
 */
public class MessageChannel<T> implements Iterable<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    // guarded by lock
    private T pending;
    private long sent;
    private long received;
    private boolean closed;

    /**
     * Hands {@code element} to a receiver, blocking until it has been taken.
     *
     * @throws IllegalStateException if the channel is closed before the element was taken; the element is withdrawn
     * @throws InterruptedException  if interrupted before the element was taken; the element is withdrawn
     */
    public void send(T element) throws InterruptedException {
        Objects.requireNonNull(element, "element");
        lock.lockInterruptibly();
        try {
            while (pending != null && !closed) {
                changed.await();
            }
            if (closed) {
                throw new IllegalStateException("send on closed channel");
            }
            pending = element;
            long ticket = ++sent;
            changed.signalAll();

            while (received < ticket) {
                if (closed) {
                    withdraw();
                    throw new IllegalStateException("channel closed before element was received");
                }
                try {
                    changed.await();
                } catch (InterruptedException e) {
                    if (received < ticket) {
                        withdraw();
                        throw e;
                    }
                    // already taken, keep the interrupt for the caller
                    Thread.currentThread().interrupt();
                }
            }
        } finally {
            lock.unlock();
        }
    }

    // lock held, own element still pending
    private void withdraw() {
        pending = null;
        sent--;
        changed.signalAll();
    }

    /**
     * Takes the next element, blocking until one is sent or the channel is closed.
     *
     * @return the element, or {@code null} once the channel is closed and drained
     */
    @Nullable
    public T receive() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (pending == null && !closed) {
                changed.await();
            }
            if (pending == null) {
                return null;
            }
            T element = pending;
            pending = null;
            received++;
            changed.signalAll();
            return element;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the channel. Idempotent. Blocked receivers wake up and see the end of the stream;
     * a blocked sender gives up its element.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocking iterator over received elements. An interrupt ends the iteration and
     * leaves the thread's interrupt flag set.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private T next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (done) {
                    return false;
                }
                try {
                    next = receive();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    next = null;
                }
                done = next == null;
                return !done;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T element = next;
                next = null;
                return element;
            }
        };
    }
}
