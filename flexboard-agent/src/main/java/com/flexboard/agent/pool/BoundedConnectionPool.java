package com.flexboard.agent.pool;

import com.flexboard.agent.error.CapacityException;
import com.flexboard.agent.error.QueryDispatchException;
import com.flexboard.agent.error.TransientBackendException;
import com.flexboard.agent.model.PoolKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Fixed-capacity pool over a {@link HandleFactory}, used for backends that have no pooling
 * library of their own in this engine (document store sessions, HTTP clients).
 *
 * <p>Handles are created lazily. Idle handles are reused most-recently-released first so
 * that the oldest ones age out through {@link #evictIdle()}. Waiters are served strictly in
 * arrival order. Handles being opened or destroyed count against capacity, so the number of
 * live backend handles never exceeds {@code maxSize}.
 *
 * @param <H> handle type
 */
@Slf4j
public class BoundedConnectionPool<H> implements ConnectionPool<H> {

    private final PoolKey key;
    private final HandleFactory<H> factory;
    private final int maxSize;
    private final int minIdle;
    private final long idleTimeoutNanos;
    private final LongSupplier nanoClock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<IdleHandle<H>> idle = new ArrayDeque<>();
    private final Set<H> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int opening;
    private int destroying;
    private boolean closed;

    public BoundedConnectionPool(PoolKey key, HandleFactory<H> factory, int maxSize, int minIdle, Duration idleTimeout) {
        this(key, factory, maxSize, minIdle, idleTimeout, System::nanoTime);
    }

    BoundedConnectionPool(PoolKey key, HandleFactory<H> factory, int maxSize, int minIdle, Duration idleTimeout, LongSupplier nanoClock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1");
        }
        this.key = key;
        this.factory = factory;
        this.maxSize = maxSize;
        this.minIdle = Math.max(0, minIdle);
        this.idleTimeoutNanos = idleTimeout.toNanos();
        this.nanoClock = nanoClock;
    }

    @Override
    public PoolKey key() {
        return key;
    }

    @Override
    public H acquire(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        Waiter me = null;

        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed) {
                    removeWaiter(me);
                    throw new CapacityException("Connection pool " + key + " is closed");
                }
                boolean myTurn = me == null ? waiters.isEmpty() : waiters.peekFirst() == me;
                if (myTurn) {
                    IdleHandle<H> reusable = idle.pollFirst();
                    if (reusable != null) {
                        removeWaiter(me);
                        checkedOut.add(reusable.handle());
                        return reusable.handle();
                    }
                    if (openCount() < maxSize) {
                        removeWaiter(me);
                        opening++;
                        break;
                    }
                }
                if (me == null) {
                    me = new Waiter(lock.newCondition());
                    waiters.addLast(me);
                }
                if (remaining <= 0L) {
                    removeWaiter(me);
                    throw new CapacityException("No connection available for " + key + " within "
                            + TimeUnit.NANOSECONDS.toMillis(timeout.toNanos()) + "ms (max pool size " + maxSize + ")");
                }
                try {
                    remaining = me.ready().awaitNanos(remaining);
                } catch (InterruptedException e) {
                    removeWaiter(me);
                    throw e;
                }
            }
        } finally {
            lock.unlock();
        }

        return openHandle();
    }

    private H openHandle() {
        H handle;
        try {
            handle = factory.create();
        } catch (QueryDispatchException e) {
            slotFreed(() -> opening--);
            throw e;
        } catch (Exception e) {
            slotFreed(() -> opening--);
            throw new TransientBackendException("Failed to open connection for " + key + ": " + e.getMessage(), e);
        }

        boolean poolClosed;
        lock.lock();
        try {
            opening--;
            poolClosed = closed;
            if (!poolClosed) {
                checkedOut.add(handle);
            }
        } finally {
            lock.unlock();
        }
        if (poolClosed) {
            destroyQuietly(handle);
            throw new CapacityException("Connection pool " + key + " is closed");
        }
        log.debug("Opened new handle for pool {}", key);
        return handle;
    }

    @Override
    public void release(H handle) {
        boolean destroy;
        lock.lock();
        try {
            if (!checkedOut.remove(handle)) {
                throw new IllegalStateException("Handle was not checked out from pool " + key);
            }
            destroy = closed;
            if (destroy) {
                destroying++;
            } else {
                idle.addFirst(new IdleHandle<>(handle, nanoClock.getAsLong()));
                signalHead();
            }
        } finally {
            lock.unlock();
        }
        if (destroy) {
            destroyAndFree(handle);
        }
    }

    @Override
    public void discard(H handle) {
        lock.lock();
        try {
            if (!checkedOut.remove(handle)) {
                throw new IllegalStateException("Handle was not checked out from pool " + key);
            }
            destroying++;
        } finally {
            lock.unlock();
        }
        log.debug("Discarding handle from pool {}", key);
        destroyAndFree(handle);
    }

    @Override
    public void evictIdle() {
        List<H> victims = new ArrayList<>();
        lock.lock();
        try {
            long now = nanoClock.getAsLong();
            Iterator<IdleHandle<H>> oldestFirst = idle.descendingIterator();
            while (oldestFirst.hasNext() && idle.size() > minIdle) {
                IdleHandle<H> candidate = oldestFirst.next();
                if (now - candidate.idleSince() < idleTimeoutNanos) {
                    break;
                }
                oldestFirst.remove();
                victims.add(candidate.handle());
                destroying++;
            }
        } finally {
            lock.unlock();
        }
        if (!victims.isEmpty()) {
            log.debug("Evicting {} idle handle(s) from pool {}", victims.size(), key);
        }
        for (H victim : victims) {
            destroyAndFree(victim);
        }
    }

    @Override
    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(
                    key.poolName(),
                    key.tenantId(),
                    key.kind().getValue(),
                    maxSize,
                    minIdle,
                    checkedOut.size(),
                    idle.size(),
                    openCount(),
                    waiters.size()
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<H> victims = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (IdleHandle<H> entry : idle) {
                victims.add(entry.handle());
            }
            idle.clear();
            for (Waiter waiter : waiters) {
                waiter.ready().signal();
            }
        } finally {
            lock.unlock();
        }
        victims.forEach(this::destroyQuietly);
        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Failed to close handle factory for pool {}: {}", key, e.getMessage());
        }
    }

    private int openCount() {
        return idle.size() + checkedOut.size() + opening + destroying;
    }

    private void destroyAndFree(H handle) {
        try {
            destroyQuietly(handle);
        } finally {
            slotFreed(() -> destroying--);
        }
    }

    private void slotFreed(Runnable accounting) {
        lock.lock();
        try {
            accounting.run();
            signalHead();
        } finally {
            lock.unlock();
        }
    }

    private void destroyQuietly(H handle) {
        try {
            factory.destroy(handle);
        } catch (Exception e) {
            log.warn("Failed to destroy handle from pool {}: {}", key, e.getMessage());
        }
    }

    private void removeWaiter(Waiter waiter) {
        if (waiter != null && waiters.remove(waiter)) {
            signalHead();
        }
    }

    /** Caller holds the lock. */
    private void signalHead() {
        Waiter head = waiters.peekFirst();
        if (head != null) {
            head.ready().signal();
        }
    }

    private record IdleHandle<H>(H handle, long idleSince) {
    }

    private record Waiter(Condition ready) {
    }
}
