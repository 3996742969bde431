package com.smartbottle.tracker.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import javax.annotation.Nonnull;

/**
 * Subscribe/unsubscribe registry with one mailbox per observer.
 *
 * <p>{@link #publish} only enqueues, so the publishing thread never waits on an observer.
 * Each mailbox is drained by at most one task at a time on the delivery executor, which
 * keeps per-observer ordering. A drain task hands back its thread after
 * {@link #MAX_BATCH} events and re-queues itself, so on a shared executor other mailboxes
 * get their turn. A mailbox that grows past its limit drops its oldest event.
 * Exceptions thrown by an observer are logged and do not affect the others.
 *
 * <p>An observer that blocks inside its callback still holds a delivery thread; give the
 * registry an executor with more than one thread when that matters.
 */
public final class ObserverRegistry<T> {
    private static final Logger log = LoggerFactory.getLogger(ObserverRegistry.class);

    /** Events one drain task delivers before yielding its thread. */
    static final int MAX_BATCH = 16;

    private final String name;
    private final Executor executor;
    private final int maxPending;
    private final CopyOnWriteArrayList<Slot> slots = new CopyOnWriteArrayList<>();
    private final AtomicLong droppedEvents = new AtomicLong();

    public ObserverRegistry(@Nonnull String name, @Nonnull Executor executor, int maxPending) {
        this.name = name;
        this.executor = executor;
        this.maxPending = Math.max(1, maxPending);
    }

    public Subscription subscribe(@Nonnull T observer) {
        Slot slot = new Slot(observer);
        slots.add(slot);
        log.debug(name + ": observer added (" + slots.size() + " total)");
        return slot;
    }

    /** Queues {@code event} for every current observer. */
    public void publish(@Nonnull Consumer<? super T> event) {
        for (Slot slot : slots) {
            slot.offer(event);
        }
    }

    /** Queues {@code event} for one subscription of this registry only. */
    public void publishTo(@Nonnull Subscription subscription, @Nonnull Consumer<? super T> event) {
        for (Slot slot : slots) {
            if (slot == subscription) {
                slot.offer(event);
                return;
            }
        }
    }

    public int size() {
        return slots.size();
    }

    public long getDroppedEvents() {
        return droppedEvents.get();
    }

    public void clear() {
        for (Slot slot : slots) {
            slot.unsubscribe();
        }
    }

    private final class Slot implements Subscription {
        private final T observer;
        private final ArrayDeque<Consumer<? super T>> mailbox = new ArrayDeque<>();
        private volatile boolean active = true;
        private boolean draining = false;

        Slot(T observer) {
            this.observer = observer;
        }

        void offer(Consumer<? super T> event) {
            synchronized (this) {
                if (!active) return;
                if (mailbox.size() >= maxPending) {
                    // drop oldest so a stalled observer cannot grow without bound
                    mailbox.pollFirst();
                    long dropped = droppedEvents.incrementAndGet();
                    if (dropped == 1 || dropped % 100 == 0) {
                        log.warn(name + ": slow observer, dropped " + dropped + " event(s) so far");
                    }
                }
                mailbox.addLast(event);
                if (draining) return;
                draining = true;
            }
            schedule();
        }

        private void schedule() {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                log.warn(name + ": delivery executor rejected work, observer mailbox cleared", e);
                synchronized (this) {
                    mailbox.clear();
                    draining = false;
                }
            }
        }

        private void drain() {
            for (int delivered = 0; delivered < MAX_BATCH; delivered++) {
                Consumer<? super T> next;
                synchronized (this) {
                    next = mailbox.pollFirst();
                    if (next == null || !active) {
                        mailbox.clear();
                        draining = false;
                        return;
                    }
                }
                try {
                    next.accept(observer);
                } catch (RuntimeException e) {
                    log.error(name + ": observer threw, continuing with the rest", e);
                }
            }
            synchronized (this) {
                if (mailbox.isEmpty() || !active) {
                    mailbox.clear();
                    draining = false;
                    return;
                }
            }
            // still draining; go to the back of the executor queue
            schedule();
        }

        @Override
        public void unsubscribe() {
            active = false;
            slots.remove(this);
            synchronized (this) {
                mailbox.clear();
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
