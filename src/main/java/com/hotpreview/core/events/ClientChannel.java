package com.hotpreview.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * One live server-to-client channel with a bounded mailbox.
 * <p>
 * Offers never block: when the mailbox is full the oldest queued message is evicted
 * (drop-oldest), so a stalled client misses stale events but still gets the newest state.
 * Delivery runs on the hub's executor, at most one drain per channel at a time, which
 * keeps per-channel order while different channels deliver in parallel.
 */
public final class ClientChannel {

    private static final Logger log = LoggerFactory.getLogger(ClientChannel.class);

    private final String id;
    private final String projectId;
    private final Instant openedAt;
    private final ChannelSink sink;
    private final int capacity;
    private final Executor executor;
    private final Runnable onDrop;
    private final Consumer<ClientChannel> onClosed;

    private final Object lock = new Object();
    private final ArrayDeque<PreviewMessage> mailbox;
    private boolean draining;
    private boolean closing;
    private boolean closed;
    private long droppedCount;

    ClientChannel(String id, String projectId, ChannelSink sink, int capacity, Executor executor,
                  Runnable onDrop, Consumer<ClientChannel> onClosed) {
        if (capacity < 1) {
            throw new IllegalArgumentException("mailbox capacity must be >= 1");
        }
        this.id = id;
        this.projectId = projectId;
        this.openedAt = Instant.now();
        this.sink = sink;
        this.capacity = capacity;
        this.executor = executor;
        this.onDrop = onDrop;
        this.onClosed = onClosed;
        this.mailbox = new ArrayDeque<>(capacity);
    }

    public String id() {
        return id;
    }

    /** Bound project, or {@code null} for a global subscriber. */
    public String projectId() {
        return projectId;
    }

    public Instant openedAt() {
        return openedAt;
    }

    public long droppedCount() {
        synchronized (lock) {
            return droppedCount;
        }
    }

    public boolean isOpen() {
        synchronized (lock) {
            return !closing && !closed;
        }
    }

    /**
     * Queues a message for delivery.
     *
     * @return {@code false} if the channel is closing or closed
     */
    boolean offer(PreviewMessage message) {
        boolean dropped;
        synchronized (lock) {
            if (closing || closed) {
                return false;
            }
            dropped = enqueueLocked(message);
            scheduleDrainLocked();
        }
        if (dropped) {
            onDrop.run();
        }
        return true;
    }

    /**
     * Delivers {@code finalMessage} after everything already queued, then closes the sink.
     */
    void closeWith(PreviewMessage finalMessage) {
        boolean dropped = false;
        synchronized (lock) {
            if (closing || closed) {
                return;
            }
            if (finalMessage != null) {
                dropped = enqueueLocked(finalMessage);
            }
            closing = true;
            scheduleDrainLocked();
        }
        if (dropped) {
            onDrop.run();
        }
    }

    /**
     * Closes immediately, discarding anything still queued.
     */
    void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            mailbox.clear();
        }
        finish();
    }

    private boolean enqueueLocked(PreviewMessage message) {
        boolean dropped = false;
        if (mailbox.size() >= capacity) {
            PreviewMessage evicted = mailbox.pollFirst();
            droppedCount++;
            dropped = true;
            log.debug("Channel {} mailbox full, dropped {}", id, evicted != null ? evicted.type() : null);
        }
        mailbox.addLast(message);
        return dropped;
    }

    private void scheduleDrainLocked() {
        if (draining) {
            return;
        }
        draining = true;
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining = false;
            log.debug("Delivery executor rejected drain for channel {}", id);
        }
    }

    private void drain() {
        while (true) {
            PreviewMessage next;
            boolean finishNow = false;
            synchronized (lock) {
                if (closed) {
                    draining = false;
                    return;
                }
                next = mailbox.pollFirst();
                if (next == null) {
                    draining = false;
                    if (!closing) {
                        return;
                    }
                    closed = true;
                    finishNow = true;
                }
            }
            if (finishNow) {
                finish();
                return;
            }
            try {
                sink.send(next);
            } catch (IOException | RuntimeException e) {
                log.debug("Delivery to channel {} failed, closing: {}", id, e.getMessage());
                close();
                return;
            }
        }
    }

    private void finish() {
        try {
            sink.close();
        } catch (RuntimeException e) {
            log.debug("Closing sink of channel {} failed: {}", id, e.getMessage());
        }
        onClosed.accept(this);
    }
}
