package org.arenaclient.match.utils;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Single-consumer inbox that hands out frames as futures.
 * <p>
 * A frame that arrives while a consumer is waiting completes the pending future; otherwise it is
 * buffered. A pending future that was completed elsewhere (for example by
 * {@link CompletableFuture#orTimeout}) no longer counts as waiting, so a frame arriving late is
 * buffered for the next {@link #next()} instead of being lost. After {@link #close(Throwable)}
 * buffered frames are still drained, then every request fails with the close cause.
 * <p>
 * <strong>Thread Safety:</strong> All methods are synchronized; futures are completed outside
 * the lock so that dependent stages never run while it is held.
 */
public final class FrameMailbox {

    private final Deque<byte[]> buffered = new ArrayDeque<>();
    private CompletableFuture<byte[]> pending;
    private Throwable closeCause;

    /**
     * Returns a future for the next frame.
     * <p>
     * Only one request may be outstanding. Calling this while a previous future is still
     * incomplete returns that same future.
     *
     * @return a future completed with the next frame, or exceptionally once the mailbox is
     *         closed and drained.
     */
    public CompletableFuture<byte[]> next() {
        synchronized (this) {
            if (!buffered.isEmpty()) {
                return CompletableFuture.completedFuture(buffered.pollFirst());
            }
            if (closeCause != null) {
                return CompletableFuture.failedFuture(closeCause);
            }
            if (pending == null || pending.isDone()) {
                pending = new CompletableFuture<>();
            }
            return pending;
        }
    }

    /**
     * Delivers a frame to the waiting consumer or buffers it.
     *
     * @param frame The frame.
     */
    public void deliver(byte[] frame) {
        CompletableFuture<byte[]> waiting;
        synchronized (this) {
            if (closeCause != null) {
                return;
            }
            waiting = pending;
            pending = null;
            if (waiting == null || waiting.isDone()) {
                buffered.addLast(frame);
                return;
            }
        }
        if (!waiting.complete(frame)) {
            // lost a race with a timeout; keep the frame for the next request
            synchronized (this) {
                buffered.addFirst(frame);
            }
        }
    }

    /**
     * Closes the mailbox. Idempotent; the first cause wins.
     *
     * @param cause Failure reported to the waiting consumer and to later requests.
     */
    public void close(Throwable cause) {
        CompletableFuture<byte[]> waiting;
        synchronized (this) {
            if (closeCause != null) {
                return;
            }
            closeCause = cause;
            waiting = pending;
            pending = null;
        }
        if (waiting != null) {
            waiting.completeExceptionally(cause);
        }
    }

    public synchronized boolean isClosed() {
        return closeCause != null;
    }

    public synchronized int bufferedCount() {
        return buffered.size();
    }
}
