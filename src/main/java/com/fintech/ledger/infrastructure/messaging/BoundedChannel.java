package com.fintech.ledger.infrastructure.messaging;

import com.fintech.ledger.domain.exception.ErrorCode;
import com.fintech.ledger.domain.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-producer, single-consumer FIFO channel with a fixed capacity.
 *
 * A full channel blocks the sender (backpressure). Closing the channel lets the
 * receiver drain what is buffered and then observe end of stream.
 *
 * @param <T> element type
 */
@Slf4j
public class BoundedChannel<T> {

    private final BlockingQueue<T> queue;
    private final long pollIntervalMs;
    private volatile boolean closed = false;

    public BoundedChannel(int capacity, long pollIntervalMs) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Sends an element, blocking while the channel is full.
     *
     * The token is checked before every blocking attempt. An element is either
     * fully enqueued or not enqueued at all.
     *
     * @return true if the element was enqueued, false if cancellation was observed first
     * @throws LedgerException CHANNEL_CLOSED if the channel was closed, SEND_FAILED if interrupted
     */
    public boolean send(T element, CancellationToken cancellationToken) {
        try {
            while (true) {
                if (cancellationToken.isCancelled()) {
                    return false;
                }
                if (closed) {
                    throw new LedgerException(ErrorCode.CHANNEL_CLOSED);
                }
                if (queue.offer(element, pollIntervalMs, TimeUnit.MILLISECONDS)) {
                    return true;
                }
                log.trace("Channel full ({} buffered), waiting for consumer", queue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerException(ErrorCode.SEND_FAILED, "Interrupted while sending to channel", e);
        }
    }

    /**
     * Receives the next element in send order, blocking while the channel is empty.
     *
     * @return the element, or empty once the channel is closed and drained
     * @throws InterruptedException if the receiving thread is interrupted
     */
    public Optional<T> receive() throws InterruptedException {
        while (true) {
            T element = queue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
            if (element != null) {
                return Optional.of(element);
            }
            // every send completed before close, so an empty queue here is final
            if (closed && queue.isEmpty()) {
                return Optional.empty();
            }
        }
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return queue.size();
    }
}
