package com.example.towermud.world;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded outbound queue for one connection. {@link #send} never blocks:
 * when the client falls too far behind, new messages are dropped. The
 * connection's writer drains the queue on its own thread.
 */
public class QueuedMessageSink implements MessageSink {
    private static final Logger logger = LoggerFactory.getLogger(QueuedMessageSink.class);

    public static final int DEFAULT_CAPACITY = 256;

    private final String owner;
    private final BlockingQueue<String> queue;
    private long dropped;

    public QueuedMessageSink(String owner) {
        this(owner, DEFAULT_CAPACITY);
    }

    public QueuedMessageSink(String owner, int capacity) {
        this.owner = owner;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    @Override
    public void send(String text) {
        if (text == null) return;
        if (!queue.offer(text)) {
            synchronized (this) {
                dropped++;
            }
            logger.debug("[QueuedMessageSink] Output queue full for {}, dropping message", owner);
        }
    }

    /** Remove and return everything queued so far. */
    public List<String> drain() {
        List<String> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    /** Drained messages joined into one string. */
    public String drainText() {
        return String.join("", drain());
    }

    /**
     * Block until a message is available (writer thread).
     */
    public String take() throws InterruptedException {
        return queue.take();
    }

    public int size() {
        return queue.size();
    }

    public synchronized long getDroppedCount() {
        return dropped;
    }
}
