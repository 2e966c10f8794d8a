package dev.flowsync.domain.execution;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded FIFO of conversational messages. Appending past capacity evicts the oldest.
 */
public class MessageBuffer {

    private final int capacity;
    private final Deque<ConversationalMessage> messages;

    public MessageBuffer(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
        this.messages = new ArrayDeque<>(Math.min(capacity, 256));
    }

    /** Returns the evicted message, or null. */
    public ConversationalMessage append(ConversationalMessage message) {
        ConversationalMessage evicted = null;
        if (messages.size() == capacity) evicted = messages.removeFirst();
        messages.addLast(message);
        return evicted;
    }

    public List<ConversationalMessage> snapshot() {
        return List.copyOf(messages);
    }

    public int size() {
        return messages.size();
    }

    public int capacity() {
        return capacity;
    }
}
