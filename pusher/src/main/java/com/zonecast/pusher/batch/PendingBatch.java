package com.zonecast.pusher.batch;

import com.zonecast.core.msg.SubMessage;
import reactor.core.Disposable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Sub-messages waiting for the next flush of one session.
 * <p>
 * Other sessions enqueue into it, so every access goes through {@link MessageBatcher} while
 * holding this object's monitor.
 * </p>
 */
public class PendingBatch {
    private final Deque<SubMessage> messages = new ArrayDeque<>();
    private Disposable scheduledFlush;
    private boolean backpressured;
    private boolean discarded;

    void add(SubMessage message) {
        messages.addLast(message);
    }

    SubMessage dropOldest() {
        return messages.pollFirst();
    }

    List<SubMessage> drain() {
        List<SubMessage> drained = new ArrayList<>(messages);
        messages.clear();
        return drained;
    }

    int size() {
        return messages.size();
    }

    boolean isEmpty() {
        return messages.isEmpty();
    }

    boolean hasScheduledFlush() {
        return scheduledFlush != null && !scheduledFlush.isDisposed();
    }

    void scheduleFlush(Disposable task) {
        this.scheduledFlush = task;
    }

    void cancelScheduledFlush() {
        if (scheduledFlush != null) {
            scheduledFlush.dispose();
            scheduledFlush = null;
        }
    }

    boolean isBackpressured() {
        return backpressured;
    }

    void setBackpressured(boolean backpressured) {
        this.backpressured = backpressured;
    }

    boolean isDiscarded() {
        return discarded;
    }

    void discard() {
        cancelScheduledFlush();
        messages.clear();
        discarded = true;
    }

    public synchronized int pendingMessages() {
        return messages.size();
    }
}
