package com.zonecast.pusher.support;

import com.zonecast.pusher.batch.OutboundChannel;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory {@link OutboundChannel}: records frames and lets tests drive the buffered byte count.
 */
public class RecordingChannel implements OutboundChannel {
    public final List<String> frames = new ArrayList<>();
    public final List<Runnable> drainCallbacks = new ArrayList<>();
    public int pings;
    public Integer closeCode;
    public String closeReason;
    private long bufferedBytes;

    @Override
    public synchronized void send(String frame) {
        frames.add(frame);
    }

    @Override
    public synchronized void sendPing() {
        pings++;
    }

    @Override
    public synchronized long bufferedBytes() {
        return bufferedBytes;
    }

    public void setBufferedBytes(long bufferedBytes) {
        synchronized (this) {
            this.bufferedBytes = bufferedBytes;
        }
    }

    /**
     * Drops the buffered count to zero and fires pending drain callbacks.
     */
    public void drain() {
        List<Runnable> callbacks;
        synchronized (this) {
            bufferedBytes = 0;
            callbacks = new ArrayList<>(drainCallbacks);
            drainCallbacks.clear();
        }
        callbacks.forEach(Runnable::run);
    }

    @Override
    public synchronized void onDrain(Runnable callback) {
        drainCallbacks.add(callback);
    }

    @Override
    public synchronized void close(int code, String reason) {
        closeCode = code;
        closeReason = reason;
    }

    @Override
    public synchronized boolean isOpen() {
        return closeCode == null;
    }

    public synchronized List<String> frames() {
        return List.copyOf(frames);
    }
}
