package com.zonecast.pusher.batch;

/**
 * Write side of a client socket as seen by the batcher.
 */
public interface OutboundChannel {

    /**
     * Queues one text frame. Never blocks.
     */
    void send(String frame);

    void sendPing();

    /**
     * Bytes written but not yet flushed to the network.
     */
    long bufferedBytes();

    /**
     * Runs {@code callback} once, the next time {@link #bufferedBytes()} falls back under the
     * ceiling the channel was created with.
     */
    void onDrain(Runnable callback);

    void close(int code, String reason);

    boolean isOpen();
}
