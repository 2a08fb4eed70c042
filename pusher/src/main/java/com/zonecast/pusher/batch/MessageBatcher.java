package com.zonecast.pusher.batch;

import com.zonecast.core.metrics.MetricsNames;
import com.zonecast.core.msg.ServerMessage;
import com.zonecast.core.msg.ServerMessages;
import com.zonecast.core.msg.SubMessage;
import com.zonecast.core.util.JsonUtils;
import com.zonecast.pusher.config.PusherConfig;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces the sub-messages sent to a session into one {@code batchMessage} frame per window.
 * <p>
 * A batch is flushed when the coalescing window elapses or when it reaches the size threshold,
 * whichever comes first. While the socket holds more than the backpressure ceiling the batch
 * is kept and retried on the drain signal or the next window; past
 * {@code maxDeferredMessages} the oldest sub-messages are dropped.
 * </p>
 */
public class MessageBatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageBatcher.class);

    public static final String BATCH_EVENT = "batch";

    private final Duration delay;
    private final int maxMessages;
    private final long ceilingBytes;
    private final int maxDeferred;
    private final Scheduler scheduler;
    private final MetricsService metrics;

    private final Set<Session> attached = ConcurrentHashMap.newKeySet();

    public MessageBatcher(PusherConfig config, Scheduler scheduler, MetricsService metrics) {
        this.delay = config.getBatchDelay();
        this.maxMessages = config.getBatchMaxMessages();
        this.ceilingBytes = config.getMaxBackpressureBytes();
        this.maxDeferred = config.getMaxDeferredMessages();
        this.scheduler = scheduler;
        this.metrics = metrics;

        metrics.registerGauge(MetricsNames.BUFFERED_BYTES,
            "Bytes written to room sockets but not yet flushed", this::totalBufferedBytes);
    }

    public void attach(Session session) {
        attached.add(session);
    }

    /**
     * Drops whatever is pending for a leaving session and cancels its scheduled flush.
     */
    public void discard(Session session) {
        attached.remove(session);
        PendingBatch batch = session.getBatch();
        synchronized (batch) {
            batch.discard();
        }
    }

    public void enqueue(Session session, SubMessage message) {
        PendingBatch batch = session.getBatch();
        boolean flushNow = false;
        synchronized (batch) {
            if (batch.isDiscarded()) {
                return;
            }
            batch.add(message);
            if (batch.size() > maxDeferred) {
                batch.dropOldest();
                metrics.recordDrop("backpressure");
            }
            if (batch.size() >= maxMessages && !batch.isBackpressured()) {
                flushNow = true;
            } else if (!batch.hasScheduledFlush()) {
                batch.scheduleFlush(scheduler.schedule(() -> flush(session), delay.toMillis(), TimeUnit.MILLISECONDS));
            }
        }
        if (flushNow) {
            flush(session);
        }
    }

    /**
     * Writes everything pending for the session as one frame, unless the socket is backpressured.
     */
    public void flush(Session session) {
        PendingBatch batch = session.getBatch();
        OutboundChannel channel = session.getChannel();
        int flushed;
        synchronized (batch) {
            batch.cancelScheduledFlush();
            if (batch.isDiscarded() || batch.isEmpty() || !channel.isOpen()) {
                return;
            }
            if (channel.bufferedBytes() > ceilingBytes) {
                defer(session, batch, channel);
                return;
            }
            List<SubMessage> payload = batch.drain();
            flushed = payload.size();
            channel.send(JsonUtils.writeValueAsString(new ServerMessages.BatchMessage(BATCH_EVENT, payload)));
        }
        metrics.recordBatchFlushed(flushed);
    }

    /**
     * Sends a frame right away, bypassing the pending batch.
     */
    public void sendImmediately(Session session, ServerMessage message) {
        OutboundChannel channel = session.getChannel();
        if (channel.isOpen()) {
            channel.send(JsonUtils.writeValueAsString(message));
        }
    }

    public long bufferedBytes(Session session) {
        return session.getChannel().bufferedBytes();
    }

    public long totalBufferedBytes() {
        long total = 0;
        for (Session session : attached) {
            total += session.getChannel().bufferedBytes();
        }
        return total;
    }

    private void defer(Session session, PendingBatch batch, OutboundChannel channel) {
        if (!batch.isBackpressured()) {
            batch.setBackpressured(true);
            metrics.recordFlushDeferred();
            log.debug("Socket of {} is over {} buffered bytes, deferring {} messages",
                session, ceilingBytes, batch.size());
            channel.onDrain(() -> {
                synchronized (batch) {
                    batch.setBackpressured(false);
                }
                flush(session);
            });
        }
        batch.scheduleFlush(scheduler.schedule(() -> flush(session), delay.toMillis(), TimeUnit.MILLISECONDS));
    }
}
