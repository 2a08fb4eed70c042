package com.zonecast.pusher.ws;

import com.zonecast.pusher.batch.OutboundChannel;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.http.websocket.WebsocketOutbound;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link OutboundChannel} over a Reactor Netty WebSocket.
 * <p>
 * Frames are written straight to the Netty channel; the bytes of every write are counted until
 * its future completes, which gives the backpressure measure the batcher relies on.
 * </p>
 */
public class NettyOutboundChannel implements OutboundChannel {
    private static final Logger log = LoggerFactory.getLogger(NettyOutboundChannel.class);

    private final Channel channel;
    private final WebsocketOutbound outbound;
    private final long ceilingBytes;

    private final AtomicLong pendingBytes = new AtomicLong();
    private final Queue<Runnable> drainCallbacks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public NettyOutboundChannel(Channel channel, WebsocketOutbound outbound, long ceilingBytes) {
        this.channel = channel;
        this.outbound = outbound;
        this.ceilingBytes = ceilingBytes;
    }

    @Override
    public void send(String frame) {
        if (!isOpen()) {
            return;
        }
        long size = ByteBufUtil.utf8Bytes(frame);
        pendingBytes.addAndGet(size);
        channel.writeAndFlush(new TextWebSocketFrame(frame)).addListener(future -> {
            long after = pendingBytes.addAndGet(-size);
            if (!future.isSuccess()) {
                log.debug("Write to {} failed: {}", channel.remoteAddress(), future.cause().getMessage());
            }
            if (after <= ceilingBytes && after + size > ceilingBytes) {
                runDrainCallbacks();
            }
        });
    }

    @Override
    public void sendPing() {
        if (isOpen()) {
            channel.writeAndFlush(new PingWebSocketFrame());
        }
    }

    @Override
    public long bufferedBytes() {
        return pendingBytes.get();
    }

    @Override
    public void onDrain(Runnable callback) {
        drainCallbacks.add(callback);
        if (pendingBytes.get() <= ceilingBytes) {
            runDrainCallbacks();
        }
    }

    @Override
    public void close(int code, String reason) {
        if (closed.compareAndSet(false, true)) {
            outbound.sendClose(code, CloseCodes.reason(reason))
                .subscribe(null, err -> log.debug("Close of {} failed: {}", channel.remoteAddress(), err.getMessage()));
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    private void runDrainCallbacks() {
        Runnable callback;
        while ((callback = drainCallbacks.poll()) != null) {
            callback.run();
        }
    }
}
