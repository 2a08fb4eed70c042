package com.zonecast.pusher.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ping/pong timers of one connection.
 * <p>
 * A ping is sent every {@code pingInterval}. Each ping arms a pong timer unless one is already
 * running; a pong disarms it. When the timer fires, {@code onTimeout} runs once and both timers stop.
 * </p>
 */
public class LivenessMonitor implements Disposable {
    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    private final Duration pingInterval;
    private final Duration pongTimeout;
    private final Scheduler scheduler;
    private final Runnable sendPing;
    private final Runnable onTimeout;

    private final AtomicReference<Disposable> pingLoop = new AtomicReference<>();
    private final AtomicReference<Disposable> pongTimer = new AtomicReference<>();
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public LivenessMonitor(Duration pingInterval, Duration pongTimeout, Scheduler scheduler,
                           Runnable sendPing, Runnable onTimeout) {
        this.pingInterval = pingInterval;
        this.pongTimeout = pongTimeout;
        this.scheduler = scheduler;
        this.sendPing = sendPing;
        this.onTimeout = onTimeout;
    }

    public void start() {
        Disposable loop = Flux.interval(pingInterval, scheduler)
            .subscribe(tick -> ping(), err -> log.warn("Ping loop failed: {}", err.getMessage()));
        if (!pingLoop.compareAndSet(null, loop) || stopped.get()) {
            loop.dispose();
        }
    }

    /**
     * A pong (or an application-level ping) arrived.
     */
    public void onPong() {
        Disposable timer = pongTimer.getAndSet(null);
        if (timer != null) {
            timer.dispose();
        }
    }

    public boolean isAwaitingPong() {
        Disposable timer = pongTimer.get();
        return timer != null && !timer.isDisposed();
    }

    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            disposeRef(pingLoop);
            disposeRef(pongTimer);
        }
    }

    @Override
    public void dispose() {
        stop();
    }

    @Override
    public boolean isDisposed() {
        return stopped.get();
    }

    private void ping() {
        if (stopped.get()) {
            return;
        }
        sendPing.run();
        if (pongTimer.get() == null) {
            Disposable timer = Mono.delay(pongTimeout, scheduler).subscribe(tick -> timeout());
            if (!pongTimer.compareAndSet(null, timer)) {
                timer.dispose();
            }
        }
    }

    private void timeout() {
        if (stopped.get()) {
            return;
        }
        stop();
        onTimeout.run();
    }

    private static void disposeRef(AtomicReference<Disposable> ref) {
        Disposable disposable = ref.getAndSet(null);
        if (disposable != null) {
            disposable.dispose();
        }
    }
}
