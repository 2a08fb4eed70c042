package com.zonecast.pusher.ws;

import com.zonecast.core.msg.ClientMessage;
import com.zonecast.core.msg.MessageKind;
import com.zonecast.pusher.metrics.MetricsService;
import com.zonecast.pusher.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Routes decoded client messages to their handler by {@link MessageKind}.
 */
public class MessageDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    @FunctionalInterface
    public interface Handler<M extends ClientMessage> {
        Mono<Void> handle(Session session, M message);
    }

    private final Map<MessageKind, Handler<ClientMessage>> handlers;
    private final MetricsService metrics;

    private MessageDispatcher(Map<MessageKind, Handler<ClientMessage>> handlers, MetricsService metrics) {
        this.handlers = handlers;
        this.metrics = metrics;
    }

    public static Builder builder(MetricsService metrics) {
        return new Builder(metrics);
    }

    public Mono<Void> dispatch(Session session, ClientMessage message) {
        Handler<ClientMessage> handler = handlers.get(message.kind());
        if (handler == null) {
            log.warn("No handler for {} from {}", message.kind(), session);
            return Mono.empty();
        }
        metrics.recordInbound(message.kind());
        return Mono.defer(() -> handler.handle(session, message));
    }

    public Set<MessageKind> kinds() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public static final class Builder {
        private final Map<MessageKind, Handler<ClientMessage>> handlers = new EnumMap<>(MessageKind.class);
        private final MetricsService metrics;

        private Builder(MetricsService metrics) {
            this.metrics = metrics;
        }

        public <M extends ClientMessage> Builder on(MessageKind kind, Class<M> type, Handler<? super M> handler) {
            if (handlers.putIfAbsent(kind, (session, message) -> handler.handle(session, type.cast(message))) != null) {
                throw new IllegalStateException("Duplicate handler for " + kind);
            }
            return this;
        }

        public MessageDispatcher build() {
            return new MessageDispatcher(new EnumMap<>(handlers), metrics);
        }
    }
}
