package com.hits.controller.rest.ws;

import com.hits.service.core.counter.HitRecordedEvent;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Pushes the key of every recorded hit to all connected WebSocket clients as a text frame.
 * Inbound frames are only logged. A failing client is dropped without affecting the hit.
 *
 * <p>Sends run on a single bounded worker, never on the thread that recorded the hit. When the
 * queue is full the notification is dropped.
 */
@Component
@Slf4j
public class HitBroadcastHandler extends TextWebSocketHandler {

    static final int SEND_TIME_LIMIT_MS = 5_000;
    static final int SEND_BUFFER_LIMIT_BYTES = 64 * 1024;
    static final int BROADCAST_QUEUE_CAPACITY = 1024;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private final Executor broadcastExecutor;

    public HitBroadcastHandler() {
        this(newBroadcastExecutor());
    }

    HitBroadcastHandler(Executor broadcastExecutor) {
        this.broadcastExecutor = broadcastExecutor;
    }

    private static ExecutorService newBroadcastExecutor() {
        return new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(BROADCAST_QUEUE_CAPACITY), r -> {
                    Thread t = new Thread(r, "hits-ws-broadcast");
                    t.setDaemon(true);
                    return t;
                });
    }

    @PreDestroy
    void stop() {
        if (broadcastExecutor instanceof ExecutorService executor) {
            executor.shutdown();
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        sessions.put(
                session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT_BYTES));
        log.info("WebSocket connection established id={} open={}", session.getId(), sessions.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Received text from WebSocket client id={}: {}", session.getId(), message.getPayload());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("WebSocket transport error id={}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("WebSocket connection closed id={} status={} open={}", session.getId(), status, sessions.size());
    }

    @EventListener
    public void onHitRecorded(HitRecordedEvent event) {
        if (sessions.isEmpty()) {
            return;
        }
        String key = event.key();
        try {
            broadcastExecutor.execute(() -> broadcast(key));
        } catch (RejectedExecutionException ex) {
            log.warn("WebSocket broadcast queue full, dropping notification for key={}", key);
        }
    }

    void broadcast(String key) {
        if (sessions.isEmpty()) {
            return;
        }
        TextMessage message = new TextMessage(key);
        sessions.forEach((id, session) -> {
            if (!session.isOpen()) {
                sessions.remove(id);
                return;
            }
            try {
                session.sendMessage(message);
            } catch (IOException | RuntimeException ex) {
                log.warn("WebSocket send failed, dropping client id={}: {}", id, ex.getMessage());
                sessions.remove(id);
            }
        });
    }

    int openSessions() {
        return sessions.size();
    }
}
