package com.linlay.agentengine.stream.service;

import com.linlay.agentengine.stream.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Sinks;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registry of live streaming sessions keyed by generated id. Writes to unknown or closed
 * sessions are dropped, which is how a disconnected consumer looks to the execution loop.
 */
@Component
public class StreamSessionManager {

    private static final Logger log = LoggerFactory.getLogger(StreamSessionManager.class);

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public StreamSession createSession() {
        String sessionId = UUID.randomUUID().toString();
        Session session = new Session(sessionId);
        sessions.put(sessionId, session);
        log.debug("Created stream session {}", sessionId);
        return new StreamSession(sessionId, session.sink.asFlux().doOnCancel(() -> close(sessionId)));
    }

    public boolean isOpen(String sessionId) {
        return sessionId != null && sessions.containsKey(sessionId);
    }

    public int activeSessions() {
        return sessions.size();
    }

    /**
     * Emits one event. Returns false when the session is gone.
     */
    public boolean send(String sessionId, String type, Map<String, Object> payload) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        return session.emit(type, payload);
    }

    /**
     * Sends the end-of-stream marker and closes the session.
     */
    public void complete(String sessionId) {
        Session session = sessionId == null ? null : sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        session.emit(StreamEvent.END_OF_STREAM, Map.of());
        session.finish();
        log.debug("Completed stream session {}", sessionId);
    }

    /**
     * Sends an {@code error} event followed by the end-of-stream marker, then closes.
     */
    public void error(String sessionId, String message) {
        Session session = sessionId == null ? null : sessions.remove(sessionId);
        if (session == null) {
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message == null ? "Unknown error" : message);
        session.emit(StreamEvent.ERROR, payload);
        session.emit(StreamEvent.END_OF_STREAM, Map.of());
        session.finish();
        log.debug("Closed stream session {} with error: {}", sessionId, message);
    }

    /**
     * Consumer-side close: no marker is sent, later writes are ignored.
     */
    public void close(String sessionId) {
        Session session = sessionId == null ? null : sessions.remove(sessionId);
        if (session != null) {
            session.finish();
            log.debug("Stream session {} closed by consumer", sessionId);
        }
    }

    private static final class Session {
        private final String id;
        private final Sinks.Many<StreamEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
        private final AtomicLong seq = new AtomicLong();

        private Session(String id) {
            this.id = id;
        }

        private synchronized boolean emit(String type, Map<String, Object> payload) {
            StreamEvent event = new StreamEvent(seq.getAndIncrement(), type, System.currentTimeMillis(), payload);
            Sinks.EmitResult result = sink.tryEmitNext(event);
            if (result.isFailure()) {
                log.debug("Dropped {} event for session {}: {}", type, id, result);
                return false;
            }
            return true;
        }

        private synchronized void finish() {
            sink.tryEmitComplete();
        }
    }
}
