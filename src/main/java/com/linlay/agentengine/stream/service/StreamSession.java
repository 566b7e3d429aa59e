package com.linlay.agentengine.stream.service;

import com.linlay.agentengine.stream.model.StreamEvent;
import reactor.core.publisher.Flux;

/**
 * Handle returned to a streaming caller. {@code events} accepts a single subscriber and ends
 * after the {@code [DONE]} marker; cancelling it closes the session.
 */
public record StreamSession(String sessionId, Flux<StreamEvent> events) {
}
