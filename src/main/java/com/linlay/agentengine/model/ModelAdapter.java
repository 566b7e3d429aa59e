package com.linlay.agentengine.model;

import com.linlay.agentengine.stream.model.StreamChunk;
import reactor.core.publisher.Flux;

/**
 * Uniform facade over one provider's chat API.
 * <p>
 * Streams emit {@code CONTENT} deltas, complete {@code TOOL_CALL}s, one {@code DONE} with the
 * usage, and at most one terminal {@code ERROR}. Argument fragments are accumulated inside the
 * adapter; callers never see partial JSON.
 */
public interface ModelAdapter {

    String provider();

    String model();

    GenerateResponse generate(GenerateRequest request);

    Flux<StreamChunk> generateStream(GenerateRequest request);

    HealthStatus healthCheck();

    ModelCapabilities capabilities();
}
