package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.error.StepExecutionException;
import com.ryuqq.pipeline.core.spi.ModelClient;
import com.ryuqq.pipeline.core.spi.ModelRequest;
import com.ryuqq.pipeline.core.spi.ModelResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Function;

/**
 * Model client double for contract tests.
 *
 * <p>Replies from a queue of scripted responses, then falls back to a default reply function.
 * Every request is recorded for assertions.</p>
 */
public class ScriptedModelClient implements ModelClient {

    private final ConcurrentLinkedQueue<Function<ModelRequest, ModelResponse>> script = new ConcurrentLinkedQueue<>();
    private final List<ModelRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile Function<ModelRequest, ModelResponse> fallback =
        request -> ModelResponse.of("echo: " + request.prompt(), 10, 5);
    private volatile long latencyMs;

    @Override
    public ModelResponse generate(ModelRequest request) {
        requests.add(request);
        if (latencyMs > 0) {
            try {
                Thread.sleep(latencyMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepExecutionException("Model call interrupted", e);
            }
        }
        Function<ModelRequest, ModelResponse> next = script.poll();
        return (next != null ? next : fallback).apply(request);
    }

    /**
     * Queues a single reply.
     */
    public ScriptedModelClient thenReply(String text, long promptTokens, long completionTokens) {
        script.add(request -> ModelResponse.of(text, promptTokens, completionTokens));
        return this;
    }

    /**
     * Queues a single failure.
     */
    public ScriptedModelClient thenFail(String message) {
        script.add(request -> {
            throw new StepExecutionException(message);
        });
        return this;
    }

    public ScriptedModelClient alwaysReply(Function<ModelRequest, ModelResponse> reply) {
        this.fallback = reply;
        return this;
    }

    public ScriptedModelClient alwaysFail(String message) {
        return alwaysReply(request -> {
            throw new StepExecutionException(message);
        });
    }

    public ScriptedModelClient withLatency(long latencyMs) {
        this.latencyMs = latencyMs;
        return this;
    }

    public List<ModelRequest> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public int callCount() {
        return requests.size();
    }

    public void clear() {
        script.clear();
        requests.clear();
        latencyMs = 0;
        fallback = request -> ModelResponse.of("echo: " + request.prompt(), 10, 5);
    }
}
