package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.core.spi.HttpCall;
import com.ryuqq.pipeline.core.spi.HttpReply;
import com.ryuqq.pipeline.core.spi.HttpTransport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP transport double for contract tests.
 *
 * <p>Answers every call with the configured responder and records the calls.</p>
 */
public class ScriptedHttpTransport implements HttpTransport {

    private final List<HttpCall> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile Function<HttpCall, HttpReply> responder =
        call -> new HttpReply(200, Map.of("Content-Type", "application/json"), "{\"ok\":true}", Map.of("ok", true));

    @Override
    public HttpReply send(HttpCall call) {
        calls.add(call);
        return responder.apply(call);
    }

    public ScriptedHttpTransport respondWith(Function<HttpCall, HttpReply> responder) {
        this.responder = responder;
        return this;
    }

    public ScriptedHttpTransport respondWithStatus(int statusCode, String body) {
        return respondWith(call -> new HttpReply(statusCode, Map.of(), body, null));
    }

    public List<HttpCall> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public void clear() {
        calls.clear();
    }
}
